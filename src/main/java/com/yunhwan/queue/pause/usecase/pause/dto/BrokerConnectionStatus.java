package com.yunhwan.queue.pause.usecase.pause.dto;

public record BrokerConnectionStatus(
        String brokerId,
        boolean connected,
        int heldConsumers
) {
}
