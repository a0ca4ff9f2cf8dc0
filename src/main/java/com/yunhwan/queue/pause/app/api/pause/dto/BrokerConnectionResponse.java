package com.yunhwan.queue.pause.app.api.pause.dto;

import com.yunhwan.queue.pause.usecase.pause.dto.BrokerConnectionStatus;

public record BrokerConnectionResponse(
        String brokerId,
        boolean connected,
        int heldConsumers
) {
    public static BrokerConnectionResponse from(BrokerConnectionStatus status) {
        return new BrokerConnectionResponse(status.brokerId(), status.connected(), status.heldConsumers());
    }
}
