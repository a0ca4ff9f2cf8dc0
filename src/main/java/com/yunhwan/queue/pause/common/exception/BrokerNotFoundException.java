package com.yunhwan.queue.pause.common.exception;

public class BrokerNotFoundException extends RuntimeException {
    public BrokerNotFoundException(String brokerId) {
        super("Broker not configured. brokerId=" + brokerId);
    }
}
