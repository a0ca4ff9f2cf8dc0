package com.yunhwan.queue.pause.common.exception;

/**
 * 브로커 연결 실패 (TCP/핸드셰이크/인증/vhost).
 * 엔진 내부에서 재시도하지 않고 호출자에게 그대로 전달한다.
 */
public class BrokerConnectionException extends RuntimeException {

    private final String brokerId;

    public BrokerConnectionException(String brokerId, String message, Throwable cause) {
        super(message, cause);
        this.brokerId = brokerId;
    }

    public String getBrokerId() {
        return brokerId;
    }
}
