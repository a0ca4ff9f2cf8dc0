package com.yunhwan.queue.pause.common.exception;

/**
 * 브로커가 AMQP 레벨에서 거부한 경우 (예: 404 NOT_FOUND, 403 ACCESS_REFUSED).
 * 브로커의 reply text를 그대로 보존한다.
 */
public class BrokerProtocolException extends RuntimeException {

    private final int replyCode;
    private final String replyText;

    public BrokerProtocolException(int replyCode, String replyText, Throwable cause) {
        super("AMQP " + replyCode + " " + replyText, cause);
        this.replyCode = replyCode;
        this.replyText = replyText;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    public boolean isNotFound() {
        return replyCode == 404;
    }
}
