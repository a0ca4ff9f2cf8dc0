package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import com.yunhwan.queue.pause.common.exception.BrokerConnectionException;
import com.yunhwan.queue.pause.common.exception.BrokerProtocolException;
import com.yunhwan.queue.pause.common.exception.PauseOperationTimeoutException;

import java.util.concurrent.TimeoutException;

/**
 * amqp-client 예외(IOException / ShutdownSignalException / TimeoutException)를
 * 엔진의 예외 체계로 변환한다. 브로커가 준 reply text는 항상 메시지에 보존한다.
 */
final class AmqpExceptionTranslator {

    private AmqpExceptionTranslator() {}

    static BrokerConnectionException connectFailed(String brokerId, Throwable e) {
        return new BrokerConnectionException(brokerId,
                "AMQP connect failed. brokerId=" + brokerId + ", reason=" + reason(e), e);
    }

    static RuntimeException operationFailed(String brokerId, String operation, Throwable e) {
        if (e instanceof BrokerConnectionException
                || e instanceof BrokerProtocolException
                || e instanceof PauseOperationTimeoutException) {
            return (RuntimeException) e;
        }

        if (isTimeout(e)) {
            return new PauseOperationTimeoutException(
                    operation + " timed out. brokerId=" + brokerId + ", reason=" + reason(e), e);
        }

        ShutdownSignalException sse = findShutdownSignal(e);
        if (sse != null && !sse.isHardError() && sse.getReason() instanceof AMQP.Channel.Close close) {
            // channel 레벨 오류 (404 NOT_FOUND, 403 ACCESS_REFUSED, 405 RESOURCE_LOCKED ...)
            return new BrokerProtocolException(close.getReplyCode(), close.getReplyText(), e);
        }

        return new BrokerConnectionException(brokerId,
                operation + " failed. brokerId=" + brokerId + ", reason=" + reason(e), e);
    }

    /**
     * 브로커 close reason이 있으면 "replyCode replyText", 없으면 가장 안쪽 원인의 메시지.
     */
    static String reason(Throwable e) {
        ShutdownSignalException sse = findShutdownSignal(e);
        if (sse != null) {
            Method m = sse.getReason();
            if (m instanceof AMQP.Connection.Close close) {
                return close.getReplyCode() + " " + close.getReplyText();
            }
            if (m instanceof AMQP.Channel.Close close) {
                return close.getReplyCode() + " " + close.getReplyText();
            }
        }
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = e.getMessage();
        }
        return root.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static ShutdownSignalException findShutdownSignal(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof ShutdownSignalException sse) {
                return sse;
            }
        }
        return null;
    }
}
