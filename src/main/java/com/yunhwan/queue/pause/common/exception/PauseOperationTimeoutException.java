package com.yunhwan.queue.pause.common.exception;

public class PauseOperationTimeoutException extends RuntimeException {

    public PauseOperationTimeoutException(String message) {
        super(message);
    }

    public PauseOperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
