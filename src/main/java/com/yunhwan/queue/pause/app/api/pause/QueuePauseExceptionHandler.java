package com.yunhwan.queue.pause.app.api.pause;

import com.yunhwan.queue.pause.app.api.pause.dto.ErrorResponse;
import com.yunhwan.queue.pause.common.exception.BrokerConnectionException;
import com.yunhwan.queue.pause.common.exception.BrokerNotFoundException;
import com.yunhwan.queue.pause.common.exception.BrokerProtocolException;
import com.yunhwan.queue.pause.common.exception.PauseOperationTimeoutException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/**
 * 엔진 예외 → HTTP 상태. 브로커가 준 사유 문자열은 message 에 그대로 싣는다.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = QueuePauseController.class)
public class QueuePauseExceptionHandler {

    @ExceptionHandler(BrokerNotFoundException.class)
    public ResponseEntity<ErrorResponse> brokerNotFound(BrokerNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "BROKER_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(BrokerProtocolException.class)
    public ResponseEntity<ErrorResponse> protocol(BrokerProtocolException e) {
        if (e.isNotFound()) {
            return body(HttpStatus.NOT_FOUND, "QUEUE_NOT_FOUND", e.getMessage());
        }
        log.warn("[QueuePauseApi] broker refused. replyCode={}, replyText={}", e.getReplyCode(), e.getReplyText());
        return body(HttpStatus.BAD_GATEWAY, "BROKER_PROTOCOL_ERROR", e.getMessage());
    }

    @ExceptionHandler(BrokerConnectionException.class)
    public ResponseEntity<ErrorResponse> connection(BrokerConnectionException e) {
        log.warn("[QueuePauseApi] broker unavailable. brokerId={}, err={}", e.getBrokerId(), e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "BROKER_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(PauseOperationTimeoutException.class)
    public ResponseEntity<ErrorResponse> timeout(PauseOperationTimeoutException e) {
        log.warn("[QueuePauseApi] operation timed out. err={}", e.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, "OPERATION_TIMEOUT", e.getMessage());
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> invalid(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
