package com.yunhwan.queue.pause.app.api.pause;

import com.yunhwan.queue.pause.app.api.pause.dto.BrokerConnectionResponse;
import com.yunhwan.queue.pause.app.api.pause.dto.QueuePauseResponse;
import com.yunhwan.queue.pause.app.pause.QueuePauseFacade;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 큐 pause/resume 제어 API. 인증/인가는 앞단에서 처리된다고 가정한다.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/brokers/{brokerId}")
public class QueuePauseController {

    // AMQP short string 상한
    private static final int MAX_QUEUE_NAME = 255;

    private final QueuePauseFacade queuePauseFacade;

    @PostMapping("/queues/{queueName}/pause")
    public ResponseEntity<QueuePauseResponse> pause(
            @PathVariable String brokerId,
            @PathVariable @NotBlank @Size(max = MAX_QUEUE_NAME) String queueName
    ) {
        return ResponseEntity.ok(queuePauseFacade.pause(brokerId, queueName));
    }

    @PostMapping("/queues/{queueName}/resume")
    public ResponseEntity<QueuePauseResponse> resume(
            @PathVariable String brokerId,
            @PathVariable @NotBlank @Size(max = MAX_QUEUE_NAME) String queueName
    ) {
        return ResponseEntity.ok(queuePauseFacade.resume(brokerId, queueName));
    }

    @GetMapping("/queues/{queueName}/pause-status")
    public ResponseEntity<QueuePauseResponse> status(
            @PathVariable String brokerId,
            @PathVariable @NotBlank @Size(max = MAX_QUEUE_NAME) String queueName
    ) {
        return ResponseEntity.ok(queuePauseFacade.status(brokerId, queueName));
    }

    @GetMapping("/queues/paused")
    public ResponseEntity<List<QueuePauseResponse>> paused(@PathVariable String brokerId) {
        return ResponseEntity.ok(queuePauseFacade.pausedQueues(brokerId));
    }

    @GetMapping("/connection")
    public ResponseEntity<BrokerConnectionResponse> connection(@PathVariable String brokerId) {
        return ResponseEntity.ok(queuePauseFacade.connection(brokerId));
    }

    @PostMapping("/connection")
    public ResponseEntity<BrokerConnectionResponse> connect(@PathVariable String brokerId) {
        return ResponseEntity.ok(queuePauseFacade.connect(brokerId));
    }

    @DeleteMapping("/connection")
    public ResponseEntity<BrokerConnectionResponse> disconnect(@PathVariable String brokerId) {
        return ResponseEntity.ok(queuePauseFacade.disconnect(brokerId));
    }
}
