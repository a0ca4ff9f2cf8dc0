package com.yunhwan.queue.pause.infra.logging;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

/**
 * pause/resume 감사 이벤트를 구조화 로그로 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueuePauseEventLogger {

    private final Clock clock;

    public void paused(String brokerId, QueuePauseState state, boolean rearmed) {
        Map<String, Object> evt = createBaseEvent("queue_pause.paused", brokerId, state);
        evt.put("paused_at", String.valueOf(state.pausedAt()));
        evt.put("consumer_tag", state.consumerTag());
        evt.put("rearmed", rearmed);
        evt.put("method", "AMQP blocking consumer");

        log.info("queue_pause_event {}", entries(evt));
    }

    public void resumed(String brokerId, QueuePauseState state, int requeued, boolean consumerHeld) {
        Map<String, Object> evt = createBaseEvent("queue_pause.resumed", brokerId, state);
        evt.put("resumed_at", String.valueOf(state.resumedAt()));
        evt.put("requeued", requeued);
        evt.put("consumer_held", consumerHeld);
        evt.put("method", "AMQP consumer cancellation");

        log.info("queue_pause_event {}", entries(evt));
    }

    /**
     * 브로커가 consumer를 끊어서 암묵적으로 resume 처리된 경우.
     */
    public void reconciled(String brokerId, QueuePauseState state, String reason) {
        Map<String, Object> evt = createBaseEvent("queue_pause.reconciled", brokerId, state);
        evt.put("resumed_at", String.valueOf(state.resumedAt()));
        if (reason != null && !reason.isBlank()) evt.put("reason", reason);

        log.warn("queue_pause_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, String brokerId, QueuePauseState state) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("broker_id", brokerId);
        evt.put("queue", state.queueName());
        if (state.vhost() != null) evt.put("vhost", state.vhost());
        evt.put("is_paused", state.paused());
        return evt;
    }
}
