package com.yunhwan.queue.pause.domain.pause;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 브로커 하나 안에서 큐 하나의 pause 상태.
 * <p>
 * 상태 전이는 새 인스턴스를 만든다. pausedAt/resumedAt은 이력으로 둘 다 남지만
 * 현재 상태는 {@code paused}만 기준으로 판단한다.
 *
 * @param consumerTag pause 중 점유하고 있는 blocking consumer 태그. 영속화 대상 아님.
 */
public record QueuePauseState(
        String queueName,
        String vhost,
        boolean paused,
        OffsetDateTime pausedAt,
        OffsetDateTime resumedAt,
        String consumerTag
) {

    public QueuePauseState {
        Objects.requireNonNull(queueName, "queueName");
    }

    /**
     * 한 번도 pause 되지 않은 큐의 기본값.
     */
    public static QueuePauseState neverPaused(String queueName, String vhost) {
        return new QueuePauseState(queueName, vhost, false, null, null, null);
    }

    public QueuePauseState pause(String consumerTag, OffsetDateTime now) {
        return new QueuePauseState(queueName, vhost, true, now, resumedAt, consumerTag);
    }

    public QueuePauseState resume(OffsetDateTime now) {
        return new QueuePauseState(queueName, vhost, false, pausedAt, now, null);
    }

    public boolean hasConsumerTag() {
        return consumerTag != null && !consumerTag.isBlank();
    }
}
