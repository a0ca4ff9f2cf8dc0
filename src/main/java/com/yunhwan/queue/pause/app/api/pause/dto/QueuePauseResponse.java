package com.yunhwan.queue.pause.app.api.pause.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueuePauseResponse(
        String queueName,
        String vhost,
        @JsonProperty("isPaused") boolean paused,
        OffsetDateTime pausedAt,
        OffsetDateTime resumedAt,
        boolean enforced,
        String method
) {

    public static QueuePauseResponse of(QueuePauseState state, boolean enforced, String method) {
        return new QueuePauseResponse(
                state.queueName(),
                state.vhost(),
                state.paused(),
                state.pausedAt(),
                state.resumedAt(),
                enforced,
                method
        );
    }
}
