package com.yunhwan.queue.pause.infra.persistence.serializer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * pause_states jsonb 안의 큐 1건.
 * 이전 버전이 남긴 필드(pausedConsumers, serverId 등)는 무시한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PauseStateDocument(
        String queueName,
        String vhost,
        @JsonProperty("isPaused") boolean paused,
        String pausedAt,
        String resumedAt
) {
}
