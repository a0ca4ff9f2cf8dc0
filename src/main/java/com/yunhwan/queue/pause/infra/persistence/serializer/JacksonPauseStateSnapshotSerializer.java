package com.yunhwan.queue.pause.infra.persistence.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스냅샷 JSON 형식: { "<queueName>": { queueName, vhost, isPaused, pausedAt, resumedAt }, ... }
 * 시각은 ISO-8601 문자열. consumerTag는 세션 한정 값이라 저장하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JacksonPauseStateSnapshotSerializer {

    private static final TypeReference<LinkedHashMap<String, PauseStateDocument>> DOCUMENT_MAP =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String serialize(List<QueuePauseState> states) {
        Map<String, PauseStateDocument> doc = new LinkedHashMap<>();
        for (QueuePauseState s : states) {
            doc.put(s.queueName(), new PauseStateDocument(
                    s.queueName(),
                    s.vhost(),
                    s.paused(),
                    format(s.pausedAt()),
                    format(s.resumedAt())
            ));
        }
        try {
            return objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize pause state snapshot", e);
        }
    }

    public List<QueuePauseState> deserialize(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        Map<String, PauseStateDocument> doc;
        try {
            doc = objectMapper.readValue(json, DOCUMENT_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to deserialize pause state snapshot", e);
        }
        if (doc == null) {
            return List.of();
        }

        List<QueuePauseState> states = new ArrayList<>(doc.size());
        doc.forEach((key, d) -> {
            if (d == null) return;
            // 값에 queueName이 없으면 키를 쓴다
            String queueName = d.queueName() != null ? d.queueName() : key;
            states.add(new QueuePauseState(
                    queueName,
                    d.vhost(),
                    d.paused(),
                    parseTime(queueName, d.pausedAt()),
                    parseTime(queueName, d.resumedAt()),
                    null
            ));
        });
        return states;
    }

    private static String format(OffsetDateTime value) {
        return value == null ? null : value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static OffsetDateTime parseTime(String queueName, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("[PauseStateSnapshot] invalid timestamp ignored. queue={}, value={}", queueName, value);
            return null;
        }
    }
}
