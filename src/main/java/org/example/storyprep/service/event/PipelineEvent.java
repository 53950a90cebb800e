package org.example.storyprep.service.event;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published through Spring's application event bus at each terminal point of the pipeline.
 */
public record PipelineEvent(
        PipelineEventType type,
        String storyId,
        String chunkId,
        Map<String, Object> details,
        LocalDateTime occurredAt
) {

    public PipelineEvent {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        details = Collections.unmodifiableMap(copy);
        occurredAt = occurredAt == null ? LocalDateTime.now() : occurredAt;
    }

    public static PipelineEvent of(PipelineEventType type, String storyId, String chunkId, Map<String, Object> details) {
        return new PipelineEvent(type, storyId, chunkId, details, LocalDateTime.now());
    }

    /**
     * Alternating key/value pairs; null values are dropped.
     */
    public static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    public String detail(String key) {
        Object value = details.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
