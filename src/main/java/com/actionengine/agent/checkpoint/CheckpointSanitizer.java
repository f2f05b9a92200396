package com.actionengine.agent.checkpoint;

import com.actionengine.agent.environment.LiveResource;
import com.actionengine.agent.environment.ThreadEnvironment;
import com.actionengine.agent.llm.LlmClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes live handles from checkpoint metadata, at any nesting depth, so
 * the rest can be serialized.
 */
final class CheckpointSanitizer {

    private CheckpointSanitizer() {
    }

    static Map<String, Object> stripLiveResources(Map<String, Object> metadata) {
        Map<String, Object> clean = new LinkedHashMap<>();
        if (metadata == null) return clean;
        metadata.forEach((key, value) -> {
            if (!isLive(value)) {
                clean.put(key, sanitizeValue(value));
            }
        });
        return clean;
    }

    @SuppressWarnings("unchecked")
    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (!isLive(v)) {
                    nested.put(String.valueOf(k), sanitizeValue(v));
                }
            });
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> nested = new ArrayList<>();
            for (Object item : list) {
                if (!isLive(item)) {
                    nested.add(sanitizeValue(item));
                }
            }
            return nested;
        }
        return value;
    }

    private static boolean isLive(Object value) {
        return value instanceof LiveResource
                || value instanceof ThreadEnvironment
                || value instanceof LlmClient;
    }
}
