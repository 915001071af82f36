package org.example.content.service.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work flowing between stages: a seed, a topic, research notes, a draft article.
 * Attributes carry stage-specific payload; the orchestrator never interprets them.
 */
public record WorkItem(
        String id,
        String title,
        Map<String, Object> attributes
) {
    public static final String CATEGORY = "category";
    public static final String TOPIC = "topic";

    public WorkItem {
        Objects.requireNonNull(id, "id");
        if (title == null) {
            title = "";
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public WorkItem withAttribute(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(attributes);
        updated.put(key, value);
        return new WorkItem(id, title, updated);
    }

    public String attribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }
}
