package org.example.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Phases of article production in pipeline order, followed by the terminal meta-states.
 */
public enum ProductionStage {
    TOPIC_DISCOVERY("topic_discovery", true),
    TOPIC_RESEARCH("topic_research", true),
    ARTICLE_WRITING("article_writing", true),
    STYLE_ADAPTATION("style_adaptation", true),
    ARTICLE_REVIEW("article_review", true),
    COMPLETED("completed", false),
    FAILED("failed", false),
    PAUSED("paused", false);

    private final String wireValue;
    private final boolean processable;

    ProductionStage(String wireValue, boolean processable) {
        this.wireValue = wireValue;
        this.processable = processable;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isProcessable() {
        return processable;
    }

    @JsonCreator
    public static ProductionStage fromWireValue(String value) {
        return find(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown production stage: " + value));
    }

    /**
     * Lenient lookup accepting wire values, constant names and dashed config keys.
     */
    public static Optional<ProductionStage> find(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ProductionStage stage : values()) {
            if (stage.wireValue.equals(normalized)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
