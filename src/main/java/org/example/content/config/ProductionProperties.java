package org.example.content.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "production")
public class ProductionProperties {

    public static final double DEFAULT_QUALITY_THRESHOLD = 0.7;

    /**
     * Progress weight per stage, keyed by stage name (e.g. {@code topic-discovery}).
     * Empty means the built-in weights.
     */
    private Map<String, Double> stageWeights = new LinkedHashMap<>();

    /**
     * Minimum feedback score for an item to advance to the next stage (inclusive).
     */
    private double qualityThreshold = DEFAULT_QUALITY_THRESHOLD;

    public Map<String, Double> getStageWeights() {
        return stageWeights;
    }

    public void setStageWeights(Map<String, Double> stageWeights) {
        this.stageWeights = stageWeights == null ? new LinkedHashMap<>() : stageWeights;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    /**
     * @throws IllegalArgumentException if the value is NaN or outside {@code [0, 1]}
     */
    public void setQualityThreshold(double qualityThreshold) {
        if (Double.isNaN(qualityThreshold) || qualityThreshold < 0.0 || qualityThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "production.quality-threshold must be within [0, 1] but was " + qualityThreshold);
        }
        this.qualityThreshold = qualityThreshold;
    }
}
