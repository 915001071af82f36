package org.example.content.service.progress;

import org.example.content.model.ProductionStage;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed ordering of the processable production stages and their progress weights.
 */
public final class StageCatalog {

    static final double WEIGHT_TOLERANCE = 1e-9;

    private static final List<ProductionStage> PROCESSABLE_STAGES = Arrays.stream(ProductionStage.values())
            .filter(ProductionStage::isProcessable)
            .toList();

    private final Map<ProductionStage, Double> weights;

    public StageCatalog(Map<ProductionStage, Double> weights) {
        this.weights = Collections.unmodifiableMap(validate(weights));
    }

    public static StageCatalog defaultCatalog() {
        return new StageCatalog(defaultWeights());
    }

    public static Map<ProductionStage, Double> defaultWeights() {
        Map<ProductionStage, Double> defaults = new LinkedHashMap<>();
        defaults.put(ProductionStage.TOPIC_DISCOVERY, 0.10);
        defaults.put(ProductionStage.TOPIC_RESEARCH, 0.20);
        defaults.put(ProductionStage.ARTICLE_WRITING, 0.30);
        defaults.put(ProductionStage.STYLE_ADAPTATION, 0.20);
        defaults.put(ProductionStage.ARTICLE_REVIEW, 0.20);
        return defaults;
    }

    public List<ProductionStage> processableStages() {
        return PROCESSABLE_STAGES;
    }

    public ProductionStage firstStage() {
        return PROCESSABLE_STAGES.get(0);
    }

    public boolean contains(ProductionStage stage) {
        return stage != null && stage.isProcessable();
    }

    public double weight(ProductionStage stage) {
        return weights.getOrDefault(stage, 0.0);
    }

    public Map<ProductionStage, Double> weights() {
        return weights;
    }

    /**
     * @return the stage that follows {@code stage}, or empty when {@code stage} is the last one
     * @throws IllegalArgumentException if {@code stage} is not a processable stage
     */
    public Optional<ProductionStage> nextStage(ProductionStage stage) {
        int index = PROCESSABLE_STAGES.indexOf(stage);
        if (index < 0) {
            throw new IllegalArgumentException("Stage " + stage + " is not part of the production pipeline");
        }
        if (index == PROCESSABLE_STAGES.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(PROCESSABLE_STAGES.get(index + 1));
    }

    private static Map<ProductionStage, Double> validate(Map<ProductionStage, Double> weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Stage weights are required");
        }
        EnumMap<ProductionStage, Double> validated = new EnumMap<>(ProductionStage.class);
        double sum = 0.0;
        for (ProductionStage stage : PROCESSABLE_STAGES) {
            Double weight = weights.get(stage);
            if (weight == null) {
                throw new IllegalArgumentException("Missing weight for stage " + stage.wireValue());
            }
            if (weight.isNaN() || weight < 0.0) {
                throw new IllegalArgumentException("Invalid weight " + weight + " for stage " + stage.wireValue());
            }
            validated.put(stage, weight);
            sum += weight;
        }
        for (ProductionStage stage : weights.keySet()) {
            if (!stage.isProcessable()) {
                throw new IllegalArgumentException("Stage " + stage.wireValue() + " cannot carry a weight");
            }
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Stage weights must sum to 1.0 but sum to " + sum);
        }
        return validated;
    }
}
