package org.example.content.service.pipeline;

import org.example.content.model.ProductionStage;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each processable stage to the executor that handles it.
 */
public class StageExecutorRegistry {

    private final Map<ProductionStage, StageExecutor> executors = new EnumMap<>(ProductionStage.class);

    public StageExecutorRegistry(Collection<? extends StageExecutor> executors) {
        for (StageExecutor executor : executors) {
            ProductionStage stage = executor.stage();
            if (stage == null || !stage.isProcessable()) {
                throw new IllegalArgumentException(
                        executor.getClass().getSimpleName() + " declares a non-processable stage: " + stage);
            }
            StageExecutor previous = this.executors.putIfAbsent(stage, executor);
            if (previous != null) {
                throw new IllegalStateException("Multiple executors registered for stage " + stage.wireValue()
                        + ": " + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
    }

    public Optional<StageExecutor> find(ProductionStage stage) {
        return Optional.ofNullable(executors.get(stage));
    }

    public StageExecutor require(ProductionStage stage) {
        return find(stage).orElseThrow(() ->
                new IllegalStateException("No executor registered for stage " + stage.wireValue()));
    }

    public Set<ProductionStage> registeredStages() {
        return Collections.unmodifiableSet(executors.keySet());
    }
}
