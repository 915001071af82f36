package org.example.content.config;

import org.example.content.model.ProductionStage;
import org.example.content.service.pipeline.StageExecutor;
import org.example.content.service.pipeline.StageExecutorRegistry;
import org.example.content.service.progress.StageCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the stage catalog from configured weights and exposes the shared clock.
 */
@Configuration
public class ProductionConfig {

    private static final Logger log = LoggerFactory.getLogger(ProductionConfig.class);

    @Bean
    public Clock productionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public StageCatalog stageCatalog(ProductionProperties properties) {
        Map<String, Double> configured = properties.getStageWeights();
        if (configured == null || configured.isEmpty()) {
            log.info("Using default stage weights");
            return StageCatalog.defaultCatalog();
        }

        Map<ProductionStage, Double> weights = new EnumMap<>(ProductionStage.class);
        for (Map.Entry<String, Double> entry : configured.entrySet()) {
            ProductionStage stage = ProductionStage.find(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown stage in production.stage-weights: " + entry.getKey()));
            weights.put(stage, entry.getValue());
        }
        StageCatalog catalog = new StageCatalog(weights);
        log.info("Using configured stage weights: {}", catalog.weights());
        return catalog;
    }

    @Bean
    public StageExecutorRegistry stageExecutorRegistry(ObjectProvider<StageExecutor> executors) {
        List<StageExecutor> available = executors.orderedStream().toList();
        StageExecutorRegistry registry = new StageExecutorRegistry(available);
        if (registry.registeredStages().isEmpty()) {
            log.warn("No stage executors registered; production runs will fail at the first stage");
        } else {
            log.info("Registered stage executors for {}", registry.registeredStages());
        }
        return registry;
    }
}
