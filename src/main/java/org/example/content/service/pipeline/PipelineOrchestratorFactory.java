package org.example.content.service.pipeline;

import org.example.content.config.ProductionProperties;
import org.example.content.service.persistence.PersistenceGateway;
import org.example.content.service.progress.ProgressTrackerFactory;
import org.example.content.service.progress.TrackedProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Wires a fresh or stored progress record to the registered executors.
 */
@Service
public class PipelineOrchestratorFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorFactory.class);

    private final ProgressTrackerFactory trackerFactory;
    private final StageExecutorRegistry executors;
    private final FeedbackReviewer reviewer;
    private final PersistenceGateway persistenceGateway;
    private final double qualityThreshold;

    public PipelineOrchestratorFactory(
            ProgressTrackerFactory trackerFactory,
            StageExecutorRegistry executors,
            ObjectProvider<FeedbackReviewer> reviewer,
            PersistenceGateway persistenceGateway,
            ProductionProperties properties) {
        this.trackerFactory = trackerFactory;
        this.executors = executors;
        this.reviewer = reviewer.getIfAvailable(AutomaticFeedbackReviewer::new);
        this.persistenceGateway = persistenceGateway;
        this.qualityThreshold = properties.getQualityThreshold();
        log.info("Pipeline orchestrators use {} with quality threshold {}",
                this.reviewer.getClass().getSimpleName(), qualityThreshold);
    }

    /**
     * @throws PipelineException if the initial progress record cannot be stored
     */
    public PipelineOrchestrator create(String entityId) {
        TrackedProgress progress = trackerFactory.create(entityId, ProgressTrackerFactory.ARTICLE_PRODUCTION)
                .orElseThrow(() -> new PipelineException("Failed to create progress record for " + entityId));
        return build(progress);
    }

    public Optional<PipelineOrchestrator> restore(String recordId) {
        return trackerFactory.load(recordId).map(this::build);
    }

    private PipelineOrchestrator build(TrackedProgress progress) {
        return new PipelineOrchestrator(
                progress.recordId(),
                progress.tracker(),
                executors,
                reviewer,
                persistenceGateway,
                qualityThreshold);
    }
}
