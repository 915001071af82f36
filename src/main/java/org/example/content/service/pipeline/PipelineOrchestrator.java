package org.example.content.service.pipeline;

import org.example.content.model.OverallStatus;
import org.example.content.model.ProductionStage;
import org.example.content.model.ProgressSummary;
import org.example.content.service.persistence.PersistenceGateway;
import org.example.content.service.progress.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one production run through every stage, gating items on review scores
 * and writing progress through to storage at each stage boundary.
 * <p>
 * One instance per run. {@link #run}, {@link #runForTopic} and {@link #resume} must be
 * called from a single thread; {@link #requestPause()} and {@link #getProgressSummary()}
 * are safe from any thread.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final String recordId;
    private final ProgressTracker tracker;
    private final StageExecutorRegistry executors;
    private final FeedbackReviewer reviewer;
    private final PersistenceGateway persistenceGateway;
    private final double qualityThreshold;
    private final AtomicBoolean pauseRequested = new AtomicBoolean(false);

    private volatile ProgressSummary latestSummary;
    private volatile List<WorkItem> pendingItems = List.of();
    private SeedParameters seed;

    public PipelineOrchestrator(
            String recordId,
            ProgressTracker tracker,
            StageExecutorRegistry executors,
            FeedbackReviewer reviewer,
            PersistenceGateway persistenceGateway,
            double qualityThreshold) {
        if (Double.isNaN(qualityThreshold) || qualityThreshold < 0.0 || qualityThreshold > 1.0) {
            throw new IllegalArgumentException("qualityThreshold must be within [0, 1] but was " + qualityThreshold);
        }
        this.recordId = Objects.requireNonNull(recordId, "recordId");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.executors = Objects.requireNonNull(executors, "executors");
        this.reviewer = Objects.requireNonNull(reviewer, "reviewer");
        this.persistenceGateway = Objects.requireNonNull(persistenceGateway, "persistenceGateway");
        this.qualityThreshold = qualityThreshold;
        this.latestSummary = tracker.getSummary();
    }

    /**
     * Runs every stage starting from topic discovery.
     *
     * @return the items accepted by the final stage; empty if the run stopped early
     *         because nothing passed a gate or a pause was requested
     * @throws PipelineException if a stage fails; the run is marked failed first
     */
    public List<WorkItem> run(SeedParameters seed) {
        Objects.requireNonNull(seed, "seed");
        requireNotStarted();
        this.seed = seed;
        log.info("Starting production {} for category '{}' with {} topics",
                tracker.getEntityId(), seed.category(), seed.count());
        return drive(tracker.getCatalog().firstStage(), seed.toSeedItems());
    }

    /**
     * Skips discovery for a topic the caller already has and runs the remaining stages.
     */
    public List<WorkItem> runForTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        requireNotStarted();
        this.seed = new SeedParameters(topic, 1);
        WorkItem item = new WorkItem("topic-1", topic, Map.of(WorkItem.CATEGORY, topic, WorkItem.TOPIC, topic));

        ProductionStage discovery = tracker.getCatalog().firstStage();
        tracker.startStage(discovery, 1);
        tracker.updateStageProgress(discovery, 1, 1.0, "Topic supplied: " + topic, 0);
        tracker.completeStage(discovery);
        persist();
        log.info("Starting single-topic production {} for '{}'", tracker.getEntityId(), topic);
        return drive(tracker.getCurrentStage(), List.of(item));
    }

    /**
     * Continues a paused run at the stage it was paused before.
     *
     * @param items input for the resumed stage; when null, the items held back at pause time
     * @throws IllegalStateException if the run is not paused
     * @throws PipelineException     if there is no stage or no input to resume with
     */
    public List<WorkItem> resume(List<WorkItem> items) {
        if (tracker.getOverallStatus() != OverallStatus.PAUSED) {
            throw new IllegalStateException("Production " + tracker.getEntityId()
                    + " is not paused (status " + tracker.getOverallStatus().wireValue() + ")");
        }
        if (!tracker.resumeProcess()) {
            throw fail("Internal error: no stage available to resume", null);
        }
        persist();

        ProductionStage stage = tracker.getCurrentStage();
        List<WorkItem> input = items != null ? List.copyOf(items) : pendingItems;
        if (input.isEmpty() && stage == tracker.getCatalog().firstStage() && seed != null) {
            input = seed.toSeedItems();
        }
        if (input.isEmpty()) {
            throw fail("Internal error: no items available to resume stage " + stage.wireValue(), null);
        }
        pendingItems = List.of();
        log.info("Resuming production {} at stage {} with {} items", tracker.getEntityId(), stage, input.size());
        return drive(stage, input);
    }

    /**
     * Asks the run to pause at the next stage boundary. The stage in flight is finished first.
     */
    public void requestPause() {
        pauseRequested.set(true);
        log.info("Pause requested for production {}", tracker.getEntityId());
    }

    public boolean isPauseRequested() {
        return pauseRequested.get();
    }

    /**
     * Items held back when the run paused, to be fed to the resumed stage.
     */
    public List<WorkItem> pendingItems() {
        return pendingItems;
    }

    /**
     * Progress as of the last state change.
     */
    public ProgressSummary getProgressSummary() {
        return latestSummary;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getEntityId() {
        return tracker.getEntityId();
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    private void requireNotStarted() {
        if (tracker.getOverallStatus() != OverallStatus.PENDING) {
            throw new IllegalStateException("Production " + tracker.getEntityId()
                    + " has already started (status " + tracker.getOverallStatus().wireValue() + ")");
        }
    }

    private List<WorkItem> drive(ProductionStage startStage, List<WorkItem> input) {
        try {
            return runStages(startStage, input);
        } catch (PipelineException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw fail("Unexpected error during " + tracker.getCurrentStage().wireValue() + ": "
                    + safeErrorMessage(ex), ex);
        } finally {
            // a request that arrives after the last stage boundary has nothing left to pause
            pauseRequested.set(false);
        }
    }

    private List<WorkItem> runStages(ProductionStage startStage, List<WorkItem> input) {
        ProductionStage stage = startStage;
        List<WorkItem> items = input;
        while (true) {
            if (pauseRequested.getAndSet(false) && pauseBefore(items)) {
                return List.of();
            }

            List<WorkItem> accepted = runStage(stage, items);
            if (tracker.getOverallStatus() == OverallStatus.FAILED) {
                throw new PipelineException("Production " + tracker.getEntityId() + " failed after stage "
                        + stage.wireValue());
            }
            if (tracker.getOverallStatus() == OverallStatus.COMPLETED) {
                log.info("Production {} finished with {} accepted items", tracker.getEntityId(), accepted.size());
                return accepted;
            }
            if (accepted.isEmpty()) {
                log.warn("No items passed stage {} for production {}; stopping", stage, tracker.getEntityId());
                return List.of();
            }
            stage = tracker.getCurrentStage();
            items = accepted;
        }
    }

    private List<WorkItem> runStage(ProductionStage stage, List<WorkItem> items) {
        StageExecutor executor;
        try {
            executor = executors.require(stage);
        } catch (IllegalStateException ex) {
            throw fail(ex.getMessage(), ex);
        }

        tracker.startStage(stage, items.size());
        persist();
        log.info("Stage {} started for production {} with {} items", stage, tracker.getEntityId(), items.size());

        List<WorkItem> accepted = new ArrayList<>();
        int processed = 0;
        double scoreSum = 0.0;
        for (int i = 0; i < items.size(); i++) {
            WorkItem item = items.get(i);
            StageContext context = new StageContext(tracker.getEntityId(), stage, seed, i, items.size());
            StageOutcome outcome;
            Feedback feedback;
            try {
                outcome = executor.execute(item, context);
                if (outcome == null || outcome.result() == null) {
                    throw new IllegalStateException("Executor returned no result");
                }
                feedback = reviewer.review(outcome, context);
            } catch (StageExecutionException ex) {
                throw fail("Stage " + stage.wireValue() + " failed: " + safeErrorMessage(ex), ex);
            } catch (RuntimeException ex) {
                log.warn("Item {} failed in stage {} for production {}: {}",
                        item.id(), stage, tracker.getEntityId(), safeErrorMessage(ex));
                tracker.addErrorLog(stage, "Item " + item.id() + " failed: " + safeErrorMessage(ex));
                continue;
            }

            processed++;
            scoreSum += feedback.averageScore();
            if (feedback.averageScore() >= qualityThreshold) {
                accepted.add(outcome.result());
            } else {
                log.info("Item {} dropped at stage {}: score {} below {}",
                        item.id(), stage, feedback.averageScore(), qualityThreshold);
            }
            tracker.updateStageProgress(stage, processed, scoreSum / processed, null, 0);
            latestSummary = tracker.getSummary();
        }

        double avgScore = processed > 0 ? scoreSum / processed : 0.0;
        tracker.updateStageProgress(stage, processed, avgScore,
                accepted.size() + " of " + items.size() + " items accepted", 0);
        tracker.completeStage(stage);
        persist();
        log.info("Stage {} completed for production {}: {} of {} items accepted",
                stage, tracker.getEntityId(), accepted.size(), items.size());
        return accepted;
    }

    private boolean pauseBefore(List<WorkItem> items) {
        if (!tracker.pauseProcess()) {
            return false;
        }
        pendingItems = List.copyOf(items);
        persist();
        return true;
    }

    private PipelineException fail(String message, Throwable cause) {
        pauseRequested.set(false);
        tracker.failProcess(message);
        persist();
        return new PipelineException(message, cause);
    }

    private void persist() {
        latestSummary = tracker.getSummary();
        boolean saved;
        try {
            saved = persistenceGateway.save(recordId, tracker.getStateForPersistence());
        } catch (RuntimeException ex) {
            log.warn("Progress store rejected record {}", recordId, ex);
            saved = false;
        }
        if (!saved) {
            log.warn("Failed to persist progress {} for production {}; continuing with in-memory state",
                    recordId, tracker.getEntityId());
        }
    }

    private static String safeErrorMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
