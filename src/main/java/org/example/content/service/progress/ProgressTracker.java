package org.example.content.service.progress;

import org.example.content.model.OverallStatus;
import org.example.content.model.ProductionStage;
import org.example.content.model.ProgressRecord;
import org.example.content.model.ProgressSnapshot;
import org.example.content.model.ProgressSummary;
import org.example.content.model.StageHistoryEntry;
import org.example.content.model.StageState;
import org.example.content.model.StageStateSnapshot;
import org.example.content.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State machine over a single production run's {@link ProgressRecord}.
 * <p>
 * Holds no I/O: callers persist {@link #getStateForPersistence()} after mutating.
 * Once the run is completed or failed every mutator becomes a logged no-op.
 * Not thread-safe; one tracker is the only writer of its entity's progress.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private static final String DEFAULT_FAILURE_MESSAGE = "Process failed at this stage.";

    private final ProgressRecord record;
    private final StageCatalog catalog;
    private final Clock clock;

    public ProgressTracker(String entityId, String operationType, StageCatalog catalog, Clock clock) {
        this(new ProgressRecord(entityId, operationType, catalog.processableStages()), catalog, clock);
        record.setStartedAt(clock.instant());
    }

    private ProgressTracker(ProgressRecord record, StageCatalog catalog, Clock clock) {
        this.record = record;
        this.catalog = catalog;
        this.clock = clock;
    }

    /**
     * Rebuilds a tracker from a stored snapshot. Stage entries missing from the
     * snapshot come back as pending.
     */
    public static ProgressTracker restore(
            String entityId,
            String operationType,
            ProgressSnapshot snapshot,
            StageCatalog catalog,
            Clock clock) {
        ProgressRecord record = new ProgressRecord(entityId, operationType, catalog.processableStages());
        for (Map.Entry<String, StageStateSnapshot> entry : snapshot.stages().entrySet()) {
            Optional<ProductionStage> stage = ProductionStage.find(entry.getKey());
            if (stage.isPresent() && record.getStages().containsKey(stage.get()) && entry.getValue() != null) {
                record.getStages().put(stage.get(), StageState.fromSnapshot(entry.getValue()));
            } else {
                log.warn("Ignoring unknown stage '{}' in stored progress for {}", entry.getKey(), entityId);
            }
        }
        if (snapshot.currentStage() != null) {
            record.setCurrentStage(snapshot.currentStage());
        }
        record.setOverallStatus(snapshot.overallStatus());
        record.setStartedAt(snapshot.startedAt());
        record.setCompletedAt(snapshot.completedAt());
        record.setPausedFromStage(snapshot.pausedFromStage());
        record.getStageHistory().addAll(snapshot.stageHistory());
        record.recomputeErrorCount();
        return new ProgressTracker(record, catalog, clock);
    }

    /**
     * Ignored on a terminal or paused run; a paused run must be resumed before any stage starts.
     */
    public void startStage(ProductionStage stage, int totalItems) {
        if (rejectWhenTerminal("start stage " + stage)) {
            return;
        }
        if (record.getOverallStatus() == OverallStatus.PAUSED) {
            log.warn("Ignoring start of stage {} for {} while paused before {}; resume first",
                    stage, record.getEntityId(), record.getPausedFromStage());
            return;
        }
        StageState state = record.getStages().get(stage);
        if (state == null) {
            log.warn("Attempted to start non-initialized stage {} for {}", stage, record.getEntityId());
            return;
        }
        record.setCurrentStage(stage);
        state.setStatus(StageStatus.IN_PROGRESS);
        state.setStartTime(clock.instant());
        state.setTotalItems(Math.max(0, totalItems));
        record.setOverallStatus(OverallStatus.IN_PROGRESS);
    }

    /**
     * Applies the non-null fields to the stage. Completed items are clamped to
     * {@code [0, totalItems]} and the score to {@code [0, 1]}.
     */
    public void updateStageProgress(
            ProductionStage stage,
            Integer completedItems,
            Double avgScore,
            String message,
            int errorIncrement) {
        if (rejectWhenTerminal("update stage " + stage)) {
            return;
        }
        StageState state = record.getStages().get(stage);
        if (state == null) {
            log.warn("Attempted to update non-initialized stage {} for {}", stage, record.getEntityId());
            return;
        }
        if (completedItems != null) {
            state.setCompletedItems(Math.min(Math.max(0, completedItems), state.getTotalItems()));
        }
        if (avgScore != null && !avgScore.isNaN()) {
            state.setAvgScore(Math.min(1.0, Math.max(0.0, avgScore)));
        }
        if (message != null) {
            state.setMessage(message);
        }
        if (errorIncrement > 0) {
            state.setErrorCount(state.getErrorCount() + errorIncrement);
            record.recomputeErrorCount();
        }
    }

    public void completeStage(ProductionStage stage) {
        if (rejectWhenTerminal("complete stage " + stage)) {
            return;
        }
        Optional<ProductionStage> nextStage;
        try {
            nextStage = catalog.nextStage(stage);
        } catch (IllegalArgumentException ex) {
            log.error("Could not find stage {} in the production pipeline for {}", stage, record.getEntityId());
            failProcess("Internal error: stage transition failed for " + stageName(stage));
            return;
        }

        StageState state = record.getStages().get(stage);
        Instant now = clock.instant();
        state.setStatus(StageStatus.COMPLETED);
        state.setEndTime(now);
        if (state.getStartTime() != null) {
            state.setDurationSeconds(Duration.between(state.getStartTime(), now).toMillis() / 1000.0);
        }

        if (nextStage.isPresent()) {
            record.setCurrentStage(nextStage.get());
            record.getStages().get(nextStage.get()).setStatus(StageStatus.PENDING);
        } else {
            completeProcess();
        }
    }

    public void completeProcess() {
        if (rejectWhenTerminal("complete process")) {
            return;
        }
        record.setCurrentStage(ProductionStage.COMPLETED);
        record.setOverallStatus(OverallStatus.COMPLETED);
        record.setCompletedAt(clock.instant());
        record.setPausedFromStage(null);
        log.info("Production {} completed", record.getEntityId());
    }

    public void failProcess(String errorMessage) {
        if (rejectWhenTerminal("fail process")) {
            return;
        }
        ProductionStage activeStage = record.getCurrentStage();
        StageState activeState = record.getStages().get(activeStage);
        if (activeState != null) {
            activeState.setStatus(StageStatus.FAILED);
            activeState.setMessage(errorMessage != null ? errorMessage : DEFAULT_FAILURE_MESSAGE);
        }

        record.setCurrentStage(ProductionStage.FAILED);
        record.setOverallStatus(OverallStatus.FAILED);
        record.setCompletedAt(clock.instant());
        record.setPausedFromStage(null);

        if (errorMessage != null) {
            appendHistory(activeStage, errorMessage);
        }
        log.error("Production {} failed at stage {}: {}", record.getEntityId(), activeStage,
                errorMessage != null ? errorMessage : DEFAULT_FAILURE_MESSAGE);
    }

    /**
     * @return true if the run is now paused
     */
    public boolean pauseProcess() {
        OverallStatus status = record.getOverallStatus();
        if (status != OverallStatus.PENDING && status != OverallStatus.IN_PROGRESS) {
            log.warn("Cannot pause production {} in status {}", record.getEntityId(), status);
            return false;
        }
        ProductionStage activeStage = record.getCurrentStage();
        record.setPausedFromStage(stageName(activeStage));
        record.setOverallStatus(OverallStatus.PAUSED);
        StageState activeState = record.getStages().get(activeStage);
        if (activeState != null) {
            activeState.setStatus(StageStatus.PAUSED);
        }
        log.info("Production {} paused at stage {}", record.getEntityId(), activeStage);
        return true;
    }

    /**
     * Resumes at the stage recorded when pausing. If that marker no longer names
     * an unfinished stage, resumes at the first stage that is not completed.
     *
     * @return true if the run is now in progress, false if it was not paused or
     *         no stage could be resumed
     */
    public boolean resumeProcess() {
        if (record.getOverallStatus() != OverallStatus.PAUSED) {
            log.warn("Cannot resume production {} from status {}", record.getEntityId(), record.getOverallStatus());
            return false;
        }

        String marker = record.getPausedFromStage();
        Optional<ProductionStage> resumeStage = ProductionStage.find(marker)
                .filter(stage -> record.getStages().containsKey(stage))
                .filter(stage -> record.getStages().get(stage).getStatus() != StageStatus.COMPLETED);
        if (resumeStage.isEmpty()) {
            log.warn("Pause marker '{}' for production {} does not name an unfinished stage; "
                    + "falling back to the first stage that is not completed", marker, record.getEntityId());
            resumeStage = firstUnfinishedStage();
        }
        if (resumeStage.isEmpty()) {
            log.warn("Could not find a stage to resume for production {}", record.getEntityId());
            return false;
        }

        ProductionStage stage = resumeStage.get();
        record.setCurrentStage(stage);
        record.getStages().get(stage).setStatus(StageStatus.IN_PROGRESS);
        record.setOverallStatus(OverallStatus.IN_PROGRESS);
        record.setPausedFromStage(null);
        log.info("Production {} resumed at stage {}", record.getEntityId(), stage);
        return true;
    }

    /**
     * Records an error in the stage history. When {@code stage} is given its
     * error count is incremented; otherwise the entry is tagged with the current stage.
     */
    public void addErrorLog(ProductionStage stage, String error) {
        if (rejectWhenTerminal("add error log")) {
            return;
        }
        appendHistory(stage != null ? stage : record.getCurrentStage(), error);
        if (stage != null) {
            StageState state = record.getStages().get(stage);
            if (state != null) {
                state.setErrorCount(state.getErrorCount() + 1);
            }
        }
        record.recomputeErrorCount();
    }

    public double progressPercentage() {
        double total = 0.0;
        for (ProductionStage stage : catalog.processableStages()) {
            StageState state = record.getStages().get(stage);
            total += stageProgress(state) * catalog.weight(stage);
        }
        return Math.min(100.0, Math.max(0.0, total * 100.0));
    }

    public double totalDurationSeconds() {
        Instant start = record.getStartedAt();
        if (start == null) {
            return 0.0;
        }
        Instant end = record.getCompletedAt() != null ? record.getCompletedAt() : clock.instant();
        return Math.max(0.0, Duration.between(start, end).toMillis() / 1000.0);
    }

    public ProgressSnapshot getStateForPersistence() {
        Map<String, StageStateSnapshot> stages = new LinkedHashMap<>();
        for (Map.Entry<ProductionStage, StageState> entry : record.getStages().entrySet()) {
            stages.put(entry.getKey().wireValue(), entry.getValue().toSnapshot());
        }
        return new ProgressSnapshot(
                ProgressSnapshot.CURRENT_FORMAT_VERSION,
                record.getCurrentStage(),
                stages,
                record.getStartedAt(),
                record.getCompletedAt(),
                record.getStageHistory(),
                record.getErrorCount(),
                record.getPausedFromStage(),
                record.getOverallStatus()
        );
    }

    public ProgressSummary getSummary() {
        return ProgressSummary.of(
                record.getEntityId(),
                record.getOperationType(),
                getStateForPersistence(),
                progressPercentage(),
                totalDurationSeconds()
        );
    }

    public String getEntityId() {
        return record.getEntityId();
    }

    public String getOperationType() {
        return record.getOperationType();
    }

    public ProductionStage getCurrentStage() {
        return record.getCurrentStage();
    }

    public OverallStatus getOverallStatus() {
        return record.getOverallStatus();
    }

    public boolean isTerminal() {
        return record.getOverallStatus().isTerminal();
    }

    public int getErrorCount() {
        return record.getErrorCount();
    }

    public String getPausedFromStage() {
        return record.getPausedFromStage();
    }

    public List<StageHistoryEntry> getStageHistory() {
        return List.copyOf(record.getStageHistory());
    }

    public Optional<StageStateSnapshot> getStageState(ProductionStage stage) {
        return Optional.ofNullable(record.getStages().get(stage)).map(StageState::toSnapshot);
    }

    public StageCatalog getCatalog() {
        return catalog;
    }

    private double stageProgress(StageState state) {
        if (state == null) {
            return 0.0;
        }
        if (state.getStatus() == StageStatus.COMPLETED) {
            return 1.0;
        }
        if (state.getStatus() == StageStatus.IN_PROGRESS && state.getTotalItems() > 0) {
            return Math.min(1.0, (double) state.getCompletedItems() / state.getTotalItems());
        }
        return 0.0;
    }

    private Optional<ProductionStage> firstUnfinishedStage() {
        for (ProductionStage stage : catalog.processableStages()) {
            StageState state = record.getStages().get(stage);
            if (state != null && state.getStatus() != StageStatus.COMPLETED) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    private void appendHistory(ProductionStage stage, String error) {
        record.getStageHistory().add(new StageHistoryEntry(clock.instant(), stage, error));
    }

    private boolean rejectWhenTerminal(String action) {
        if (!record.getOverallStatus().isTerminal()) {
            return false;
        }
        log.warn("Ignoring request to {} for production {}: already {}",
                action, record.getEntityId(), record.getOverallStatus().wireValue());
        return true;
    }

    private static String stageName(ProductionStage stage) {
        return stage != null ? stage.wireValue() : "unknown";
    }
}
