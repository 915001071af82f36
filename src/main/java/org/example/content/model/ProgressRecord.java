package org.example.content.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * State of one production run. Every processable stage has an entry from construction on.
 */
public class ProgressRecord {

    private final String entityId;
    private final String operationType;
    private final EnumMap<ProductionStage, StageState> stages = new EnumMap<>(ProductionStage.class);
    private final List<StageHistoryEntry> stageHistory = new ArrayList<>();

    private ProductionStage currentStage;
    private OverallStatus overallStatus = OverallStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String pausedFromStage;
    private int errorCount;

    public ProgressRecord(String entityId, String operationType, Collection<ProductionStage> processableStages) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        if (operationType == null || operationType.isBlank()) {
            throw new IllegalArgumentException("operationType must not be blank");
        }
        if (processableStages == null || processableStages.isEmpty()) {
            throw new IllegalArgumentException("At least one processable stage is required");
        }
        this.entityId = entityId;
        this.operationType = operationType;
        for (ProductionStage stage : processableStages) {
            stages.put(stage, new StageState());
        }
        this.currentStage = processableStages.iterator().next();
    }

    public String getEntityId() {
        return entityId;
    }

    public String getOperationType() {
        return operationType;
    }

    public Map<ProductionStage, StageState> getStages() {
        return stages;
    }

    public List<StageHistoryEntry> getStageHistory() {
        return stageHistory;
    }

    public ProductionStage getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(ProductionStage currentStage) {
        this.currentStage = currentStage;
    }

    public OverallStatus getOverallStatus() {
        return overallStatus;
    }

    public void setOverallStatus(OverallStatus overallStatus) {
        this.overallStatus = overallStatus;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getPausedFromStage() {
        return pausedFromStage;
    }

    public void setPausedFromStage(String pausedFromStage) {
        this.pausedFromStage = pausedFromStage;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public void recomputeErrorCount() {
        int total = 0;
        for (StageState state : stages.values()) {
            total += state.getErrorCount();
        }
        this.errorCount = total;
    }
}
