package org.example.content.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a run for status polling; adds the derived percentage and duration.
 */
public record ProgressSummary(
        String entityId,
        String operationType,
        ProductionStage currentStage,
        OverallStatus overallStatus,
        Map<String, StageStateSnapshot> stages,
        Instant startedAt,
        Instant completedAt,
        List<StageHistoryEntry> stageHistory,
        int errorCount,
        String pausedFromStage,
        double progressPercentage,
        double durationSeconds
) {
    public static ProgressSummary of(
            String entityId,
            String operationType,
            ProgressSnapshot snapshot,
            double progressPercentage,
            double durationSeconds) {
        return new ProgressSummary(
                entityId,
                operationType,
                snapshot.currentStage(),
                snapshot.overallStatus(),
                snapshot.stages(),
                snapshot.startedAt(),
                snapshot.completedAt(),
                snapshot.stageHistory(),
                snapshot.errorCount(),
                snapshot.pausedFromStage(),
                progressPercentage,
                durationSeconds
        );
    }
}
