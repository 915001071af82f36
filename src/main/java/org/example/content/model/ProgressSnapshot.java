package org.example.content.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain, immutable copy of a production run's progress as handed to storage.
 * Stage keys and the pause marker are kept as wire strings so that a stale or
 * corrupted value survives a round trip and can be repaired on resume.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressSnapshot(
        @JsonProperty("format_version") int formatVersion,
        @JsonProperty("current_stage") ProductionStage currentStage,
        Map<String, StageStateSnapshot> stages,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("stage_history") List<StageHistoryEntry> stageHistory,
        @JsonProperty("error_count") int errorCount,
        @JsonProperty("paused_from_stage") String pausedFromStage,
        @JsonProperty("overall_status") OverallStatus overallStatus
) {
    public static final int CURRENT_FORMAT_VERSION = 1;

    public ProgressSnapshot {
        stages = stages == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        stageHistory = stageHistory == null ? List.of() : List.copyOf(stageHistory);
        if (overallStatus == null) {
            overallStatus = OverallStatus.PENDING;
        }
    }

    public ProgressSnapshot withPausedFromStage(String marker) {
        return new ProgressSnapshot(
                formatVersion,
                currentStage,
                stages,
                startedAt,
                completedAt,
                stageHistory,
                errorCount,
                marker,
                overallStatus
        );
    }
}
