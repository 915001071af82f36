package org.example.content.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StageStateSnapshot(
        StageStatus status,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("total_items") int totalItems,
        @JsonProperty("completed_items") int completedItems,
        @JsonProperty("avg_score") double avgScore,
        @JsonProperty("error_count") int errorCount,
        String message
) {
    public StageStateSnapshot {
        if (status == null) {
            status = StageStatus.PENDING;
        }
        if (message == null) {
            message = "";
        }
    }
}
