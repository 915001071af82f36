package org.example.content.model;

import java.time.Instant;

public record StageHistoryEntry(
        Instant time,
        ProductionStage stage,
        String error
) {
}
