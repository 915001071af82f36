package org.example.content.service.persistence;

import org.example.content.model.ProgressSnapshot;

public record StoredProgress(
        String recordId,
        String entityId,
        String operationType,
        ProgressSnapshot snapshot
) {
}
