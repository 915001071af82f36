package org.example.content.service.progress;

/**
 * A live tracker paired with the id of the record that stores its snapshots.
 */
public record TrackedProgress(
        String recordId,
        ProgressTracker tracker
) {
}
