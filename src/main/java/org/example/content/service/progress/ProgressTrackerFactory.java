package org.example.content.service.progress;

import org.example.content.model.ProgressSnapshot;
import org.example.content.service.persistence.PersistenceGateway;
import org.example.content.service.persistence.StoredProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Creates, reloads and stores progress trackers by operation type.
 */
@Service
public class ProgressTrackerFactory {

    public static final String ARTICLE_PRODUCTION = "article_production";

    private static final Logger log = LoggerFactory.getLogger(ProgressTrackerFactory.class);

    private final PersistenceGateway persistenceGateway;
    private final Clock clock;
    private final Map<String, StageCatalog> catalogsByOperationType;

    public ProgressTrackerFactory(PersistenceGateway persistenceGateway, StageCatalog stageCatalog, Clock clock) {
        this.persistenceGateway = persistenceGateway;
        this.clock = clock;
        this.catalogsByOperationType = Map.of(ARTICLE_PRODUCTION, stageCatalog);
    }

    public boolean supports(String operationType) {
        return operationType != null && catalogsByOperationType.containsKey(operationType);
    }

    /**
     * Starts tracking a new run and stores its initial snapshot.
     *
     * @return empty if the operation type is unsupported or the initial record could not be stored
     */
    public Optional<TrackedProgress> create(String entityId, String operationType) {
        if (!supports(operationType)) {
            log.warn("Unsupported operation type for progress tracking: {}", operationType);
            return Optional.empty();
        }
        ProgressTracker tracker = new ProgressTracker(
                entityId, operationType, catalogsByOperationType.get(operationType), clock);
        Optional<String> recordId = persistenceGateway.create(entityId, operationType, tracker.getStateForPersistence());
        if (recordId.isEmpty()) {
            log.error("Failed to save initial progress state for {}, type {}", entityId, operationType);
            return Optional.empty();
        }
        log.info("Created progress: id={}, type={}, entity={}", recordId.get(), operationType, entityId);
        return Optional.of(new TrackedProgress(recordId.get(), tracker));
    }

    public Optional<TrackedProgress> load(String recordId) {
        Optional<StoredProgress> stored = persistenceGateway.load(recordId);
        if (stored.isEmpty()) {
            log.warn("Progress record with id {} not found", recordId);
            return Optional.empty();
        }
        return reconstruct(stored.get());
    }

    public Optional<TrackedProgress> findByEntityId(String entityId) {
        return persistenceGateway.findByEntityId(entityId).flatMap(this::reconstruct);
    }

    public boolean save(TrackedProgress progress) {
        boolean saved = persistenceGateway.save(progress.recordId(), progress.tracker().getStateForPersistence());
        if (!saved) {
            log.error("Failed to update progress record {}", progress.recordId());
        }
        return saved;
    }

    public boolean delete(String recordId) {
        return persistenceGateway.delete(recordId);
    }

    private Optional<TrackedProgress> reconstruct(StoredProgress stored) {
        if (!supports(stored.operationType())) {
            log.warn("Cannot reconstruct progress {}: unsupported type '{}'", stored.recordId(), stored.operationType());
            return Optional.empty();
        }
        ProgressSnapshot snapshot = stored.snapshot();
        if (snapshot.formatVersion() > ProgressSnapshot.CURRENT_FORMAT_VERSION) {
            log.warn("Progress record {} uses snapshot format {} (newer than {}); unknown fields are ignored",
                    stored.recordId(), snapshot.formatVersion(), ProgressSnapshot.CURRENT_FORMAT_VERSION);
        }
        ProgressTracker tracker = ProgressTracker.restore(
                stored.entityId(),
                stored.operationType(),
                snapshot,
                catalogsByOperationType.get(stored.operationType()),
                clock);
        return Optional.of(new TrackedProgress(stored.recordId(), tracker));
    }
}
