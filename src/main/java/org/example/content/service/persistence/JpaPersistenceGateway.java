package org.example.content.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.content.entity.ProductionProgressEntity;
import org.example.content.model.ProgressSnapshot;
import org.example.content.repository.ProductionProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Stores each run as one {@code production_progress} row holding the snapshot as JSON,
 * with status, stage and error count mirrored into columns for querying.
 * <p>
 * Writes run in the repository's own transaction and are flushed immediately, so a
 * constraint violation surfaces inside the call and is reported as empty/false.
 */
@Component
@ConditionalOnProperty(name = "production.persistence.store", havingValue = "database", matchIfMissing = true)
public class JpaPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaPersistenceGateway.class);

    private final ProductionProgressRepository repository;
    private final ObjectMapper objectMapper;

    public JpaPersistenceGateway(ProductionProgressRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<String> create(String entityId, String operationType, ProgressSnapshot initialSnapshot) {
        try {
            ProductionProgressEntity entity = new ProductionProgressEntity(entityId, operationType);
            apply(entity, initialSnapshot);
            ProductionProgressEntity saved = repository.saveAndFlush(entity);
            log.info("Progress record created for entity {}, type {}, id {}", entityId, operationType, saved.getId());
            return Optional.of(saved.getId());
        } catch (JsonProcessingException | DataAccessException ex) {
            log.error("Failed to create progress record for entity {}: {}", entityId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredProgress> load(String recordId) {
        try {
            return repository.findById(recordId).flatMap(this::toStoredProgress);
        } catch (DataAccessException ex) {
            log.error("Failed to load progress record {}: {}", recordId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredProgress> findByEntityId(String entityId) {
        try {
            return repository.findFirstByEntityIdOrderByUpdatedAtDesc(entityId).flatMap(this::toStoredProgress);
        } catch (DataAccessException ex) {
            log.error("Failed to find progress record for entity {}: {}", entityId, ex.getMessage(), ex);
            return Optional.empty();
        }
    }

    @Override
    public boolean save(String recordId, ProgressSnapshot snapshot) {
        try {
            Optional<ProductionProgressEntity> existing = repository.findById(recordId);
            if (existing.isEmpty()) {
                log.warn("Progress record {} not found for update", recordId);
                return false;
            }
            ProductionProgressEntity entity = existing.get();
            apply(entity, snapshot);
            repository.saveAndFlush(entity);
            log.debug("Progress record {} updated: status={}, stage={}",
                    recordId, snapshot.overallStatus(), snapshot.currentStage());
            return true;
        } catch (JsonProcessingException | DataAccessException ex) {
            log.error("Failed to update progress record {}: {}", recordId, ex.getMessage(), ex);
            return false;
        }
    }

    @Override
    public boolean delete(String recordId) {
        try {
            if (!repository.existsById(recordId)) {
                log.warn("Progress record {} not found for deletion", recordId);
                return false;
            }
            repository.deleteById(recordId);
            log.info("Progress record {} deleted", recordId);
            return true;
        } catch (DataAccessException ex) {
            log.error("Failed to delete progress record {}: {}", recordId, ex.getMessage(), ex);
            return false;
        }
    }

    private void apply(ProductionProgressEntity entity, ProgressSnapshot snapshot) throws JsonProcessingException {
        entity.setSnapshotJson(objectMapper.writeValueAsString(snapshot));
        entity.setOverallStatus(snapshot.overallStatus());
        entity.setCurrentStage(snapshot.currentStage());
        entity.setErrorCount(snapshot.errorCount());
        entity.setStartedAt(snapshot.startedAt());
        entity.setCompletedAt(snapshot.completedAt());
    }

    private Optional<StoredProgress> toStoredProgress(ProductionProgressEntity entity) {
        String json = entity.getSnapshotJson();
        if (json == null || json.isBlank()) {
            log.warn("Progress record {} has no stored snapshot", entity.getId());
            return Optional.empty();
        }
        try {
            ProgressSnapshot snapshot = objectMapper.readValue(json, ProgressSnapshot.class);
            return Optional.of(new StoredProgress(
                    entity.getId(),
                    entity.getEntityId(),
                    entity.getOperationType(),
                    snapshot
            ));
        } catch (JsonProcessingException ex) {
            log.error("Failed to parse snapshot of progress record {}: {}", entity.getId(), ex.getMessage());
            return Optional.empty();
        }
    }
}
