package org.example.content.service.persistence;

import org.example.content.model.ProgressSnapshot;

import java.util.Optional;

/**
 * Storage for progress snapshots keyed by an opaque record id.
 * Implementations report failures as empty results or {@code false}; they do not throw.
 */
public interface PersistenceGateway {

    /**
     * Store the initial snapshot of a new run.
     *
     * @return the new record id, or empty if the record could not be written
     */
    Optional<String> create(String entityId, String operationType, ProgressSnapshot initialSnapshot);

    Optional<StoredProgress> load(String recordId);

    /**
     * Most recently updated record for the entity, if any.
     */
    Optional<StoredProgress> findByEntityId(String entityId);

    /**
     * Overwrite the snapshot of an existing record. Last write wins.
     */
    boolean save(String recordId, ProgressSnapshot snapshot);

    boolean delete(String recordId);
}
