package org.example.content.service.persistence;

import org.example.content.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local snapshot store. Contents are lost on restart.
 */
@Component
@ConditionalOnProperty(name = "production.persistence.store", havingValue = "in-memory")
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceGateway.class);

    private final ConcurrentHashMap<String, Entry> records = new ConcurrentHashMap<>();
    private final AtomicLong writeSequence = new AtomicLong();

    @Override
    public Optional<String> create(String entityId, String operationType, ProgressSnapshot initialSnapshot) {
        if (entityId == null || operationType == null || initialSnapshot == null) {
            log.warn("Refusing to create progress record with missing fields (entity={}, type={})",
                    entityId, operationType);
            return Optional.empty();
        }
        String recordId = UUID.randomUUID().toString();
        records.put(recordId, new Entry(
                new StoredProgress(recordId, entityId, operationType, initialSnapshot),
                writeSequence.incrementAndGet()));
        return Optional.of(recordId);
    }

    @Override
    public Optional<StoredProgress> load(String recordId) {
        if (recordId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(recordId)).map(Entry::progress);
    }

    @Override
    public Optional<StoredProgress> findByEntityId(String entityId) {
        return records.values().stream()
                .filter(entry -> entry.progress().entityId().equals(entityId))
                .max(Comparator.comparingLong(Entry::sequence))
                .map(Entry::progress);
    }

    @Override
    public boolean save(String recordId, ProgressSnapshot snapshot) {
        if (recordId == null || snapshot == null) {
            return false;
        }
        Entry updated = records.computeIfPresent(recordId, (id, existing) -> new Entry(
                new StoredProgress(id, existing.progress().entityId(), existing.progress().operationType(), snapshot),
                writeSequence.incrementAndGet()));
        if (updated == null) {
            log.warn("Progress record {} not found for update", recordId);
            return false;
        }
        return true;
    }

    @Override
    public boolean delete(String recordId) {
        if (recordId == null || records.remove(recordId) == null) {
            log.warn("Progress record {} not found for deletion", recordId);
            return false;
        }
        return true;
    }

    private record Entry(StoredProgress progress, long sequence) {
    }
}
