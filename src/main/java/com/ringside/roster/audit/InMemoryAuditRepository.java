package com.ringside.roster.audit;

import com.ringside.roster.core.model.EntityRef;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Audit trail kept in memory. Besides the journal, entries are indexed by
 * entity key and by correlation id so an entity's history, or everything one
 * transition cascaded into, is read without scanning the whole trail.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> journal = new ArrayList<>();
    private final Map<String, List<AuditEntry>> byEntity = new HashMap<>();
    private final Map<String, List<AuditEntry>> byCorrelation = new HashMap<>();

    @Override
    public synchronized AuditEntry save(AuditEntry entry) {
        journal.add(entry);
        if (entry.entityType() != null && entry.entityId() != null) {
            byEntity.computeIfAbsent(entityKey(entry), k -> new ArrayList<>()).add(entry);
        }
        if (entry.correlationId() != null) {
            byCorrelation.computeIfAbsent(entry.correlationId(), k -> new ArrayList<>()).add(entry);
        }
        return entry;
    }

    @Override
    public synchronized List<AuditEntry> findAll() {
        return List.copyOf(journal);
    }

    @Override
    public synchronized List<AuditEntry> findByEntity(EntityRef entity) {
        return List.copyOf(byEntity.getOrDefault(entity.key(), List.of()));
    }

    @Override
    public synchronized List<AuditEntry> findByAction(AuditAction action) {
        return journal.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public synchronized List<AuditEntry> findByCorrelationId(String correlationId) {
        return List.copyOf(byCorrelation.getOrDefault(correlationId, List.of()));
    }

    @Override
    public synchronized List<AuditEntry> findBetween(Instant start, Instant end) {
        return journal.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public synchronized Optional<AuditEntry> findLatest(EntityRef entity, AuditAction action) {
        List<AuditEntry> entries = byEntity.getOrDefault(entity.key(), List.of());
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).action() == action) {
                return Optional.of(entries.get(i));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized int count() {
        return journal.size();
    }

    // same shape as EntityRef.key()
    private static String entityKey(AuditEntry entry) {
        return entry.entityType() + ":" + entry.entityId();
    }
}
