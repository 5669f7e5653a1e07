package com.ringside.roster.audit;

import com.ringside.roster.core.model.EntityRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service for recording and querying audit entries.
 * Provides append-only storage for all auditable roster operations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} {} by {}",
                entry.action(), entry.entityType(), entry.entityId(), entry.actorId());
        return entry;
    }

    /**
     * Records a batch of entries collected during one unit of work.
     */
    public void recordAll(List<AuditEntry> entries) {
        entries.forEach(this::record);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForEntity(EntityRef entity) {
        return repository.findByEntity(entity);
    }

    public Optional<AuditEntry> getLatestEntry(EntityRef entity, AuditAction action) {
        return repository.findLatest(entity, action);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    /**
     * Gets the entries written by one unit of work, the primary transition and its cascades.
     */
    public List<AuditEntry> getEntriesForCorrelation(String correlationId) {
        return repository.findByCorrelationId(correlationId);
    }

    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return repository.findBetween(start, end);
    }

    public int size() {
        return repository.count();
    }
}
