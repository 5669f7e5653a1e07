package com.ringside.roster.audit;

import com.ringside.roster.core.model.EntityRef;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store for the roster audit trail. Entries are returned in the
 * order they were saved.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Entries about one entity, matched on both its type and its id.
     */
    List<AuditEntry> findByEntity(EntityRef entity);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Entries written by one unit of work: the transition and its cascades.
     */
    List<AuditEntry> findByCorrelationId(String correlationId);

    /**
     * Entries timestamped within the range, both ends inclusive.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    /**
     * The most recently saved entry of the given action about the entity.
     */
    Optional<AuditEntry> findLatest(EntityRef entity, AuditAction action);

    int count();
}
