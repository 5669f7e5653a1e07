package com.ringside.roster.transition;

import com.ringside.roster.audit.AuditAction;
import com.ringside.roster.audit.AuditEntry;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.lock.EntityLock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one unit of work: its compensating transaction, the entity locks it
 * holds until completion, and the audit entries to publish once it succeeds.
 */
public class TransitionContext {

    private final String correlationId;
    private final String actorId;
    private final TransitionTransaction transaction = new TransitionTransaction();
    private final Set<EntityRef> heldLocks = new LinkedHashSet<>();
    private final List<AuditEntry> pendingAudit = new ArrayList<>();

    TransitionContext(String correlationId, String actorId) {
        this.correlationId = correlationId;
        this.actorId = actorId;
    }

    public String correlationId() {
        return correlationId;
    }

    public String actorId() {
        return actorId;
    }

    public TransitionTransaction transaction() {
        return transaction;
    }

    /**
     * Queues an audit entry; entries are written only when the unit of work commits.
     */
    public void audit(AuditAction action, EntityRef subject, Instant timestamp, Map<String, Object> details) {
        pendingAudit.add(AuditEntry.builder()
                .action(action)
                .entityId(subject.id())
                .entityType(subject.type().name())
                .actorId(actorId)
                .correlationId(correlationId)
                .details(details)
                .timestamp(timestamp)
                .build());
    }

    List<AuditEntry> pendingAudit() {
        return pendingAudit;
    }

    void lockAll(Collection<EntityRef> refs, EntityLock lock) {
        refs.stream()
                .sorted(EntityRef.LOCK_ORDER)
                .filter(ref -> !heldLocks.contains(ref))
                .forEach(ref -> {
                    lock.acquire(ref);
                    heldLocks.add(ref);
                });
    }

    boolean holdsAll(Collection<EntityRef> refs) {
        return heldLocks.containsAll(refs);
    }

    void releaseLocks(EntityLock lock) {
        List<EntityRef> refs = new ArrayList<>(heldLocks);
        for (int i = refs.size() - 1; i >= 0; i--) {
            lock.release(refs.get(i));
        }
        heldLocks.clear();
    }

    Set<EntityRef> heldLocks() {
        return heldLocks;
    }
}
