package com.ringside.roster.transition;

import com.ringside.roster.audit.AuditService;
import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.lock.EntityLock;
import com.ringside.roster.lock.LockAcquisitionException;
import com.ringside.roster.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a block of roster writes as one all-or-nothing unit while holding the
 * locks of every entity it touches.
 *
 * <p>The entities to lock are resolved before locking and again once the
 * locks are held. If the second resolution names an entity that is not
 * locked, a concurrent change moved the set: every lock is released and the
 * unit starts over, so locks are only ever taken in rank order.</p>
 *
 * <p>Units of work nest: a cascade that triggers another transition on the
 * same thread joins the unit already in progress, sharing its locks and its
 * transaction, so the whole chain commits or rolls back together.</p>
 */
public class UnitOfWork {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    static final int MAX_LOCK_ATTEMPTS = 3;

    private static final ThreadLocal<TransitionContext> CURRENT = new ThreadLocal<>();

    private final EntityLock lock;
    private final AuditService auditService;
    private final String actorId;

    public UnitOfWork(EntityLock lock, AuditService auditService, String actorId) {
        this.lock = lock;
        this.auditService = auditService;
        this.actorId = actorId;
    }

    /**
     * Whether the calling thread is already inside a unit of work.
     */
    public boolean inProgress() {
        return CURRENT.get() != null;
    }

    public String getActorId() {
        return actorId;
    }

    public Optional<TransitionContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Executes the work with the given entities locked.
     *
     * @param refs entities to serialize on; acquired in lock-rank order
     * @param work the writes to perform
     * @return the work's result
     */
    public <T> T execute(Collection<EntityRef> refs, Function<TransitionContext, T> work) {
        return execute(LogContext.generateCorrelationId(), refs, work);
    }

    /**
     * Executes the work under the given correlation id. When a unit of work is
     * already in progress the id is ignored and the work joins it.
     */
    public <T> T execute(String correlationId, Collection<EntityRef> refs, Function<TransitionContext, T> work) {
        return execute(correlationId, () -> refs, work);
    }

    /**
     * Executes the work with the entities named by {@code related} locked.
     * {@code related} reads the current relationships of the entities involved
     * and may be called several times.
     *
     * @throws LockAcquisitionException if a lock times out, or the related
     *                                  entities keep changing while they are locked
     */
    public <T> T execute(String correlationId, Supplier<? extends Collection<EntityRef>> related,
                         Function<TransitionContext, T> work) {
        TransitionContext existing = CURRENT.get();
        if (existing != null) {
            Collection<EntityRef> refs = related.get();
            if (!existing.holdsAll(refs)) {
                log.debug("unit.late_lock correlationId={} refs={} held={}",
                        existing.correlationId(), refs, existing.heldLocks());
            }
            existing.lockAll(refs, lock);
            return work.apply(existing);
        }

        for (int attempt = 1; ; attempt++) {
            TransitionContext ctx = new TransitionContext(correlationId, actorId);
            CURRENT.set(ctx);
            try {
                ctx.lockAll(related.get(), lock);
                Optional<EntityRef> missed = related.get().stream()
                        .filter(ref -> !ctx.heldLocks().contains(ref))
                        .findFirst();
                if (missed.isPresent()) {
                    if (attempt >= MAX_LOCK_ATTEMPTS) {
                        throw LockAcquisitionException.unsettled(missed.get(), attempt);
                    }
                    log.debug("unit.relock correlationId={} attempt={} missed={}",
                            correlationId, attempt, missed.get());
                    continue;
                }

                T result;
                try (TransitionTransaction tx = ctx.transaction()) {
                    result = work.apply(ctx);
                    tx.markSuccess();
                }
                auditService.recordAll(ctx.pendingAudit());
                log.debug("Unit of work {} committed ({} locks)", ctx.correlationId(), ctx.heldLocks().size());
                return result;
            } finally {
                ctx.releaseLocks(lock);
                CURRENT.remove();
            }
        }
    }
}
