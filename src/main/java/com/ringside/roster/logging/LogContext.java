package com.ringside.roster.logging;

import com.ringside.roster.core.model.EntityRef;
import com.ringside.roster.core.model.MembershipKind;
import com.ringside.roster.core.model.Transition;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forTransition(correlationId, ref, Transition.RETIRE)) {
 *     log.info("transition.applied entityId={} status={}", ref.id(), status);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a lifecycle transition.
     */
    public static LogContext forTransition(String correlationId, EntityRef subject, Transition transition) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityType", subject.type().name());
        ctx.put("entityId", subject.id());
        ctx.put("transition", transition.getLabel());
        ctx.put("operation", "transition");
        return ctx;
    }

    /**
     * Creates a log context for membership changes.
     */
    public static LogContext forMembership(String correlationId, MembershipKind kind, EntityRef group,
                                           EntityRef member) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("membershipKind", kind.name());
        ctx.put("groupId", group.id());
        ctx.put("entityId", member.id());
        ctx.put("operation", "membership");
        return ctx;
    }

    /**
     * Creates a log context for championship changes.
     */
    public static LogContext forChampionship(String correlationId, String titleId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("titleId", titleId);
        ctx.put("operation", "championship");
        return ctx;
    }

    /**
     * Creates a log context for roster maintenance (delete, restore).
     */
    public static LogContext forRoster(String correlationId, EntityRef subject, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityType", subject.type().name());
        ctx.put("entityId", subject.id());
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
