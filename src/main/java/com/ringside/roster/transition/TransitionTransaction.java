package com.ringside.roster.transition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating transaction grouping every write of one transition:
 * ledger changes, status resync and cascade writes.
 * Compensations run in reverse order if any step fails or the
 * transaction is closed without being marked successful.
 *
 * <p>Usage:</p>
 * <pre>
 * try (TransitionTransaction tx = new TransitionTransaction()) {
 *     Period p = tx.execute("open employment", () -> repo.createPeriod(...), p -> repo.deletePeriod(p.id()));
 *     tx.execute("resync status", () -> repo.saveMember(updated), () -> repo.saveMember(previous));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class TransitionTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransitionTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Executes a write and registers the action that undoes it.
     * If the write fails, all previously registered compensations run in
     * reverse order and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        execute(description, () -> {
            operation.run();
            return null;
        }, ignored -> compensation.run());
    }

    /**
     * Executes a write returning a value; the compensation receives that value.
     */
    public <T> T execute(String description, Supplier<T> operation, Consumer<T> compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }

        try {
            log.debug("Executing step: {}", description);
            T result = operation.get();
            compensationStack.push(new CompensatingAction(description, () -> compensation.accept(result)));
            return result;
        } catch (RuntimeException e) {
            log.warn("Step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Marks the transaction as successful.
     * If called before close(), compensations will not be executed.
     */
    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of compensations currently registered.
     */
    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success && !compensationStack.isEmpty()) {
            log.warn("Transaction closed without success - running {} compensations", compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' failed (best-effort): {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
