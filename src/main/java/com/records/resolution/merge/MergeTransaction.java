package com.records.resolution.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Compensating transaction for entity merges.
 * Compensations registered by completed steps run in reverse order when a later step
 * fails or when the transaction closes without {@link #markSuccess()}.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     tx.execute("update primary", () -> store.updateEntity(...), () -> store.updateEntity(original));
 *     tx.executeNoCompensation("delete duplicate", () -> store.deleteEntity(duplicateId));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private final List<String> completedSteps = new ArrayList<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Runs a step and registers its compensation. On failure the compensations of the
     * earlier steps run and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        runStep(description, operation);
        compensationStack.push(new CompensatingAction(description, compensation));
    }

    /**
     * Runs a step that has nothing to undo, or whose effect must not be undone.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        runStep(description, operation);
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Descriptions of the steps that completed, in execution order.
     */
    public List<String> getCompletedSteps() {
        return List.copyOf(completedSteps);
    }

    @Override
    public void close() {
        if (!closed && !success && !compensationStack.isEmpty()) {
            log.warn("MergeTransaction closed without success - running compensations");
            runCompensations();
        }
        closed = true;
    }

    private void runStep(String description, Runnable operation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("Executing merge step: {}", description);
            operation.run();
            completedSteps.add(description);
        } catch (RuntimeException e) {
            log.warn("Merge step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                // Best effort: keep undoing the remaining steps
                log.error("Compensation '{}' failed: {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
