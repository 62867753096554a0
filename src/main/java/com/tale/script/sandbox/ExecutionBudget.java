package com.tale.script.sandbox;

import com.tale.script.diagnostics.ExecutionTimeoutException;

/**
 * Cooperative run limits. The interpreter calls {@link #checkpoint()} before
 * every statement, on every loop iteration and on every call.
 */
public final class ExecutionBudget {

    private final long maxSteps;
    private final long timeoutMillis;
    private final long deadlineNanos;
    private long steps;

    public ExecutionBudget(long maxSteps, long timeoutMillis) {
        this.maxSteps = maxSteps;
        this.timeoutMillis = timeoutMillis;
        this.deadlineNanos = System.nanoTime() + timeoutMillis * 1_000_000L;
    }

    public void checkpoint() {
        if (++steps > maxSteps) {
            throw new ExecutionTimeoutException("The program took more than " + maxSteps
                    + " steps and was stopped. Is there a loop that never ends?");
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new ExecutionTimeoutException("The program ran longer than " + timeoutMillis
                    + " ms and was stopped. Is there a loop that never ends?");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ExecutionTimeoutException("The run was cancelled");
        }
    }

    public long steps() { return steps; }
}
