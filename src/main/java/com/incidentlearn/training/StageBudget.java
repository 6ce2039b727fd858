package com.incidentlearn.training;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Waits for a submitted stage until its deadline, cancelling it when the budget runs out. */
public record StageBudget(String stage, Duration budget, long deadlineNanos) {
    public static StageBudget startingNow(String stage, Duration budget) {
        return new StageBudget(stage, budget, System.nanoTime() + budget.toNanos());
    }

    public <T> T await(Future<T> future) throws InterruptedException, ExecutionException {
        try {
            return future.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new PipelineTimeoutException(stage, budget);
        }
    }
}
