package org.kvplane.balance.scheduler;

import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A unit of work for the scheduler loop.
 * <p>
 * The caller owns the future and may {@link #abandon()} it at any time. The loop skips commands already abandoned
 * and undoes the effect of a command abandoned while it was running.
 *
 * @param <T> result type
 */
public class SchedulerCommand<T> {

    @Getter
    private final String name;

    @Getter
    private final CompletableFuture<T> future = new CompletableFuture<>();

    private final Supplier<T> action;

    private final Consumer<T> rollback;

    @Getter
    private volatile long enqueueTime;

    SchedulerCommand(String name, Supplier<T> action) {
        this(name, action, result -> {
        });
    }

    SchedulerCommand(String name, Supplier<T> action, Consumer<T> rollback) {
        this.name = name;
        this.action = action;
        this.rollback = rollback;
    }

    /**
     * Give up on the result. Safe to call more than once and after completion.
     */
    public void abandon() {
        future.cancel(false);
    }

    void markEnqueued() {
        this.enqueueTime = System.currentTimeMillis();
    }

    T execute() {
        return action.get();
    }

    void rollback(T result) {
        rollback.accept(result);
    }

    @Override
    public String toString() {
        return "SchedulerCommand{" + name + "}";
    }
}
