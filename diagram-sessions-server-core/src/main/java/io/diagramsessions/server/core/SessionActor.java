package io.diagramsessions.server.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serial executor for one session.
 *
 * <p>Tasks run one at a time in submission order. A task's returned future must complete before
 * the next task starts, so asynchronous collaborator calls (persistence, layout) suspend the
 * session without blocking a thread and without letting a later envelope overtake them.
 */
final class SessionActor {

    private final Executor executor;
    private final Object lock = new Object();
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    SessionActor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> task) {
        Objects.requireNonNull(task, "task");
        synchronized (lock) {
            CompletableFuture<T> next = tail
                    .handle((ignored, failure) -> null)
                    .thenComposeAsync(ignored -> run(task), executor);
            tail = next;
            return next;
        }
    }

    private static <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> task) {
        try {
            return Objects.requireNonNull(task.get(), "task returned null");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
