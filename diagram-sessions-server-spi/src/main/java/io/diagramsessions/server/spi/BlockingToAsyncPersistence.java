package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Adapter that wraps a blocking {@link ModelPersistence} to provide the {@link AsyncModelPersistence}
 * interface.
 *
 * <p>Blocking calls run on the provided {@link Executor}:
 * <pre>{@code
 * ModelPersistence blocking = new InMemoryModelPersistence();
 * AsyncModelPersistence async = new BlockingToAsyncPersistence(blocking, executor);
 * async.load("file:///model.json").thenAccept(root -> ...);
 * }</pre>
 */
public final class BlockingToAsyncPersistence implements AsyncModelPersistence {

    private final ModelPersistence delegate;
    private final Executor executor;

    public BlockingToAsyncPersistence(ModelPersistence delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Optional<ModelElement>> load(String sourceUri) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return delegate.load(sourceUri);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> save(String sourceUri, ModelElement root) {
        return CompletableFuture.runAsync(() -> {
            try {
                delegate.save(sourceUri, root);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> export(String sourceUri, String svg) {
        return CompletableFuture.runAsync(() -> {
            try {
                delegate.export(sourceUri, svg);
            } catch (Exception e) {
                throw wrapException(e);
            }
        }, executor);
    }

    /**
     * Returns the underlying blocking persistence.
     */
    public ModelPersistence delegate() {
        return delegate;
    }

    private static RuntimeException wrapException(Exception e) {
        if (e instanceof RuntimeException re) {
            return re;
        }
        return new PersistenceException(e);
    }

    /**
     * Exception wrapper for checked exceptions from blocking persistence operations.
     */
    public static final class PersistenceException extends RuntimeException {
        public PersistenceException(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
