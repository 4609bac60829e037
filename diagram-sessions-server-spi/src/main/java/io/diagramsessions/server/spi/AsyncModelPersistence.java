package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous counterpart of {@link ModelPersistence}.
 *
 * <p>All operations return immediately; the session actor resumes when the future completes.
 *
 * @see BlockingToAsyncPersistence
 */
public interface AsyncModelPersistence {

    CompletableFuture<Optional<ModelElement>> load(String sourceUri);

    CompletableFuture<Void> save(String sourceUri, ModelElement root);

    CompletableFuture<Void> export(String sourceUri, String svg);
}
