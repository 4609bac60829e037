package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;

import java.util.concurrent.CompletableFuture;

/**
 * Server-side layout collaborator.
 *
 * <p>Used for sessions that do not delegate measurement to the client. The result has the same
 * shape as a client {@code computedBounds} reply and is merged the same way.
 */
@FunctionalInterface
public interface LayoutEngine {

    /**
     * Compute bounds for a candidate model.
     *
     * @param candidate model tree lacking final bounds for some elements
     * @param revision revision the candidate belongs to; echoed in the result
     */
    CompletableFuture<LayoutResult> layout(ModelElement candidate, long revision);
}
