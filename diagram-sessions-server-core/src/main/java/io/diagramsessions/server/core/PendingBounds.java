package io.diagramsessions.server.core;

import io.diagramsessions.core.ModelElement;

import java.util.Objects;

/**
 * An outstanding bounds computation.
 *
 * @param requestedRevision revision the candidate was sent with; a reply must echo it
 * @param candidateRoot full (unprojected) candidate model waiting for bounds
 */
public record PendingBounds(long requestedRevision, ModelElement candidateRoot) {

    public PendingBounds {
        Objects.requireNonNull(candidateRoot, "candidateRoot");
    }
}
