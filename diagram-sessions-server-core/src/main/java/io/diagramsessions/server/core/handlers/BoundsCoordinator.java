package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.server.core.ActionRegistry;
import io.diagramsessions.server.core.ModelTrees;
import io.diagramsessions.server.core.ModelUpdater;
import io.diagramsessions.server.core.PendingBounds;
import io.diagramsessions.server.core.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Completes the bounds handshake with the client's {@code computedBounds} reply.
 *
 * <p>Only a reply carrying the current revision commits. A pending candidate is always stored at
 * the revision it was requested for, and every later proposal replaces it, so any other reply is
 * stale and dropped.
 */
public final class BoundsCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BoundsCoordinator.class);

    private final ModelUpdater updater;

    public BoundsCoordinator(ModelUpdater updater) {
        this.updater = Objects.requireNonNull(updater, "updater");
    }

    public void registerWith(ActionRegistry.Builder registry) {
        registry.register(Action.ComputedBounds.KIND, Action.ComputedBounds.class, (ctx, reply) -> computedBounds(ctx.session(), reply));
    }

    CompletableFuture<List<Action>> computedBounds(Session session, Action.ComputedBounds reply) {
        long current = session.modelRevision();
        PendingBounds pending = session.pendingBounds()
                .orElseThrow(() -> new DiagramSessionsException.StaleBoundsReply(reply.revision(), current));
        if (reply.revision() != current) {
            throw new DiagramSessionsException.StaleBoundsReply(reply.revision(), current);
        }
        log.debug("client {}: bounds for revision {} arrived", session.clientId(), current);
        ModelElement merged = ModelTrees.mergeLayout(pending.candidateRoot(), reply.bounds(), reply.alignments());
        session.advanceRevision();
        return CompletableFuture.completedFuture(updater.commit(session, merged));
    }
}
