package io.diagramsessions.server.core;

import io.diagramsessions.core.ModelElement;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Point-in-time copy of a session, taken inside its actor.
 *
 * @param model committed model, unprojected; null before the first commit
 * @param visibleModel model as last sent to the client; null before the first commit
 * @param pendingRevision revision of the outstanding bounds request, or null
 */
public record SessionSnapshot(
        String clientId,
        SessionState state,
        Instant openedAt,
        long modelRevision,
        ModelElement model,
        ModelElement visibleModel,
        Long pendingRevision,
        List<String> activeLayers,
        Set<String> selection,
        int queuedEdits,
        int pendingRequests,
        boolean dirty
) {

    static SessionSnapshot of(Session session) {
        return new SessionSnapshot(
                session.clientId(),
                session.state(),
                session.openedAt(),
                session.modelRevision(),
                session.model().orElse(null),
                session.broadcastRoot().orElse(null),
                session.pendingBounds().map(PendingBounds::requestedRevision).orElse(null),
                session.activeLayerList(),
                session.selection(),
                session.queuedEditCount(),
                session.pendingRequestCount(),
                session.isDirty());
    }
}
