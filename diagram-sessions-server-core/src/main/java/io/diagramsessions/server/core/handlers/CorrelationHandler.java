package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.server.core.ActionRegistry;
import io.diagramsessions.server.core.PendingBounds;
import io.diagramsessions.server.core.Session;
import io.diagramsessions.server.core.SessionContext;
import io.diagramsessions.server.core.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Identifiable request/response pairs in both directions.
 *
 * <p>A client request is answered by wrapping the first {@link Action.Response} its inner action
 * produces; other outbound actions pass unwrapped. When the inner action starts a bounds handshake
 * instead, the model sent by the handshake's commit is the answer. Operations arriving during a
 * handshake are queued together with their id. A client response completes the server request
 * registered under the same id.
 */
public final class CorrelationHandler {

    private static final Logger log = LoggerFactory.getLogger(CorrelationHandler.class);

    public void registerWith(ActionRegistry.Builder registry) {
        registry.register(Action.IdentifiableRequest.KIND, Action.IdentifiableRequest.class, this::request);
        registry.register(Action.IdentifiableResponse.KIND, Action.IdentifiableResponse.class, this::response);
    }

    CompletableFuture<List<Action>> request(SessionContext context, Action.IdentifiableRequest request) {
        Session session = context.session();
        if (request.action() instanceof Action.Operation && session.state() == SessionState.AWAITING_BOUNDS) {
            session.queueEdit(request);
            log.debug("client {}: queued request {} until bounds arrive", session.clientId(), request.id());
            return CompletableFuture.completedFuture(List.of());
        }
        PendingBounds before = session.pendingBounds().orElse(null);
        return context.dispatch(request.action()).thenApply(actions -> {
            List<Action> out = new ArrayList<>(actions.size());
            boolean answered = false;
            for (Action action : actions) {
                if (!answered && action instanceof Action.Response) {
                    out.add(new Action.IdentifiableResponse(request.id(), action));
                    answered = true;
                } else {
                    out.add(action);
                }
            }
            if (!answered) {
                PendingBounds after = session.pendingBounds().orElse(null);
                if (after != null && after != before) {
                    session.deferResponse(request.id());
                    log.debug("client {}: request {} is answered when revision {} commits",
                            session.clientId(), request.id(), after.requestedRevision());
                } else {
                    log.debug("client {}: request {} produced no response", session.clientId(), request.id());
                }
            }
            return out;
        });
    }

    CompletableFuture<List<Action>> response(SessionContext context, Action.IdentifiableResponse response) {
        context.session().takePendingRequest(response.id())
                .orElseThrow(() -> new DiagramSessionsException.UnknownRequestId(response.id()))
                .complete(response.action());
        log.debug("client {}: request {} answered with {}", context.session().clientId(), response.id(), response.action().kind());
        return CompletableFuture.completedFuture(List.of());
    }
}
