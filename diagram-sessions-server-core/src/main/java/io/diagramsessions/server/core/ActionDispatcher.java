package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Routes actions to their registered handlers and converts failures into status actions.
 *
 * <p>Protocol errors become an error {@code serverStatus} for the originating client; a stale
 * bounds reply is dropped without a reply. Anything else is a collaborator or handler bug: it is
 * logged with its stack trace and reported as an internal error. The returned future never
 * completes exceptionally.
 */
public final class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ActionRegistry registry;

    public ActionDispatcher(ActionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ActionRegistry registry() {
        return registry;
    }

    public CompletableFuture<List<Action>> dispatch(Session session, Action action) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(action, "action");
        CompletableFuture<List<Action>> result;
        try {
            ActionRegistry.Registration<?> registration = registry.find(action.kind())
                    .orElseThrow(() -> new DiagramSessionsException.UnknownActionKind(action.kind()));
            log.trace("dispatching {} for client {}", action.kind(), session.clientId());
            result = registration.invoke(new SessionContext(session, this), action);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((actions, failure) ->
                failure == null ? actions : onFailure(session, action, unwrap(failure)));
    }

    private List<Action> onFailure(Session session, Action action, Throwable failure) {
        if (failure instanceof DiagramSessionsException.StaleBoundsReply stale) {
            log.debug("client {}: {}", session.clientId(), stale.getMessage());
            return List.of();
        }
        if (failure instanceof DiagramSessionsException protocolError) {
            log.warn("client {}: {} rejected: {}", session.clientId(), action.kind(), protocolError.getMessage());
            return List.of(Action.ServerStatus.error(protocolError.getMessage()));
        }
        log.error("client {}: failed to handle {}", session.clientId(), action.kind(), failure);
        return List.of(new Action.ServerStatus(Severity.ERROR,
                "internal error while handling " + action.kind(), String.valueOf(failure.getMessage())));
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
