package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * What a handler sees of the engine while it runs.
 */
public final class SessionContext {

    private final Session session;
    private final ActionDispatcher dispatcher;

    SessionContext(Session session, ActionDispatcher dispatcher) {
        this.session = Objects.requireNonNull(session, "session");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public Session session() {
        return session;
    }

    /**
     * Dispatch a nested action for the same session, inside the current actor task.
     */
    public CompletableFuture<List<Action>> dispatch(Action action) {
        return dispatcher.dispatch(session, action);
    }
}
