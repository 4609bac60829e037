package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handles one action kind for a session.
 *
 * <p>Handlers run inside the session actor and may mutate {@link SessionContext#session()}
 * directly, including from continuations of the returned future. Failures (thrown or as an
 * exceptionally completed future) are turned into status actions by the {@link ActionDispatcher}.
 *
 * @param <A> action type
 */
@FunctionalInterface
public interface ActionHandler<A extends Action> {

    /**
     * @return actions to send to the client, in order
     */
    CompletableFuture<List<Action>> handle(SessionContext context, A action);
}
