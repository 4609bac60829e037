package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Immutable mapping from action kind to handler.
 */
public final class ActionRegistry {

    private final Map<String, Registration<?>> byKind;

    private ActionRegistry(Map<String, Registration<?>> byKind) {
        this.byKind = Map.copyOf(byKind);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Registration<?>> find(String kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public Set<String> kinds() {
        return byKind.keySet();
    }

    /**
     * A handler bound to its kind and action type.
     */
    public static final class Registration<A extends Action> {
        private final String kind;
        private final Class<A> type;
        private final ActionHandler<? super A> handler;

        private Registration(String kind, Class<A> type, ActionHandler<? super A> handler) {
            this.kind = kind;
            this.type = type;
            this.handler = handler;
        }

        public String kind() {
            return kind;
        }

        public Class<A> type() {
            return type;
        }

        CompletableFuture<List<Action>> invoke(SessionContext context, Action action) {
            // an Unrecognized action can carry a registered kind when the codec table lacks it
            if (!type.isInstance(action)) {
                throw new DiagramSessionsException.UnknownActionKind(action.kind());
            }
            CompletableFuture<List<Action>> result = handler.handle(context, type.cast(action));
            return Objects.requireNonNull(result, () -> "handler for " + kind + " returned null");
        }
    }

    public static final class Builder {
        private final Map<String, Registration<?>> byKind = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws IllegalArgumentException if the kind is blank or already registered
         */
        public <A extends Action> Builder register(String kind, Class<A> type, ActionHandler<? super A> handler) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(handler, "handler");
            if (kind == null || kind.isBlank()) throw new IllegalArgumentException("kind must not be blank");
            if (byKind.containsKey(kind)) throw new IllegalArgumentException("kind already registered: " + kind);
            byKind.put(kind, new Registration<>(kind, type, handler));
            return this;
        }

        public ActionRegistry build() {
            return new ActionRegistry(byKind);
        }
    }
}
