package io.diagramsessions.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table mapping each action kind to its record type.
 *
 * <p>Codecs use it to decode the {@code kind} discriminant; the server dispatcher uses it to check
 * that every handled kind is a known one. Kinds are unique: registering the same kind twice fails.
 * <pre>{@code
 * ActionTypes types = ActionTypes.builder()
 *     .registerAll(ActionTypes.defaults())
 *     .register("customAction", CustomAction.class)
 *     .build();
 * }</pre>
 */
public final class ActionTypes {

    private static final ActionTypes DEFAULTS = builder()
            .register(Action.RequestModel.KIND, Action.RequestModel.class)
            .register(Action.RequestTools.KIND, Action.RequestTools.class)
            .register(Action.RequestLayers.KIND, Action.RequestLayers.class)
            .register(Action.RequestTypeHints.KIND, Action.RequestTypeHints.class)
            .register(Action.RequestEditValidation.KIND, Action.RequestEditValidation.class)
            .register(Action.ComputedBounds.KIND, Action.ComputedBounds.class)
            .register(Action.ToggleLayer.KIND, Action.ToggleLayer.class)
            .register(Action.CreateNode.KIND, Action.CreateNode.class)
            .register(Action.CreateConnection.KIND, Action.CreateConnection.class)
            .register(Action.DeleteElement.KIND, Action.DeleteElement.class)
            .register(Action.ChangeBounds.KIND, Action.ChangeBounds.class)
            .register(Action.ChangeContainer.KIND, Action.ChangeContainer.class)
            .register(Action.ReconnectEdge.KIND, Action.ReconnectEdge.class)
            .register(Action.ChangeRoutingPoints.KIND, Action.ChangeRoutingPoints.class)
            .register(Action.ApplyLabelEdit.KIND, Action.ApplyLabelEdit.class)
            .register(Action.Select.KIND, Action.Select.class)
            .register(Action.SelectAll.KIND, Action.SelectAll.class)
            .register(Action.SaveModel.KIND, Action.SaveModel.class)
            .register(Action.ExportSvg.KIND, Action.ExportSvg.class)
            .register(Action.IdentifiableRequest.KIND, Action.IdentifiableRequest.class)
            .register(Action.IdentifiableResponse.KIND, Action.IdentifiableResponse.class)
            .register(Action.SetModel.KIND, Action.SetModel.class)
            .register(Action.UpdateModel.KIND, Action.UpdateModel.class)
            .register(Action.RequestBounds.KIND, Action.RequestBounds.class)
            .register(Action.SetTools.KIND, Action.SetTools.class)
            .register(Action.SetLayers.KIND, Action.SetLayers.class)
            .register(Action.SetOperations.KIND, Action.SetOperations.class)
            .register(Action.SetTypeHints.KIND, Action.SetTypeHints.class)
            .register(Action.SetEditValidationResult.KIND, Action.SetEditValidationResult.class)
            .register(Action.SetDirtyState.KIND, Action.SetDirtyState.class)
            .register(Action.ServerStatus.KIND, Action.ServerStatus.class)
            .build();

    private final Map<String, Class<? extends Action>> byKind;

    private ActionTypes(Map<String, Class<? extends Action>> byKind) {
        this.byKind = byKind;
    }

    /**
     * Returns the table of all built-in protocol actions.
     */
    public static ActionTypes defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Class<? extends Action>> find(String kind) {
        if (kind == null) return Optional.empty();
        return Optional.ofNullable(byKind.get(kind));
    }

    public boolean contains(String kind) {
        return kind != null && byKind.containsKey(kind);
    }

    public Set<String> kinds() {
        return byKind.keySet();
    }

    /**
     * Returns the kind to type mapping in registration order.
     */
    public Map<String, Class<? extends Action>> asMap() {
        return byKind;
    }

    /**
     * Builder for {@link ActionTypes}.
     */
    public static final class Builder {
        private final Map<String, Class<? extends Action>> byKind = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register an action type under its kind.
         *
         * @throws IllegalArgumentException if the kind is blank or already registered
         */
        public Builder register(String kind, Class<? extends Action> type) {
            Objects.requireNonNull(type, "type");
            if (kind == null || kind.isBlank()) {
                throw new IllegalArgumentException("kind must not be null or blank");
            }
            Class<? extends Action> existing = byKind.putIfAbsent(kind, type);
            if (existing != null) {
                throw new IllegalArgumentException("kind '" + kind + "' already registered for " + existing.getName());
            }
            return this;
        }

        public Builder registerAll(ActionTypes types) {
            for (Map.Entry<String, Class<? extends Action>> e : types.byKind.entrySet()) {
                register(e.getKey(), e.getValue());
            }
            return this;
        }

        public ActionTypes build() {
            return new ActionTypes(Collections.unmodifiableMap(new LinkedHashMap<>(byKind)));
        }
    }
}
