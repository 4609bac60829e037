package io.diagramsessions.server.spi;

import io.diagramsessions.core.EdgeTypeHint;
import io.diagramsessions.core.LayerDescriptor;
import io.diagramsessions.core.OperationDescriptor;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.core.ToolDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link CapabilityProvider} backed by fixed lists.
 *
 * <pre>{@code
 * CapabilityProvider provider = StaticCapabilityProvider.builder()
 *     .shapeHint(new ShapeTypeHint("task", true, true, true, true, List.of()))
 *     .operation(new OperationDescriptor("create-task", "task", "Task", OperationKind.CREATE_NODE, true))
 *     .build();
 * }</pre>
 */
public final class StaticCapabilityProvider implements CapabilityProvider {

    private final List<ShapeTypeHint> shapeHints;
    private final List<EdgeTypeHint> edgeHints;
    private final List<LayerDescriptor> layers;
    private final List<ToolDescriptor> tools;
    private final List<OperationDescriptor> operations;

    private StaticCapabilityProvider(Builder builder) {
        this.shapeHints = List.copyOf(builder.shapeHints.values());
        this.edgeHints = List.copyOf(builder.edgeHints.values());
        this.layers = List.copyOf(builder.layers.values());
        this.tools = List.copyOf(builder.tools);
        this.operations = List.copyOf(builder.operations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Provider offering nothing; every create operation is rejected.
     */
    public static StaticCapabilityProvider empty() {
        return builder().build();
    }

    @Override
    public List<ShapeTypeHint> shapeHints() {
        return shapeHints;
    }

    @Override
    public List<EdgeTypeHint> edgeHints() {
        return edgeHints;
    }

    @Override
    public List<LayerDescriptor> layers() {
        return layers;
    }

    @Override
    public List<ToolDescriptor> tools() {
        return tools;
    }

    @Override
    public List<OperationDescriptor> operations() {
        return operations;
    }

    /**
     * Builder for {@link StaticCapabilityProvider}. Hints and layers are keyed by id; a later
     * registration replaces an earlier one.
     */
    public static final class Builder {
        private final Map<String, ShapeTypeHint> shapeHints = new LinkedHashMap<>();
        private final Map<String, EdgeTypeHint> edgeHints = new LinkedHashMap<>();
        private final Map<String, LayerDescriptor> layers = new LinkedHashMap<>();
        private final List<ToolDescriptor> tools = new ArrayList<>();
        private final List<OperationDescriptor> operations = new ArrayList<>();

        private Builder() {}

        public Builder shapeHint(ShapeTypeHint hint) {
            Objects.requireNonNull(hint, "hint");
            edgeHints.remove(hint.elementTypeId());
            shapeHints.put(hint.elementTypeId(), hint);
            return this;
        }

        public Builder edgeHint(EdgeTypeHint hint) {
            Objects.requireNonNull(hint, "hint");
            shapeHints.remove(hint.elementTypeId());
            edgeHints.put(hint.elementTypeId(), hint);
            return this;
        }

        public Builder layer(LayerDescriptor layer) {
            Objects.requireNonNull(layer, "layer");
            layers.put(layer.id(), layer);
            return this;
        }

        public Builder tool(ToolDescriptor tool) {
            tools.add(Objects.requireNonNull(tool, "tool"));
            return this;
        }

        public Builder operation(OperationDescriptor operation) {
            operations.add(Objects.requireNonNull(operation, "operation"));
            return this;
        }

        public StaticCapabilityProvider build() {
            return new StaticCapabilityProvider(this);
        }
    }
}
