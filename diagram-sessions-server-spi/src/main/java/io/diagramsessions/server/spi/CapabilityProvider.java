package io.diagramsessions.server.spi;

import io.diagramsessions.core.EdgeTypeHint;
import io.diagramsessions.core.LayerDescriptor;
import io.diagramsessions.core.OperationDescriptor;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.core.ToolDescriptor;

import java.util.List;

/**
 * Declares what a diagram language offers: type hints, layers, tools and operations.
 *
 * <p>The engine asks for the full catalogue and derives the per-session offered subsets from the
 * active layers and the current model itself. Implementations must be thread-safe.
 */
public interface CapabilityProvider {

    List<ShapeTypeHint> shapeHints();

    List<EdgeTypeHint> edgeHints();

    List<LayerDescriptor> layers();

    List<ToolDescriptor> tools();

    List<OperationDescriptor> operations();
}
