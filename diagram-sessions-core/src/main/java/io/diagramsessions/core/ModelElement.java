package io.diagramsessions.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable node of the graphical model tree.
 *
 * <p>One record shape serves every element: nodes carry a {@code position} (and usually a
 * {@code size}), edges carry {@code sourceId}/{@code targetId}, and the root carries
 * {@code canvasBounds} and the {@code revision} it was emitted with. Element ids are unique
 * within one tree; that invariant is checked where the tree is mutated, not here.
 */
public record ModelElement(
        String type,
        String id,
        List<ModelElement> children,
        Point position,
        Dimension size,
        Point alignment,
        String sourceId,
        String targetId,
        List<Point> routingPoints,
        Map<String, String> properties,
        Bounds canvasBounds,
        Long revision
) {

    public ModelElement {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        children = children == null ? List.of() : List.copyOf(children);
        routingPoints = routingPoints == null ? List.of() : List.copyOf(routingPoints);
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static ModelElement root(String type, String id) {
        return new ModelElement(type, id, List.of(), null, null, null, null, null, List.of(), Map.of(), null, null);
    }

    public static ModelElement emptyRoot() {
        return root(Protocol.DEFAULT_ROOT_TYPE, Protocol.DEFAULT_ROOT_ID);
    }

    public static ModelElement node(String type, String id, Point position) {
        return new ModelElement(type, id, List.of(), position, null, null, null, null, List.of(), Map.of(), null, null);
    }

    public static ModelElement edge(String type, String id, String sourceId, String targetId) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(targetId, "targetId");
        return new ModelElement(type, id, List.of(), null, null, null, sourceId, targetId, List.of(), Map.of(), null, null);
    }

    public boolean isEdge() {
        return sourceId != null && targetId != null;
    }

    public Optional<Bounds> bounds() {
        if (position == null || size == null) return Optional.empty();
        return Optional.of(Bounds.of(position, size));
    }

    public Optional<String> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public ModelElement withChildren(List<ModelElement> children) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withChild(ModelElement child) {
        List<ModelElement> next = new ArrayList<>(children);
        next.add(child);
        return withChildren(next);
    }

    public ModelElement withPosition(Point position) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withSize(Dimension size) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withAlignment(Point alignment) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withEndpoints(String sourceId, String targetId) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withRoutingPoints(List<Point> routingPoints) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withProperty(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(properties);
        if (value == null) {
            next.remove(key);
        } else {
            next.put(key, value);
        }
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, next, canvasBounds, revision);
    }

    public ModelElement withCanvasBounds(Bounds canvasBounds) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }

    public ModelElement withRevision(Long revision) {
        return new ModelElement(type, id, children, position, size, alignment, sourceId, targetId, routingPoints, properties, canvasBounds, revision);
    }
}
