package io.diagramsessions.core;

import java.util.List;
import java.util.Objects;

/**
 * Type hint for connections.
 *
 * <p>Empty source or target lists place no restriction on that end.
 *
 * @param elementTypeId edge type the hint applies to
 * @param repositionable whether the edge may be moved as a whole
 * @param deletable whether the edge may be deleted
 * @param routable whether routing points may be changed
 * @param sourceElementTypeIds element types allowed as source
 * @param targetElementTypeIds element types allowed as target
 */
public record EdgeTypeHint(
        String elementTypeId,
        boolean repositionable,
        boolean deletable,
        boolean routable,
        List<String> sourceElementTypeIds,
        List<String> targetElementTypeIds
) implements TypeHint {

    public EdgeTypeHint {
        Objects.requireNonNull(elementTypeId, "elementTypeId");
        sourceElementTypeIds = sourceElementTypeIds == null ? List.of() : List.copyOf(sourceElementTypeIds);
        targetElementTypeIds = targetElementTypeIds == null ? List.of() : List.copyOf(targetElementTypeIds);
    }

    public boolean allowsSource(String typeId) {
        return sourceElementTypeIds.isEmpty() || sourceElementTypeIds.contains(typeId);
    }

    public boolean allowsTarget(String typeId) {
        return targetElementTypeIds.isEmpty() || targetElementTypeIds.contains(typeId);
    }
}
