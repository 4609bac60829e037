package io.diagramsessions.core;

import java.util.List;
import java.util.Objects;

/**
 * Type hint for node-like elements.
 *
 * @param elementTypeId element type the hint applies to
 * @param repositionable whether the position may change
 * @param deletable whether the element may be deleted
 * @param resizable whether the size may change
 * @param reparentable whether the element may move to another container
 * @param containableElementTypeIds element types this element accepts as children; empty means none
 */
public record ShapeTypeHint(
        String elementTypeId,
        boolean repositionable,
        boolean deletable,
        boolean resizable,
        boolean reparentable,
        List<String> containableElementTypeIds
) implements TypeHint {

    public ShapeTypeHint {
        Objects.requireNonNull(elementTypeId, "elementTypeId");
        containableElementTypeIds = containableElementTypeIds == null ? List.of() : List.copyOf(containableElementTypeIds);
    }

    public boolean canContain(String childTypeId) {
        return containableElementTypeIds.contains(childTypeId);
    }
}
