package io.diagramsessions.core;

import java.util.List;
import java.util.Objects;

/**
 * A toggleable layer grouping element types.
 *
 * @param id layer id
 * @param label human readable label
 * @param elementTypeIds element types shown only while the layer is active
 * @param activeByDefault whether new sessions start with the layer active
 */
public record LayerDescriptor(String id, String label, List<String> elementTypeIds, boolean activeByDefault) {

    public LayerDescriptor {
        Objects.requireNonNull(id, "id");
        if (label == null) label = id;
        elementTypeIds = elementTypeIds == null ? List.of() : List.copyOf(elementTypeIds);
    }
}
