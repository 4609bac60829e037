package io.diagramsessions.core;

import java.util.Objects;

/**
 * Palette tool offered to the client.
 *
 * @param id stable identifier of the tool
 * @param label human readable label
 * @param elementTypeId element type the tool works with, or null for type independent tools
 */
public record ToolDescriptor(String id, String label, String elementTypeId) {

    public ToolDescriptor {
        Objects.requireNonNull(id, "id");
        if (label == null) label = id;
    }
}
