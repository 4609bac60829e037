package io.diagramsessions.core;

import java.util.Objects;

/**
 * Bounds measured or requested for one model element.
 *
 * @param elementId id of the element
 * @param newPosition new position, or null to keep the current one
 * @param newSize new size, or null to keep the current one
 */
public record ElementAndBounds(String elementId, Point newPosition, Dimension newSize) {

    public ElementAndBounds {
        Objects.requireNonNull(elementId, "elementId");
    }

    public static ElementAndBounds of(String elementId, Bounds bounds) {
        return new ElementAndBounds(elementId, bounds.position(), bounds.size());
    }
}
