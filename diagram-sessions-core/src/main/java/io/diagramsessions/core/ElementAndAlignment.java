package io.diagramsessions.core;

import java.util.Objects;

/**
 * Alignment offset measured by the client for one element (e.g. text baseline of a label).
 */
public record ElementAndAlignment(String elementId, Point newAlignment) {

    public ElementAndAlignment {
        Objects.requireNonNull(elementId, "elementId");
        Objects.requireNonNull(newAlignment, "newAlignment");
    }
}
