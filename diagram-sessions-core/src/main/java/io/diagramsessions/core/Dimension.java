package io.diagramsessions.core;

/**
 * Width and height in diagram coordinates. Negative extents are rejected.
 */
public record Dimension(double width, double height) {

    public Dimension {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("dimension must not be negative: " + width + "x" + height);
        }
    }
}
