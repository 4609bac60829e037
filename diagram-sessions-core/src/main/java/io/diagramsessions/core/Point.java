package io.diagramsessions.core;

/**
 * Position in diagram coordinates.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }
}
