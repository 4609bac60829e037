package io.diagramsessions.core;

/**
 * Axis-aligned rectangle: a {@link Point} combined with a {@link Dimension}.
 */
public record Bounds(double x, double y, double width, double height) {

    public Bounds {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("bounds must not have a negative extent");
        }
    }

    public static Bounds of(Point position, Dimension size) {
        return new Bounds(position.x(), position.y(), size.width(), size.height());
    }

    public Point position() {
        return new Point(x, y);
    }

    public Dimension size() {
        return new Dimension(width, height);
    }
}
