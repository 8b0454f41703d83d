package com.purchasingpower.wiregraph.core;

import java.util.List;

/**
 * Ordered points of a polyline or of a flattened path.
 */
public record Polyline(List<Point> points) {

    public Polyline {
        points = List.copyOf(points);
    }

    public static Polyline of(Point... points) {
        return new Polyline(List.of(points));
    }

    public int size() {
        return points.size();
    }

    public Point first() {
        return points.get(0);
    }

    public Point last() {
        return points.get(points.size() - 1);
    }

    public Point get(int index) {
        return points.get(index);
    }
}
