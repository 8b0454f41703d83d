package com.purchasingpower.wiregraph.core;

/**
 * Position in diagram coordinates. Y grows downwards, as in the exported drawing.
 */
public record Point(double x, double y) {

    public double distanceTo(double otherX, double otherY) {
        return Math.hypot(x - otherX, y - otherY);
    }

    public double distanceTo(Point other) {
        return distanceTo(other.x, other.y);
    }
}
