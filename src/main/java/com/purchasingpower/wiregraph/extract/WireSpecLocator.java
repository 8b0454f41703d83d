package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.WireSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attributes wire specs to routed wires.
 *
 * <p>Specs are printed just above the first horizontal run of a wire, near where it
 * leaves its source, never at the ends of the run.
 *
 * @since 1.0.0
 */
public class WireSpecLocator {

    private final List<WireSpec> specs;
    private final InferenceThresholds thresholds;

    public WireSpecLocator(List<WireSpec> specs, InferenceThresholds thresholds) {
        this.specs = specs;
        this.thresholds = thresholds;
    }

    /**
     * Spec of a routing path, searched above the horizontal segment closest to the source.
     *
     * @param points path points
     * @param source position of the source endpoint, or {@code null} to use the first
     *               horizontal segment
     */
    public Optional<WireSpec> nearPath(List<Point> points, Point source) {
        if (specs.isEmpty() || points.size() < 2) {
            return Optional.empty();
        }

        List<Point[]> horizontal = new ArrayList<>();
        for (int i = 0; i < points.size() - 1; i++) {
            Point a = points.get(i);
            Point b = points.get(i + 1);
            if (Math.abs(b.y() - a.y()) < thresholds.getSegmentAxisTolerance()) {
                horizontal.add(new Point[]{a, b});
            }
        }

        List<Point> target = new ArrayList<>();
        if (source != null && !horizontal.isEmpty()) {
            Point[] closest = null;
            double closestDistance = Double.POSITIVE_INFINITY;
            for (Point[] segment : horizontal) {
                double midX = (segment[0].x() + segment[1].x()) / 2;
                double midY = (segment[0].y() + segment[1].y()) / 2;
                double distance = source.distanceTo(midX, midY);
                if (distance < closestDistance) {
                    closestDistance = distance;
                    closest = segment;
                }
            }
            target.add(closest[0]);
            target.add(closest[1]);
        } else if (!horizontal.isEmpty()) {
            target.add(horizontal.get(0)[0]);
            target.add(horizontal.get(0)[1]);
        } else {
            target.addAll(points.subList(0, Math.min(3, points.size())));
        }

        double minX = target.stream().mapToDouble(Point::x).min().orElse(0);
        double maxX = target.stream().mapToDouble(Point::x).max().orElse(0);

        WireSpec best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (WireSpec spec : specs) {
            if (!(minX < spec.x() && spec.x() < maxX)) {
                continue;
            }
            for (Point p : target) {
                double distance = weightedDistanceAbove(spec, p.x(), p.y());
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = spec;
                }
            }
        }
        return bestDistance < thresholds.getSpecMaxWeightedDistance() ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * Spec of a rectangular polyline, taken from its longest horizontal segment.
     * Equal-length segments are all searched; the spec closest in Y wins.
     */
    public Optional<WireSpec> forRectangle(List<Point> points) {
        if (specs.isEmpty() || points.size() < 2) {
            return Optional.empty();
        }

        double longest = -1;
        List<Point[]> longestSegments = new ArrayList<>();
        for (int i = 0; i < points.size() - 1; i++) {
            Point a = points.get(i);
            Point b = points.get(i + 1);
            if (Math.abs(b.y() - a.y()) >= thresholds.getSegmentAxisTolerance()) {
                continue;
            }
            double length = Math.abs(b.x() - a.x());
            if (length > longest) {
                longest = length;
                longestSegments.clear();
            }
            if (length == longest) {
                longestSegments.add(new Point[]{a, b});
            }
        }

        WireSpec best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        double overhang = thresholds.getRectangleSpecXOverhang();
        for (Point[] segment : longestSegments) {
            double minX = Math.min(segment[0].x(), segment[1].x());
            double maxX = Math.max(segment[0].x(), segment[1].x());
            double segmentY = (segment[0].y() + segment[1].y()) / 2;
            for (WireSpec spec : specs) {
                double yDistance = Math.abs(spec.y() - segmentY);
                if (yDistance < thresholds.getRectangleSpecYTolerance()
                    && minX - overhang < spec.x() && spec.x() < maxX + overhang
                    && yDistance < bestDistance) {
                    bestDistance = yDistance;
                    best = spec;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Spec of a ground wire, printed between the pin and the ground label, above the
     * ground label's row.
     */
    public Optional<WireSpec> forGround(double pinX, double groundX, double groundY) {
        double minX = Math.min(pinX, groundX);
        double maxX = Math.max(pinX, groundX);

        WireSpec best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (WireSpec spec : specs) {
            if (!(minX < spec.x() && spec.x() < maxX)) {
                continue;
            }
            double distance = weightedDistanceAbove(spec, pinX, groundY);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = spec;
            }
        }
        return bestDistance < thresholds.getSpecMaxWeightedDistance() ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * Distance with the vertical part weighted up, or infinity when the spec is not
     * printed above the reference point.
     */
    private double weightedDistanceAbove(WireSpec spec, double x, double y) {
        double above = spec.y() - y;
        if (!(-thresholds.getSpecAboveMaxDistance() < above && above < 0)) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.hypot(Math.abs(spec.x() - x), above * thresholds.getSpecVerticalWeight());
    }
}
