package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.ConnectionPoint;
import com.purchasingpower.wiregraph.core.PinRef;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.core.WireSpec;
import com.purchasingpower.wiregraph.engine.InferenceContext;
import com.purchasingpower.wiregraph.index.TokenIndex;
import com.purchasingpower.wiregraph.resolve.ConnectorMatch;
import com.purchasingpower.wiregraph.resolve.ResolveHints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Traces wires drawn as multi-segment polylines and routing paths.
 *
 * <p>Handles three shapes: simple runs between two endpoints, runs passing through
 * intermediate splices (chained into consecutive edges), and closed-looking 4-point
 * rectangles whose corners sit on components. Horizontal wires found earlier take
 * precedence over anything traced here.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@Order(2)
public class RoutingPathExtractor implements ConnectionExtractor {

    @Override
    public ExtractionStage stage() {
        return ExtractionStage.ROUTING;
    }

    @Override
    public List<Connection> extract(InferenceContext context) {
        HorizontalWires horizontal = new HorizontalWires(context.connectionsFrom(ExtractionStage.HORIZONTAL));
        Optional<TokenIndex.Bounds> bounds = context.getIndex()
            .componentBounds(context.getThresholds().getBoundsMargin());
        Map<ConnectionKey, Connection> found = new LinkedHashMap<>();

        int discarded = 0;
        for (Polyline polyline : context.getGeometry().getPolylines()) {
            if (polyline.size() < 2 || outsideComponents(polyline, bounds)) {
                discarded++;
                continue;
            }
            if (isRectangular(polyline, context.getThresholds())) {
                traceRectangle(polyline, horizontal, context, found);
            } else {
                tracePolyline(polyline, horizontal, context, found);
            }
        }

        for (Polyline path : context.getGeometry().getRoutingPaths()) {
            if (path.size() < 2 || outsideComponents(path, bounds)) {
                discarded++;
                continue;
            }
            traceRoutingPath(path, horizontal, context, found);
        }

        List<Connection> connections = new ArrayList<>(found.values());
        log.info("Routing paths: {} connections, {} paths outside the component area", connections.size(), discarded);
        return connections;
    }

    // ---------------------------------------------------------------------
    // Polylines
    // ---------------------------------------------------------------------

    private void tracePolyline(Polyline polyline,
                               HorizontalWires horizontal,
                               InferenceContext context,
                               Map<ConnectionKey, Connection> found) {
        InferenceThresholds thresholds = context.getThresholds();
        double radius = thresholds.getEndpointSearchRadius();

        Optional<ConnectionPoint> startPoint = context.getResolver()
            .nearestConnectionPoint(polyline.first().x(), polyline.first().y(), radius);
        Optional<ConnectionPoint> endPoint = context.getResolver()
            .nearestConnectionPoint(polyline.last().x(), polyline.last().y(), radius);
        if (startPoint.isEmpty() || endPoint.isEmpty()) {
            return;
        }
        ConnectionPoint start = startPoint.get();
        ConnectionPoint end = endPoint.get();
        if (start.isGround() || end.isGround()) {
            // Ground wires are handled from their arrows
            return;
        }

        if (polyline.size() > 2) {
            List<ConnectionPoint> splices = intermediateSplices(polyline, start, end, context);
            if (!splices.isEmpty()) {
                traceChain(polyline, start, end, splices, horizontal, context, found);
                return;
            }
        }

        boolean startIsSource = startIsSource(start, end);
        ConnectionPoint source = startIsSource ? start : end;
        ConnectionPoint destination = startIsSource ? end : start;
        Point sourceVertex = startIsSource ? polyline.first() : polyline.last();

        WireSpec spec = context.getSpecLocator().nearPath(polyline.points(), sourceVertex).orElse(null);
        emit(source, destination, spec, false, horizontal, context, found);
    }

    private void traceChain(Polyline polyline,
                            ConnectionPoint start,
                            ConnectionPoint end,
                            List<ConnectionPoint> splices,
                            HorizontalWires horizontal,
                            InferenceContext context,
                            Map<ConnectionKey, Connection> found) {
        boolean vertical = Math.abs(end.y() - start.y()) > Math.abs(end.x() - start.x());

        List<ConnectionPoint> chain = new ArrayList<>();
        chain.add(start);
        chain.addAll(splices);
        chain.add(end);
        chain.sort(vertical
            ? Comparator.comparingDouble(ConnectionPoint::y)
            : Comparator.comparingDouble(ConnectionPoint::x));

        Point sourceVertex = startIsSource(start, end) ? polyline.first() : polyline.last();
        WireSpec spec = context.getSpecLocator().nearPath(polyline.points(), sourceVertex).orElse(null);
        for (int i = 0; i < chain.size() - 1; i++) {
            ConnectionPoint a = chain.get(i);
            ConnectionPoint b = chain.get(i + 1);
            if (a.isSplice() != b.isSplice() && a.isSplice()) {
                emit(b, a, spec, false, horizontal, context, found);
            } else {
                emit(a, b, spec, false, horizontal, context, found);
            }
        }
    }

    /**
     * A pin drives a splice. Between two pins or two splices the lower end is the source.
     */
    private static boolean startIsSource(ConnectionPoint start, ConnectionPoint end) {
        if (start.isSplice() != end.isSplice()) {
            return !start.isSplice();
        }
        return start.y() >= end.y();
    }

    /**
     * Splices lying on a segment of the polyline, or failing that, sitting at one of
     * its interior vertices. Endpoints are excluded.
     */
    List<ConnectionPoint> intermediateSplices(Polyline polyline,
                                              ConnectionPoint start,
                                              ConnectionPoint end,
                                              InferenceContext context) {
        InferenceThresholds thresholds = context.getThresholds();
        List<Token> splices = context.getIndex().allOfKind(TokenKind.SPLICE);
        Map<String, ConnectionPoint> onPath = new LinkedHashMap<>();

        for (int i = 0; i < polyline.size() - 1; i++) {
            Point a = polyline.get(i);
            Point b = polyline.get(i + 1);
            boolean horizontalSegment = Math.abs(b.y() - a.y()) < thresholds.getSegmentAxisTolerance();
            boolean verticalSegment = Math.abs(b.x() - a.x()) < thresholds.getSegmentAxisTolerance();

            for (Token splice : splices) {
                boolean onSegment;
                if (horizontalSegment) {
                    onSegment = Math.abs(splice.y() - a.y()) < thresholds.getSpliceOnSegmentTolerance()
                        && Math.min(a.x(), b.x()) < splice.x() && splice.x() < Math.max(a.x(), b.x());
                } else if (verticalSegment) {
                    onSegment = Math.abs(splice.x() - a.x()) < thresholds.getSpliceOnSegmentTolerance()
                        && Math.min(a.y(), b.y()) < splice.y() && splice.y() < Math.max(a.y(), b.y());
                } else {
                    onSegment = false;
                }
                if (onSegment && isNotEndpoint(splice, start, end)) {
                    onPath.putIfAbsent(splice.content(), ConnectionPoint.direct(splice));
                }
            }
        }

        if (onPath.isEmpty()) {
            for (int i = 1; i < polyline.size() - 1; i++) {
                Point vertex = polyline.get(i);
                for (Token splice : splices) {
                    if (vertex.distanceTo(splice.x(), splice.y()) < thresholds.getVertexSpliceRadius()
                        && isNotEndpoint(splice, start, end)) {
                        onPath.putIfAbsent(splice.content(), ConnectionPoint.direct(splice));
                    }
                }
            }
        }
        return new ArrayList<>(onPath.values());
    }

    private static boolean isNotEndpoint(Token splice, ConnectionPoint start, ConnectionPoint end) {
        return !splice.content().equals(start.connectorId()) && !splice.content().equals(end.connectorId());
    }

    // ---------------------------------------------------------------------
    // Rectangles
    // ---------------------------------------------------------------------

    /**
     * Four points forming horizontal, vertical, horizontal segments.
     */
    boolean isRectangular(Polyline polyline, InferenceThresholds thresholds) {
        if (polyline.size() != 4) {
            return false;
        }
        double tolerance = thresholds.getSegmentAxisTolerance();
        Point p0 = polyline.get(0);
        Point p1 = polyline.get(1);
        Point p2 = polyline.get(2);
        Point p3 = polyline.get(3);
        return Math.abs(p1.y() - p0.y()) < tolerance
            && Math.abs(p2.x() - p1.x()) < tolerance
            && Math.abs(p3.y() - p2.y()) < tolerance;
    }

    private void traceRectangle(Polyline polyline,
                                HorizontalWires horizontal,
                                InferenceContext context,
                                Map<ConnectionKey, Connection> found) {
        WireSpec spec = context.getSpecLocator().forRectangle(polyline.points()).orElse(null);

        List<ConnectionPoint> corners = new ArrayList<>();
        for (Point corner : polyline.points()) {
            cornerComponent(corner, spec, horizontal, context).ifPresent(point -> {
                if (corners.isEmpty() || !corners.get(corners.size() - 1).sameEndpointAs(point)) {
                    corners.add(point);
                }
            });
        }

        for (int i = 0; i < corners.size() - 1; i++) {
            emit(corners.get(i), corners.get(i + 1), spec, true, horizontal, context, found);
        }
    }

    private Optional<ConnectionPoint> cornerComponent(Point corner,
                                                      WireSpec spec,
                                                      HorizontalWires horizontal,
                                                      InferenceContext context) {
        Token nearest = null;
        double best = context.getThresholds().getRectangleCornerRadius();
        for (Token token : context.getIndex().all()) {
            boolean component = token.kind() == TokenKind.PIN || token.kind() == TokenKind.SPLICE
                || token.kind().isConnectorLike();
            double distance = corner.distanceTo(token.x(), token.y());
            if (component && distance < best) {
                best = distance;
                nearest = token;
            }
        }
        if (nearest == null) {
            return Optional.empty();
        }

        switch (nearest.kind()) {
            case CONNECTOR:
            case JUNCTION:
            case SPLICE:
                return Optional.of(ConnectionPoint.direct(nearest));
            case PIN:
                return ownerAvoidingConflict(nearest, spec, horizontal, context);
            default:
                return Optional.empty();
        }
    }

    /**
     * The closest connector above the pin, unless that pin already carries a horizontal
     * wire with a different spec; then the next connector without such a conflict.
     */
    private Optional<ConnectionPoint> ownerAvoidingConflict(Token pin,
                                                            WireSpec spec,
                                                            HorizontalWires horizontal,
                                                            InferenceContext context) {
        List<ConnectorMatch> candidates = context.getResolver().candidatesAbove(pin.x(), pin.y());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        ConnectorMatch chosen = candidates.get(0);
        if (spec != null) {
            for (ConnectorMatch candidate : candidates) {
                if (!horizontal.hasConflictingSpec(new PinRef(candidate.connectorId(), pin.content()), spec)) {
                    chosen = candidate;
                    break;
                }
            }
        }
        return Optional.of(new ConnectionPoint(chosen.connectorId(), pin.content(), pin.x(), pin.y()));
    }

    // ---------------------------------------------------------------------
    // Routing paths
    // ---------------------------------------------------------------------

    private void traceRoutingPath(Polyline path,
                                  HorizontalWires horizontal,
                                  InferenceContext context,
                                  Map<ConnectionKey, Connection> found) {
        InferenceThresholds thresholds = context.getThresholds();
        Map<PinRef, ConnectionPoint> collected = new LinkedHashMap<>();

        for (int i = 0; i < path.size(); i++) {
            Point vertex = path.get(i);
            boolean end = i == 0 || i == path.size() - 1;
            double radius = end ? thresholds.getEndpointSearchRadius() : thresholds.getVertexSpliceRadius();
            context.getResolver().nearestConnectionPoint(vertex.x(), vertex.y(), radius)
                .ifPresent(point -> collected.putIfAbsent(point.pinRef(), point));
        }

        for (int i = 0; i < path.size() - 1; i++) {
            Point a = path.get(i);
            Point b = path.get(i + 1);
            for (Token token : context.getIndex().all()) {
                if (token.kind().isConnectionPoint()
                    && distanceToSegment(token.x(), token.y(), a, b) < thresholds.getPathPointOnSegmentTolerance()) {
                    context.getResolver().toConnectionPoint(token, ResolveHints.none())
                        .ifPresent(point -> collected.putIfAbsent(point.pinRef(), point));
                }
            }
        }

        List<ConnectionPoint> points = new ArrayList<>(collected.values());
        points.removeIf(ConnectionPoint::isGround);
        if (points.size() < 2) {
            return;
        }

        Point p0 = path.get(0);
        Point p1 = path.get(1);
        boolean vertical = Math.abs(p1.y() - p0.y()) > Math.abs(p1.x() - p0.x());
        points.sort(vertical
            ? Comparator.comparingDouble(ConnectionPoint::y)
            : Comparator.comparingDouble(ConnectionPoint::x));

        ConnectionPoint first = points.get(0);
        WireSpec spec = context.getSpecLocator()
            .nearPath(path.points(), new Point(first.x(), first.y()))
            .orElse(null);

        for (int i = 0; i < points.size() - 1; i++) {
            ConnectionPoint a = points.get(i);
            ConnectionPoint b = points.get(i + 1);
            ConnectionPoint source = a.isSplice() && !b.isSplice() ? b : a;
            ConnectionPoint destination = source == a ? b : a;

            if (spec == null && (horizontal.hasOtherPartner(source, destination) || horizontal.hasOtherPartner(destination, source))) {
                log.debug("Skipping routed {} -> {}: pin already wired elsewhere", source.connectorId(), destination.connectorId());
                continue;
            }
            if (spec != null && (horizontal.contradictsColors(source, spec) || horizontal.contradictsColors(destination, spec))) {
                log.debug("Skipping routed {} -> {}: color not seen at splice", source.connectorId(), destination.connectorId());
                continue;
            }
            emit(source, destination, spec, false, horizontal, context, found);
        }
    }

    private static double distanceToSegment(double x, double y, Point a, Point b) {
        double dx = b.x() - a.x();
        double dy = b.y() - a.y();
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0) {
            return a.distanceTo(x, y);
        }
        double t = ((x - a.x()) * dx + (y - a.y()) * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));
        return Math.hypot(x - (a.x() + t * dx), y - (a.y() + t * dy));
    }

    // ---------------------------------------------------------------------
    // Shared filtering
    // ---------------------------------------------------------------------

    private void emit(ConnectionPoint source,
                      ConnectionPoint destination,
                      WireSpec spec,
                      boolean allowClaimedSource,
                      HorizontalWires horizontal,
                      InferenceContext context,
                      Map<ConnectionKey, Connection> found) {
        if (source.sameEndpointAs(destination)) {
            return;
        }
        if (horizontal.links(source, destination)) {
            return;
        }
        if (source.isSplice() && destination.isSplice()) {
            double distance = Math.hypot(source.x() - destination.x(), source.y() - destination.y());
            if (distance < context.getThresholds().getMinSpliceLinkDistance()) {
                log.debug("Skipping {} -> {}: splices too close for a routed link", source.connectorId(), destination.connectorId());
                return;
            }
            if (horizontal.isPassThrough(source.connectorId()) && horizontal.isPassThrough(destination.connectorId())) {
                log.debug("Skipping {} -> {}: both splices are pass-through", source.connectorId(), destination.connectorId());
                return;
            }
        }
        if (!allowClaimedSource && !source.isSplice() && horizontal.claims(source.pinRef())) {
            log.debug("Skipping {},{} as routing source: already wired horizontally", source.connectorId(), source.pin());
            return;
        }

        Connection connection = Connection.between(source, destination, spec);
        Connection existing = found.get(connection.key());
        if (existing == null || (!existing.hasWireSpec() && connection.hasWireSpec())) {
            found.put(connection.key(), connection);
        }
    }

    private static boolean outsideComponents(Polyline polyline, Optional<TokenIndex.Bounds> bounds) {
        if (bounds.isEmpty()) {
            return true;
        }
        TokenIndex.Bounds box = bounds.get();
        return !box.contains(polyline.first().x(), polyline.first().y())
            && !box.contains(polyline.last().x(), polyline.last().y());
    }

    /**
     * Lookups over the horizontal wires found in the first stage.
     */
    static class HorizontalWires {

        private final List<Connection> connections;
        private final Map<PinRef, List<Connection>> byPin = new LinkedHashMap<>();
        private final Map<String, int[]> spliceDegrees = new LinkedHashMap<>();

        HorizontalWires(List<Connection> connections) {
            this.connections = connections;
            for (Connection connection : connections) {
                byPin.computeIfAbsent(new PinRef(connection.getFromId(), connection.getFromPin()), k -> new ArrayList<>())
                    .add(connection);
                byPin.computeIfAbsent(new PinRef(connection.getToId(), connection.getToPin()), k -> new ArrayList<>())
                    .add(connection);
                if (TokenKind.isSpliceId(connection.getToId())) {
                    spliceDegrees.computeIfAbsent(connection.getToId(), k -> new int[2])[0]++;
                }
                if (TokenKind.isSpliceId(connection.getFromId())) {
                    spliceDegrees.computeIfAbsent(connection.getFromId(), k -> new int[2])[1]++;
                }
            }
        }

        boolean claims(PinRef pin) {
            return byPin.containsKey(pin);
        }

        boolean links(ConnectionPoint a, ConnectionPoint b) {
            ConnectionKey key = new ConnectionKey(a.connectorId(), a.pin(), b.connectorId(), b.pin());
            for (Connection connection : connections) {
                if (connection.key().equals(key) || connection.key().equals(key.reversed())) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Splice with horizontal wires both entering and leaving it.
         */
        boolean isPassThrough(String spliceId) {
            int[] degree = spliceDegrees.get(spliceId);
            return degree != null && degree[0] > 0 && degree[1] > 0;
        }

        boolean hasConflictingSpec(PinRef pin, WireSpec spec) {
            for (Connection connection : byPin.getOrDefault(pin, List.of())) {
                if (connection.hasWireSpec() && !connection.flowKey().equals(spec.flowKey())) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Pin already wired horizontally to a different non-splice connector.
         */
        boolean hasOtherPartner(ConnectionPoint point, ConnectionPoint partner) {
            if (point.isSplice() || partner.isSplice()) {
                return false;
            }
            for (Connection connection : byPin.getOrDefault(point.pinRef(), List.of())) {
                String other = connection.getFromId().equals(point.connectorId()) && connection.getFromPin().equals(point.pin())
                    ? connection.getToId()
                    : connection.getFromId();
                if (!TokenKind.isSpliceId(other) && !other.equals(partner.connectorId())) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Splice whose horizontal wires all carry colors other than the spec's.
         */
        boolean contradictsColors(ConnectionPoint point, WireSpec spec) {
            if (!point.isSplice()) {
                return false;
            }
            boolean anyColor = false;
            for (Connection connection : byPin.getOrDefault(point.pinRef(), List.of())) {
                if (!connection.getWireColor().isEmpty()) {
                    anyColor = true;
                    if (connection.getWireColor().equals(spec.color())) {
                        return false;
                    }
                }
            }
            return anyColor;
        }
    }
}
