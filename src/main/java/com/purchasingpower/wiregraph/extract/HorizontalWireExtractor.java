package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionPoint;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.core.WireSpec;
import com.purchasingpower.wiregraph.engine.InferenceContext;
import com.purchasingpower.wiregraph.index.TokenIndex;
import com.purchasingpower.wiregraph.resolve.ConnectorMatch;
import com.purchasingpower.wiregraph.resolve.ConnectorResolver;
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
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reconstructs wires drawn as straight horizontal runs.
 *
 * <p>Wire specs mark the rows that carry wires. Connection points on a row are sorted
 * left to right and only neighbours are joined: a wire entering a splice ends there,
 * so {@code A - SP - C} yields {@code A->SP} and {@code SP->C}, never {@code A->C}.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@Order(1)
public class HorizontalWireExtractor implements ConnectionExtractor {

    @Override
    public ExtractionStage stage() {
        return ExtractionStage.HORIZONTAL;
    }

    @Override
    public List<Connection> extract(InferenceContext context) {
        TokenIndex index = context.getIndex();
        InferenceThresholds thresholds = context.getThresholds();
        List<WireSpec> specs = index.wireSpecs();
        if (specs.isEmpty()) {
            return List.of();
        }

        List<Token> points = index.all().stream()
            .filter(token -> token.kind().isConnectionPoint())
            .collect(Collectors.toList());
        List<Point[]> verticalSegments = verticalSegments(context.getGeometry().getPolylines(), thresholds);

        Map<String, Candidate> accepted = new LinkedHashMap<>();
        Map<Long, List<WireSpec>> bands = groupIntoBands(specs, thresholds);

        for (List<WireSpec> band : bands.values()) {
            List<Token> bandPoints = points.stream()
                .filter(point -> band.stream()
                    .anyMatch(spec -> Math.abs(point.y() - spec.y()) < thresholds.getBandYTolerance()))
                .collect(Collectors.toList());
            if (bandPoints.size() < 2) {
                continue;
            }

            for (List<Token> level : splitIntoLevels(bandPoints, thresholds)) {
                List<Token> row = collapseColumns(level, band, thresholds);
                for (int i = 0; i < row.size() - 1; i++) {
                    evaluatePair(row.get(i), row.get(i + 1), band, verticalSegments, context)
                        .ifPresent(candidate -> merge(accepted, candidate));
                }
            }
        }

        List<Connection> connections = accepted.values().stream()
            .map(Candidate::connection)
            .collect(Collectors.toList());
        log.info("Horizontal wires: {} bands, {} connections", bands.size(), connections.size());
        return connections;
    }

    /**
     * Group specs into rows by rounding Y to the band bucket. Sorted top to bottom.
     */
    Map<Long, List<WireSpec>> groupIntoBands(List<WireSpec> specs, InferenceThresholds thresholds) {
        Map<Long, List<WireSpec>> bands = new TreeMap<>();
        for (WireSpec spec : specs) {
            long key = Math.round(spec.y() / thresholds.getSpecBandBucket());
            bands.computeIfAbsent(key, k -> new ArrayList<>()).add(spec);
        }
        return bands;
    }

    /**
     * Split a band that spans several closely stacked wires into one list per wire level.
     */
    List<List<Token>> splitIntoLevels(List<Token> bandPoints, InferenceThresholds thresholds) {
        List<Token> sorted = new ArrayList<>(bandPoints);
        sorted.sort(Comparator.comparingDouble(Token::y));

        double spread = sorted.get(sorted.size() - 1).y() - sorted.get(0).y();
        if (spread <= thresholds.getBandSpreadTolerance()) {
            return List.of(bandPoints);
        }

        List<List<Token>> levels = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token point : sorted) {
            if (!current.isEmpty()) {
                double lowest = current.get(0).y();
                double highest = current.get(current.size() - 1).y();
                boolean sameLevel = Math.abs(point.y() - lowest) <= thresholds.getSubBandGap()
                    || Math.abs(point.y() - highest) <= thresholds.getSubBandGap();
                if (!sameLevel) {
                    levels.add(current);
                    current = new ArrayList<>();
                }
            }
            current.add(point);
        }
        levels.add(current);

        return levels.stream()
            .filter(level -> level.size() >= 2)
            .collect(Collectors.toList());
    }

    /**
     * Sort left to right and keep one point per X column, the one closest to a spec in Y.
     */
    List<Token> collapseColumns(List<Token> level, List<WireSpec> band, InferenceThresholds thresholds) {
        List<Token> sorted = new ArrayList<>(level);
        sorted.sort(Comparator.comparingDouble(Token::x).thenComparingDouble(Token::y));

        List<Token> row = new ArrayList<>();
        Token columnBest = null;
        double columnX = Double.NaN;
        for (Token point : sorted) {
            if (columnBest != null && Math.abs(point.x() - columnX) < thresholds.getSameColumnTolerance()) {
                if (specGap(point, band) < specGap(columnBest, band)) {
                    columnBest = point;
                }
                continue;
            }
            if (columnBest != null) {
                row.add(columnBest);
            }
            columnBest = point;
            columnX = point.x();
        }
        if (columnBest != null) {
            row.add(columnBest);
        }
        return row;
    }

    private Optional<Candidate> evaluatePair(Token left,
                                             Token right,
                                             List<WireSpec> band,
                                             List<Point[]> verticalSegments,
                                             InferenceContext context) {
        InferenceThresholds thresholds = context.getThresholds();
        ConnectorResolver resolver = context.getResolver();
        double meanY = (left.y() + right.y()) / 2;

        List<WireSpec> between = band.stream()
            .filter(spec -> left.x() < spec.x() && spec.x() < right.x())
            .collect(Collectors.toList());
        WireSpec spec = (between.isEmpty() ? band : between).stream()
            .min(Comparator.comparingDouble(s -> Math.abs(s.y() - meanY)))
            .orElseThrow();

        double leftGap = Math.abs(left.y() - spec.y());
        double rightGap = Math.abs(right.y() - spec.y());
        if (Math.abs(leftGap - rightGap) > thresholds.getWireLevelMismatch()) {
            log.debug("Skipping {} / {}: different wire levels", left.content(), right.content());
            return Optional.empty();
        }

        ResolveHints sourceHints = ResolveHints.asSource(right.x());
        ResolveHints destinationHints = ResolveHints.asDestination(left.x());
        Optional<ConnectionPoint> from = resolver.toConnectionPoint(left, sourceHints);
        Optional<ConnectionPoint> to = resolver.toConnectionPoint(right, destinationHints);
        if (from.isEmpty() || to.isEmpty()) {
            return Optional.empty();
        }
        ConnectionPoint source = from.get();
        ConnectionPoint destination = to.get();

        if (right.x() - left.x() > thresholds.getMaxUnbridgedPairDistance() && between.isEmpty()) {
            log.debug("Skipping {} -> {}: too far apart without a spec", source.connectorId(), destination.connectorId());
            return Optional.empty();
        }
        if (source.sameEndpointAs(destination)
            || (source.connectorId().equals(destination.connectorId()) && !source.isSplice())) {
            log.debug("Skipping self-connection on {}", source.connectorId());
            return Optional.empty();
        }
        if (spliceBetween(left, right, meanY, context)) {
            log.debug("Skipping {} -> {}: splice in between", source.connectorId(), destination.connectorId());
            return Optional.empty();
        }
        if (source.isSplice() && destination.isSplice() && foreignLabelBetween(left, right, meanY, context)) {
            log.debug("Skipping {} -> {}: module boundary", source.connectorId(), destination.connectorId());
            return Optional.empty();
        }
        if (!source.isSplice() && !destination.isSplice() && !source.isGround() && !destination.isGround()
            && modulesApart(resolver.resolve(left.x(), left.y(), sourceHints),
                resolver.resolve(right.x(), right.y(), destinationHints), band, context)) {
            log.debug("Skipping {} -> {}: connectors of different modules", source.connectorId(), destination.connectorId());
            return Optional.empty();
        }
        if (between.isEmpty() && !specNearLeft(left, band, thresholds)
            && (onVerticalWire(source, verticalSegments, thresholds) || onVerticalWire(destination, verticalSegments, thresholds))) {
            log.debug("Skipping {} -> {}: splice continues vertically", source.connectorId(), destination.connectorId());
            return Optional.empty();
        }

        return Optional.of(new Candidate(Connection.between(source, destination, spec), !between.isEmpty(),
            undirectedKey(source, destination)));
    }

    private boolean spliceBetween(Token left, Token right, double meanY, InferenceContext context) {
        if (left.kind() == TokenKind.SPLICE) {
            return false;
        }
        double tolerance = context.getThresholds().getSubBandGap();
        return context.getIndex().allOfKind(TokenKind.SPLICE).stream()
            .anyMatch(splice -> left.x() < splice.x() && splice.x() < right.x()
                && Math.abs(splice.y() - meanY) <= tolerance);
    }

    /**
     * A connector label sitting on the wire row between two splices means the row is
     * split into separate modules. Junction labels are pass-throughs and do not count.
     */
    private boolean foreignLabelBetween(Token left, Token right, double meanY, InferenceContext context) {
        double tolerance = context.getThresholds().getBoundaryLabelYTolerance();
        return context.getIndex().allOfKind(TokenKind.CONNECTOR).stream()
            .anyMatch(label -> left.x() < label.x() && label.x() < right.x()
                && Math.abs(label.y() - meanY) < tolerance);
    }

    /**
     * Connectors whose labels lie far apart belong to different modules unless a spec of
     * this row sits between the labels. Uses the labels the pins actually resolved to.
     */
    private boolean modulesApart(Optional<ConnectorMatch> sourceLabel,
                                 Optional<ConnectorMatch> destinationLabel,
                                 List<WireSpec> band,
                                 InferenceContext context) {
        if (sourceLabel.isEmpty() || destinationLabel.isEmpty()) {
            return false;
        }
        double low = Math.min(sourceLabel.get().x(), destinationLabel.get().x());
        double high = Math.max(sourceLabel.get().x(), destinationLabel.get().x());
        if (high - low <= context.getThresholds().getModuleBoundaryDistance()) {
            return false;
        }
        return band.stream().noneMatch(spec -> low < spec.x() && spec.x() < high);
    }

    private boolean specNearLeft(Token left, List<WireSpec> band, InferenceThresholds thresholds) {
        return band.stream().anyMatch(spec -> Math.abs(spec.x() - left.x()) < thresholds.getNearbySpecXDistance());
    }

    private boolean onVerticalWire(ConnectionPoint point, List<Point[]> verticalSegments, InferenceThresholds thresholds) {
        if (!point.isSplice()) {
            return false;
        }
        for (Point[] segment : verticalSegments) {
            double top = Math.min(segment[0].y(), segment[1].y());
            double bottom = Math.max(segment[0].y(), segment[1].y());
            if (Math.abs(point.x() - segment[0].x()) < thresholds.getSpliceOnSegmentTolerance()
                && top < point.y() && point.y() < bottom) {
                return true;
            }
        }
        return false;
    }

    private List<Point[]> verticalSegments(List<Polyline> polylines, InferenceThresholds thresholds) {
        List<Point[]> segments = new ArrayList<>();
        for (Polyline polyline : polylines) {
            for (int i = 0; i < polyline.size() - 1; i++) {
                Point a = polyline.get(i);
                Point b = polyline.get(i + 1);
                if (Math.abs(b.x() - a.x()) < thresholds.getSegmentAxisTolerance()
                    && Math.abs(b.y() - a.y()) >= thresholds.getSegmentAxisTolerance()) {
                    segments.add(new Point[]{a, b});
                }
            }
        }
        return segments;
    }

    private static double specGap(Token point, List<WireSpec> band) {
        return band.stream().mapToDouble(spec -> Math.abs(point.y() - spec.y())).min().orElse(Double.MAX_VALUE);
    }

    /**
     * Keep the first version of a pair unless a later one has its spec between the pins.
     */
    private static void merge(Map<String, Candidate> accepted, Candidate candidate) {
        Candidate existing = accepted.get(candidate.key());
        if (existing == null || (!existing.specBetween() && candidate.specBetween())) {
            accepted.put(candidate.key(), candidate);
        }
    }

    private static String undirectedKey(ConnectionPoint a, ConnectionPoint b) {
        String first = a.connectorId() + "," + a.pin() + "@" + a.x() + "," + a.y();
        String second = b.connectorId() + "," + b.pin() + "@" + b.x() + "," + b.y();
        return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
    }

    private record Candidate(Connection connection, boolean specBetween, String key) {
    }
}
