package com.purchasingpower.wiregraph.resolve.impl;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.ConnectionPoint;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.index.TokenIndex;
import com.purchasingpower.wiregraph.resolve.ConnectorMatch;
import com.purchasingpower.wiregraph.resolve.ConnectorResolver;
import com.purchasingpower.wiregraph.resolve.JunctionDecisionTable;
import com.purchasingpower.wiregraph.resolve.ResolveHints;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves pins against the connector labels printed above them.
 *
 * <p>One instance serves one diagram; it reads the diagram's {@link TokenIndex} only.
 *
 * @since 1.0.0
 */
@Slf4j
public class ProximityConnectorResolver implements ConnectorResolver {

    private static final Comparator<ConnectorMatch> BY_DISTANCE = Comparator
        .comparingDouble(ConnectorMatch::distance)
        .thenComparing(ConnectorMatch::connectorId)
        .thenComparingDouble(ConnectorMatch::x);

    private final TokenIndex index;
    private final InferenceThresholds thresholds;
    private final JunctionDecisionTable junctionTable;

    public ProximityConnectorResolver(TokenIndex index, InferenceThresholds thresholds, String junctionCode) {
        this.index = index;
        this.thresholds = thresholds;
        this.junctionTable = new JunctionDecisionTable(junctionCode);
    }

    @Override
    public Optional<ConnectorMatch> resolve(double pinX, double pinY, ResolveHints hints) {
        List<ConnectorMatch> ranked = candidatesAbove(pinX, pinY);
        if (ranked.isEmpty()) {
            return Optional.empty();
        }

        if (hints.hasSourceHint() && !hints.hasDestinationHint()) {
            ranked = preferBetween(ranked, pinX, pinY, hints.sourceX());
        }

        int window = Math.min(thresholds.getJunctionPairWindow(), ranked.size());
        List<ConnectorMatch> closest = ranked.subList(0, window);
        for (ConnectorMatch candidate : closest) {
            if (!candidate.isJunction()) {
                continue;
            }
            String mirrorId = TokenKind.mirrorOf(candidate.connectorId());
            Optional<ConnectorMatch> mirror = closest.stream()
                .filter(other -> other.connectorId().equals(mirrorId))
                .findFirst();
            if (mirror.isPresent()) {
                ConnectorMatch chosen = junctionTable.choose(candidate, mirror.get(), pinX, hints);
                log.debug("Junction pair {} / {} at pin ({}, {}) resolved to {}",
                    candidate.connectorId(), mirrorId, pinX, pinY, chosen.connectorId());
                return Optional.of(chosen);
            }
        }

        return Optional.of(ranked.get(0));
    }

    @Override
    public List<ConnectorMatch> candidatesAbove(double pinX, double pinY) {
        List<ConnectorMatch> candidates = new ArrayList<>();
        for (Token label : index.all()) {
            if (!label.kind().isConnectorLike()) {
                continue;
            }
            double maxX = label.kind() == TokenKind.JUNCTION
                ? thresholds.getJunctionMaxXDistance()
                : thresholds.getConnectorMaxXDistance();
            double xDistance = Math.abs(label.x() - pinX);
            double above = pinY - label.y();

            if (xDistance < maxX
                && above > thresholds.getConnectorMinVerticalGap()
                && above <= thresholds.getConnectorMaxVerticalGap()) {
                candidates.add(ConnectorMatch.of(label, pinX, pinY));
            }
        }
        candidates.sort(BY_DISTANCE);
        return candidates;
    }

    @Override
    public Optional<ConnectionPoint> toConnectionPoint(Token token, ResolveHints hints) {
        switch (token.kind()) {
            case SPLICE:
            case GROUND:
                return Optional.of(ConnectionPoint.direct(token));
            case PIN:
                return resolve(token.x(), token.y(), hints)
                    .map(match -> new ConnectionPoint(match.connectorId(), token.content(), token.x(), token.y()));
            default:
                return Optional.empty();
        }
    }

    @Override
    public Optional<ConnectionPoint> nearestConnectionPoint(double x, double y, double radius) {
        ConnectionPoint nearest = null;
        double best = radius;

        for (Token token : index.all()) {
            if (!token.kind().isConnectionPoint()) {
                continue;
            }
            double distance = Math.hypot(token.x() - x, token.y() - y);
            if (distance >= best) {
                continue;
            }
            Optional<ConnectionPoint> point = toConnectionPoint(token, ResolveHints.none());
            if (point.isPresent()) {
                nearest = point.get();
                best = distance;
            }
        }
        return Optional.ofNullable(nearest);
    }

    /**
     * A destination pin shared by two connectors belongs to the one lying between the
     * wire's source and the pin, provided it sits close above the pin.
     */
    private List<ConnectorMatch> preferBetween(List<ConnectorMatch> ranked, double pinX, double pinY, double sourceX) {
        double low = Math.min(sourceX, pinX);
        double high = Math.max(sourceX, pinX);

        List<ConnectorMatch> between = new ArrayList<>();
        List<ConnectorMatch> rest = new ArrayList<>();
        for (ConnectorMatch candidate : ranked) {
            boolean isBetween = low < candidate.x() && candidate.x() < high;
            if (isBetween && pinY - candidate.y() < thresholds.getBetweenPreferenceMaxVerticalGap()) {
                between.add(candidate);
            } else {
                rest.add(candidate);
            }
        }
        if (between.isEmpty()) {
            return ranked;
        }
        between.addAll(rest);
        return between;
    }
}
