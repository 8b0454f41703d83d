package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.engine.InferenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers splice-to-splice links that run across the page without a drawn path.
 *
 * <p>Every wire entering a splice has to leave it again. Counting, per splice and per
 * wire spec, the specified wires going in and out shows which splices lack an outgoing
 * wire; the nearest far-away splice already carrying that spec receives it.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@Order(4)
public class LongRoutingResolver implements ConnectionExtractor {

    @Override
    public ExtractionStage stage() {
        return ExtractionStage.LONG_ROUTING;
    }

    @Override
    public List<Connection> extract(InferenceContext context) {
        List<Connection> connections = resolve(context.allConnections(), context.getIndex().splicePositions(),
            context.getThresholds());
        log.info("Long routing: {} splice links inferred", connections.size());
        return connections;
    }

    /**
     * Balance splice flows over the existing connections.
     *
     * @param existing connections found by the earlier stages
     * @param splices  splice positions keyed by splice ID
     */
    public List<Connection> resolve(List<Connection> existing, Map<String, Token> splices, InferenceThresholds thresholds) {
        Map<String, Map<String, Flow>> flows = tallyFlows(existing);

        Set<String> connectedPairs = new HashSet<>();
        for (Connection connection : existing) {
            connectedPairs.add(pairKey(connection.getFromId(), connection.getToId()));
        }

        List<Connection> inferred = new ArrayList<>();
        Set<String> usedPairs = new HashSet<>();
        Set<String> pairedSplices = new HashSet<>();

        for (Map.Entry<String, Map<String, Flow>> spliceFlows : flows.entrySet()) {
            String sourceId = spliceFlows.getKey();
            Token source = splices.get(sourceId);
            if (source == null) {
                continue;
            }
            int busiest = spliceFlows.getValue().values().stream().mapToInt(Flow::total).max().orElse(0);

            for (Map.Entry<String, Flow> keyFlow : spliceFlows.getValue().entrySet()) {
                String flowKey = keyFlow.getKey();
                Flow flow = keyFlow.getValue();
                if (flow.balance() <= 0 || pairedSplices.contains(sourceId)) {
                    continue;
                }
                if (spliceFlows.getValue().size() > 1
                    && flow.total() < busiest
                    && flow.total() <= thresholds.getMinorityColorMaxCount()) {
                    log.debug("Skipping {} for {}: minority color", flowKey, sourceId);
                    continue;
                }

                String bestTarget = null;
                double bestDistance = Double.POSITIVE_INFINITY;
                for (Map.Entry<String, Map<String, Flow>> candidate : flows.entrySet()) {
                    String targetId = candidate.getKey();
                    Token target = splices.get(targetId);
                    if (targetId.equals(sourceId) || target == null || !candidate.getValue().containsKey(flowKey)) {
                        continue;
                    }
                    String pair = pairKey(sourceId, targetId);
                    if (connectedPairs.contains(pair) || usedPairs.contains(pair)) {
                        continue;
                    }
                    double distance = Math.hypot(target.x() - source.x(), target.y() - source.y());
                    if (distance <= thresholds.getLongRoutingMinDistance()
                        || Math.abs(target.y() - source.y()) <= thresholds.getLongRoutingMinVerticalSpan()) {
                        continue;
                    }
                    if (distance < bestDistance) {
                        bestDistance = distance;
                        bestTarget = targetId;
                    }
                }

                if (bestTarget != null) {
                    String[] spec = flowKey.split(",", 2);
                    inferred.add(Connection.builder()
                        .fromId(sourceId)
                        .toId(bestTarget)
                        .wireDm(spec[0])
                        .wireColor(spec[1])
                        .build());
                    usedPairs.add(pairKey(sourceId, bestTarget));
                    pairedSplices.add(sourceId);
                    pairedSplices.add(bestTarget);
                    log.debug("Long routing {} -> {} ({})", sourceId, bestTarget, flowKey);
                }
            }
        }
        return inferred;
    }

    /**
     * Incoming and outgoing counts per splice and per spec, in order of first appearance.
     * Connections without a spec carry no flow.
     */
    Map<String, Map<String, Flow>> tallyFlows(List<Connection> connections) {
        Map<String, Map<String, Flow>> flows = new LinkedHashMap<>();
        for (Connection connection : connections) {
            if (!connection.hasWireSpec()) {
                continue;
            }
            String key = connection.flowKey();
            if (TokenKind.isSpliceId(connection.getToId())) {
                flows.computeIfAbsent(connection.getToId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(key, k -> new Flow()).incoming++;
            }
            if (TokenKind.isSpliceId(connection.getFromId())) {
                flows.computeIfAbsent(connection.getFromId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(key, k -> new Flow()).outgoing++;
            }
        }
        return flows;
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    static class Flow {
        int incoming;
        int outgoing;

        int balance() {
            return incoming - outgoing;
        }

        int total() {
            return incoming + outgoing;
        }
    }
}
