package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.PinRef;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.core.WireSpec;
import com.purchasingpower.wiregraph.engine.InferenceContext;
import com.purchasingpower.wiregraph.index.TokenIndex;
import com.purchasingpower.wiregraph.resolve.ConnectorMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Connects pins to ground symbols drawn as arrow heads.
 *
 * <p>The arrow anchor sits on the pin row. Ground labels near the anchor name the
 * ground; the pin under the anchor whose connector label is closest to the ground
 * label is the wire's source.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@Order(3)
public class GroundConnectionExtractor implements ConnectionExtractor {

    @Override
    public ExtractionStage stage() {
        return ExtractionStage.GROUND;
    }

    @Override
    public List<Connection> extract(InferenceContext context) {
        InferenceThresholds thresholds = context.getThresholds();
        TokenIndex index = context.getIndex();
        Set<PinRef> wiredPins = pinsWithSpecifiedWires(context.connectionsFrom(ExtractionStage.HORIZONTAL));
        Map<ConnectionKey, Connection> found = new LinkedHashMap<>();

        for (Polyline arrow : context.getGeometry().getGroundArrows()) {
            if (arrow.size() == 0) {
                continue;
            }
            Point anchor = arrow.first();

            for (Token ground : index.allOfKind(TokenKind.GROUND)) {
                if (Math.abs(ground.y() - anchor.y()) >= thresholds.getGroundLabelYWindow()
                    || Math.abs(ground.x() - anchor.x()) >= thresholds.getGroundLabelXWindow()) {
                    continue;
                }
                connectGround(ground, anchor, wiredPins, context).ifPresent(connection -> {
                    if (!found.containsKey(connection.key())) {
                        found.put(connection.key(), connection);
                    }
                });
            }
        }

        List<Connection> connections = new ArrayList<>(found.values());
        log.info("Ground connections: {} from {} arrows", connections.size(), context.getGeometry().getGroundArrows().size());
        return connections;
    }

    private Optional<Connection> connectGround(Token ground, Point anchor, Set<PinRef> wiredPins, InferenceContext context) {
        InferenceThresholds thresholds = context.getThresholds();
        TokenIndex index = context.getIndex();

        List<GroundCandidate> candidates = new ArrayList<>();
        for (Token pin : index.allOfKind(TokenKind.PIN)) {
            if (Math.abs(pin.y() - anchor.y()) >= thresholds.getGroundPinYWindow()
                || Math.abs(pin.x() - anchor.x()) >= thresholds.getGroundPinXWindow()) {
                continue;
            }
            ownerOf(pin, context).ifPresent(owner -> candidates.add(new GroundCandidate(pin, owner,
                index.firstNamed(owner)
                    .filter(label -> label.kind().isConnectorLike())
                    .map(label -> Math.abs(label.x() - ground.x()))
                    .orElse(null))));
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        List<GroundCandidate> labelled = candidates.stream()
            .filter(candidate -> candidate.labelDistance() != null)
            .toList();

        GroundCandidate chosen;
        if (labelled.isEmpty()) {
            chosen = candidates.stream()
                .min(Comparator.comparingDouble(candidate -> Math.abs(candidate.pin().x() - anchor.x())))
                .orElseThrow();
        } else {
            chosen = labelled.stream()
                .min(Comparator.comparingDouble(GroundCandidate::labelDistance))
                .orElseThrow();
            if (wiredPins.contains(new PinRef(chosen.connectorId(), chosen.pin().content()))) {
                log.debug("Skipping ground {}: {},{} already carries a specified wire",
                    ground.content(), chosen.connectorId(), chosen.pin().content());
                return Optional.empty();
            }
            if (chosen.labelDistance() >= thresholds.getGroundLabelPlausibility()) {
                log.debug("Skipping ground {}: connector {} too far from the ground label",
                    ground.content(), chosen.connectorId());
                return Optional.empty();
            }
        }

        WireSpec spec = context.getSpecLocator()
            .forGround(chosen.pin().x(), ground.x(), ground.y())
            .orElse(null);
        return Optional.of(Connection.builder()
            .fromId(chosen.connectorId())
            .fromPin(chosen.pin().content())
            .toId(ground.content())
            .wireDm(spec != null ? spec.diameter() : "")
            .wireColor(spec != null ? spec.color() : "")
            .build());
    }

    /**
     * Connector above the pin, preferring the junction variant that leads into the
     * designated harness.
     */
    private Optional<String> ownerOf(Token pin, InferenceContext context) {
        List<ConnectorMatch> above = context.getResolver().candidatesAbove(pin.x(), pin.y());
        if (above.isEmpty()) {
            return Optional.empty();
        }
        String suffix = "2" + context.getConventions().getJunctionCode();
        return Optional.of(above.stream()
            .filter(match -> match.connectorId().endsWith(suffix))
            .findFirst()
            .orElse(above.get(0))
            .connectorId());
    }

    private static Set<PinRef> pinsWithSpecifiedWires(List<Connection> horizontal) {
        Set<PinRef> pins = new HashSet<>();
        for (Connection connection : horizontal) {
            if (connection.hasWireSpec()) {
                pins.add(new PinRef(connection.getFromId(), connection.getFromPin()));
                if (!connection.getToPin().isEmpty()) {
                    pins.add(new PinRef(connection.getToId(), connection.getToPin()));
                }
            }
        }
        return pins;
    }

    private record GroundCandidate(Token pin, String connectorId, Double labelDistance) {
    }
}
