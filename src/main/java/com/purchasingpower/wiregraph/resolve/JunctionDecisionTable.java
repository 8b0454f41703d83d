package com.purchasingpower.wiregraph.resolve;

import java.util.HashMap;
import java.util.Map;

/**
 * Picks one variant of a mirrored junction pair ({@code MH2FL} / {@code FL2MH}).
 *
 * <p>The rule is looked up by whether a source hint is present, whether a destination
 * hint is present, and whether the pair involves the designated junction code. A
 * destination hint always wins over a source hint.
 *
 * <p>Naming convention for the designated code {@code J}: destination-side pins take
 * {@code *2J}, source-side pins take {@code J2*}.
 *
 * @since 1.0.0
 */
public class JunctionDecisionTable {

    /**
     * Whether a junction pair is named against the designated code.
     */
    public enum JunctionType {
        DESIGNATED,
        FOREIGN
    }

    /**
     * Outcome of a table lookup.
     */
    public enum TieBreak {
        CLOSEST_TO_DESTINATION,
        BETWEEN_THEN_NAMING,
        BETWEEN_THEN_CLOSEST,
        NAMING,
        CLOSEST
    }

    record DecisionKey(boolean hasSourceHint, boolean hasDestinationHint, JunctionType type) {
    }

    private static final Map<DecisionKey, TieBreak> RULES = new HashMap<>();

    static {
        for (JunctionType type : JunctionType.values()) {
            RULES.put(new DecisionKey(true, true, type), TieBreak.CLOSEST_TO_DESTINATION);
            RULES.put(new DecisionKey(false, true, type), TieBreak.CLOSEST_TO_DESTINATION);
        }
        RULES.put(new DecisionKey(true, false, JunctionType.DESIGNATED), TieBreak.BETWEEN_THEN_NAMING);
        RULES.put(new DecisionKey(true, false, JunctionType.FOREIGN), TieBreak.BETWEEN_THEN_CLOSEST);
        RULES.put(new DecisionKey(false, false, JunctionType.DESIGNATED), TieBreak.NAMING);
        RULES.put(new DecisionKey(false, false, JunctionType.FOREIGN), TieBreak.CLOSEST);
    }

    private final String junctionCode;

    public JunctionDecisionTable(String junctionCode) {
        this.junctionCode = junctionCode;
    }

    public TieBreak ruleFor(ResolveHints hints, JunctionType type) {
        return RULES.get(new DecisionKey(hints.hasSourceHint(), hints.hasDestinationHint(), type));
    }

    public JunctionType typeOf(ConnectorMatch junction) {
        String id = junction.connectorId();
        return id.startsWith(junctionCode + "2") || id.endsWith("2" + junctionCode)
            ? JunctionType.DESIGNATED
            : JunctionType.FOREIGN;
    }

    /**
     * Choose between the closer variant and its mirror for a pin at {@code pinX}.
     */
    public ConnectorMatch choose(ConnectorMatch closer, ConnectorMatch mirror, double pinX, ResolveHints hints) {
        TieBreak rule = ruleFor(hints, typeOf(closer));

        switch (rule) {
            case CLOSEST_TO_DESTINATION:
                double destination = hints.destinationX();
                return Math.abs(mirror.x() - destination) < Math.abs(closer.x() - destination) ? mirror : closer;
            case BETWEEN_THEN_NAMING:
                ConnectorMatch between = onlyBetween(closer, mirror, hints.sourceX(), pinX);
                return between != null ? between : byNaming(closer, mirror, hints.actsAsSource());
            case BETWEEN_THEN_CLOSEST:
                ConnectorMatch onlyOne = onlyBetween(closer, mirror, hints.sourceX(), pinX);
                return onlyOne != null ? onlyOne : closer;
            case NAMING:
                return byNaming(closer, mirror, hints.actsAsSource());
            case CLOSEST:
            default:
                return closer;
        }
    }

    private ConnectorMatch onlyBetween(ConnectorMatch first, ConnectorMatch second, double sourceX, double pinX) {
        boolean firstBetween = isBetween(first.x(), sourceX, pinX);
        boolean secondBetween = isBetween(second.x(), sourceX, pinX);
        if (firstBetween && !secondBetween) {
            return first;
        }
        if (secondBetween && !firstBetween) {
            return second;
        }
        return null;
    }

    private ConnectorMatch byNaming(ConnectorMatch closer, ConnectorMatch mirror, boolean asSource) {
        if (asSource) {
            String prefix = junctionCode + "2";
            if (closer.connectorId().startsWith(prefix)) {
                return closer;
            }
            return mirror.connectorId().startsWith(prefix) ? mirror : closer;
        }
        String suffix = "2" + junctionCode;
        if (closer.connectorId().endsWith(suffix)) {
            return closer;
        }
        return mirror.connectorId().endsWith(suffix) ? mirror : closer;
    }

    private static boolean isBetween(double x, double a, double b) {
        return Math.min(a, b) < x && x < Math.max(a, b);
    }
}
