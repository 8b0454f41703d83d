package com.purchasingpower.wiregraph.resolve;

import com.purchasingpower.wiregraph.core.ConnectionPoint;
import com.purchasingpower.wiregraph.core.Token;

import java.util.List;
import java.util.Optional;

/**
 * Finds the connector that owns a pin label.
 *
 * <p>Connectors are printed above their pins. When several labels qualify the resolver
 * ranks them by distance and uses hints about the wire's other end to break ties
 * between mirrored junction names.
 *
 * @since 1.0.0
 */
public interface ConnectorResolver {

    /**
     * Resolve the owning connector of the pin at the given position.
     *
     * @return the chosen connector, or empty when no connector sits above the pin
     */
    Optional<ConnectorMatch> resolve(double pinX, double pinY, ResolveHints hints);

    /**
     * All connectors qualifying for the pin, closest first.
     */
    List<ConnectorMatch> candidatesAbove(double pinX, double pinY);

    /**
     * Turn a token into a connection point: pins resolve through their connector,
     * splices and grounds are used directly, other kinds yield nothing.
     */
    Optional<ConnectionPoint> toConnectionPoint(Token token, ResolveHints hints);

    /**
     * Nearest pin, splice or ground within {@code radius} that resolves to a connection point.
     */
    Optional<ConnectionPoint> nearestConnectionPoint(double x, double y, double radius);
}
