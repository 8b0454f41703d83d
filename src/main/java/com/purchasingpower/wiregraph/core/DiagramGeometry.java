package com.purchasingpower.wiregraph.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the engine needs from one diagram: labels and line primitives.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class DiagramGeometry {

    @Singular
    List<Token> tokens;

    /** Straight and staircase wire polylines. */
    @Singular
    List<Polyline> polylines;

    /** White routing wires and L-shaped routing paths. */
    @Singular
    List<Polyline> routingPaths;

    /** Ground arrow paths; the first point is the arrow anchor. */
    @Singular
    List<Polyline> groundArrows;
}
