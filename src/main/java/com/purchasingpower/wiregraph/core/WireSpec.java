package com.purchasingpower.wiregraph.core;

import java.util.Optional;

/**
 * Wire diameter and color printed above a wire, e.g. {@code 0.35,GY/PU}.
 *
 * <p>A spec is never an endpoint; it only annotates the wire it is attributed to.
 */
public record WireSpec(String diameter, String color, double x, double y) {

    public static Optional<WireSpec> from(Token token) {
        if (token.kind() != TokenKind.WIRE_SPEC) {
            return Optional.empty();
        }
        String[] parts = token.content().split(",", 2);
        return Optional.of(new WireSpec(parts[0], parts[1], token.x(), token.y()));
    }

    /**
     * Key used to balance wire flow at splices.
     */
    public String flowKey() {
        return diameter + "," + color;
    }
}
