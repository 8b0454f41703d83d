package com.purchasingpower.wiregraph.core;

/**
 * Resolved wire endpoint. Splices and grounds are used directly and carry an empty pin.
 */
public record ConnectionPoint(String connectorId, String pin, double x, double y) {

    public static ConnectionPoint direct(Token token) {
        return new ConnectionPoint(token.content(), "", token.x(), token.y());
    }

    public boolean isSplice() {
        return TokenKind.isSpliceId(connectorId);
    }

    public boolean isGround() {
        return TokenKind.classify(connectorId) == TokenKind.GROUND;
    }

    public PinRef pinRef() {
        return new PinRef(connectorId, pin);
    }

    public boolean sameEndpointAs(ConnectionPoint other) {
        return connectorId.equals(other.connectorId) && pin.equals(other.pin);
    }
}
