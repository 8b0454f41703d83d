package com.purchasingpower.wiregraph.core;

import lombok.Builder;
import lombok.Value;

/**
 * Directed wire between two endpoints.
 *
 * <p>{@code wireDm} and {@code wireColor} are empty strings when no spec was found.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Connection {

    String fromId;
    @Builder.Default
    String fromPin = "";
    String toId;
    @Builder.Default
    String toPin = "";
    @Builder.Default
    String wireDm = "";
    @Builder.Default
    String wireColor = "";

    public static Connection between(ConnectionPoint from, ConnectionPoint to, WireSpec spec) {
        return Connection.builder()
            .fromId(from.connectorId())
            .fromPin(from.pin())
            .toId(to.connectorId())
            .toPin(to.pin())
            .wireDm(spec != null ? spec.diameter() : "")
            .wireColor(spec != null ? spec.color() : "")
            .build();
    }

    public ConnectionKey key() {
        return new ConnectionKey(fromId, fromPin, toId, toPin);
    }

    public boolean hasWireSpec() {
        return !wireDm.isEmpty() || !wireColor.isEmpty();
    }

    public String flowKey() {
        return wireDm + "," + wireColor;
    }

    public boolean isSelfLoop() {
        return fromId.equals(toId) && fromPin.equals(toPin);
    }

    public boolean touches(String connectorId, String pin) {
        return (fromId.equals(connectorId) && fromPin.equals(pin))
            || (toId.equals(connectorId) && toPin.equals(pin));
    }

    public boolean links(String firstId, String secondId) {
        return (fromId.equals(firstId) && toId.equals(secondId))
            || (fromId.equals(secondId) && toId.equals(firstId));
    }
}
