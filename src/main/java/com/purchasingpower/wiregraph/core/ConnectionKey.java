package com.purchasingpower.wiregraph.core;

/**
 * Identity of a directed connection. Unique in the final graph.
 */
public record ConnectionKey(String fromId, String fromPin, String toId, String toPin) {

    public ConnectionKey reversed() {
        return new ConnectionKey(toId, toPin, fromId, fromPin);
    }
}
