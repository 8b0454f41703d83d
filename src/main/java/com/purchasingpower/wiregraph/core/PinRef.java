package com.purchasingpower.wiregraph.core;

/**
 * A connector (or splice) and one of its pins.
 */
public record PinRef(String connectorId, String pin) {
}
