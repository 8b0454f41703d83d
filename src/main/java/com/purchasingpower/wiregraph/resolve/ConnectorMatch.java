package com.purchasingpower.wiregraph.resolve;

import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;

/**
 * Connector label found above a pin, with its distance to the pin.
 */
public record ConnectorMatch(String connectorId, double x, double y, double distance) {

    public static ConnectorMatch of(Token label, double pinX, double pinY) {
        return new ConnectorMatch(label.content(), label.x(), label.y(),
            Math.hypot(label.x() - pinX, label.y() - pinY));
    }

    public boolean isJunction() {
        return TokenKind.isJunctionId(connectorId);
    }
}
