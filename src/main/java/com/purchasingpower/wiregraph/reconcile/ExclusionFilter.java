package com.purchasingpower.wiregraph.reconcile;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.PinRef;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Known false positives of one diagram, removed from the final graph.
 *
 * @param excludedPins        pins whose connections are all dropped
 * @param excludedConnections exact directed connections to drop
 */
public record ExclusionFilter(Set<PinRef> excludedPins, Set<ConnectionKey> excludedConnections) {

    public ExclusionFilter {
        excludedPins = Set.copyOf(excludedPins);
        excludedConnections = Set.copyOf(excludedConnections);
    }

    public static ExclusionFilter none() {
        return new ExclusionFilter(Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return excludedPins.isEmpty() && excludedConnections.isEmpty();
    }

    public boolean excludes(Connection connection) {
        return excludedPins.contains(new PinRef(connection.getFromId(), connection.getFromPin()))
            || excludedPins.contains(new PinRef(connection.getToId(), connection.getToPin()))
            || excludedConnections.contains(connection.key());
    }

    public List<Connection> apply(List<Connection> connections) {
        return connections.stream()
            .filter(connection -> !excludes(connection))
            .collect(Collectors.toList());
    }
}
