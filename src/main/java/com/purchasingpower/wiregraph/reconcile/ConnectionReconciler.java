package com.purchasingpower.wiregraph.reconcile;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.TokenKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the output of all extraction stages into one connection set.
 *
 * <p>Drops self-loops and unspecified wires between two pins of the same connector
 * (arrows pointing at descriptions). Duplicates collapse onto one key; a version with
 * a wire spec replaces one without. First-seen order is kept, and reconciling a
 * reconciled list returns it unchanged.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ConnectionReconciler {

    public List<Connection> reconcile(List<Connection> connections) {
        int selfLoops = 0;
        int selfConnections = 0;
        Map<ConnectionKey, Connection> unique = new LinkedHashMap<>();

        for (Connection connection : connections) {
            if (connection.isSelfLoop()) {
                selfLoops++;
                continue;
            }
            if (isUnspecifiedSelfConnection(connection)) {
                selfConnections++;
                continue;
            }

            Connection existing = unique.get(connection.key());
            if (existing == null || (connection.hasWireSpec() && !existing.hasWireSpec())) {
                unique.put(connection.key(), connection);
            }
        }

        if (selfLoops > 0 || selfConnections > 0) {
            log.info("Filtered {} self-loops and {} same-connector connections", selfLoops, selfConnections);
        }
        log.debug("Reconciled {} connections into {}", connections.size(), unique.size());
        return new ArrayList<>(unique.values());
    }

    private static boolean isUnspecifiedSelfConnection(Connection connection) {
        return connection.getFromId().equals(connection.getToId())
            && !connection.getFromPin().equals(connection.getToPin())
            && !TokenKind.isSpliceId(connection.getFromId())
            && !connection.hasWireSpec();
    }
}
