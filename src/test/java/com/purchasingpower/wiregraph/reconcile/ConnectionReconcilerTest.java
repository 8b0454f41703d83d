package com.purchasingpower.wiregraph.reconcile;

import com.purchasingpower.wiregraph.core.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Connection reconciliation")
class ConnectionReconcilerTest {

    private ConnectionReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new ConnectionReconciler();
    }

    private static Connection wire(String from, String fromPin, String to, String toPin, String dm, String color) {
        return Connection.builder()
            .fromId(from).fromPin(fromPin)
            .toId(to).toPin(toPin)
            .wireDm(dm).wireColor(color)
            .build();
    }

    @Test
    @DisplayName("Should drop self-loops, including splice self-loops")
    void reconcile_dropsSelfLoops() {
        List<Connection> result = reconciler.reconcile(List.of(
            wire("ECU100", "1", "ECU100", "1", "0.5", "BU"),
            wire("SP1", "", "SP1", "", "", ""),
            wire("ECU100", "1", "SP1", "", "", "")));

        assertThat(result).extracting(Connection::getFromId, Connection::getToId)
            .containsExactly(tuple("ECU100", "SP1"));
    }

    @Test
    @DisplayName("Should drop unspecified wires between pins of one connector but keep specified ones")
    void reconcile_sameConnector() {
        List<Connection> result = reconciler.reconcile(List.of(
            wire("ECU100", "1", "ECU100", "2", "", ""),
            wire("ECU100", "3", "ECU100", "4", "0.35", "BK")));

        assertThat(result).extracting(Connection::getFromPin).containsExactly("3");
    }

    @Test
    @DisplayName("Should keep the specified version of a duplicate in first-seen position")
    void reconcile_specPrecedence() {
        // Given
        Connection bare = wire("ECU100", "1", "BCM200", "2", "", "");
        Connection specified = wire("ECU100", "1", "BCM200", "2", "0.5", "BU");
        Connection other = wire("LMP300", "3", "SP1", "", "", "");

        // When
        List<Connection> forward = reconciler.reconcile(List.of(bare, other, specified));
        List<Connection> backward = reconciler.reconcile(List.of(specified, other, bare));

        // Then
        assertThat(forward).containsExactly(specified, other);
        assertThat(backward).containsExactly(specified, other);
    }

    @Test
    @DisplayName("Should return a reconciled list unchanged")
    void reconcile_idempotent() {
        List<Connection> once = reconciler.reconcile(List.of(
            wire("ECU100", "1", "BCM200", "2", "", ""),
            wire("ECU100", "1", "BCM200", "2", "0.5", "BU"),
            wire("BCM200", "2", "ECU100", "1", "", ""),
            wire("SP1", "", "SP1", "", "", "")));

        assertThat(reconciler.reconcile(once)).isEqualTo(once);
        assertThat(once).hasSize(2);
    }
}
