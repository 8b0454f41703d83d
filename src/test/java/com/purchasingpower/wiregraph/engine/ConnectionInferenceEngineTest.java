package com.purchasingpower.wiregraph.engine;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.core.PinRef;
import com.purchasingpower.wiregraph.extract.ExtractionStage;
import com.purchasingpower.wiregraph.reconcile.ExclusionFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.purchasingpower.wiregraph.DiagramFixtures.engine;
import static com.purchasingpower.wiregraph.DiagramFixtures.threePinRow;
import static com.purchasingpower.wiregraph.DiagramFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Connection inference engine")
class ConnectionInferenceEngineTest {

    private ConnectionInferenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine();
    }

    /**
     * Two specified rows far apart: a pin feeding SP001 on top, SP002 feeding a pin below.
     */
    private static DiagramGeometry splitHarness() {
        return DiagramGeometry.builder()
            .token(token("ECU100", 10, 70))
            .token(token("1", 10, 100))
            .token(token("SP001", 60, 100))
            .token(token("0.5,BU", 35, 95))
            .token(token("SP002", 460, 400))
            .token(token("BCM200", 510, 370))
            .token(token("2", 510, 400))
            .token(token("0.5,BU", 485, 395))
            .build();
    }

    @Test
    @DisplayName("Should run every stage and report its raw count")
    void infer_reportsStages() {
        // When
        InferenceResult result = engine.infer(DiagramGeometry.builder().tokens(threePinRow()).build());

        // Then
        assertThat(result.getTotalConnections()).isEqualTo(2);
        assertThat(result.getStageCounts()).containsOnlyKeys(ExtractionStage.values());
        assertThat(result.getStageCounts().get(ExtractionStage.HORIZONTAL)).isEqualTo(2);
        assertThat(result.getExcludedCount()).isZero();
    }

    @Test
    @DisplayName("Should bridge a splice whose wire leaves the page section")
    void infer_longRouting() {
        InferenceResult result = engine.infer(splitHarness());

        assertThat(result.getConnections())
            .extracting(Connection::getFromId, Connection::getToId, Connection::getWireColor)
            .containsExactly(
                tuple("ECU100", "SP001", "BU"),
                tuple("SP002", "BCM200", "BU"),
                tuple("SP001", "SP002", "BU"));
        assertThat(result.getStageCounts().get(ExtractionStage.LONG_ROUTING)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void infer_deterministic() {
        DiagramGeometry geometry = splitHarness();

        List<Connection> first = engine.infer(geometry).getConnections();
        List<Connection> second = engine.infer(geometry).getConnections();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should never emit self-loops or duplicate keys")
    void infer_noSelfLoopsOrDuplicates() {
        List<Connection> connections = engine.infer(splitHarness()).getConnections();

        Set<ConnectionKey> keys = new HashSet<>();
        for (Connection connection : connections) {
            assertThat(connection.isSelfLoop()).isFalse();
            assertThat(keys.add(connection.key())).isTrue();
        }
    }

    @Test
    @DisplayName("Should apply exclusions after reconciliation")
    void infer_withExclusions() {
        ExclusionFilter filter = new ExclusionFilter(Set.of(new PinRef("LMP300", "3")), Set.of());

        InferenceResult result = engine.infer(DiagramGeometry.builder().tokens(threePinRow()).build(), filter);

        assertThat(result.getConnections())
            .extracting(Connection::getFromId, Connection::getToId)
            .containsExactly(tuple("ECU100", "BCM200"));
        assertThat(result.getReconciledCount()).isEqualTo(2);
        assertThat(result.getExcludedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty graph for an empty diagram")
    void infer_emptyDiagram() {
        InferenceResult result = engine.infer(DiagramGeometry.builder().build());

        assertThat(result.getConnections()).isEmpty();
    }
}
