package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.wiregraph.DiagramFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Connector label merging")
class ConnectorLabelMergerTest {

    private ConnectorLabelMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ConnectorLabelMerger(new DiagramConventions());
    }

    @Test
    @DisplayName("Should attach option labels and join shielded pairs into one two-line label")
    void merge_shieldedPair() {
        // Given
        List<Token> labels = List.of(
            token("MAIN202", 100, 300),
            token("(XR-)", 120, 300),
            token("MAIN642", 102, 312),
            token("(XR+)", 122, 312));

        // When
        List<Token> merged = merger.merge(labels);

        // Then
        assertThat(merged).singleElement().satisfies(label -> {
            assertThat(label.content()).isEqualTo("MAIN202 (XR-)\nMAIN642 (XR+)");
            assertThat(label.x()).isEqualTo(101.0);
            assertThat(label.y()).isEqualTo(300.0);
            assertThat(label.kind()).isEqualTo(TokenKind.CONNECTOR);
        });
    }

    @Test
    @DisplayName("Should leave unrelated labels untouched")
    void merge_unrelated() {
        List<Token> labels = List.of(
            token("ECU100", 100, 50),
            token("(XR-)", 300, 50),
            token("7", 100, 80));

        assertThat(merger.merge(labels)).isEqualTo(labels);
    }
}
