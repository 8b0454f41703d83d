package com.purchasingpower.wiregraph.index;

import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.wiregraph.DiagramFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Token index")
class TokenIndexTest {

    private final TokenIndex index = new TokenIndex(List.of(
        token("ECU100", 100, 50),
        token("3", 100, 80),
        token("SP10", 200, 80),
        token("SP10", 900, 900),
        token("0.5,BU", 150, 75),
        token("Engine harness", 500, 500)));

    @Test
    @DisplayName("Should group tokens by kind in input order")
    void allOfKind_shouldKeepInputOrder() {
        assertThat(index.allOfKind(TokenKind.SPLICE)).extracting(Token::x).containsExactly(200.0, 900.0);
        assertThat(index.allOfKind(TokenKind.GROUND)).isEmpty();
        assertThat(index.wireSpecs()).singleElement()
            .satisfies(spec -> {
                assertThat(spec.diameter()).isEqualTo("0.5");
                assertThat(spec.color()).isEqualTo("BU");
            });
    }

    @Test
    @DisplayName("Should find tokens within a radius")
    void tokensNear_shouldUseEuclideanDistance() {
        assertThat(index.tokensNear(100, 60, 25)).extracting(Token::content).containsExactly("ECU100", "3");
        assertThat(index.tokensNear(100, 60, 5)).isEmpty();
    }

    @Test
    @DisplayName("Should keep the first position of a repeated splice")
    void splicePositions_shouldKeepFirstOccurrence() {
        assertThat(index.splicePositions()).containsOnlyKeys("SP10");
        assertThat(index.splicePositions().get("SP10").x()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Should bound components only, with margin")
    void componentBounds_shouldIgnoreSpecsAndLabels() {
        TokenIndex.Bounds bounds = index.componentBounds(20).orElseThrow();

        assertThat(bounds.minX()).isEqualTo(80.0);
        assertThat(bounds.maxX()).isEqualTo(920.0);
        assertThat(bounds.minY()).isEqualTo(30.0);
        assertThat(bounds.contains(500, 500)).isTrue();
        assertThat(new TokenIndex(List.of()).componentBounds(20)).isEmpty();
    }
}
