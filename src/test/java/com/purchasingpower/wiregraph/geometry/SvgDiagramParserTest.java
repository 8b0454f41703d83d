package com.purchasingpower.wiregraph.geometry;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.exception.DiagramParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("SVG diagram parsing")
class SvgDiagramParserTest {

    static final String DIAGRAM = """
        <?xml version="1.0" encoding="utf-8"?>
        <svg xmlns="http://www.w3.org/2000/svg" viewBox="0 0 1000 1000">
          <text transform="matrix(1 0 0 1 100 50)" class="st5">ECU100</text>
          <text transform="matrix(1 0 0 1 100 80)">3</text>
          <text transform="matrix(1 0 0 1 120 96)">SP10</text>
          <text>no position</text>
          <path d="M100,100c1.1,0,2,0.9,2,2c0,1.1-0.9,2-2,2c-1.1,0-2-0.9-2-2C98,100.9,98.9,100,100,100z"/>
          <path d="M500,500c1.1,0,2,0.9,2,2c0,1.1-0.9,2-2,2c-1.1,0-2-0.9-2-2C498,500.9,498.9,500,500,500z"/>
          <path class="st17" d="M200,50l5,10"/>
          <path class="st1" d="M100,85V300H400"/>
          <path class="st3" d="M10,10H300"/>
          <path class="st3" d="M10,10V40H300"/>
          <polyline class="st20" points="100,85 100,375"/>
          <polyline class="st21" points="100.5,85 100.5,376"/>
        </svg>
        """;

    private SvgDiagramParser parser;

    @BeforeEach
    void setUp() {
        DiagramConventions conventions = new DiagramConventions();
        parser = new SvgDiagramParser(conventions, new ConnectorLabelMerger(conventions), new SpliceDotMapper(conventions));
    }

    @Test
    @DisplayName("Should read labels, splice dots and classified paths")
    void parse_inlineDiagram() {
        // When
        DiagramGeometry geometry = parser.parse(DIAGRAM, "inline");

        // Then
        assertThat(geometry.getTokens())
            .extracting(Token::content, Token::x, Token::y)
            .containsExactly(
                tuple("ECU100", 100.0, 50.0),
                tuple("3", 100.0, 80.0),
                tuple("SP10", 100.0, 100.0),
                tuple("SP_CUSTOM_001", 500.0, 500.0));
        assertThat(geometry.getPolylines()).hasSize(1);
        assertThat(geometry.getRoutingPaths()).hasSize(2);
        assertThat(geometry.getGroundArrows()).singleElement()
            .satisfies(arrow -> assertThat(arrow.first()).isEqualTo(new Point(200, 50)));
    }

    @Test
    @DisplayName("Should read a diagram file")
    void parse_file(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("diagram.svg");
        Files.writeString(file, DIAGRAM);

        assertThat(parser.parse(file).getTokens()).hasSize(4);
    }

    @Test
    @DisplayName("Should report malformed documents with their source")
    void parse_malformed() {
        assertThatThrownBy(() -> parser.parse("<svg><text>", "broken.svg"))
            .isInstanceOf(DiagramParseException.class)
            .hasMessageContaining("Malformed diagram")
            .extracting("source").isEqualTo("broken.svg");
    }

    @Test
    @DisplayName("Should report missing files")
    void parse_missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> parser.parse(dir.resolve("missing.svg")))
            .isInstanceOf(DiagramParseException.class);
    }
}
