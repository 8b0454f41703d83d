package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.core.Point;
import com.purchasingpower.wiregraph.core.Polyline;
import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.engine.InferenceContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.wiregraph.DiagramFixtures.context;
import static com.purchasingpower.wiregraph.DiagramFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("Routing path extraction")
class RoutingPathExtractorTest {

    private static final List<Token> TWO_CONNECTORS = List.of(
        token("ECU100", 100, 50),
        token("3", 100, 80),
        token("BCM200", 100, 350),
        token("7", 100, 380));

    private RoutingPathExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new RoutingPathExtractor();
    }

    @Test
    @DisplayName("Should trace a simple polyline from the lower endpoint to the upper one")
    void extract_simplePolyline() {
        // Given
        InferenceContext context = context(DiagramGeometry.builder()
            .tokens(TWO_CONNECTORS)
            .polyline(line(100, 85, 100, 375))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        // When
        List<Connection> connections = extractor.extract(context);

        // Then
        assertThat(connections)
            .extracting(Connection::getFromId, Connection::getFromPin, Connection::getToId, Connection::getToPin)
            .containsExactly(tuple("BCM200", "7", "ECU100", "3"));
        assertThat(connections.get(0).hasWireSpec()).isFalse();
    }

    @Test
    @DisplayName("Should leave pairs already linked by a horizontal wire alone")
    void extract_horizontalTakesPrecedence() {
        InferenceContext context = context(DiagramGeometry.builder()
            .tokens(TWO_CONNECTORS)
            .polyline(line(100, 85, 100, 375))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of(Connection.builder()
            .fromId("ECU100").fromPin("3").toId("BCM200").toPin("7")
            .wireDm("0.5").wireColor("BU")
            .build()));

        assertThat(extractor.extract(context)).isEmpty();
    }

    @Test
    @DisplayName("Should not use a horizontally wired pin as routing source")
    void extract_claimedSourceSkipped() {
        InferenceContext context = context(DiagramGeometry.builder()
            .tokens(TWO_CONNECTORS)
            .polyline(line(100, 85, 100, 375))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of(Connection.builder()
            .fromId("BCM200").fromPin("7").toId("SP99")
            .build()));

        assertThat(extractor.extract(context)).isEmpty();
    }

    @Test
    @DisplayName("Should chain through splices lying on the polyline")
    void extract_chainThroughSplice() {
        InferenceContext context = context(DiagramGeometry.builder()
            .token(token("ECU100", 100, 50))
            .token(token("3", 100, 80))
            .token(token("SP10", 102, 150))
            .token(token("LMP300", 400, 205))
            .token(token("5", 400, 235))
            .polyline(new Polyline(List.of(new Point(100, 85), new Point(100, 230), new Point(400, 230))))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        List<Connection> connections = extractor.extract(context);

        assertThat(connections)
            .extracting(Connection::getFromId, Connection::getToId)
            .containsExactly(tuple("ECU100", "SP10"), tuple("LMP300", "SP10"));
    }

    @Test
    @DisplayName("Should take the chain's spec from the run nearest its source end")
    void extract_chainSpecFromSourceEnd() {
        // Given
        InferenceContext context = context(DiagramGeometry.builder()
            .token(token("ECU100", 100, 50))
            .token(token("3", 100, 80))
            .token(token("0.35,BK", 200, 70))
            .token(token("SP10", 302, 300))
            .token(token("0.5,RD", 400, 585))
            .token(token("BCM200", 500, 540))
            .token(token("7", 500, 570))
            .polyline(new Polyline(List.of(
                new Point(100, 85), new Point(300, 85), new Point(300, 600),
                new Point(500, 600), new Point(500, 575))))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        // When
        List<Connection> connections = extractor.extract(context);

        // Then
        assertThat(connections)
            .extracting(Connection::getFromId, Connection::getToId, Connection::getWireDm, Connection::getWireColor)
            .containsExactly(
                tuple("ECU100", "SP10", "0.5", "RD"),
                tuple("BCM200", "SP10", "0.5", "RD"));
    }

    @Test
    @DisplayName("Should not link splices closer than the minimum routed distance")
    void extract_splicesTooClose() {
        InferenceContext context = context(DiagramGeometry.builder()
            .token(token("SP10", 100, 100))
            .token(token("SP20", 100, 350))
            .polyline(line(100, 105, 100, 345))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        assertThat(extractor.extract(context)).isEmpty();
    }

    @Test
    @DisplayName("Should link splices far enough apart from the lower one upwards")
    void extract_farSplices() {
        InferenceContext context = context(DiagramGeometry.builder()
            .token(token("SP10", 100, 100))
            .token(token("SP20", 100, 600))
            .polyline(line(100, 105, 100, 595))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        assertThat(extractor.extract(context))
            .extracting(Connection::getFromId, Connection::getToId)
            .containsExactly(tuple("SP20", "SP10"));
    }

    @Test
    @DisplayName("Should connect the corners of a rectangle and take the spec from its longest run")
    void extract_rectangle() {
        InferenceContext context = context(DiagramGeometry.builder()
            .token(token("ECU100", 100, 50))
            .token(token("3", 100, 80))
            .token(token("ABS400", 400, 270))
            .token(token("9", 400, 303))
            .token(token("0.5,RD", 300, 290))
            .polyline(new Polyline(List.of(
                new Point(100, 82), new Point(150, 82), new Point(150, 300), new Point(400, 300))))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        List<Connection> connections = extractor.extract(context);

        assertThat(connections)
            .extracting(Connection::getFromId, Connection::getFromPin, Connection::getToId, Connection::getToPin,
                Connection::getWireDm, Connection::getWireColor)
            .containsExactly(tuple("ECU100", "3", "ABS400", "9", "0.5", "RD"));
    }

    @Test
    @DisplayName("Should trace routing paths through the connection points along them")
    void extract_routingPath() {
        InferenceContext context = context(DiagramGeometry.builder()
            .tokens(TWO_CONNECTORS)
            .routingPath(line(100, 85, 100, 375))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        assertThat(extractor.extract(context))
            .extracting(Connection::getFromId, Connection::getToId)
            .containsExactly(tuple("ECU100", "BCM200"));
    }

    @Test
    @DisplayName("Should discard paths drawn outside the component area")
    void extract_outsideComponents() {
        InferenceContext context = context(DiagramGeometry.builder()
            .tokens(TWO_CONNECTORS)
            .polyline(line(2000, 2000, 2100, 2000))
            .build());
        context.record(ExtractionStage.HORIZONTAL, List.of());

        assertThat(extractor.extract(context)).isEmpty();
    }

    @Test
    @DisplayName("Should recognise horizontal-vertical-horizontal four point shapes")
    void isRectangular() {
        InferenceThresholds thresholds = new InferenceThresholds();

        assertThat(extractor.isRectangular(new Polyline(List.of(
            new Point(0, 0), new Point(50, 2), new Point(51, 200), new Point(300, 199))), thresholds)).isTrue();
        assertThat(extractor.isRectangular(new Polyline(List.of(
            new Point(0, 0), new Point(0, 50), new Point(51, 50), new Point(51, 200))), thresholds)).isFalse();
        assertThat(extractor.isRectangular(line(0, 0, 100, 0), thresholds)).isFalse();
    }

    private static Polyline line(double x1, double y1, double x2, double y2) {
        return new Polyline(List.of(new Point(x1, y1), new Point(x2, y2)));
    }
}
