package com.purchasingpower.wiregraph.resolve;

import com.purchasingpower.wiregraph.resolve.JunctionDecisionTable.JunctionType;
import com.purchasingpower.wiregraph.resolve.JunctionDecisionTable.TieBreak;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("Junction decision table")
class JunctionDecisionTableTest {

    private JunctionDecisionTable table;

    @BeforeEach
    void setUp() {
        table = new JunctionDecisionTable("FL");
    }

    @Test
    @DisplayName("Should let a destination hint win over a source hint")
    void ruleFor_destinationHintWins() {
        ResolveHints both = new ResolveHints(false, 10.0, 200.0);

        assertEquals(TieBreak.CLOSEST_TO_DESTINATION, table.ruleFor(both, JunctionType.DESIGNATED));
        assertEquals(TieBreak.CLOSEST_TO_DESTINATION, table.ruleFor(both, JunctionType.FOREIGN));
        assertEquals(TieBreak.CLOSEST_TO_DESTINATION, table.ruleFor(ResolveHints.asSource(200), JunctionType.FOREIGN));
    }

    @Test
    @DisplayName("Should pick rules by junction type when no destination is known")
    void ruleFor_withoutDestination() {
        assertEquals(TieBreak.BETWEEN_THEN_NAMING, table.ruleFor(ResolveHints.asDestination(10), JunctionType.DESIGNATED));
        assertEquals(TieBreak.BETWEEN_THEN_CLOSEST, table.ruleFor(ResolveHints.asDestination(10), JunctionType.FOREIGN));
        assertEquals(TieBreak.NAMING, table.ruleFor(ResolveHints.none(), JunctionType.DESIGNATED));
        assertEquals(TieBreak.CLOSEST, table.ruleFor(ResolveHints.none(), JunctionType.FOREIGN));
    }

    @Test
    @DisplayName("Should classify pairs against the designated code")
    void typeOf_designatedAndForeign() {
        assertEquals(JunctionType.DESIGNATED, table.typeOf(match("MH2FL", 40)));
        assertEquals(JunctionType.DESIGNATED, table.typeOf(match("FL2MH", 60)));
        assertEquals(JunctionType.FOREIGN, table.typeOf(match("AB2CD", 40)));
    }

    @Test
    @DisplayName("Should follow naming when neither side is known")
    void choose_namingConvention() {
        ConnectorMatch toJunction = match("MH2FL", 40);
        ConnectorMatch fromJunction = match("FL2MH", 60);

        assertSame(toJunction, table.choose(fromJunction, toJunction, 50, ResolveHints.none()));
        assertSame(fromJunction, table.choose(toJunction, fromJunction, 50, new ResolveHints(true, null, null)));
    }

    @Test
    @DisplayName("Should keep the closer variant of a foreign pair when nothing else decides")
    void choose_foreignPairFallsBackToCloser() {
        ConnectorMatch closer = match("AB2CD", 45);
        ConnectorMatch mirror = match("CD2AB", 60);

        assertSame(closer, table.choose(closer, mirror, 50, ResolveHints.none()));
        assertSame(mirror, table.choose(closer, mirror, 50, ResolveHints.asDestination(100)));
    }

    private static ConnectorMatch match(String id, double x) {
        return new ConnectorMatch(id, x, 20, Math.hypot(x - 50, 40));
    }
}
