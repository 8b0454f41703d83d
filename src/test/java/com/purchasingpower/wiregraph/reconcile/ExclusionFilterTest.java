package com.purchasingpower.wiregraph.reconcile;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.PinRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Exclusion filter")
class ExclusionFilterTest {

    private static final Connection ECU_TO_BCM = Connection.builder()
        .fromId("ECU100").fromPin("1").toId("BCM200").toPin("2").build();
    private static final Connection BCM_TO_ECU = Connection.builder()
        .fromId("BCM200").fromPin("2").toId("ECU100").toPin("1").build();
    private static final Connection LMP_TO_SPLICE = Connection.builder()
        .fromId("LMP300").fromPin("3").toId("SP1").build();

    @Test
    @DisplayName("Should drop every connection touching an excluded pin")
    void apply_excludedPin() {
        ExclusionFilter filter = new ExclusionFilter(Set.of(new PinRef("ECU100", "1")), Set.of());

        assertEquals(List.of(LMP_TO_SPLICE), filter.apply(List.of(ECU_TO_BCM, BCM_TO_ECU, LMP_TO_SPLICE)));
    }

    @Test
    @DisplayName("Should drop excluded connections in their given direction only")
    void apply_excludedConnection() {
        ExclusionFilter filter = new ExclusionFilter(Set.of(),
            Set.of(new ConnectionKey("ECU100", "1", "BCM200", "2")));

        assertTrue(filter.excludes(ECU_TO_BCM));
        assertFalse(filter.excludes(BCM_TO_ECU));
        assertFalse(filter.isEmpty());
    }

    @Test
    @DisplayName("Should keep everything when empty")
    void none_keepsAll() {
        assertTrue(ExclusionFilter.none().isEmpty());
        assertEquals(3, ExclusionFilter.none().apply(List.of(ECU_TO_BCM, BCM_TO_ECU, LMP_TO_SPLICE)).size());
    }
}
