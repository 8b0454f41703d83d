package com.purchasingpower.wiregraph.exclusion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Exclusion file layout: pins to drop entirely and exact connections to drop.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExclusionConfig {

    @Builder.Default
    private List<PinEntry> excludedPins = new ArrayList<>();

    @Builder.Default
    private List<ConnectionEntry> excludedConnections = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PinEntry {
        private String connectorId;
        private String pin = "";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionEntry {
        private String fromId;
        private String fromPin = "";
        private String toId;
        private String toPin = "";
    }
}
