package com.purchasingpower.wiregraph.engine;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.extract.ExtractionStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final connection graph of one diagram with per-stage statistics.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InferenceResult {

    @Builder.Default
    private List<Connection> connections = new ArrayList<>();

    /** Raw connection count reported by each stage, before reconciliation. */
    @Builder.Default
    private Map<ExtractionStage, Integer> stageCounts = new LinkedHashMap<>();

    private int reconciledCount;
    private int excludedCount;
    private long durationMs;

    public int getTotalConnections() {
        return connections.size();
    }
}
