package com.purchasingpower.wiregraph.engine;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.extract.ExtractionStage;
import com.purchasingpower.wiregraph.extract.WireSpecLocator;
import com.purchasingpower.wiregraph.index.TokenIndex;
import com.purchasingpower.wiregraph.resolve.ConnectorResolver;
import com.purchasingpower.wiregraph.resolve.impl.ProximityConnectorResolver;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * State of one inference run over one diagram.
 *
 * <p>Created per diagram and discarded afterwards; nothing in it is shared between runs.
 * Holds the token index, the resolver and spec locator built on it, and the connections
 * recorded by each stage so far.
 *
 * @since 1.0.0
 */
@Getter
public class InferenceContext {

    private final DiagramGeometry geometry;
    private final TokenIndex index;
    private final InferenceThresholds thresholds;
    private final DiagramConventions conventions;
    private final ConnectorResolver resolver;
    private final WireSpecLocator specLocator;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<ExtractionStage, List<Connection>> stageOutputs = new EnumMap<>(ExtractionStage.class);

    private InferenceContext(DiagramGeometry geometry, InferenceThresholds thresholds, DiagramConventions conventions) {
        this.geometry = geometry;
        this.index = new TokenIndex(geometry.getTokens());
        this.thresholds = thresholds;
        this.conventions = conventions;
        this.resolver = new ProximityConnectorResolver(index, thresholds, conventions.getJunctionCode());
        this.specLocator = new WireSpecLocator(index.wireSpecs(), thresholds);
    }

    public static InferenceContext create(DiagramGeometry geometry,
                                          InferenceThresholds thresholds,
                                          DiagramConventions conventions) {
        return new InferenceContext(geometry, thresholds, conventions);
    }

    public void record(ExtractionStage stage, List<Connection> connections) {
        stageOutputs.put(stage, List.copyOf(connections));
    }

    /**
     * Connections recorded by one stage, empty if the stage has not run.
     */
    public List<Connection> connectionsFrom(ExtractionStage stage) {
        return stageOutputs.getOrDefault(stage, Collections.emptyList());
    }

    /**
     * All recorded connections in stage order.
     */
    public List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>();
        for (List<Connection> connections : stageOutputs.values()) {
            all.addAll(connections);
        }
        return all;
    }
}
