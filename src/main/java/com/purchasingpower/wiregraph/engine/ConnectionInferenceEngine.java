package com.purchasingpower.wiregraph.engine;

import com.purchasingpower.wiregraph.config.DiagramConventions;
import com.purchasingpower.wiregraph.config.InferenceThresholds;
import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.extract.ConnectionExtractor;
import com.purchasingpower.wiregraph.extract.ExtractionStage;
import com.purchasingpower.wiregraph.reconcile.ConnectionReconciler;
import com.purchasingpower.wiregraph.reconcile.ExclusionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the extraction stages over one diagram and reconciles their output.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionInferenceEngine {

    /**
     * Spring injects every ConnectionExtractor bean, sorted by its @Order.
     */
    private final List<ConnectionExtractor> extractors;

    private final ConnectionReconciler reconciler;
    private final InferenceThresholds thresholds;
    private final DiagramConventions conventions;

    public InferenceResult infer(DiagramGeometry geometry) {
        return infer(geometry, ExclusionFilter.none());
    }

    public InferenceResult infer(DiagramGeometry geometry, ExclusionFilter exclusions) {
        long startTime = System.currentTimeMillis();
        log.info("Inferring connections from {} tokens, {} polylines, {} routing paths, {} ground arrows",
            geometry.getTokens().size(), geometry.getPolylines().size(),
            geometry.getRoutingPaths().size(), geometry.getGroundArrows().size());

        InferenceContext context = InferenceContext.create(geometry, thresholds, conventions);
        Map<ExtractionStage, Integer> stageCounts = new LinkedHashMap<>();

        for (ConnectionExtractor extractor : extractors) {
            log.debug(">> Running stage: {}", extractor.stage());
            List<Connection> found = extractor.extract(context);
            context.record(extractor.stage(), found);
            stageCounts.put(extractor.stage(), found.size());
        }

        List<Connection> reconciled = reconciler.reconcile(context.allConnections());
        List<Connection> connections = exclusions.apply(reconciled);
        long duration = System.currentTimeMillis() - startTime;

        log.info("Inferred {} connections ({} excluded) in {}ms",
            connections.size(), reconciled.size() - connections.size(), duration);

        return InferenceResult.builder()
            .connections(connections)
            .stageCounts(stageCounts)
            .reconciledCount(reconciled.size())
            .excludedCount(reconciled.size() - connections.size())
            .durationMs(duration)
            .build();
    }
}
