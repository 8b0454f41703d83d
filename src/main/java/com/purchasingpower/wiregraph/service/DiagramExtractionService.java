package com.purchasingpower.wiregraph.service;

import com.purchasingpower.wiregraph.core.DiagramGeometry;
import com.purchasingpower.wiregraph.engine.ConnectionInferenceEngine;
import com.purchasingpower.wiregraph.engine.InferenceResult;
import com.purchasingpower.wiregraph.exclusion.ExclusionConfig;
import com.purchasingpower.wiregraph.exclusion.ExclusionConfigLoader;
import com.purchasingpower.wiregraph.geometry.SvgDiagramParser;
import com.purchasingpower.wiregraph.reconcile.ExclusionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Diagram in, connection graph out: parses the SVG, loads exclusions and runs inference.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagramExtractionService {

    private final SvgDiagramParser svgParser;
    private final ExclusionConfigLoader exclusionLoader;
    private final ConnectionInferenceEngine engine;

    /**
     * Extract from a diagram file.
     *
     * @param diagram    SVG file
     * @param exclusions exclusion file, may be null or missing
     */
    public InferenceResult extract(Path diagram, Path exclusions) {
        log.info("Extracting connections from {}", diagram);
        DiagramGeometry geometry = svgParser.parse(diagram);
        ExclusionFilter filter = exclusionLoader.loadIfPresent(exclusions);
        return engine.infer(geometry, filter);
    }

    /**
     * Extract from SVG text received over the API.
     */
    public InferenceResult extract(String svg, ExclusionConfig exclusions) {
        DiagramGeometry geometry = svgParser.parse(svg, "request");
        return engine.infer(geometry, exclusionLoader.toFilter(exclusions));
    }
}
