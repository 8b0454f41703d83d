package com.purchasingpower.wiregraph.extract;

import com.purchasingpower.wiregraph.core.Connection;
import com.purchasingpower.wiregraph.engine.InferenceContext;

import java.util.List;

/**
 * One stage of connection inference.
 *
 * <p>Implementations are stateless Spring beans ordered with {@code @Order}; all
 * per-diagram data comes from the {@link InferenceContext}.
 *
 * @since 1.0.0
 */
public interface ConnectionExtractor {

    ExtractionStage stage();

    /**
     * Infer this stage's connections. Must not modify the context.
     */
    List<Connection> extract(InferenceContext context);
}
