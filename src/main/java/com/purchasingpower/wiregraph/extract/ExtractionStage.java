package com.purchasingpower.wiregraph.extract;

/**
 * Stages of connection inference, in execution order. Later stages read the output
 * of earlier ones.
 */
public enum ExtractionStage {
    HORIZONTAL,
    ROUTING,
    GROUND,
    LONG_ROUTING
}
