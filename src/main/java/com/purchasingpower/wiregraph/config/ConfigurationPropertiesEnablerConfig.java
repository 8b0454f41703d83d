package com.purchasingpower.wiregraph.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers all @ConfigurationProperties classes with Spring's property binding.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link InferenceThresholds} - distance and tolerance thresholds of the engine
 *   <li>{@link DiagramConventions} - naming and SVG layer conventions
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    InferenceThresholds.class,
    DiagramConventions.class
})
public class ConfigurationPropertiesEnablerConfig {
}
