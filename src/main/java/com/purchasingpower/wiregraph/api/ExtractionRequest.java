package com.purchasingpower.wiregraph.api;

import com.purchasingpower.wiregraph.exclusion.ExclusionConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Extraction request: the SVG document and optional exclusions.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {

    private String svg;
    private ExclusionConfig exclusions;
}
