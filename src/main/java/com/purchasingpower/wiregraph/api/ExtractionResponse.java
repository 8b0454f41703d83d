package com.purchasingpower.wiregraph.api;

import com.purchasingpower.wiregraph.engine.InferenceResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Extraction response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {

    private boolean success;
    private int totalConnections;

    @Builder.Default
    private Map<String, Integer> stageCounts = new LinkedHashMap<>();

    @Builder.Default
    private List<ConnectionDto> connections = new ArrayList<>();

    private long durationMs;
    private String error;

    public static ExtractionResponse success(InferenceResult result) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        result.getStageCounts().forEach((stage, count) -> counts.put(stage.name(), count));
        return ExtractionResponse.builder()
            .success(true)
            .totalConnections(result.getTotalConnections())
            .stageCounts(counts)
            .connections(result.getConnections().stream().map(ConnectionDto::from).collect(Collectors.toList()))
            .durationMs(result.getDurationMs())
            .build();
    }

    public static ExtractionResponse error(String error) {
        return ExtractionResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
