package com.purchasingpower.wiregraph.api;

import com.purchasingpower.wiregraph.engine.InferenceResult;
import com.purchasingpower.wiregraph.exception.DiagramParseException;
import com.purchasingpower.wiregraph.exception.ExclusionConfigException;
import com.purchasingpower.wiregraph.report.MarkdownReportWriter;
import com.purchasingpower.wiregraph.service.DiagramExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for diagram connection extraction.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/diagrams")
@RequiredArgsConstructor
public class DiagramController {

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final DiagramExtractionService extractionService;
    private final MarkdownReportWriter reportWriter;

    /**
     * Extract the connection graph of a diagram.
     *
     * POST /api/v1/diagrams/connections
     */
    @PostMapping("/connections")
    public ResponseEntity<ExtractionResponse> extractConnections(@RequestBody ExtractionRequest request) {
        if (request.getSvg() == null || request.getSvg().isBlank()) {
            return ResponseEntity.badRequest().body(ExtractionResponse.error("SVG document is required"));
        }
        try {
            InferenceResult result = extractionService.extract(request.getSvg(), request.getExclusions());
            return ResponseEntity.ok(ExtractionResponse.success(result));
        } catch (DiagramParseException | ExclusionConfigException e) {
            log.warn("Rejected extraction request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ExtractionResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Extraction failed", e);
            return ResponseEntity.internalServerError()
                .body(ExtractionResponse.error("Extraction failed: " + e.getMessage()));
        }
    }

    /**
     * Extract and render the connection graph as a markdown report.
     *
     * POST /api/v1/diagrams/report
     */
    @PostMapping("/report")
    public ResponseEntity<String> extractReport(@RequestBody ExtractionRequest request) {
        if (request.getSvg() == null || request.getSvg().isBlank()) {
            return ResponseEntity.badRequest().body("SVG document is required");
        }
        try {
            InferenceResult result = extractionService.extract(request.getSvg(), request.getExclusions());
            return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .body(reportWriter.render(result.getConnections()));
        } catch (DiagramParseException | ExclusionConfigException e) {
            log.warn("Rejected report request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (Exception e) {
            log.error("Report generation failed", e);
            return ResponseEntity.internalServerError().body("Report generation failed: " + e.getMessage());
        }
    }
}
