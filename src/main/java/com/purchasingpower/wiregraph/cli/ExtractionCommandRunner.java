package com.purchasingpower.wiregraph.cli;

import com.purchasingpower.wiregraph.engine.InferenceResult;
import com.purchasingpower.wiregraph.report.MarkdownReportWriter;
import com.purchasingpower.wiregraph.service.DiagramExtractionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line extraction:
 * <pre>
 * java -jar wire-graph-extractor.jar --diagram=sample-wire.svg \
 *     [--output=connections_output.md] [--exclusions=exclusions.json]
 * </pre>
 * Does nothing when {@code --diagram} is absent, so the application can run as a server.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionCommandRunner implements ApplicationRunner {

    static final String DEFAULT_OUTPUT = "connections_output.md";

    private final DiagramExtractionService extractionService;
    private final MarkdownReportWriter reportWriter;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String diagram = option(args, "diagram");
        if (diagram == null) {
            return;
        }
        Path output = Path.of(option(args, "output") != null ? option(args, "output") : DEFAULT_OUTPUT);
        String exclusions = option(args, "exclusions");

        InferenceResult result = extractionService.extract(Path.of(diagram), exclusions != null ? Path.of(exclusions) : null);
        reportWriter.write(result.getConnections(), output);

        log.info("Summary for {}:", diagram);
        result.getStageCounts().forEach((stage, count) -> log.info("  {}: {} connections", stage, count));
        log.info("  excluded: {}", result.getExcludedCount());
        log.info("  total: {} connections in {}ms", result.getTotalConnections(), result.getDurationMs());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
