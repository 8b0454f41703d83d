package com.purchasingpower.wiregraph.report;

import com.purchasingpower.wiregraph.core.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders a connection list as a markdown report: one table of all connections sorted
 * by source connector and pin, then one section per source connector.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class MarkdownReportWriter {

    static final Comparator<Connection> REPORT_ORDER = Comparator
        .comparing(Connection::getFromId)
        .thenComparingInt(connection -> pinNumber(connection.getFromPin()))
        .thenComparing(Connection::getFromPin)
        .thenComparing(Connection::getToId)
        .thenComparing(Connection::getToPin);

    public String render(List<Connection> connections) {
        List<Connection> sorted = new ArrayList<>(connections);
        sorted.sort(REPORT_ORDER);

        StringBuilder report = new StringBuilder();
        report.append("# Circuit Diagram Wire Connections\n\n");
        report.append("**Total Connections:** ").append(connections.size()).append("\n\n");

        report.append("## All Connections (Sorted by From Connector)\n\n");
        report.append("| From | From Pin | To | To Pin | Wire DM | Color |\n");
        report.append("|------|----------|-----|--------|---------|-------|\n");
        for (Connection connection : sorted) {
            report.append("| ").append(cell(connection.getFromId()))
                .append(" | ").append(connection.getFromPin())
                .append(" | ").append(cell(connection.getToId()))
                .append(" | ").append(connection.getToPin())
                .append(" | ").append(connection.getWireDm())
                .append(" | ").append(connection.getWireColor())
                .append(" |\n");
        }
        report.append("\n");

        report.append("## Connections Grouped by Source Connector\n");
        Map<String, List<Connection>> bySource = sorted.stream()
            .collect(Collectors.groupingBy(Connection::getFromId, TreeMap::new, Collectors.toList()));
        for (Map.Entry<String, List<Connection>> group : bySource.entrySet()) {
            report.append("\n### ").append(cell(group.getKey()))
                .append(" (").append(group.getValue().size()).append(" connections)\n\n");
            report.append("| From Pin | To | To Pin | Wire DM | Color |\n");
            report.append("|----------|-----|--------|---------|-------|\n");
            for (Connection connection : group.getValue()) {
                report.append("| ").append(connection.getFromPin())
                    .append(" | ").append(cell(connection.getToId()))
                    .append(" | ").append(connection.getToPin())
                    .append(" | ").append(connection.getWireDm())
                    .append(" | ").append(connection.getWireColor())
                    .append(" |\n");
            }
        }
        return report.toString();
    }

    public void write(List<Connection> connections, Path output) throws IOException {
        Files.writeString(output, render(connections), StandardCharsets.UTF_8);
        log.info("Exported {} connections to {}", connections.size(), output);
    }

    /**
     * Leading number of a pin ({@code 12} for {@code "12-13"}), or -1 for splices and grounds.
     */
    static int pinNumber(String pin) {
        int end = 0;
        while (end < pin.length() && Character.isDigit(pin.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return -1;
        }
        try {
            return Integer.parseInt(pin.substring(0, end));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String cell(String id) {
        return id.replace("\n", "<br>");
    }
}
