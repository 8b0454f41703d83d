package com.purchasingpower.wiregraph.report;

import com.purchasingpower.wiregraph.core.Connection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Markdown report")
class MarkdownReportWriterTest {

    private final MarkdownReportWriter writer = new MarkdownReportWriter();

    private final List<Connection> connections = List.of(
        Connection.builder().fromId("ECU100").fromPin("10").toId("SP1").wireDm("0.5").wireColor("BU").build(),
        Connection.builder().fromId("BCM200").fromPin("1").toId("ECU100").toPin("3").build(),
        Connection.builder().fromId("ECU100").fromPin("2").toId("MAIN202 (XR-)\nMAIN642 (XR+)").toPin("4").build());

    @Test
    @DisplayName("Should list connections sorted by source connector and numeric pin")
    void render_sortedTable() {
        String report = writer.render(connections);

        assertTrue(report.startsWith("# Circuit Diagram Wire Connections\n\n**Total Connections:** 3\n"));
        int bcm = report.indexOf("| BCM200 | 1 | ECU100 | 3 |  |  |");
        int ecuPin2 = report.indexOf("| ECU100 | 2 |");
        int ecuPin10 = report.indexOf("| ECU100 | 10 | SP1 |  | 0.5 | BU |");
        assertTrue(bcm > 0 && bcm < ecuPin2 && ecuPin2 < ecuPin10, report);
    }

    @Test
    @DisplayName("Should group by source and keep shielded labels on one table row")
    void render_groups() {
        String report = writer.render(connections);

        assertTrue(report.contains("### ECU100 (2 connections)"));
        assertTrue(report.contains("### BCM200 (1 connections)"));
        assertTrue(report.contains("MAIN202 (XR-)<br>MAIN642 (XR+)"));
    }

    @Test
    @DisplayName("Should order pins by their leading number")
    void pinNumber() {
        assertEquals(12, MarkdownReportWriter.pinNumber("12-13"));
        assertEquals(-1, MarkdownReportWriter.pinNumber(""));
        assertEquals(7, MarkdownReportWriter.pinNumber("7"));
    }

    @Test
    @DisplayName("Should write the report as UTF-8")
    void write(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("connections_output.md");

        writer.write(connections, output);

        assertEquals(writer.render(connections), Files.readString(output));
    }
}
