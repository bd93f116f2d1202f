package com.raditha.cogent.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.cogent.analyzer.ComplexityAnalyzer;
import com.raditha.cogent.analyzer.FileReport;
import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.java.JavaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportExporter - CSV and JSON export functionality.
 */
class ReportExporterTest {

    private static final String SIMPLE = """
            class Simple {
                int add(int a, int b) {
                    return a + b;
                }
            }
            """;

    @TempDir
    Path tempDir;

    private ReportExporter exporter;
    private AnalysisConfig config;
    private List<FileReport> reports;

    @BeforeEach
    void setUp() {
        exporter = new ReportExporter();
        config = AnalysisConfig.moderate().withLimits(20, 5);
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(config);
        reports = List.of(
                analyzer.analyzeSource(JavaFixtures.ORDERS, "src/Orders.java"),
                analyzer.analyzeSource(SIMPLE, "src/Simple.java"),
                analyzer.analyzeSource("class Broken {", "src/Broken.java"));
    }

    @Test
    void testBuildMetrics() {
        ReportExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "shop", config);

        assertEquals("shop", metrics.projectName());
        assertNotNull(metrics.timestamp());

        ReportExporter.Summary summary = metrics.summary();
        assertEquals(3, summary.totalFiles());
        assertEquals(1, summary.filesWithErrors());
        assertEquals(2, summary.totalFunctions());
        assertEquals(0, summary.cyclomaticFindings());
        assertEquals(1, summary.cognitiveFindings());
        assertEquals(20, summary.maxCyclomatic());
        assertEquals(5, summary.maxCognitive());
        assertEquals(7.5, summary.averageCognitive(), 0.001);

        ReportExporter.FunctionMetrics processOrder = metrics.files().get(0).functions().get(0);
        assertEquals("processOrder", processOrder.name());
        assertTrue(processOrder.overCognitive());
        assertFalse(processOrder.overCyclomatic());
        assertEquals(2, processOrder.suggestions().size());
        assertEquals("HIGH", processOrder.suggestions().get(0).confidence());
        assertEquals(3, processOrder.suggestions().get(1).issues().size());

        assertEquals(1, metrics.files().get(1).functions().size());
        assertNotNull(metrics.files().get(2).error());
    }

    @Test
    void testEmptyProject() {
        ReportExporter.ProjectMetrics metrics = exporter.buildMetrics(List.of(), "empty", config);

        assertEquals(0, metrics.summary().totalFunctions());
        assertEquals(0.0, metrics.summary().averageCognitive(), 0.001);
        assertTrue(metrics.files().isEmpty());
    }

    @Test
    void testCsv() {
        String csv = exporter.toCsv(exporter.buildMetrics(reports, "shop", config));
        String[] lines = csv.split("\n");

        assertEquals("# Project Summary", lines[0]);
        assertEquals("timestamp,project,total_files,files_with_errors,total_functions,"
                + "cyclomatic_findings,cognitive_findings,max_cyclomatic,max_cognitive,avg_cognitive", lines[1]);
        assertTrue(lines[2].endsWith(",shop,3,1,2,0,1,20,5,7.50"), lines[2]);
        assertEquals("", lines[3]);
        assertEquals("# Per-Function Metrics", lines[4]);
        assertEquals("file,function,start_line,end_line,cyclomatic,cognitive,over_cyclomatic,over_cognitive,"
                + "suggestions", lines[5]);
        assertEquals("src/Orders.java,processOrder,2,28,10,15,false,true,2", lines[6]);
        assertEquals("src/Simple.java,add,2,4,1,0,false,false,0", lines[7]);
        assertEquals(8, lines.length);
    }

    @Test
    void testCsvEscaping() {
        FileReport report = new ComplexityAnalyzer(config).analyzeSource(SIMPLE, "dir,with \"comma\"/Simple.java");
        String csv = exporter.toCsv(exporter.buildMetrics(List.of(report), "a,b", config));

        assertTrue(csv.contains(",\"a,b\","));
        assertTrue(csv.contains("\"dir,with \"\"comma\"\"/Simple.java\",add,"));
    }

    @Test
    void testExportToCsv() throws IOException {
        Path output = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(exporter.buildMetrics(reports, "shop", config), output);

        assertTrue(Files.exists(output));
        assertTrue(Files.readString(output).startsWith("# Project Summary\n"));
    }

    @Test
    void testJson() throws IOException {
        String json = exporter.toJson(exporter.buildMetrics(reports, "shop", config));
        JsonNode root = new ObjectMapper().readTree(json);

        assertEquals("shop", root.get("projectName").asText());
        assertTrue(root.get("timestamp").isTextual(), "timestamps are ISO strings");
        assertEquals(2, root.get("summary").get("totalFunctions").asInt());
        assertEquals(3, root.get("files").size());

        JsonNode function = root.get("files").get(0).get("functions").get(0);
        assertEquals("processOrder", function.get("name").asText());
        assertEquals(15, function.get("cognitive").asInt());
        assertEquals("extracted(items: List, strict: boolean): Item",
                function.get("suggestions").get(0).get("signature").asText());
        assertTrue(function.get("suggestions").get(1).get("signature").isNull());
        assertTrue(root.get("files").get(1).get("error").isNull());
    }

    @Test
    void testJsonRoundTrip() throws IOException {
        ReportExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "shop", config);

        ReportExporter.ProjectMetrics read = ReportExporter.fromJson(exporter.toJson(metrics));

        assertEquals(metrics.summary(), read.summary());
        assertEquals(metrics.files(), read.files());
    }

    @Test
    void testExportToJson() throws IOException {
        Path output = tempDir.resolve("metrics.json");
        exporter.exportToJson(exporter.buildMetrics(reports, "shop", config), output);

        JsonNode root = new ObjectMapper().readTree(Files.readString(output));
        assertEquals(3, root.get("summary").get("totalFiles").asInt());
    }
}
