package com.raditha.cogent.analyzer;

import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.java.JavaFixtures;
import com.raditha.cogent.model.LineRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private static final String SIMPLE = """
            class Simple {
                int add(int a, int b) {
                    return a + b;
                }

                int abs(int x) {
                    if (x < 0) {
                        return -x;
                    }
                    return x;
                }
            }
            """;

    @TempDir
    Path tempDir;

    @Test
    void testAnalyzeSource() {
        FileReport report = new ComplexityAnalyzer(AnalysisConfig.moderate()).analyzeSource(SIMPLE, "Simple.java");

        assertFalse(report.hasError());
        assertFalse(report.hasFindings());
        assertEquals("Simple.java", report.file());
        assertEquals(List.of("add", "abs"), report.functions().stream().map(FunctionReport::name).toList());

        FunctionReport add = report.functions().get(0);
        assertEquals(2, add.startLine());
        assertEquals(4, add.endLine());
        assertEquals(1, add.cyclomatic());
        assertEquals(0, add.cognitive());

        FunctionReport abs = report.functions().get(1);
        assertEquals(2, abs.cyclomatic());
        assertEquals(1, abs.cognitive());
        assertEquals(1, abs.cognitivePoints().size());
    }

    @Test
    void testLimitsProduceFindings() {
        AnalysisConfig config = AnalysisConfig.moderate().withLimits(1, 1);
        FileReport report = new ComplexityAnalyzer(config).analyzeSource(SIMPLE, "Simple.java");

        assertTrue(report.hasFindings());
        assertEquals(List.of("abs"), report.flagged().stream().map(FunctionReport::name).toList());
        assertEquals(1, report.findingCount(), "cognitive 1 is not over a limit of 1");

        Finding finding = report.flagged().get(0).findings().get(0);
        assertEquals(Finding.Metric.CYCLOMATIC, finding.metric());
        assertEquals(2, finding.value());
        assertEquals(1, finding.max());
        assertEquals(1, finding.excess());
        assertTrue(finding.message().startsWith("Function 'abs' has cyclomatic complexity of 2. Maximum allowed is 1."));
    }

    @Test
    void testParseError() {
        FileReport report = new ComplexityAnalyzer(AnalysisConfig.moderate())
                .analyzeSource("class Broken { void run( }", "Broken.java");

        assertTrue(report.hasError());
        assertNotNull(report.error());
        assertTrue(report.functions().isEmpty());
        assertFalse(report.hasFindings());
    }

    @Test
    void testExtractionSuggestionsForFarOverLimit() {
        AnalysisConfig config = AnalysisConfig.moderate().withLimits(20, 5);
        FileReport report = new ComplexityAnalyzer(config).analyzeSource(JavaFixtures.ORDERS, "Orders.java");

        FunctionReport processOrder = report.functions().get(0);
        assertEquals(10, processOrder.cyclomatic());
        assertEquals(15, processOrder.cognitive());
        assertTrue(processOrder.exceeds(Finding.Metric.COGNITIVE));
        assertFalse(processOrder.exceeds(Finding.Metric.CYCLOMATIC));

        assertEquals(List.of(new LineRange(4, 6), new LineRange(15, 21)),
                processOrder.suggestions().stream().map(s -> s.range()).toList());
        String message = processOrder.findings().get(0).message();
        assertTrue(message.contains("Smart extraction suggestions:"));
        assertTrue(message.contains("Suggested: extracted(items: List, strict: boolean): Item"));
    }

    @Test
    void testNoSuggestionsJustOverLimit() {
        AnalysisConfig config = AnalysisConfig.moderate().withLimits(20, 12);
        FunctionReport processOrder = new ComplexityAnalyzer(config)
                .analyzeSource(JavaFixtures.ORDERS, "Orders.java").functions().get(0);

        assertTrue(processOrder.exceeds(Finding.Metric.COGNITIVE));
        assertTrue(processOrder.suggestions().isEmpty(), "15 is not above 12 * 1.5");
    }

    @Test
    void testExtractionDisabled() {
        AnalysisConfig config = AnalysisConfig.moderate().withLimits(20, 5).withExtraction(false);
        FunctionReport processOrder = new ComplexityAnalyzer(config)
                .analyzeSource(JavaFixtures.ORDERS, "Orders.java").functions().get(0);

        assertTrue(processOrder.exceeds(Finding.Metric.COGNITIVE));
        assertTrue(processOrder.suggestions().isEmpty());
        assertFalse(processOrder.findings().get(0).message().contains("Smart extraction suggestions"));
    }

    @Test
    void testAnalyzeProject() throws IOException {
        Files.writeString(tempDir.resolve("A.java"), SIMPLE);
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("sub/B.java"), "class B { void run() { } }");
        Files.writeString(tempDir.resolve("sub/Broken.java"), "class Broken {");
        Files.writeString(tempDir.resolve("notes.txt"), "not java");

        List<FileReport> reports = new ComplexityAnalyzer(AnalysisConfig.moderate()).analyzeProject(List.of(tempDir));

        assertEquals(3, reports.size());
        assertTrue(reports.get(0).file().endsWith("A.java"));
        assertTrue(reports.get(1).file().endsWith("B.java"));
        assertTrue(reports.get(2).hasError(), "a broken file does not stop the scan");
    }

    @Test
    void testUnreadableFile_IsReportedAndScanContinues() throws IOException {
        Files.writeString(tempDir.resolve("A.java"), SIMPLE);
        Files.writeString(tempDir.resolve("B.java"),
                "class B { String name() { return \"café\"; } }", StandardCharsets.ISO_8859_1);

        List<FileReport> reports = new ComplexityAnalyzer(AnalysisConfig.moderate()).analyzeProject(List.of(tempDir));

        assertEquals(2, reports.size());
        assertFalse(reports.get(0).hasError());
        assertEquals(2, reports.get(0).functions().size());
        assertTrue(reports.get(1).file().endsWith("B.java"));
        assertTrue(reports.get(1).hasError());
        assertTrue(reports.get(1).error().startsWith("Cannot read file"));
    }

    @Test
    void testExcludePatterns() throws IOException {
        Files.createDirectories(tempDir.resolve("generated"));
        Files.writeString(tempDir.resolve("generated/Gen.java"), SIMPLE);
        Files.writeString(tempDir.resolve("Kept.java"), SIMPLE);
        Files.writeString(tempDir.resolve("KeptTest.java"), SIMPLE);
        AnalysisConfig config = new AnalysisConfig(20, 15, true, 1.5, 30, 3, 4, 3,
                List.of("**/generated/**", "*Test.java"));

        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(config);

        assertEquals(List.of(tempDir.resolve("Kept.java")), analyzer.javaFiles(tempDir));
        assertEquals(List.of(), analyzer.javaFiles(tempDir.resolve("KeptTest.java")));
    }

    @Test
    void testSingleFile() throws IOException {
        Path file = tempDir.resolve("Simple.java");
        Files.writeString(file, SIMPLE);

        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalysisConfig.moderate());
        assertEquals(List.of(file), analyzer.javaFiles(file));
        assertEquals(2, analyzer.analyzeFile(file).functions().size());
    }

    @Test
    void testMissingDirectory() {
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalysisConfig.moderate());

        assertThrows(IOException.class, () -> analyzer.analyzeProject(List.of(tempDir.resolve("missing"))));
    }
}
