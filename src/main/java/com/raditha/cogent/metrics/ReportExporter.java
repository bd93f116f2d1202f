package com.raditha.cogent.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cogent.analyzer.FileReport;
import com.raditha.cogent.analyzer.Finding;
import com.raditha.cogent.analyzer.FunctionReport;
import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.model.ExtractionIssue;
import com.raditha.cogent.model.ExtractionSuggestion;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Exports complexity metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class ReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Project-level metrics aggregated from all analyzed files.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            Summary summary,
            List<FileMetrics> files) {
    }

    public record Summary(
            int totalFiles,
            int filesWithErrors,
            int totalFunctions,
            int cyclomaticFindings,
            int cognitiveFindings,
            int maxCyclomatic,
            int maxCognitive,
            double averageCognitive) {
    }

    public record FileMetrics(
            String file,
            @Nullable String error,
            List<FunctionMetrics> functions) {
    }

    public record FunctionMetrics(
            String name,
            int startLine,
            int endLine,
            int cyclomatic,
            int cognitive,
            boolean overCyclomatic,
            boolean overCognitive,
            List<SuggestionMetrics> suggestions) {
    }

    public record SuggestionMetrics(
            int startLine,
            int endLine,
            int complexity,
            int percentage,
            String confidence,
            @Nullable String signature,
            List<String> issues) {
    }

    /**
     * Build aggregated metrics from analysis reports.
     */
    public ProjectMetrics buildMetrics(List<FileReport> reports, String projectName, AnalysisConfig config) {
        List<FileMetrics> files = reports.stream().map(ReportExporter::buildFileMetrics).toList();

        List<FunctionReport> functions = reports.stream()
                .flatMap(r -> r.functions().stream())
                .toList();

        Summary summary = new Summary(
                reports.size(),
                (int) reports.stream().filter(FileReport::hasError).count(),
                functions.size(),
                (int) functions.stream().filter(f -> f.exceeds(Finding.Metric.CYCLOMATIC)).count(),
                (int) functions.stream().filter(f -> f.exceeds(Finding.Metric.COGNITIVE)).count(),
                config.maxCyclomatic(),
                config.maxCognitive(),
                functions.stream().mapToInt(FunctionReport::cognitive).average().orElse(0.0));

        return new ProjectMetrics(projectName, LocalDateTime.now(), summary, files);
    }

    private static FileMetrics buildFileMetrics(FileReport report) {
        List<FunctionMetrics> functions = report.functions().stream()
                .map(f -> new FunctionMetrics(
                        f.name(),
                        f.startLine(),
                        f.endLine(),
                        f.cyclomatic(),
                        f.cognitive(),
                        f.exceeds(Finding.Metric.CYCLOMATIC),
                        f.exceeds(Finding.Metric.COGNITIVE),
                        f.suggestions().stream().map(ReportExporter::buildSuggestionMetrics).toList()))
                .toList();
        return new FileMetrics(report.file(), report.error(), functions);
    }

    private static SuggestionMetrics buildSuggestionMetrics(ExtractionSuggestion suggestion) {
        return new SuggestionMetrics(
                suggestion.range().start(),
                suggestion.range().end(),
                suggestion.complexity(),
                suggestion.percentage(),
                suggestion.confidence().name(),
                suggestion.suggestedSignature(),
                suggestion.issues().stream().map(ExtractionIssue::description).toList());
    }

    /**
     * Export metrics to CSV format: a summary block followed by one row per function.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        Files.writeString(outputPath, toCsv(metrics));
    }

    String toCsv(ProjectMetrics metrics) {
        StringBuilder csv = new StringBuilder();
        Summary summary = metrics.summary();

        csv.append("# Project Summary\n");
        csv.append("timestamp,project,total_files,files_with_errors,total_functions,"
                + "cyclomatic_findings,cognitive_findings,max_cyclomatic,max_cognitive,avg_cognitive\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%d,%d,%d,%.2f\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                escape(metrics.projectName()),
                summary.totalFiles(),
                summary.filesWithErrors(),
                summary.totalFunctions(),
                summary.cyclomaticFindings(),
                summary.cognitiveFindings(),
                summary.maxCyclomatic(),
                summary.maxCognitive(),
                summary.averageCognitive()));

        csv.append("\n");

        csv.append("# Per-Function Metrics\n");
        csv.append("file,function,start_line,end_line,cyclomatic,cognitive,over_cyclomatic,over_cognitive,"
                + "suggestions\n");
        for (FileMetrics file : metrics.files()) {
            for (FunctionMetrics function : file.functions()) {
                csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%b,%b,%d\n",
                        escape(file.file()),
                        escape(function.name()),
                        function.startLine(),
                        function.endLine(),
                        function.cyclomatic(),
                        function.cognitive(),
                        function.overCyclomatic(),
                        function.overCognitive(),
                        function.suggestions().size()));
            }
        }
        return csv.toString();
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    public String toJson(ProjectMetrics metrics) throws JsonProcessingException {
        return mapper.writeValueAsString(metrics);
    }

    static ProjectMetrics fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, ProjectMetrics.class);
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
