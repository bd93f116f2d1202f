package com.raditha.cogent.cli;

import com.raditha.cogent.analyzer.ComplexityAnalyzer;
import com.raditha.cogent.analyzer.FileReport;
import com.raditha.cogent.analyzer.Finding;
import com.raditha.cogent.analyzer.FunctionReport;
import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.config.CogentSettings;
import com.raditha.cogent.metrics.ReportExporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the complexity checker.
 * <p>
 * Usage:
 * java -jar cogent.jar [options] <file-or-directory>...
 * <p>
 * Configuration priority: CLI arguments > cogent.yml > preset defaults
 */
@Command(name = "cogent", mixinStandardHelpOptions = true, version = "Cogent v1.0.0",
        description = "Cyclomatic and cognitive complexity checker with extraction advice")
public class CogentCLI implements Callable<Integer> {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;

    private static final String RULE = "=".repeat(80);

    @Spec
    private CommandSpec spec;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--max-cyclomatic", description = "Cyclomatic complexity limit (default: 20)", paramLabel = "<n>")
    private int maxCyclomatic = 0; // 0 = use YAML/default

    @Option(names = "--max-cognitive", description = "Cognitive complexity limit (default: 15)", paramLabel = "<n>")
    private int maxCognitive = 0; // 0 = use YAML/default

    @Option(names = "--strict", description = "Strict preset (10 cyclomatic, 10 cognitive)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (30 cyclomatic, 25 cognitive)")
    private boolean lenient = false;

    @Option(names = "--no-extraction", description = "Do not compute extraction suggestions")
    private boolean noExtraction = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "Java files or directories to analyze")
    private List<Path> paths;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return 0 when no function is over a limit, 1 otherwise
     */
    @Override
    public Integer call() throws IOException {
        validateConfiguration();

        AnalysisConfig config = CogentSettings.loadConfig(
                configFile != null ? Paths.get(configFile) : null,
                maxCyclomatic,
                maxCognitive,
                preset(),
                noExtraction);

        List<FileReport> reports = new ComplexityAnalyzer(config).analyzeProject(paths);

        ReportExporter exporter = new ReportExporter();
        if (jsonOutput) {
            out().println(exporter.toJson(exporter.buildMetrics(reports, projectName(), config)));
        } else {
            printTextReport(reports);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(exporter, reports, config);
        }

        boolean findings = reports.stream().anyMatch(FileReport::hasFindings);
        return findings ? EXIT_FINDINGS : EXIT_CLEAN;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The command with its exit-code mapping installed.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CogentCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FINDINGS;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxCyclomatic < 0) {
            throw new IllegalArgumentException("Max-cyclomatic must be positive, got: " + maxCyclomatic);
        }
        if (maxCognitive < 0) {
            throw new IllegalArgumentException("Max-cognitive must be positive, got: " + maxCognitive);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase(Locale.ROOT);
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }

        if (configFile != null && !Files.exists(Paths.get(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        for (Path path : paths) {
            if (!Files.exists(path)) {
                throw new IllegalArgumentException("Path not found: " + path);
            }
        }

        if (outputPath != null) {
            Path outputDir = Paths.get(outputPath);
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private String preset() {
        if (strict) {
            return "strict";
        } else if (lenient) {
            return "lenient";
        }
        return null;
    }

    private void printTextReport(List<FileReport> reports) {
        PrintWriter out = out();
        out.println(RULE);
        out.println("COMPLEXITY REPORT");
        out.println(RULE);
        out.println();

        for (FileReport report : reports) {
            if (report.hasError()) {
                out.printf("%s%n  Skipped: %s%n%n", report.file(), report.error());
                continue;
            }
            if (!report.hasFindings()) {
                continue;
            }
            out.println(report.file());
            for (FunctionReport function : report.flagged()) {
                for (Finding finding : function.findings()) {
                    out.printf("  Line %d: %s%n%n", function.startLine(), indent(finding.message()));
                }
            }
        }

        List<FunctionReport> functions = reports.stream().flatMap(r -> r.functions().stream()).toList();
        out.println(RULE);
        out.println("SUMMARY");
        out.println(RULE);
        out.printf("Files analyzed: %d%n", reports.size());
        out.printf("Files skipped: %d%n", reports.stream().filter(FileReport::hasError).count());
        out.printf("Functions analyzed: %d%n", functions.size());
        out.printf("Over cyclomatic limit: %d%n",
                functions.stream().filter(f -> f.exceeds(Finding.Metric.CYCLOMATIC)).count());
        out.printf("Over cognitive limit: %d%n",
                functions.stream().filter(f -> f.exceeds(Finding.Metric.COGNITIVE)).count());
        out.flush();
    }

    private static String indent(String message) {
        return message.replace("\n", "\n  ");
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(ReportExporter exporter, List<FileReport> reports, AnalysisConfig config)
            throws IOException {
        ReportExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, projectName(), config);

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);

        String format = exportFormat.toLowerCase(Locale.ROOT);
        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("complexity-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            out().println("\nMetrics exported to: " + csvPath.toAbsolutePath());
        }
        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("complexity-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            out().println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
        out().flush();
    }

    private String projectName() {
        Path first = paths.get(0).toAbsolutePath().normalize();
        Path dir = Files.isDirectory(first) ? first : first.getParent();
        Path name = dir != null ? dir.getFileName() : null;
        return name != null ? name.toString() : "project";
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }
}
