package com.raditha.cogent.analyzer;

import com.github.javaparser.ParseProblemException;
import com.raditha.cogent.complexity.CombinedScorer;
import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.extraction.ExtractionAnalyzer;
import com.raditha.cogent.extraction.VariableTracker;
import com.raditha.cogent.java.JavaTreeAdapter;
import com.raditha.cogent.model.ComplexityResult;
import com.raditha.cogent.model.ExtractionSuggestion;
import com.raditha.cogent.scope.ScopeAnalyzer;
import com.raditha.cogent.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scores every function of Java sources and turns scores over the configured limits
 * into findings.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);
    private static final String JAVA_EXTENSION = ".java";

    private final AnalysisConfig config;
    private final JavaTreeAdapter adapter = new JavaTreeAdapter();
    private final CombinedScorer scorer = new CombinedScorer();
    private final ExtractionAnalyzer extraction;
    private final ComplexityFormatter formatter;
    private final List<PathMatcher> excludes;

    public ComplexityAnalyzer(AnalysisConfig config) {
        this.config = config;
        this.extraction = new ExtractionAnalyzer(config.extractionOptions());
        this.formatter = new ComplexityFormatter(config);
        this.excludes = config.excludePatterns().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    /**
     * Analyze all Java files under the given files and directories.
     * Files that cannot be read or parsed are reported with an error and the scan continues.
     *
     * @throws IOException if a directory cannot be walked
     */
    public List<FileReport> analyzeProject(List<Path> paths) throws IOException {
        List<FileReport> reports = new ArrayList<>();
        for (Path path : paths) {
            for (Path file : javaFiles(path)) {
                try {
                    reports.add(analyzeFile(file));
                } catch (IOException e) {
                    String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    logger.warn("Skipping {}: cannot read file ({})", file, reason);
                    reports.add(FileReport.failed(file.toString(), "Cannot read file: " + reason));
                }
            }
        }
        logger.debug("Analyzed {} files", reports.size());
        return reports;
    }

    /**
     * Analyze one Java file.
     *
     * @throws IOException if the file cannot be read
     */
    public FileReport analyzeFile(Path file) throws IOException {
        return analyzeSource(Files.readString(file), file.toString());
    }

    /**
     * Analyze Java source text.
     *
     * @param source    the compilation unit
     * @param fileLabel name to report the results under
     */
    public FileReport analyzeSource(String source, String fileLabel) {
        SyntaxNode root;
        try {
            root = adapter.parse(source);
        } catch (ParseProblemException e) {
            logger.warn("Skipping {}: {}", fileLabel, firstProblem(e));
            return FileReport.failed(fileLabel, firstProblem(e));
        }
        return new FileReport(fileLabel, analyzeTree(root), null);
    }

    /**
     * Score every function in an already built tree.
     */
    public List<FunctionReport> analyzeTree(SyntaxNode root) {
        List<FunctionReport> functions = new ArrayList<>();
        VariableTracker tracker = null;

        for (ComplexityResult result : scorer.scoreAll(root)) {
            List<Finding> findings = new ArrayList<>();
            List<ExtractionSuggestion> suggestions = List.of();

            if (result.cyclomatic() > config.maxCyclomatic()) {
                findings.add(new Finding(Finding.Metric.CYCLOMATIC, result.cyclomatic(), config.maxCyclomatic(),
                        formatter.cyclomaticMessage(result)));
            }
            if (result.cognitive() > config.maxCognitive()) {
                if (config.enableExtraction()
                        && extraction.shouldAnalyze(result.cognitive(), config.maxCognitive())) {
                    if (tracker == null) {
                        // scope analysis is only paid for files with extraction work
                        tracker = new VariableTracker(ScopeAnalyzer.analyze(root));
                    }
                    suggestions = extraction.analyze(result.function(), result.cognitivePoints(),
                            result.cognitive(), tracker.track(result.function()));
                }
                findings.add(new Finding(Finding.Metric.COGNITIVE, result.cognitive(), config.maxCognitive(),
                        formatter.cognitiveMessage(result, suggestions)));
            }

            functions.add(new FunctionReport(
                    result.name(),
                    result.startLine(),
                    result.function().location().endLine(),
                    result.cyclomatic(),
                    result.cognitive(),
                    result.cyclomaticPoints(),
                    result.cognitivePoints(),
                    suggestions,
                    findings));
        }
        return functions;
    }

    /**
     * Java files at or under {@code path}, in a stable order, with excluded files removed.
     */
    List<Path> javaFiles(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return isExcluded(path, path.getFileName()) ? List.of() : List.of(path);
        }
        try (Stream<Path> stream = Files.walk(path)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(JAVA_EXTENSION))
                    .filter(p -> !isExcluded(p, path.relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    private boolean isExcluded(Path file, Path relative) {
        for (PathMatcher matcher : excludes) {
            if (matcher.matches(relative) || matcher.matches(file) || matcher.matches(file.getFileName())) {
                logger.debug("Excluded {}", file);
                return true;
            }
        }
        return false;
    }

    private static String firstProblem(ParseProblemException e) {
        return e.getProblems().isEmpty() ? e.getMessage() : e.getProblems().get(0).getVerboseMessage();
    }
}
