package com.raditha.cogent.config;

import com.raditha.cogent.extraction.ExtractionOptions;

import java.util.List;

/**
 * Thresholds and switches for a complexity scan.
 *
 * @param maxCyclomatic            report functions whose cyclomatic complexity exceeds this
 * @param maxCognitive             report functions whose cognitive complexity exceeds this
 * @param enableExtraction         compute extraction suggestions for cognitive findings
 * @param extractionMultiplier     only analyze extraction above {@code maxCognitive * multiplier}
 * @param minExtractionPercentage  smallest share of the score an extraction candidate may carry
 * @param nestingTipThreshold      nesting depth of the top offender that triggers a tip (0 disables)
 * @param elseIfChainThreshold     else-if count that triggers a tip (0 disables)
 * @param logicalOperatorThreshold logical operator run count that triggers a tip (0 disables)
 * @param excludePatterns          file patterns to skip (glob format)
 */
public record AnalysisConfig(
        int maxCyclomatic,
        int maxCognitive,
        boolean enableExtraction,
        double extractionMultiplier,
        int minExtractionPercentage,
        int nestingTipThreshold,
        int elseIfChainThreshold,
        int logicalOperatorThreshold,
        List<String> excludePatterns) {

    private static final int MAX_EXTRACTION_PERCENTAGE = 70;
    private static final int MAX_LINE_GAP = 2;
    private static final int MAX_CANDIDATES = 3;

    /**
     * Validate configuration.
     */
    public AnalysisConfig {
        if (maxCyclomatic < 1) {
            throw new IllegalArgumentException("maxCyclomatic must be >= 1");
        }
        if (maxCognitive < 1) {
            throw new IllegalArgumentException("maxCognitive must be >= 1");
        }
        if (extractionMultiplier < 1.0) {
            throw new IllegalArgumentException("extractionMultiplier must be >= 1");
        }
        if (minExtractionPercentage < 1 || minExtractionPercentage > 100) {
            throw new IllegalArgumentException("minExtractionPercentage must be between 1 and 100");
        }
        if (nestingTipThreshold < 0 || elseIfChainThreshold < 0 || logicalOperatorThreshold < 0) {
            throw new IllegalArgumentException("tip thresholds must be >= 0");
        }
        if (excludePatterns == null) {
            excludePatterns = List.of();
        }
        excludePatterns = List.copyOf(excludePatterns);
    }

    /**
     * Moderate preset: the usual limits of 20 cyclomatic and 15 cognitive.
     */
    public static AnalysisConfig moderate() {
        return new AnalysisConfig(20, 15, true, 1.5, 30, 3, 4, 3, List.of());
    }

    /**
     * Strict preset: flags functions early, for codebases that keep methods small.
     */
    public static AnalysisConfig strict() {
        return new AnalysisConfig(10, 10, true, 1.5, 30, 3, 4, 3, List.of());
    }

    /**
     * Lenient preset: only the worst offenders, for legacy code.
     */
    public static AnalysisConfig lenient() {
        return new AnalysisConfig(30, 25, true, 1.5, 30, 3, 4, 3, List.of());
    }

    public static AnalysisConfig preset(String name) {
        return switch (name) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> moderate();
        };
    }

    /**
     * Options for the extraction engine derived from this configuration.
     */
    public ExtractionOptions extractionOptions() {
        return new ExtractionOptions(
                minExtractionPercentage,
                Math.max(minExtractionPercentage, MAX_EXTRACTION_PERCENTAGE),
                MAX_LINE_GAP,
                MAX_CANDIDATES,
                extractionMultiplier);
    }

    public AnalysisConfig withLimits(int cyclomatic, int cognitive) {
        return new AnalysisConfig(cyclomatic, cognitive, enableExtraction, extractionMultiplier,
                minExtractionPercentage, nestingTipThreshold, elseIfChainThreshold, logicalOperatorThreshold,
                excludePatterns);
    }

    public AnalysisConfig withExtraction(boolean enabled) {
        return new AnalysisConfig(maxCyclomatic, maxCognitive, enabled, extractionMultiplier,
                minExtractionPercentage, nestingTipThreshold, elseIfChainThreshold, logicalOperatorThreshold,
                excludePatterns);
    }
}
