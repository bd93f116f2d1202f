package com.raditha.cogent.extraction;

/**
 * Tuning for extraction analysis.
 *
 * @param minPercentage smallest share of the function's cognitive score a candidate may carry
 * @param maxPercentage largest share; anything above is the whole function again
 * @param maxLineGap    lines allowed between consecutive points of one candidate
 * @param maxCandidates candidates returned per function
 * @param multiplier    a function is analyzed once its score exceeds {@code max * multiplier}
 */
public record ExtractionOptions(
        int minPercentage,
        int maxPercentage,
        int maxLineGap,
        int maxCandidates,
        double multiplier) {

    public static final ExtractionOptions DEFAULTS = new ExtractionOptions(30, 70, 2, 3, 1.5);

    /**
     * Validate options.
     */
    public ExtractionOptions {
        if (minPercentage < 0 || maxPercentage > 100 || minPercentage > maxPercentage) {
            throw new IllegalArgumentException("percentages must satisfy 0 <= min <= max <= 100");
        }
        if (maxLineGap < 0) {
            throw new IllegalArgumentException("maxLineGap must be >= 0");
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be >= 1");
        }
        if (multiplier <= 0.0) {
            throw new IllegalArgumentException("multiplier must be > 0");
        }
    }
}
