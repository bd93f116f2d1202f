package com.raditha.cogent.analyzer;

/**
 * A function over one of the configured limits.
 *
 * @param metric  which score is over
 * @param value   the function's score
 * @param max     the configured limit
 * @param message full report text, including breakdown and advice
 */
public record Finding(Metric metric, int value, int max, String message) {

    public enum Metric {
        CYCLOMATIC,
        COGNITIVE
    }

    /**
     * How far over the limit the function is.
     */
    public int excess() {
        return value - max;
    }
}
