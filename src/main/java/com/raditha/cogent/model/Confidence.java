package com.raditha.cogent.model;

/**
 * How safely a candidate can be pulled out into its own function.
 */
public enum Confidence {
    HIGH("Extractable with minimal changes"),
    MEDIUM("Extractable with some refactoring"),
    LOW("Requires significant refactoring");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
