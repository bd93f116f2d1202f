package com.raditha.cogent.analyzer;

import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ExtractionSuggestion;

import java.util.List;

/**
 * Scores, attribution and findings of one function.
 */
public record FunctionReport(
        String name,
        int startLine,
        int endLine,
        int cyclomatic,
        int cognitive,
        List<ComplexityPoint> cyclomaticPoints,
        List<ComplexityPoint> cognitivePoints,
        List<ExtractionSuggestion> suggestions,
        List<Finding> findings) {

    public FunctionReport {
        cyclomaticPoints = List.copyOf(cyclomaticPoints);
        cognitivePoints = List.copyOf(cognitivePoints);
        suggestions = List.copyOf(suggestions);
        findings = List.copyOf(findings);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public boolean exceeds(Finding.Metric metric) {
        return findings.stream().anyMatch(f -> f.metric() == metric);
    }
}
