package com.raditha.cogent.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Advice for one extraction candidate.
 *
 * @param range              lines of the candidate
 * @param complexity         cognitive complexity the candidate carries
 * @param percentage         share of the function's total
 * @param confidence         how safely it can be extracted
 * @param inputs             parameters the extracted function would take
 * @param outputs            values it would have to return
 * @param suggestedSignature signature for a clean extraction, absent when there are issues
 * @param issues             what complicates the extraction
 * @param suggestions        remedies for the issues, without repeats
 */
public record ExtractionSuggestion(
        LineRange range,
        int complexity,
        int percentage,
        Confidence confidence,
        List<TypedVariable> inputs,
        List<TypedVariable> outputs,
        @Nullable String suggestedSignature,
        List<ExtractionIssue> issues,
        List<String> suggestions) {

    public ExtractionSuggestion {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }

    public boolean hasIssue(IssueType type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }
}
