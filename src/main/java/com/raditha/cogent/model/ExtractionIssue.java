package com.raditha.cogent.model;

import org.jspecify.annotations.Nullable;

/**
 * Something that complicates extracting a candidate.
 *
 * @param type        issue category
 * @param description human-readable description
 * @param line        line the issue is anchored to, if any
 * @param variable    variable involved, if any
 */
public record ExtractionIssue(
        IssueType type,
        String description,
        @Nullable Integer line,
        @Nullable String variable) {

    public static ExtractionIssue of(IssueType type, String description) {
        return new ExtractionIssue(type, description, null, null);
    }
}
