package com.raditha.cogent.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A contiguous region of a function worth considering for extraction.
 *
 * @param startLine  first line, the start of the earliest point
 * @param endLine    last line, the end of the latest point
 * @param complexity summed contribution of the points
 * @param percentage share of the function's total, rounded to a whole percent
 * @param points     the points that make up the region, by start line
 * @param constructs distinct construct labels in the region, in first-seen order
 */
public record ExtractionCandidate(
        int startLine,
        int endLine,
        int complexity,
        int percentage,
        List<ComplexityPoint> points,
        Set<String> constructs) {

    public ExtractionCandidate {
        points = List.copyOf(points);
        constructs = Collections.unmodifiableSet(new LinkedHashSet<>(constructs));
    }

    public LineRange range() {
        return new LineRange(startLine, endLine);
    }

    public boolean overlaps(ExtractionCandidate other) {
        return startLine <= other.endLine && other.startLine <= endLine;
    }
}
