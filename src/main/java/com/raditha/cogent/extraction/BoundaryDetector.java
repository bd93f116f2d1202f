package com.raditha.cogent.extraction;

import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ExtractionCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a function's cognitive points into candidate line ranges for extraction.
 * <p>
 * Points close together (by start line) form a group. A group becomes a candidate when
 * its share of the total is neither trivial nor most of the function. The heaviest
 * candidates that do not overlap are kept.
 */
public class BoundaryDetector {

    private final ExtractionOptions options;

    public BoundaryDetector(ExtractionOptions options) {
        this.options = options;
    }

    /**
     * Candidates in ascending start-line order, at most {@code maxCandidates}.
     */
    public List<ExtractionCandidate> findCandidates(List<ComplexityPoint> points, int totalComplexity) {
        if (points.isEmpty() || totalComplexity == 0) {
            return List.of();
        }

        List<ExtractionCandidate> candidates = new ArrayList<>();
        for (List<ComplexityPoint> group : groupAdjacent(points)) {
            ExtractionCandidate candidate = toCandidate(group, totalComplexity);
            if (candidate.percentage() >= options.minPercentage()
                    && candidate.percentage() <= options.maxPercentage()) {
                candidates.add(candidate);
            }
        }
        return selectNonOverlapping(candidates);
    }

    private List<List<ComplexityPoint>> groupAdjacent(List<ComplexityPoint> points) {
        List<ComplexityPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingInt(ComplexityPoint::line));

        List<List<ComplexityPoint>> groups = new ArrayList<>();
        List<ComplexityPoint> current = new ArrayList<>();
        int groupEnd = 0;
        for (ComplexityPoint point : sorted) {
            if (!current.isEmpty() && point.line() > groupEnd + options.maxLineGap()) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(point);
            groupEnd = point.line();
        }
        groups.add(current);
        return groups;
    }

    private static ExtractionCandidate toCandidate(List<ComplexityPoint> group, int totalComplexity) {
        ComplexityPoint first = group.get(0);
        ComplexityPoint last = group.get(group.size() - 1);
        int complexity = group.stream().mapToInt(ComplexityPoint::contribution).sum();
        Set<String> constructs = new LinkedHashSet<>();
        group.forEach(point -> constructs.add(point.label()));

        return new ExtractionCandidate(
                first.line(),
                last.location().endLine(),
                complexity,
                (int) Math.round(complexity * 100.0 / totalComplexity),
                group,
                constructs);
    }

    private List<ExtractionCandidate> selectNonOverlapping(List<ExtractionCandidate> candidates) {
        List<ExtractionCandidate> byWeight = new ArrayList<>(candidates);
        byWeight.sort(Comparator.comparingInt(ExtractionCandidate::complexity).reversed());

        List<ExtractionCandidate> selected = new ArrayList<>();
        for (ExtractionCandidate candidate : byWeight) {
            if (selected.size() >= options.maxCandidates()) {
                break;
            }
            if (selected.stream().noneMatch(candidate::overlaps)) {
                selected.add(candidate);
            }
        }
        selected.sort(Comparator.comparingInt(ExtractionCandidate::startLine));
        return selected;
    }
}
