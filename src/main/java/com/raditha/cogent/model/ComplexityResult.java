package com.raditha.cogent.model;

import com.raditha.cogent.tree.SyntaxNode;

import java.util.List;

/**
 * Final scores of one function.
 *
 * @param function         the function literal
 * @param name             resolved function name
 * @param cyclomatic       1 + cyclomatic decision points
 * @param cognitive        sum of cognitive contributions
 * @param cyclomaticPoints cyclomatic attribution
 * @param cognitivePoints  cognitive attribution
 */
public record ComplexityResult(
        SyntaxNode function,
        String name,
        int cyclomatic,
        int cognitive,
        List<ComplexityPoint> cyclomaticPoints,
        List<ComplexityPoint> cognitivePoints) {

    private static final int BASE_CYCLOMATIC = 1;

    public ComplexityResult {
        cyclomaticPoints = List.copyOf(cyclomaticPoints);
        cognitivePoints = List.copyOf(cognitivePoints);
    }

    /**
     * Reduce a finished scope to its totals.
     */
    public static ComplexityResult of(FunctionScope scope) {
        return new ComplexityResult(
                scope.node(),
                scope.name(),
                BASE_CYCLOMATIC + sum(scope.cyclomaticPoints()),
                sum(scope.cognitivePoints()),
                scope.cyclomaticPoints(),
                scope.cognitivePoints());
    }

    public static int sum(List<ComplexityPoint> points) {
        return points.stream().mapToInt(ComplexityPoint::contribution).sum();
    }

    public int startLine() {
        return function.location().startLine();
    }
}
