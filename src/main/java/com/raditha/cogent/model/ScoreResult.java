package com.raditha.cogent.model;

import com.raditha.cogent.tree.SyntaxNode;

import java.util.List;

/**
 * One metric's score for one function.
 *
 * @param function the function literal
 * @param name     resolved function name
 * @param total    the score
 * @param points   attribution, in the order the constructs were visited
 */
public record ScoreResult(SyntaxNode function, String name, int total, List<ComplexityPoint> points) {

    public ScoreResult {
        points = List.copyOf(points);
    }
}
