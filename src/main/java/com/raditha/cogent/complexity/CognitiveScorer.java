package com.raditha.cogent.complexity;

import com.raditha.cogent.model.ComplexityResult;
import com.raditha.cogent.model.ScoreResult;
import com.raditha.cogent.tree.SyntaxNode;

import java.util.List;

/**
 * Cognitive complexity: nesting-weighted readability score.
 */
public final class CognitiveScorer {

    private static final List<ComplexityRules> RULES = List.of(NestingTracker.INSTANCE, CognitiveRules.INSTANCE);

    public ScoreResult score(SyntaxNode function) {
        return toScore(FunctionTraversal.runOne(function, RULES));
    }

    public List<ScoreResult> scoreAll(SyntaxNode root) {
        return FunctionTraversal.run(root, RULES).stream().map(CognitiveScorer::toScore).toList();
    }

    private static ScoreResult toScore(ComplexityResult result) {
        return new ScoreResult(result.function(), result.name(), result.cognitive(), result.cognitivePoints());
    }
}
