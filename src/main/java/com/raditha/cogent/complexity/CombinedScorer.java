package com.raditha.cogent.complexity;

import com.raditha.cogent.model.ComplexityResult;
import com.raditha.cogent.tree.SyntaxNode;

import java.util.List;

/**
 * Both metrics in one pass. Uses the same rule objects as {@link CyclomaticScorer} and
 * {@link CognitiveScorer}; the cyclomatic rules only add cyclomatic points and the
 * cognitive rules only cognitive ones, so the results match the standalone scorers.
 */
public final class CombinedScorer {

    private static final List<ComplexityRules> RULES =
            List.of(NestingTracker.INSTANCE, CyclomaticRules.INSTANCE, CognitiveRules.INSTANCE);

    public ComplexityResult score(SyntaxNode function) {
        return FunctionTraversal.runOne(function, RULES);
    }

    public List<ComplexityResult> scoreAll(SyntaxNode root) {
        return FunctionTraversal.run(root, RULES);
    }
}
