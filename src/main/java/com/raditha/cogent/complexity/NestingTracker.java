package com.raditha.cogent.complexity;

import com.raditha.cogent.model.FunctionScope;
import com.raditha.cogent.tree.SyntaxNode;

/**
 * Raises the scope's nesting level while the walk is inside a marked region and
 * consumes the region on the way out.
 */
public final class NestingTracker implements ComplexityRules {

    static final NestingTracker INSTANCE = new NestingTracker();

    private NestingTracker() {
    }

    @Override
    public void enterNode(SyntaxNode node, FunctionScope scope) {
        scope.enterRegion(node);
    }

    @Override
    public void exitNode(SyntaxNode node, FunctionScope scope) {
        scope.exitRegion(node);
    }
}
