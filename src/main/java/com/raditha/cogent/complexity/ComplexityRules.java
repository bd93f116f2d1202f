package com.raditha.cogent.complexity;

import com.raditha.cogent.model.FunctionScope;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * A set of scoring hooks driven by {@link FunctionTraversal}.
 * <p>
 * For every node inside a function the traversal calls {@link #enterNode} on all rules,
 * then {@link #visit} on all rules, walks the children, and finally calls
 * {@link #exitNode}. Rules keep no state of their own; everything lives in the
 * {@link FunctionScope} they are handed.
 */
public interface ComplexityRules {

    /**
     * Generic hook run before any kind-specific handling of the node.
     */
    default void enterNode(SyntaxNode node, FunctionScope scope) {
    }

    /**
     * Generic hook run after the node's children have been walked.
     */
    default void exitNode(SyntaxNode node, FunctionScope scope) {
    }

    /**
     * Kind-specific handling of a node that is not a function literal.
     */
    default void visit(SyntaxNode node, FunctionScope scope) {
    }

    /**
     * A function literal was entered and its scope pushed.
     *
     * @param scope     the new scope
     * @param enclosing scope of the enclosing function, if any
     * @param depth     number of function literals open around this one
     */
    default void enterFunction(FunctionScope scope, @Nullable FunctionScope enclosing, int depth) {
    }

    /**
     * The function's body has been walked; its scope is about to be finalized.
     */
    default void exitFunction(FunctionScope scope) {
    }
}
