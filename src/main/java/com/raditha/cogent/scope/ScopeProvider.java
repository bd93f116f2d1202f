package com.raditha.cogent.scope;

import com.raditha.cogent.tree.SyntaxNode;

import java.util.Optional;

/**
 * Supplies scope information for function literals.
 */
public interface ScopeProvider {

    /**
     * Scope opened by the given function literal.
     *
     * @return the scope, or empty when no scope information is available; never throws
     */
    Optional<Scope> scopeOf(SyntaxNode function);

    /**
     * Provider for callers that have no scope information at all.
     */
    static ScopeProvider none() {
        return function -> Optional.empty();
    }
}
