package com.raditha.cogent.complexity;

import com.raditha.cogent.model.ComplexityResult;
import com.raditha.cogent.model.FunctionScope;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first walk that keeps one {@link FunctionScope} per open function literal and
 * drives a list of {@link ComplexityRules}.
 * <p>
 * A function literal's own node is entered and left in the enclosing function's scope,
 * so a literal that is a nesting region of its parent (a callback in a ternary branch,
 * say) raises and lowers the parent's level symmetrically. Its children are walked in
 * its own scope. Results come out in post-order: inner functions before outer ones.
 * <p>
 * Instances are single-use; {@link #run} allocates a fresh one per call.
 */
public final class FunctionTraversal {

    private final List<ComplexityRules> rules;
    private final Deque<FunctionScope> scopes = new ArrayDeque<>();
    private final List<ComplexityResult> results = new ArrayList<>();

    private FunctionTraversal(List<ComplexityRules> rules) {
        this.rules = rules;
    }

    /**
     * Score every function literal in the tree rooted at {@code root}.
     */
    public static List<ComplexityResult> run(SyntaxNode root, List<ComplexityRules> rules) {
        FunctionTraversal traversal = new FunctionTraversal(rules);
        traversal.walk(root, 0);
        return List.copyOf(traversal.results);
    }

    /**
     * Score a single function literal. Functions nested inside it are walked too, so
     * their penalties land on it, but only its own result is returned.
     *
     * @throws IllegalArgumentException if the node is not a function literal
     */
    public static ComplexityResult runOne(SyntaxNode function, List<ComplexityRules> rules) {
        if (!function.kind().isFunction()) {
            throw new IllegalArgumentException("Not a function literal: " + function.kind());
        }
        List<ComplexityResult> all = run(function, rules);
        return all.get(all.size() - 1);
    }

    /**
     * Scope of the innermost open function, empty outside any function.
     */
    Optional<FunctionScope> currentScope() {
        return Optional.ofNullable(scopes.peek());
    }

    private void walk(SyntaxNode node, int depth) {
        FunctionScope current = currentScope().orElse(null);
        if (current != null) {
            for (ComplexityRules rule : rules) {
                rule.enterNode(node, current);
            }
        }

        if (node.kind().isFunction()) {
            walkFunction(node, current, depth);
        } else {
            if (current != null) {
                for (ComplexityRules rule : rules) {
                    rule.visit(node, current);
                }
            }
            for (SyntaxNode child : node.children()) {
                walk(child, depth);
            }
        }

        if (current != null) {
            for (ComplexityRules rule : rules) {
                rule.exitNode(node, current);
            }
        }
    }

    private void walkFunction(SyntaxNode function, @Nullable FunctionScope enclosing, int depth) {
        FunctionScope scope = new FunctionScope(function, FunctionNames.resolve(function));
        scopes.push(scope);
        for (ComplexityRules rule : rules) {
            rule.enterFunction(scope, enclosing, depth);
        }

        for (SyntaxNode child : function.children()) {
            walk(child, depth + 1);
        }

        for (ComplexityRules rule : rules) {
            rule.exitFunction(scope);
        }
        scopes.pop();
        results.add(ComplexityResult.of(scope));
    }
}
