package com.raditha.cogent.complexity;

import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ConstructKind;
import com.raditha.cogent.model.FunctionScope;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Cognitive complexity rules.
 * <p>
 * Structural constructs (if, loops, switch, catch, ternary) cost {@code 1 + nesting}
 * and mark the sub-trees that raise nesting for their contents. Flat constructs
 * (else-if, else, labeled jumps, operator-sequence changes) cost 1. Nested functions
 * charge their enclosing function, and a function that calls itself pays once for
 * recursion. Depends on {@link NestingTracker} running alongside.
 */
public final class CognitiveRules implements ComplexityRules {

    static final CognitiveRules INSTANCE = new CognitiveRules();

    private final Map<NodeKind, BiConsumer<SyntaxNode, FunctionScope>> handlers = new EnumMap<>(NodeKind.class);

    private CognitiveRules() {
        handlers.put(NodeKind.IF, CognitiveRules::ifStatement);
        handlers.put(NodeKind.FOR, loop(ConstructKind.FOR));
        handlers.put(NodeKind.FOR_IN, loop(ConstructKind.FOR_IN));
        handlers.put(NodeKind.FOR_OF, loop(ConstructKind.FOR_OF));
        handlers.put(NodeKind.WHILE, loop(ConstructKind.WHILE));
        handlers.put(NodeKind.DO_WHILE, loop(ConstructKind.DO_WHILE));
        handlers.put(NodeKind.SWITCH, (node, scope) -> {
            structural(scope, ConstructKind.SWITCH, node);
            node.children(Role.CASES).forEach(scope::markNestingRegion);
        });
        handlers.put(NodeKind.CATCH, (node, scope) -> {
            structural(scope, ConstructKind.CATCH, node);
            markRegion(scope, node.child(Role.BODY));
        });
        handlers.put(NodeKind.CONDITIONAL, (node, scope) -> {
            structural(scope, ConstructKind.TERNARY, node);
            markRegion(scope, node.child(Role.CONSEQUENT));
            markRegion(scope, node.child(Role.ALTERNATE));
        });
        handlers.put(NodeKind.BREAK, labeledJump(ConstructKind.LABELED_BREAK));
        handlers.put(NodeKind.CONTINUE, labeledJump(ConstructKind.LABELED_CONTINUE));
        handlers.put(NodeKind.LOGICAL, CognitiveRules::logicalExpression);
        handlers.put(NodeKind.CALL, (node, scope) -> {
            if (RecursionDetector.isRecursiveCall(node, scope.name())) {
                scope.markRecursiveCall();
            }
        });
    }

    @Override
    public void visit(SyntaxNode node, FunctionScope scope) {
        BiConsumer<SyntaxNode, FunctionScope> handler = handlers.get(node.kind());
        if (handler != null) {
            handler.accept(node, scope);
        }
    }

    @Override
    public void enterFunction(FunctionScope scope, @Nullable FunctionScope enclosing, int depth) {
        if (enclosing == null || depth == 0) {
            return;
        }
        SyntaxNode function = scope.node();
        ConstructKind kind = function.is(NodeKind.ARROW_FUNCTION)
                ? ConstructKind.NESTED_ARROW
                : ConstructKind.NESTED_FUNCTION;
        enclosing.addCognitive(ComplexityPoint.flat(kind, function.location()));
    }

    @Override
    public void exitFunction(FunctionScope scope) {
        if (scope.hasRecursiveCall()) {
            scope.addCognitive(ComplexityPoint.flat(ConstructKind.RECURSION, scope.node().location()));
        }
    }

    private static void ifStatement(SyntaxNode node, FunctionScope scope) {
        if (isElseIf(node)) {
            flat(scope, ConstructKind.ELSE_IF, node);
        } else {
            structural(scope, ConstructKind.IF, node);
        }
        markRegion(scope, node.child(Role.CONSEQUENT));

        SyntaxNode alternate = node.child(Role.ALTERNATE);
        if (alternate != null && !alternate.is(NodeKind.IF)) {
            scope.markNestingRegion(alternate);
            flat(scope, ConstructKind.ELSE, alternate);
        }
    }

    private static boolean isElseIf(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        return parent != null && parent.is(NodeKind.IF) && node.role() == Role.ALTERNATE;
    }

    private static void logicalExpression(SyntaxNode node, FunctionScope scope) {
        ConstructKind kind = ConstructKind.forLogicalOperator(node.operator());
        if (kind == null) {
            return;
        }
        if (PatternExclusions.isMarkupChain(node) || PatternExclusions.isDefaultValueChain(node)) {
            return;
        }
        // only the first operator of a same-operator run counts
        SyntaxNode parent = node.parent();
        if (parent != null && parent.is(NodeKind.LOGICAL) && kind.equals(ConstructKind.forLogicalOperator(parent.operator()))) {
            return;
        }
        flat(scope, kind, node);
    }

    private static BiConsumer<SyntaxNode, FunctionScope> loop(ConstructKind kind) {
        return (node, scope) -> {
            structural(scope, kind, node);
            markRegion(scope, node.child(Role.BODY));
        };
    }

    private static BiConsumer<SyntaxNode, FunctionScope> labeledJump(ConstructKind kind) {
        return (node, scope) -> {
            if (node.name() != null) {
                scope.addCognitive(new ComplexityPoint(kind, node.name(), 1, 0, node.location()));
            }
        };
    }

    private static void markRegion(FunctionScope scope, @Nullable SyntaxNode region) {
        if (region != null) {
            scope.markNestingRegion(region);
        }
    }

    private static void structural(FunctionScope scope, ConstructKind kind, SyntaxNode node) {
        scope.addCognitive(ComplexityPoint.structural(kind, scope.nestingLevel(), node.location()));
    }

    private static void flat(FunctionScope scope, ConstructKind kind, SyntaxNode node) {
        scope.addCognitive(ComplexityPoint.flat(kind, node.location()));
    }
}
