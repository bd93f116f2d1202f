package com.raditha.cogent.complexity;

import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ConstructKind;
import com.raditha.cogent.model.FunctionScope;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Decision-point counting: +1 per branch, loop, non-default case, catch, ternary,
 * short-circuit operator and short-circuit assignment. No nesting, no exclusions.
 */
public final class CyclomaticRules implements ComplexityRules {

    static final CyclomaticRules INSTANCE = new CyclomaticRules();

    private final Map<NodeKind, BiConsumer<SyntaxNode, FunctionScope>> handlers = new EnumMap<>(NodeKind.class);

    private CyclomaticRules() {
        handlers.put(NodeKind.IF, decision(ConstructKind.IF));
        handlers.put(NodeKind.FOR, decision(ConstructKind.FOR));
        handlers.put(NodeKind.FOR_IN, decision(ConstructKind.FOR_IN));
        handlers.put(NodeKind.FOR_OF, decision(ConstructKind.FOR_OF));
        handlers.put(NodeKind.WHILE, decision(ConstructKind.WHILE));
        handlers.put(NodeKind.DO_WHILE, decision(ConstructKind.DO_WHILE));
        handlers.put(NodeKind.CATCH, decision(ConstructKind.CATCH));
        handlers.put(NodeKind.CONDITIONAL, decision(ConstructKind.TERNARY));
        handlers.put(NodeKind.SWITCH_CASE, (node, scope) -> {
            // a case without a test is the default branch
            if (node.child(Role.TEST) != null) {
                add(scope, ConstructKind.CASE, node);
            }
        });
        handlers.put(NodeKind.LOGICAL, (node, scope) -> {
            ConstructKind kind = ConstructKind.forLogicalOperator(node.operator());
            if (kind != null) {
                add(scope, kind, node);
            }
        });
        handlers.put(NodeKind.ASSIGNMENT, (node, scope) -> {
            ConstructKind kind = ConstructKind.forLogicalAssignment(node.operator());
            if (kind != null) {
                add(scope, kind, node);
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

    private static BiConsumer<SyntaxNode, FunctionScope> decision(ConstructKind kind) {
        return (node, scope) -> add(scope, kind, node);
    }

    private static void add(FunctionScope scope, ConstructKind kind, SyntaxNode node) {
        scope.addCyclomatic(ComplexityPoint.flat(kind, node.location()));
    }
}
