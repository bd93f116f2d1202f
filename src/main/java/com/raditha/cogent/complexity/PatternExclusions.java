package com.raditha.cogent.complexity;

import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Logical-operator idioms that read as a single value rather than as branching, and
 * therefore add no cognitive complexity.
 */
public final class PatternExclusions {

    private static final Set<String> DEFAULT_VALUE_OPERATORS = Set.of("||", "??");
    private static final Set<String> MARKUP_OPERATORS = Set.of("&&");
    private static final Set<NodeKind> LITERAL_KINDS =
            EnumSet.of(NodeKind.LITERAL, NodeKind.ARRAY_LITERAL, NodeKind.OBJECT_LITERAL);
    private static final Set<NodeKind> MARKUP_KINDS = EnumSet.of(NodeKind.MARKUP_ELEMENT, NodeKind.MARKUP_FRAGMENT);

    private PatternExclusions() {
    }

    /**
     * {@code const x = a || []} or {@code x = x ?? {}}: a fallback chain ending in a
     * literal that initializes a variable or re-assigns its own left operand.
     */
    public static boolean isDefaultValueChain(SyntaxNode logical) {
        if (!DEFAULT_VALUE_OPERATORS.contains(logical.operator())) {
            return false;
        }
        if (!LITERAL_KINDS.contains(rightmostInChain(logical, DEFAULT_VALUE_OPERATORS).kind())) {
            return false;
        }

        SyntaxNode root = chainRoot(logical, DEFAULT_VALUE_OPERATORS);
        SyntaxNode parent = root.parent();
        if (parent == null) {
            return false;
        }
        if (parent.is(NodeKind.VARIABLE_DECLARATOR)) {
            return true;
        }
        if (parent.is(NodeKind.ASSIGNMENT)) {
            SyntaxNode target = parent.child(Role.LEFT);
            SyntaxNode operand = root.child(Role.LEFT);
            return target != null && operand != null && target.text().equals(operand.text());
        }
        return false;
    }

    /**
     * {@code show && <Panel/>}: a guard chain whose value is inline markup.
     */
    public static boolean isMarkupChain(SyntaxNode logical) {
        if (!MARKUP_OPERATORS.contains(logical.operator())) {
            return false;
        }
        return MARKUP_KINDS.contains(rightmostInChain(logical, MARKUP_OPERATORS).kind());
    }

    private static SyntaxNode rightmostInChain(SyntaxNode logical, Set<String> operators) {
        SyntaxNode current = logical.child(Role.RIGHT);
        if (current == null) {
            return logical;
        }
        while (isLogical(current, operators)) {
            SyntaxNode right = current.child(Role.RIGHT);
            if (right == null) {
                break;
            }
            current = right;
        }
        return current;
    }

    private static SyntaxNode chainRoot(SyntaxNode logical, Set<String> operators) {
        SyntaxNode current = logical;
        while (current.parent() != null && isLogical(current.parent(), operators)) {
            current = current.parent();
        }
        return current;
    }

    private static boolean isLogical(SyntaxNode node, Set<String> operators) {
        return node.is(NodeKind.LOGICAL) && node.operator() != null && operators.contains(node.operator());
    }
}
