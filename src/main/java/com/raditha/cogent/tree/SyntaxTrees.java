package com.raditha.cogent.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Static helpers for walking and inspecting {@link SyntaxNode} trees.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    /**
     * Pre-order walk over every node of the tree.
     */
    public static void walk(SyntaxNode root, Consumer<SyntaxNode> visitor) {
        visitor.accept(root);
        for (SyntaxNode child : root.children()) {
            walk(child, visitor);
        }
    }

    /**
     * Pre-order walk that does not descend below nodes matching {@code prune}.
     * Pruned nodes themselves are not visited, except the root.
     */
    public static void walk(SyntaxNode root, Predicate<SyntaxNode> prune, Consumer<SyntaxNode> visitor) {
        visitor.accept(root);
        for (SyntaxNode child : root.children()) {
            if (!prune.test(child)) {
                walk(child, prune, visitor);
            }
        }
    }

    public static List<SyntaxNode> findAll(SyntaxNode root, NodeKind kind) {
        List<SyntaxNode> found = new ArrayList<>();
        walk(root, node -> {
            if (node.is(kind)) {
                found.add(node);
            }
        });
        return found;
    }

    /**
     * All function literals in the tree, in pre-order.
     */
    public static List<SyntaxNode> functions(SyntaxNode root) {
        List<SyntaxNode> found = new ArrayList<>();
        walk(root, node -> {
            if (node.kind().isFunction()) {
                found.add(node);
            }
        });
        return found;
    }

    /**
     * Nearest function literal strictly above the node.
     */
    public static @Nullable SyntaxNode enclosingFunction(SyntaxNode node) {
        SyntaxNode current = node.parent();
        while (current != null && !current.kind().isFunction()) {
            current = current.parent();
        }
        return current;
    }

    /**
     * Identifier at the root of a member-access chain such as {@code a.b[c].d}.
     *
     * @return the identifier name, or null when the chain is rooted at something else
     */
    public static @Nullable String rootIdentifier(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.is(NodeKind.MEMBER)) {
            SyntaxNode object = current.child(Role.OBJECT);
            if (object == null) {
                return null;
            }
            current = object;
        }
        return current.is(NodeKind.IDENTIFIER) ? current.name() : null;
    }

    /**
     * Property name of a member access: the identifier for {@code a.b}, the string
     * literal for {@code a["b"]}, null otherwise.
     */
    public static @Nullable String propertyName(SyntaxNode member) {
        SyntaxNode property = member.child(Role.PROPERTY);
        if (property == null) {
            return null;
        }
        boolean computed = member.hasFlag(NodeFlag.COMPUTED);
        if (!computed && property.is(NodeKind.IDENTIFIER)) {
            return property.name();
        }
        if (computed && property.is(NodeKind.LITERAL) && property.value() instanceof String s) {
            return s;
        }
        return null;
    }

    /**
     * Structural rendering used when a tree provider supplies no source text.
     */
    static String render(SyntaxNode node) {
        switch (node.kind()) {
            case IDENTIFIER:
                return String.valueOf(node.name());
            case THIS:
                return "this";
            case LITERAL:
                return node.value() instanceof String s ? "\"" + s + "\"" : String.valueOf(node.value());
            case MEMBER: {
                SyntaxNode object = node.child(Role.OBJECT);
                SyntaxNode property = node.child(Role.PROPERTY);
                String left = object == null ? "" : object.text();
                String right = property == null ? "" : property.text();
                return node.hasFlag(NodeFlag.COMPUTED) ? left + "[" + right + "]" : left + "." + right;
            }
            case CALL: {
                SyntaxNode callee = node.child(Role.CALLEE);
                return (callee == null ? "" : callee.text()) + "(" + joined(node.children(Role.ARGUMENTS)) + ")";
            }
            case LOGICAL, BINARY, ASSIGNMENT: {
                SyntaxNode left = node.child(Role.LEFT);
                SyntaxNode right = node.child(Role.RIGHT);
                return (left == null ? "" : left.text()) + " " + node.operator() + " "
                        + (right == null ? "" : right.text());
            }
            default:
                return node.kind().name().toLowerCase() + "(" + joined(node.children()) + ")";
        }
    }

    private static String joined(List<SyntaxNode> nodes) {
        return nodes.stream().map(SyntaxNode::text).collect(Collectors.joining(", "));
    }
}
