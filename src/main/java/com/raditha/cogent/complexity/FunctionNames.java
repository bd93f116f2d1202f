package com.raditha.cogent.complexity;

import com.raditha.cogent.tree.NodeFlag;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * Resolves a display name for a function literal.
 */
public final class FunctionNames {

    public static final String ANONYMOUS = "<anonymous>";
    public static final String ARROW = "<arrow>";
    public static final String CONSTRUCTOR = "constructor";

    private FunctionNames() {
    }

    /**
     * Name of a function literal: its own identifier or key, else the name its parent
     * gives it (variable, property, assignment target, method or class field), else
     * an anonymous marker.
     */
    public static String resolve(SyntaxNode function) {
        String own = identifierName(function.child(Role.ID));
        if (own == null) {
            own = identifierName(function.child(Role.KEY));
        }
        if (own != null) {
            return own;
        }

        String fromParent = fromParent(function.parent());
        if (fromParent != null) {
            return fromParent;
        }
        return function.is(NodeKind.ARROW_FUNCTION) ? ARROW : ANONYMOUS;
    }

    private static @Nullable String fromParent(@Nullable SyntaxNode parent) {
        if (parent == null) {
            return null;
        }
        return switch (parent.kind()) {
            case VARIABLE_DECLARATOR -> identifierName(parent.child(Role.ID));
            case PROPERTY, PROPERTY_DEFINITION -> identifierName(parent.child(Role.KEY));
            case ASSIGNMENT -> identifierName(parent.child(Role.LEFT));
            case METHOD_DEFINITION -> {
                String key = identifierName(parent.child(Role.KEY));
                if (key == null && parent.hasFlag(NodeFlag.CONSTRUCTOR)) {
                    key = CONSTRUCTOR;
                }
                yield key;
            }
            default -> null;
        };
    }

    private static @Nullable String identifierName(@Nullable SyntaxNode node) {
        if (node != null && node.is(NodeKind.IDENTIFIER)) {
            return node.name();
        }
        return null;
    }
}
