package com.raditha.cogent.model;

import org.jspecify.annotations.Nullable;

/**
 * The construct a {@link ComplexityPoint} is charged to.
 * <p>
 * {@link #tag()} is the stable machine-readable name; {@link #label(String)} is what
 * reports print. {@link #category()} groups related kinds for cognitive summaries.
 */
public enum ConstructKind {
    IF("if", "if"),
    ELSE_IF("else-if", "else if"),
    ELSE("else", "else"),
    FOR("for", "for"),
    FOR_IN("for-in", "for...in"),
    FOR_OF("for-of", "for...of"),
    WHILE("while", "while"),
    DO_WHILE("do-while", "do...while"),
    SWITCH("switch", "switch"),
    CASE("case", "case"),
    CATCH("catch", "catch"),
    TERNARY("ternary", "ternary operator"),
    LOGICAL_AND("logical-and", "logical operator '&&'"),
    LOGICAL_OR("logical-or", "logical operator '||'"),
    LOGICAL_NULLISH("logical-nullish", "logical operator '??'"),
    LOGICAL_AND_ASSIGN("logical-and-assign", "&&="),
    LOGICAL_OR_ASSIGN("logical-or-assign", "||="),
    NULLISH_ASSIGN("nullish-assign", "??="),
    LABELED_BREAK("labeled-break", "break to label '%s'"),
    LABELED_CONTINUE("labeled-continue", "continue to label '%s'"),
    NESTED_FUNCTION("nested-function", "nested function"),
    NESTED_ARROW("nested-arrow", "nested arrow function"),
    RECURSION("recursion", "recursion");

    private final String tag;
    private final String label;

    ConstructKind(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public String tag() {
        return tag;
    }

    /**
     * Display label. Labeled jumps substitute the label name.
     */
    public String label(@Nullable String detail) {
        if (label.contains("%s")) {
            return String.format(label, detail == null ? "" : detail);
        }
        return label;
    }

    /**
     * Summary category used for cognitive reports.
     */
    public String category() {
        return switch (this) {
            case LOGICAL_AND, LOGICAL_OR, LOGICAL_NULLISH -> "logical operators";
            case NESTED_FUNCTION, NESTED_ARROW -> "nested functions";
            case LABELED_BREAK, LABELED_CONTINUE -> "labeled jumps";
            default -> label;
        };
    }

    public boolean isLogicalOperator() {
        return this == LOGICAL_AND || this == LOGICAL_OR || this == LOGICAL_NULLISH;
    }

    /**
     * Kind for a short-circuit operator, or null if the operator is not one.
     */
    public static @Nullable ConstructKind forLogicalOperator(@Nullable String operator) {
        if (operator == null) {
            return null;
        }
        return switch (operator) {
            case "&&" -> LOGICAL_AND;
            case "||" -> LOGICAL_OR;
            case "??" -> LOGICAL_NULLISH;
            default -> null;
        };
    }

    /**
     * Kind for a short-circuit assignment operator, or null if the operator is not one.
     */
    public static @Nullable ConstructKind forLogicalAssignment(@Nullable String operator) {
        if (operator == null) {
            return null;
        }
        return switch (operator) {
            case "&&=" -> LOGICAL_AND_ASSIGN;
            case "||=" -> LOGICAL_OR_ASSIGN;
            case "??=" -> NULLISH_ASSIGN;
            default -> null;
        };
    }
}
