package com.raditha.cogent.tree;

/**
 * Kind tag of a {@link SyntaxNode}.
 * <p>
 * The set covers the constructs the scorers and the extraction analysis care about.
 * Everything else a tree provider encounters is mapped to {@link #OTHER} with its
 * children preserved.
 */
public enum NodeKind {
    PROGRAM,
    IMPORT_DECLARATION,
    CLASS_DECLARATION,
    CLASS_BODY,

    FUNCTION_DECLARATION,
    FUNCTION_EXPRESSION,
    ARROW_FUNCTION,
    METHOD_DEFINITION,
    PROPERTY_DEFINITION,

    BLOCK,
    EXPRESSION_STATEMENT,
    VARIABLE_DECLARATION,
    VARIABLE_DECLARATOR,
    IF,
    FOR,
    FOR_IN,
    FOR_OF,
    WHILE,
    DO_WHILE,
    SWITCH,
    SWITCH_CASE,
    TRY,
    CATCH,
    THROW,
    RETURN,
    BREAK,
    CONTINUE,
    LABELED,

    IDENTIFIER,
    LITERAL,
    ARRAY_LITERAL,
    OBJECT_LITERAL,
    PROPERTY,
    MEMBER,
    CALL,
    NEW,
    ASSIGNMENT,
    UPDATE,
    UNARY,
    BINARY,
    LOGICAL,
    CONDITIONAL,
    THIS,

    MARKUP_ELEMENT,
    MARKUP_FRAGMENT,
    OBJECT_PATTERN,
    ARRAY_PATTERN,

    TYPE_KEYWORD,
    TYPE_ARRAY,
    TYPE_REFERENCE,
    TYPE_UNION,
    TYPE_INTERSECTION,
    TYPE_OTHER,

    OTHER;

    /**
     * How a function literal treats the receiver ({@code this}) of the code around it.
     */
    public enum ReceiverBinding {
        /** Binds its own receiver; a {@code this} inside refers to something else. */
        REBINDING,
        /** Sees the receiver of the enclosing function. */
        INHERITING
    }

    public boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION || this == ARROW_FUNCTION;
    }

    public boolean isPattern() {
        return this == OBJECT_PATTERN || this == ARRAY_PATTERN;
    }

    /**
     * Receiver binding of a function literal kind. Only meaningful when {@link #isFunction()}.
     */
    public ReceiverBinding receiverBinding() {
        return this == ARROW_FUNCTION ? ReceiverBinding.INHERITING : ReceiverBinding.REBINDING;
    }
}
