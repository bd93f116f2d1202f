package com.raditha.cogent.tree;

/**
 * Boolean attributes a node may carry.
 */
public enum NodeFlag {
    /** Member access or property key written with brackets. */
    COMPUTED,
    /** Object property written as {@code { a }}. */
    SHORTHAND,
    /** Update expression written before its operand. */
    PREFIX,
    /** Method definition that is a constructor. */
    CONSTRUCTOR,
    /** Identifier that names a member rather than a variable, such as an unqualified method call. */
    MEMBER_NAME
}
