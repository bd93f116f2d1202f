package com.raditha.cogent.tree;

/**
 * Binding keyword of a variable declaration.
 * <p>
 * {@code VAR} declarations are function scoped, the other two are block scoped.
 */
public enum BindingKind {
    CONST,
    LET,
    VAR
}
