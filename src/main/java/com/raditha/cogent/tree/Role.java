package com.raditha.cogent.tree;

/**
 * The slot a child occupies in its parent, e.g. the {@code TEST} of an {@code IF}.
 */
public enum Role {
    ID,
    PARAMS,
    BODY,
    TEST,
    CONSEQUENT,
    ALTERNATE,
    INIT,
    UPDATE,
    LEFT,
    RIGHT,
    ARGUMENT,
    CALLEE,
    ARGUMENTS,
    OBJECT,
    PROPERTY,
    KEY,
    VALUE,
    ELEMENTS,
    PROPERTIES,
    DECLARATIONS,
    SPECIFIERS,
    DISCRIMINANT,
    CASES,
    BLOCK,
    HANDLER,
    PARAM,
    FINALIZER,
    EXPRESSION,
    TYPE_ANNOTATION,
    TYPES,
    ELEMENT_TYPE,
    CHILD
}
