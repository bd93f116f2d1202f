package com.raditha.cogent.model;

/**
 * How a tracked variable was introduced.
 */
public enum DeclarationKind {
    CONST,
    LET,
    VAR,
    PARAM,
    DESTRUCTURED;

    public boolean isMutable() {
        return this != CONST;
    }
}
