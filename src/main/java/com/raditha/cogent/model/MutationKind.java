package com.raditha.cogent.model;

public enum MutationKind {
    ASSIGNMENT,
    INCREMENT,
    METHOD_CALL
}
