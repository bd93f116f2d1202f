package com.raditha.cogent.model;

/**
 * Whether a variable occurrence reads, writes, or does both (compound assignment, increment).
 */
public enum ReferenceKind {
    READ,
    WRITE,
    READ_WRITE;

    public boolean isRead() {
        return this == READ || this == READ_WRITE;
    }

    public boolean isWrite() {
        return this == WRITE || this == READ_WRITE;
    }
}
