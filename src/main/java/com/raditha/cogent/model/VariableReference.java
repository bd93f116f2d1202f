package com.raditha.cogent.model;

import com.raditha.cogent.tree.SyntaxNode;

/**
 * A single occurrence of a tracked variable.
 *
 * @param line   line of the identifier
 * @param column column of the identifier
 * @param kind   read, write or read-write
 * @param node   the identifier node
 */
public record VariableReference(int line, int column, ReferenceKind kind, SyntaxNode node) {

    public static VariableReference of(SyntaxNode identifier, ReferenceKind kind) {
        return new VariableReference(
                identifier.location().startLine(),
                identifier.location().startColumn(),
                kind,
                identifier);
    }

    public boolean isWithin(int startLine, int endLine) {
        return line >= startLine && line <= endLine;
    }
}
