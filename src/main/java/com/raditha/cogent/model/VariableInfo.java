package com.raditha.cogent.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A variable visible in an analyzed function, with every place it is used.
 *
 * @param name               variable name
 * @param declarationLine    line of the declaring construct
 * @param declarationColumn  column of the declaring construct
 * @param declarationKind    how the variable was introduced
 * @param mutable            false only for constants
 * @param typeAnnotation     rendered declared type, if any
 * @param references         uses made directly by the function, in source order
 * @param capturedReferences uses made from function literals nested inside the function
 * @param scopeLevel         block depth of the declaring scope below the function scope
 */
public record VariableInfo(
        String name,
        int declarationLine,
        int declarationColumn,
        DeclarationKind declarationKind,
        boolean mutable,
        @Nullable String typeAnnotation,
        List<VariableReference> references,
        List<VariableReference> capturedReferences,
        int scopeLevel) {

    public VariableInfo {
        references = List.copyOf(references);
        capturedReferences = List.copyOf(capturedReferences);
    }

    public boolean isDeclaredWithin(int startLine, int endLine) {
        return declarationLine >= startLine && declarationLine <= endLine;
    }

    public boolean isReadWithin(int startLine, int endLine) {
        return references.stream().anyMatch(ref -> ref.kind().isRead() && ref.isWithin(startLine, endLine));
    }

    public boolean isUsedAfter(int endLine) {
        return references.stream().anyMatch(ref -> ref.line() > endLine);
    }

    public TypedVariable toTyped() {
        return new TypedVariable(name, typeAnnotation);
    }
}
