package com.raditha.cogent.scope;

import com.raditha.cogent.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named binding within a {@link Scope}.
 */
public final class Variable {

    private final String name;
    private final Scope scope;
    private final List<Definition> definitions = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();

    Variable(String name, Scope scope) {
        this.name = name;
        this.scope = scope;
    }

    public String name() {
        return name;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * Definitions in source order. A {@code var} declared twice has two.
     */
    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    public List<SyntaxNode> identifiers() {
        return definitions.stream().map(Definition::identifier).toList();
    }

    public List<Reference> references() {
        return Collections.unmodifiableList(references);
    }

    void addDefinition(Definition definition) {
        definitions.add(definition);
    }

    void addReference(Reference reference) {
        references.add(reference);
    }

    @Override
    public String toString() {
        return name + " (" + definitions.size() + " defs, " + references.size() + " refs)";
    }
}
