package com.raditha.cogent.scope;

import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A lexical scope: the variables it declares and the references made from inside it.
 */
public final class Scope {

    /**
     * What created the scope.
     */
    public enum Kind {
        GLOBAL,
        FUNCTION,
        BLOCK,
        CATCH,
        FOR,
        SWITCH,
        CLASS
    }

    private final Kind kind;
    private final SyntaxNode block;
    private final @Nullable Scope upper;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final List<Reference> references = new ArrayList<>();

    Scope(Kind kind, SyntaxNode block, @Nullable Scope upper) {
        this.kind = kind;
        this.block = block;
        this.upper = upper;
        if (upper != null) {
            upper.children.add(this);
        }
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The node that opened the scope.
     */
    public SyntaxNode block() {
        return block;
    }

    public @Nullable Scope upper() {
        return upper;
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Variables in declaration order.
     */
    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public @Nullable Variable variable(String name) {
        return variables.get(name);
    }

    /**
     * References whose identifier sits directly in this scope.
     */
    public List<Reference> references() {
        return Collections.unmodifiableList(references);
    }

    public boolean isFunctionScope() {
        return kind == Kind.FUNCTION;
    }

    /**
     * Look a name up through this scope and its ancestors.
     */
    public @Nullable Variable resolve(String name) {
        for (Scope current = this; current != null; current = current.upper) {
            Variable found = current.variables.get(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Nearest enclosing function scope, or the global scope at top level.
     */
    Scope variableScope() {
        Scope current = this;
        while (current.kind != Kind.FUNCTION && current.kind != Kind.GLOBAL && current.upper != null) {
            current = current.upper;
        }
        return current;
    }

    Variable declare(String name) {
        return variables.computeIfAbsent(name, n -> new Variable(n, this));
    }

    void addReference(Reference reference) {
        references.add(reference);
    }

    @Override
    public String toString() {
        return kind + " scope at " + block.location();
    }
}
