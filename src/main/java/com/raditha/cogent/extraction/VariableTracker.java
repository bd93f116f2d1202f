package com.raditha.cogent.extraction;

import com.raditha.cogent.model.DeclarationKind;
import com.raditha.cogent.model.VariableInfo;
import com.raditha.cogent.model.VariableReference;
import com.raditha.cogent.scope.Definition;
import com.raditha.cogent.scope.Reference;
import com.raditha.cogent.scope.Scope;
import com.raditha.cogent.scope.ScopeProvider;
import com.raditha.cogent.scope.Variable;
import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.Location;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the variables of one function: its parameters and everything declared in
 * its body's blocks, but not what nested function literals declare.
 * <p>
 * Uses made from inside nested function literals are kept apart as captured
 * references so that extraction analysis can spot closures.
 */
public class VariableTracker {

    private static final Logger logger = LoggerFactory.getLogger(VariableTracker.class);

    private final ScopeProvider scopes;

    public VariableTracker(ScopeProvider scopes) {
        this.scopes = scopes;
    }

    /**
     * Variables of the function keyed by name, in declaration order. The first
     * declaration of a name wins. Empty when no scope information is available.
     */
    public Map<String, VariableInfo> track(SyntaxNode function) {
        Optional<Scope> functionScope = scopes.scopeOf(function);
        if (functionScope.isEmpty()) {
            logger.debug("No scope information for function at {}", function.location());
            return Collections.emptyMap();
        }
        Map<String, VariableInfo> collected = new LinkedHashMap<>();
        collect(functionScope.get(), functionScope.get(), collected);
        return collected;
    }

    private void collect(Scope scope, Scope functionScope, Map<String, VariableInfo> collected) {
        if (isInsideNestedFunction(scope, functionScope)) {
            return;
        }
        for (Variable variable : scope.variables()) {
            if (!collected.containsKey(variable.name()) && !variable.definitions().isEmpty()) {
                collected.put(variable.name(), describe(variable, scope, functionScope));
            }
        }
        for (Scope child : scope.children()) {
            collect(child, functionScope, collected);
        }
    }

    private VariableInfo describe(Variable variable, Scope scope, Scope functionScope) {
        Definition definition = variable.definitions().get(0);
        DeclarationKind kind = declarationKind(definition);
        Location declared = definition.node().location();

        List<VariableReference> direct = new ArrayList<>();
        List<VariableReference> captured = new ArrayList<>();
        for (Reference reference : variable.references()) {
            VariableReference converted = VariableReference.of(reference.identifier(), reference.kind());
            if (isInsideNestedFunction(reference.from(), functionScope)) {
                captured.add(converted);
            } else {
                direct.add(converted);
            }
        }

        return new VariableInfo(
                variable.name(),
                declared.startLine(),
                declared.startColumn(),
                kind,
                kind.isMutable(),
                TypeRenderer.annotationOf(definition.identifier()),
                direct,
                captured,
                levelBelow(scope, functionScope));
    }

    static DeclarationKind declarationKind(Definition definition) {
        return switch (definition.kind()) {
            case PARAMETER, CATCH_CLAUSE -> DeclarationKind.PARAM;
            case IMPORT_BINDING, CLASS_NAME, FUNCTION_NAME -> DeclarationKind.CONST;
            case VARIABLE -> {
                if (isDestructured(definition.identifier())) {
                    yield DeclarationKind.DESTRUCTURED;
                }
                yield fromBinding(definition.declaration() == null ? null : definition.declaration().binding());
            }
        };
    }

    private static DeclarationKind fromBinding(@Nullable BindingKind binding) {
        if (binding == BindingKind.CONST) {
            return DeclarationKind.CONST;
        }
        if (binding == BindingKind.LET) {
            return DeclarationKind.LET;
        }
        return DeclarationKind.VAR;
    }

    private static boolean isDestructured(SyntaxNode identifier) {
        SyntaxNode parent = identifier.parent();
        if (parent == null) {
            return false;
        }
        if (parent.kind().isPattern()) {
            return true;
        }
        SyntaxNode grandparent = parent.parent();
        return grandparent != null && grandparent.kind().isPattern();
    }

    private static boolean isInsideNestedFunction(Scope scope, Scope functionScope) {
        for (Scope current = scope; current != null && current != functionScope; current = current.upper()) {
            if (current.isFunctionScope()) {
                return true;
            }
        }
        return false;
    }

    private static int levelBelow(Scope scope, Scope functionScope) {
        int level = 0;
        for (Scope current = scope; current != null && current != functionScope; current = current.upper()) {
            level++;
        }
        return level;
    }
}
