package com.raditha.cogent.scope;

import com.raditha.cogent.model.ReferenceKind;
import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.Location;
import com.raditha.cogent.tree.NodeFlag;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds lexical scopes for a syntax tree and resolves every variable reference.
 * <p>
 * {@code var} bindings hoist to the nearest function scope, {@code let} and
 * {@code const} stay in their block. References are collected during one walk and
 * resolved afterwards, so uses that appear before a hoisted declaration still
 * resolve, while uses before a block-scoped declaration look further out. References that resolve to nothing (globals, fields) are dropped.
 */
public class ScopeAnalyzer implements ScopeProvider {

    private static final Logger logger = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private final Scope globalScope;
    private final Map<SyntaxNode, Scope> functionScopes = new IdentityHashMap<>();
    private final List<PendingReference> pending = new ArrayList<>();

    private record PendingReference(SyntaxNode identifier, ReferenceKind kind, Scope from) {
    }

    private ScopeAnalyzer(SyntaxNode root) {
        this.globalScope = new Scope(Scope.Kind.GLOBAL, root, null);
    }

    /**
     * Analyze a whole tree.
     */
    public static ScopeAnalyzer analyze(SyntaxNode root) {
        ScopeAnalyzer analyzer = new ScopeAnalyzer(root);
        analyzer.visitChildren(root, analyzer.globalScope);
        analyzer.resolveReferences();
        logger.debug("Built {} function scopes, {} references", analyzer.functionScopes.size(),
                analyzer.pending.size());
        return analyzer;
    }

    @Override
    public Optional<Scope> scopeOf(SyntaxNode function) {
        return Optional.ofNullable(functionScopes.get(function));
    }

    public Scope globalScope() {
        return globalScope;
    }

    private void visit(SyntaxNode node, Scope scope) {
        switch (node.kind()) {
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION -> visitFunction(node, scope);
            case CLASS_DECLARATION -> visitClass(node, scope);
            case VARIABLE_DECLARATION -> visitDeclaration(node, scope);
            case IMPORT_DECLARATION -> visitImport(node, scope);
            case BLOCK -> visitChildren(node, new Scope(Scope.Kind.BLOCK, node, scope));
            case FOR, FOR_IN, FOR_OF -> visitChildren(node, new Scope(Scope.Kind.FOR, node, scope));
            case SWITCH -> visitSwitch(node, scope);
            case CATCH -> visitCatch(node, scope);
            case IDENTIFIER -> visitIdentifier(node, scope);
            default -> visitChildren(node, scope);
        }
    }

    private void visitChildren(SyntaxNode node, Scope scope) {
        for (SyntaxNode child : node.children()) {
            visit(child, scope);
        }
    }

    private void visitFunction(SyntaxNode function, Scope outer) {
        SyntaxNode id = function.child(Role.ID);
        if (id != null && function.is(NodeKind.FUNCTION_DECLARATION)) {
            declare(outer, id, DefinitionKind.FUNCTION_NAME, function, null);
        }

        Scope scope = new Scope(Scope.Kind.FUNCTION, function, outer);
        functionScopes.put(function, scope);
        if (id != null && function.is(NodeKind.FUNCTION_EXPRESSION)) {
            declare(scope, id, DefinitionKind.FUNCTION_NAME, function, null);
        }

        for (SyntaxNode param : function.children(Role.PARAMS)) {
            declarePattern(param, scope, DefinitionKind.PARAMETER, function, null);
        }

        for (SyntaxNode child : function.children()) {
            if (child.role() == Role.ID || child.role() == Role.PARAMS) {
                continue;
            }
            if (child.role() == Role.BODY && child.is(NodeKind.BLOCK)) {
                // the body block shares the function scope
                visitChildren(child, scope);
            } else {
                visit(child, scope);
            }
        }
    }

    private void visitClass(SyntaxNode declaration, Scope outer) {
        SyntaxNode id = declaration.child(Role.ID);
        if (id != null) {
            declare(outer, id, DefinitionKind.CLASS_NAME, declaration, null);
        }
        Scope scope = new Scope(Scope.Kind.CLASS, declaration, outer);
        for (SyntaxNode child : declaration.children()) {
            if (child.role() != Role.ID) {
                visit(child, scope);
            }
        }
    }

    private void visitDeclaration(SyntaxNode declaration, Scope scope) {
        Scope target = declaration.binding() == BindingKind.VAR ? scope.variableScope() : scope;
        SyntaxNode parent = declaration.parent();
        boolean loopTarget = declaration.role() == Role.LEFT && parent != null
                && (parent.is(NodeKind.FOR_IN) || parent.is(NodeKind.FOR_OF));

        for (SyntaxNode declarator : declaration.children(Role.DECLARATIONS)) {
            SyntaxNode id = declarator.child(Role.ID);
            SyntaxNode init = declarator.child(Role.INIT);
            if (id != null) {
                List<SyntaxNode> bound = declarePattern(id, target, DefinitionKind.VARIABLE, declarator, declaration);
                if (init != null || loopTarget) {
                    for (SyntaxNode identifier : bound) {
                        pending.add(new PendingReference(identifier, ReferenceKind.WRITE, scope));
                    }
                }
            }
            if (init != null) {
                visit(init, scope);
            }
        }
    }

    private void visitImport(SyntaxNode declaration, Scope scope) {
        for (SyntaxNode specifier : declaration.children(Role.SPECIFIERS)) {
            if (specifier.is(NodeKind.IDENTIFIER)) {
                declare(scope, specifier, DefinitionKind.IMPORT_BINDING, declaration, null);
            }
        }
    }

    private void visitSwitch(SyntaxNode node, Scope scope) {
        Scope cases = new Scope(Scope.Kind.SWITCH, node, scope);
        for (SyntaxNode child : node.children()) {
            visit(child, child.role() == Role.DISCRIMINANT ? scope : cases);
        }
    }

    private void visitCatch(SyntaxNode node, Scope scope) {
        Scope catchScope = new Scope(Scope.Kind.CATCH, node, scope);
        for (SyntaxNode child : node.children()) {
            if (child.role() == Role.PARAM) {
                declarePattern(child, catchScope, DefinitionKind.CATCH_CLAUSE, node, null);
            } else {
                visit(child, catchScope);
            }
        }
    }

    private void visitIdentifier(SyntaxNode identifier, Scope scope) {
        if (identifier.name() == null || !isVariableOccurrence(identifier)) {
            return;
        }
        pending.add(new PendingReference(identifier, referenceKind(identifier), scope));
    }

    /**
     * Bind every identifier of a binding target, which may be a plain identifier or a
     * destructuring pattern with defaults.
     *
     * @return the identifiers bound
     */
    private List<SyntaxNode> declarePattern(SyntaxNode target, Scope scope, DefinitionKind kind,
                                            SyntaxNode definingNode, @Nullable SyntaxNode declaration) {
        List<SyntaxNode> bound = new ArrayList<>();
        bindTarget(target, scope, kind, definingNode, declaration, bound);
        return bound;
    }

    private void bindTarget(SyntaxNode target, Scope scope, DefinitionKind kind, SyntaxNode definingNode,
                            @Nullable SyntaxNode declaration, List<SyntaxNode> bound) {
        switch (target.kind()) {
            case IDENTIFIER -> {
                declare(scope, target, kind, definingNode, declaration);
                bound.add(target);
            }
            case OBJECT_PATTERN -> {
                for (SyntaxNode property : target.children(Role.PROPERTIES)) {
                    SyntaxNode value = property.is(NodeKind.PROPERTY) ? property.child(Role.VALUE) : property;
                    if (value != null) {
                        bindTarget(value, scope, kind, definingNode, declaration, bound);
                    }
                }
            }
            case ARRAY_PATTERN -> {
                for (SyntaxNode element : target.children(Role.ELEMENTS)) {
                    bindTarget(element, scope, kind, definingNode, declaration, bound);
                }
            }
            case ASSIGNMENT -> {
                SyntaxNode left = target.child(Role.LEFT);
                SyntaxNode right = target.child(Role.RIGHT);
                if (left != null) {
                    bindTarget(left, scope, kind, definingNode, declaration, bound);
                }
                if (right != null) {
                    visit(right, scope);
                }
            }
            default -> logger.debug("Ignoring unsupported binding target {}", target);
        }
    }

    private void declare(Scope scope, SyntaxNode identifier, DefinitionKind kind, SyntaxNode definingNode,
                         @Nullable SyntaxNode declaration) {
        if (identifier.name() == null) {
            return;
        }
        scope.declare(identifier.name()).addDefinition(new Definition(kind, identifier, definingNode, declaration));
    }

    private void resolveReferences() {
        for (PendingReference candidate : pending) {
            Variable variable = resolve(candidate);
            if (variable == null) {
                continue;
            }
            Reference reference = new Reference(candidate.identifier(), candidate.kind(), candidate.from(), variable);
            variable.addReference(reference);
            candidate.from().addReference(reference);
        }
    }

    /**
     * Like {@link Scope#resolve(String)}, but a block-scoped binding only covers uses at
     * or after its declaration. Earlier uses see the enclosing scopes instead.
     */
    private static @Nullable Variable resolve(PendingReference candidate) {
        SyntaxNode use = candidate.identifier();
        for (Scope current = candidate.from(); current != null; current = current.upper()) {
            Variable found = current.variable(use.name());
            if (found != null && !declaredAfter(found, use)) {
                return found;
            }
        }
        return null;
    }

    private static boolean declaredAfter(Variable variable, SyntaxNode use) {
        if (variable.definitions().isEmpty()) {
            return false;
        }
        Definition first = variable.definitions().get(0);
        SyntaxNode declaration = first.declaration();
        if (first.kind() != DefinitionKind.VARIABLE || declaration == null
                || declaration.binding() == BindingKind.VAR) {
            return false;
        }
        Location declared = first.identifier().location();
        Location used = use.location();
        if (!declared.isKnown() || !used.isKnown()) {
            return false;
        }
        return used.startLine() < declared.startLine()
                || (used.startLine() == declared.startLine() && used.startColumn() < declared.startColumn());
    }

    /**
     * False for identifiers that name members or keys rather than variables.
     */
    static boolean isVariableOccurrence(SyntaxNode identifier) {
        if (identifier.hasFlag(NodeFlag.MEMBER_NAME)) {
            return false;
        }
        SyntaxNode parent = identifier.parent();
        if (parent == null) {
            return true;
        }
        boolean computed = parent.hasFlag(NodeFlag.COMPUTED);
        if (identifier.role() == Role.PROPERTY && parent.is(NodeKind.MEMBER)) {
            return computed;
        }
        if (identifier.role() == Role.KEY) {
            return computed;
        }
        return true;
    }

    /**
     * Classify an identifier occurrence by its syntactic position.
     */
    static ReferenceKind referenceKind(SyntaxNode identifier) {
        SyntaxNode parent = identifier.parent();
        if (parent == null) {
            return ReferenceKind.READ;
        }
        if (parent.is(NodeKind.UPDATE) && identifier.role() == Role.ARGUMENT) {
            return ReferenceKind.READ_WRITE;
        }
        if (parent.is(NodeKind.ASSIGNMENT) && identifier.role() == Role.LEFT) {
            return "=".equals(parent.operator()) ? ReferenceKind.WRITE : ReferenceKind.READ_WRITE;
        }
        if ((parent.is(NodeKind.FOR_IN) || parent.is(NodeKind.FOR_OF)) && identifier.role() == Role.LEFT) {
            return ReferenceKind.WRITE;
        }
        return ReferenceKind.READ;
    }
}
