package com.raditha.cogent.scope;

import com.raditha.cogent.java.JavaFixtures;
import com.raditha.cogent.model.ReferenceKind;
import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.cogent.tree.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class ScopeAnalyzerTest {

    @Test
    void testVarHoistsToFunctionScope() {
        SyntaxNode f = function("f",
                block(declare(BindingKind.VAR, "x", lit(1))),
                stmt(id("x")));
        ScopeAnalyzer analyzer = ScopeAnalyzer.analyze(program(f));

        Scope scope = analyzer.scopeOf(f).orElseThrow();
        Variable x = scope.variable("x");
        assertNotNull(x);
        assertEquals(2, x.references().size());
        assertEquals(ReferenceKind.WRITE, x.references().get(0).kind());
        assertEquals(ReferenceKind.READ, x.references().get(1).kind());
    }

    @Test
    void testUseBeforeHoistedDeclarationResolves() {
        SyntaxNode f = function("f",
                stmt(id("z")),
                declare(BindingKind.VAR, "z", lit(1)));
        Variable z = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow().variable("z");

        assertNotNull(z);
        assertEquals(2, z.references().size());
    }

    @Test
    void testLetStaysInItsBlock() {
        SyntaxNode inner = block(declare(BindingKind.LET, "y", lit(1)));
        SyntaxNode f = function("f", inner, stmt(id("y")));
        Scope scope = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow();

        assertNull(scope.variable("y"));
        Scope blockScope = scope.children().get(0);
        assertEquals(Scope.Kind.BLOCK, blockScope.kind());
        Variable y = blockScope.variable("y");
        assertNotNull(y);
        // the read outside the block resolves to nothing and is dropped
        assertEquals(1, y.references().size());
    }

    @Test
    void testParametersAndMemberNames() {
        SyntaxNode f = functionWithParams("f", List.of(id("obj")),
                declare(BindingKind.LET, "name", lit("x")),
                stmt(member(id("obj"), "name")));
        Scope scope = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow();

        Variable obj = scope.variable("obj");
        assertNotNull(obj);
        assertEquals(DefinitionKind.PARAMETER, obj.definitions().get(0).kind());
        assertSame(f, obj.definitions().get(0).node());
        assertEquals(1, obj.references().size());

        Variable name = scope.variable("name");
        assertNotNull(name);
        assertEquals(1, name.references().size(), "property names are not variable references");
    }

    @Test
    void testComputedMemberIsAReference() {
        SyntaxNode f = functionWithParams("f", List.of(id("items"), id("i")),
                stmt(computed(id("items"), id("i"))));
        Scope scope = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow();

        assertEquals(1, scope.variable("i").references().size());
    }

    @Test
    void testDestructuringPatternsBindEveryName() {
        SyntaxNode objectPattern = SyntaxNode.builder(NodeKind.OBJECT_PATTERN)
                .child(Role.PROPERTIES, SyntaxNode.builder(NodeKind.PROPERTY)
                        .child(Role.KEY, id("a"))
                        .child(Role.VALUE, id("a"))
                        .build())
                .child(Role.PROPERTIES, assign("=", id("b"), id("fallback")))
                .build();
        SyntaxNode arrayPattern = SyntaxNode.builder(NodeKind.ARRAY_PATTERN)
                .child(Role.ELEMENTS, id("c"))
                .build();
        SyntaxNode f = functionWithParams("f", List.of(id("src"), id("fallback")),
                declare(BindingKind.CONST, objectPattern, id("src")),
                declare(BindingKind.LET, arrayPattern, id("src")));
        Scope scope = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow();

        assertNotNull(scope.variable("a"));
        assertNotNull(scope.variable("b"));
        assertNotNull(scope.variable("c"));
        // the default value is read while binding
        assertEquals(1, scope.variable("fallback").references().size());
        assertEquals(2, scope.variable("src").references().size());
    }

    @Test
    void testCatchParameterLivesInCatchScope() {
        SyntaxNode handler = SyntaxNode.builder(NodeKind.CATCH)
                .child(Role.PARAM, id("e"))
                .child(Role.BODY, block(stmt(call(id("log"), id("e")))))
                .build();
        SyntaxNode tryNode = SyntaxNode.builder(NodeKind.TRY)
                .child(Role.BLOCK, block())
                .child(Role.HANDLER, handler)
                .build();
        SyntaxNode f = function("f", tryNode);
        Scope scope = ScopeAnalyzer.analyze(program(f)).scopeOf(f).orElseThrow();

        assertNull(scope.variable("e"));
        Scope catchScope = scope.children().stream()
                .filter(s -> s.kind() == Scope.Kind.CATCH)
                .findFirst()
                .orElseThrow();
        Variable e = catchScope.variable("e");
        assertNotNull(e);
        assertEquals(DefinitionKind.CATCH_CLAUSE, e.definitions().get(0).kind());
        assertEquals(1, e.references().size());
    }

    @Test
    void testReferenceFromNestedFunctionKeepsItsScope() {
        SyntaxNode callback = arrow(update(id("count")));
        SyntaxNode f = function("outer",
                declare(BindingKind.LET, "count", lit(0)),
                stmt(call(id("schedule"), callback)));
        ScopeAnalyzer analyzer = ScopeAnalyzer.analyze(program(f));

        Variable count = analyzer.scopeOf(f).orElseThrow().variable("count");
        Reference captured = count.references().get(1);
        assertEquals(ReferenceKind.READ_WRITE, captured.kind());
        assertSame(analyzer.scopeOf(callback).orElseThrow(), captured.from());
    }

    @Test
    void testFunctionNamesAndImports() {
        SyntaxNode importDeclaration = SyntaxNode.builder(NodeKind.IMPORT_DECLARATION)
                .name("java.util.Objects.requireNonNull")
                .child(Role.SPECIFIERS, id("requireNonNull"))
                .build();
        SyntaxNode f = function("f");
        ScopeAnalyzer analyzer = ScopeAnalyzer.analyze(program(importDeclaration, f));

        Scope global = analyzer.globalScope();
        assertEquals(DefinitionKind.IMPORT_BINDING,
                global.variable("requireNonNull").definitions().get(0).kind());
        assertEquals(DefinitionKind.FUNCTION_NAME, global.variable("f").definitions().get(0).kind());
    }

    @Test
    void testReferenceKind() {
        SyntaxNode plain = id("x");
        SyntaxNode assigned = id("x");
        SyntaxNode compound = id("x");
        SyntaxNode incremented = id("x");
        stmt(plain);
        assign("=", assigned, lit(1));
        assign("+=", compound, lit(1));
        update(incremented);

        assertEquals(ReferenceKind.READ, ScopeAnalyzer.referenceKind(plain));
        assertEquals(ReferenceKind.WRITE, ScopeAnalyzer.referenceKind(assigned));
        assertEquals(ReferenceKind.READ_WRITE, ScopeAnalyzer.referenceKind(compound));
        assertEquals(ReferenceKind.READ_WRITE, ScopeAnalyzer.referenceKind(incremented));
    }

    @Test
    void testScopeOf_UnknownNodeIsEmpty() {
        SyntaxNode f = function("f");
        ScopeAnalyzer analyzer = ScopeAnalyzer.analyze(program(f));

        assertTrue(analyzer.scopeOf(function("elsewhere")).isEmpty());
        assertTrue(ScopeProvider.none().scopeOf(f).isEmpty());
    }

    @Test
    void testJavaMethod_LocalsParametersAndFields() {
        SyntaxNode root = JavaFixtures.parse("""
                class Counter {
                    private int count;

                    int add(int delta) {
                        int before = this.count;
                        count = before + delta;
                        return count;
                    }
                }
                """);
        SyntaxNode add = JavaFixtures.method(root, "add");
        Scope scope = ScopeAnalyzer.analyze(root).scopeOf(add).orElseThrow();

        assertNotNull(scope.variable("delta"));
        Variable before = scope.variable("before");
        assertNotNull(before);
        assertEquals(2, before.references().size());
        // fields are not variables
        assertNull(scope.variable("count"));
        assertNull(scope.resolve("count"));
    }

    @Test
    void testJavaLocal_DoesNotCoverEarlierUseOfShadowedField() {
        SyntaxNode root = JavaFixtures.parse("""
                class Shadow {
                    int x;
                    int twice(int a) {
                        int y = x + a;
                        int x = y * 2;
                        return x;
                    }
                }
                """);
        SyntaxNode twice = JavaFixtures.method(root, "twice");
        Scope scope = ScopeAnalyzer.analyze(root).scopeOf(twice).orElseThrow();

        Variable x = scope.variable("x");
        assertNotNull(x);
        assertEquals(List.of(5, 6), x.references().stream()
                .map(r -> r.identifier().location().startLine())
                .toList());
        assertEquals(ReferenceKind.WRITE, x.references().get(0).kind());
        assertEquals(ReferenceKind.READ, x.references().get(1).kind());
    }
}
