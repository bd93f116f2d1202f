package com.raditha.cogent.complexity;

import com.raditha.cogent.java.JavaFixtures;
import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.NodeFlag;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import com.raditha.cogent.tree.SyntaxTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.cogent.tree.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class FunctionNamesTest {

    @Test
    void testOwnIdentifier() {
        assertEquals("alpha", FunctionNames.resolve(function("alpha")));
    }

    @Test
    void testNamedByVariable() {
        SyntaxNode handler = arrow(block());
        declare(BindingKind.CONST, "handler", handler);
        assertEquals("handler", FunctionNames.resolve(handler));
    }

    @Test
    void testNamedByPropertyKey() {
        SyntaxNode value = functionExpression();
        SyntaxNode.builder(NodeKind.PROPERTY).child(Role.KEY, id("onClick")).child(Role.VALUE, value).build();
        assertEquals("onClick", FunctionNames.resolve(value));
    }

    @Test
    void testNamedByAssignmentTarget() {
        SyntaxNode value = functionExpression();
        assign("=", id("callback"), value);
        assertEquals("callback", FunctionNames.resolve(value));
    }

    @Test
    void testMemberAssignmentTargetGivesNoName() {
        SyntaxNode value = arrow(block());
        assign("=", member(self(), "callback"), value);
        assertEquals(FunctionNames.ARROW, FunctionNames.resolve(value));
    }

    @Test
    void testMethodDefinitions() {
        SyntaxNode method = functionExpression();
        SyntaxNode.builder(NodeKind.METHOD_DEFINITION).child(Role.KEY, id("render")).child(Role.VALUE, method).build();
        assertEquals("render", FunctionNames.resolve(method));

        SyntaxNode constructor = functionExpression();
        SyntaxNode.builder(NodeKind.METHOD_DEFINITION)
                .flag(NodeFlag.CONSTRUCTOR)
                .child(Role.VALUE, constructor)
                .build();
        assertEquals(FunctionNames.CONSTRUCTOR, FunctionNames.resolve(constructor));
    }

    @Test
    void testClassField() {
        SyntaxNode value = arrow(block());
        SyntaxNode.builder(NodeKind.PROPERTY_DEFINITION).child(Role.KEY, id("onLoad")).child(Role.VALUE, value).build();
        assertEquals("onLoad", FunctionNames.resolve(value));
    }

    @Test
    void testAnonymousMarkers() {
        assertEquals(FunctionNames.ARROW, FunctionNames.resolve(arrow(block())));
        assertEquals(FunctionNames.ANONYMOUS, FunctionNames.resolve(functionExpression()));

        SyntaxNode argument = functionExpression();
        call(id("run"), argument);
        assertEquals(FunctionNames.ANONYMOUS, FunctionNames.resolve(argument));
    }

    @Test
    void testJavaMembers() {
        SyntaxNode root = JavaFixtures.parse("""
                class Widget {
                    private final Runnable onClose = () -> close();

                    Widget() {
                    }

                    void close() {
                    }
                }
                """);
        List<String> names = SyntaxTrees.functions(root).stream().map(FunctionNames::resolve).toList();
        assertEquals(List.of("onClose", "Widget", "close"), names);
    }
}
