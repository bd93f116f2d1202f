package com.raditha.cogent.complexity;

import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import static com.raditha.cogent.tree.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class PatternExclusionsTest {

    private final CognitiveScorer cognitive = new CognitiveScorer();
    private final CyclomaticScorer cyclomatic = new CyclomaticScorer();

    @Test
    void testDefaultValueInDeclaration() {
        SyntaxNode chain = logical("||", id("a"), array());
        declare(BindingKind.CONST, "x", chain);
        assertTrue(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testDefaultValueReassigningItself() {
        SyntaxNode chain = logical("??", id("x"), object());
        assign("=", id("x"), chain);
        assertTrue(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testAssignmentToAnotherVariable_IsNotExcluded() {
        SyntaxNode chain = logical("||", id("x"), array());
        assign("=", id("y"), chain);
        assertFalse(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testFallbackToCall_IsNotExcluded() {
        SyntaxNode chain = logical("||", id("a"), call(id("compute")));
        declare(BindingKind.CONST, "x", chain);
        assertFalse(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testAndChain_IsNeverADefault() {
        SyntaxNode chain = logical("&&", id("a"), lit(1));
        declare(BindingKind.CONST, "x", chain);
        assertFalse(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testDefaultValueOutsideDeclaration_IsNotExcluded() {
        SyntaxNode chain = logical("||", id("a"), lit("none"));
        call(id("use"), chain);
        assertFalse(PatternExclusions.isDefaultValueChain(chain));
    }

    @Test
    void testLongFallbackChain() {
        SyntaxNode inner = logical("??", id("a"), id("b"));
        SyntaxNode outer = logical("??", inner, object());
        declare(BindingKind.CONST, "x", outer);
        assertTrue(PatternExclusions.isDefaultValueChain(outer));
    }

    @Test
    void testMarkupGuard() {
        assertTrue(PatternExclusions.isMarkupChain(logical("&&", id("show"), markup())));
        assertTrue(PatternExclusions.isMarkupChain(
                logical("&&", id("a"), logical("&&", id("b"), markup()))));
        assertFalse(PatternExclusions.isMarkupChain(logical("||", id("show"), markup())));
        assertFalse(PatternExclusions.isMarkupChain(logical("&&", id("show"), id("panel"))));
    }

    @Test
    void testExcludedChainsCostNoCognitiveComplexity() {
        SyntaxNode f = function("f",
                declare(BindingKind.CONST, "items", logical("||", id("input"), array())),
                stmt(assign("=", id("opts"), logical("??", id("opts"), object()))),
                stmt(logical("&&", id("visible"), markup())));

        assertEquals(0, cognitive.score(f).total());
        assertEquals(4, cyclomatic.score(f).total());
    }

    @Test
    void testLogicalAssignmentCostsNoCognitiveComplexity() {
        SyntaxNode f = function("f", stmt(assign("||=", id("x"), lit(1))));

        assertEquals(0, cognitive.score(f).total());
        assertEquals(2, cyclomatic.score(f).total());
    }

    @Test
    void testNonLiteralFallbackStillCounts() {
        SyntaxNode f = function("f",
                declare(BindingKind.CONST, "x", logical("||", id("a"), call(id("compute")))));
        assertEquals(1, cognitive.score(f).total());
    }
}
