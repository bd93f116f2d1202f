package com.raditha.cogent.complexity;

import org.junit.jupiter.api.Test;

import static com.raditha.cogent.tree.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class RecursionDetectorTest {

    @Test
    void testDirectCall() {
        assertTrue(RecursionDetector.isRecursiveCall(call(id("walk")), "walk"));
        assertFalse(RecursionDetector.isRecursiveCall(call(id("other")), "walk"));
    }

    @Test
    void testSelfMemberCall() {
        assertTrue(RecursionDetector.isRecursiveCall(call(member(self(), "walk")), "walk"));
        assertTrue(RecursionDetector.isRecursiveCall(call(computed(self(), lit("walk"))), "walk"));
        assertFalse(RecursionDetector.isRecursiveCall(call(member(id("other"), "walk")), "walk"));
    }

    @Test
    void testIndirectInvocation() {
        assertTrue(RecursionDetector.isRecursiveCall(call(member(id("walk"), "call"), self()), "walk"));
        assertTrue(RecursionDetector.isRecursiveCall(call(member(id("walk"), "apply")), "walk"));
        assertTrue(RecursionDetector.isRecursiveCall(call(member(member(self(), "walk"), "bind")), "walk"));
        assertFalse(RecursionDetector.isRecursiveCall(call(member(id("walk"), "toString")), "walk"));
    }

    @Test
    void testComputedInvokerName_IsNotIndirectInvocation() {
        assertFalse(RecursionDetector.isRecursiveCall(call(computed(id("walk"), lit("call"))), "walk"));
        assertFalse(RecursionDetector.isRecursiveCall(call(computed(id("walk"), lit("apply")), self()), "walk"));
        assertFalse(RecursionDetector.isRecursiveCall(
                call(computed(member(self(), "walk"), lit("bind"))), "walk"));
    }

    @Test
    void testAnonymousFunctionsNeverRecurse() {
        assertFalse(RecursionDetector.isRecursiveCall(call(id(FunctionNames.ANONYMOUS)), FunctionNames.ANONYMOUS));
        assertFalse(RecursionDetector.isRecursiveCall(call(id(FunctionNames.ARROW)), FunctionNames.ARROW));
    }
}
