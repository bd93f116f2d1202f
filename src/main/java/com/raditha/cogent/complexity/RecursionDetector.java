package com.raditha.cogent.complexity;

import com.raditha.cogent.tree.NodeFlag;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import com.raditha.cogent.tree.SyntaxTrees;

import java.util.Set;

/**
 * Recognizes calls that invoke the function they appear in.
 * <p>
 * Matches {@code name(...)}, {@code this.name(...)} and the indirect forms
 * {@code name.call(...)}, {@code name.apply(...)}, {@code name.bind(...)} and their
 * {@code this.name} counterparts. Anonymous functions never match.
 */
public final class RecursionDetector {

    private static final Set<String> INDIRECT_INVOKERS = Set.of("call", "apply", "bind");

    private RecursionDetector() {
    }

    public static boolean isRecursiveCall(SyntaxNode call, String functionName) {
        if (isAnonymous(functionName)) {
            return false;
        }
        SyntaxNode callee = call.child(Role.CALLEE);
        if (callee == null) {
            return false;
        }
        if (callee.is(NodeKind.IDENTIFIER)) {
            return functionName.equals(callee.name());
        }
        if (!callee.is(NodeKind.MEMBER)) {
            return false;
        }
        if (isSelfMember(callee, functionName)) {
            return true;
        }

        if (callee.hasFlag(NodeFlag.COMPUTED)) {
            return false;
        }
        String property = SyntaxTrees.propertyName(callee);
        SyntaxNode target = callee.child(Role.OBJECT);
        if (property == null || target == null || !INDIRECT_INVOKERS.contains(property)) {
            return false;
        }
        if (target.is(NodeKind.IDENTIFIER)) {
            return functionName.equals(target.name());
        }
        return target.is(NodeKind.MEMBER) && isSelfMember(target, functionName);
    }

    private static boolean isSelfMember(SyntaxNode member, String functionName) {
        SyntaxNode object = member.child(Role.OBJECT);
        return object != null && object.is(NodeKind.THIS) && functionName.equals(SyntaxTrees.propertyName(member));
    }

    private static boolean isAnonymous(String name) {
        return FunctionNames.ANONYMOUS.equals(name) || FunctionNames.ARROW.equals(name);
    }
}
