package com.raditha.cogent.extraction;

import com.raditha.cogent.model.ClosureInfo;
import com.raditha.cogent.model.ExtractionCandidate;
import com.raditha.cogent.model.MutationInfo;
import com.raditha.cogent.model.MutationKind;
import com.raditha.cogent.model.ReferenceKind;
import com.raditha.cogent.model.VariableFlowAnalysis;
import com.raditha.cogent.model.VariableInfo;
import com.raditha.cogent.model.VariableReference;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import com.raditha.cogent.tree.SyntaxTrees;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Works out how a candidate range would connect to the rest of its function if it were
 * pulled out: what flows in, what flows out, and what makes the move unsafe.
 */
public class VariableFlowAnalyzer {

    /**
     * Method names that change the receiver, for arrays, maps, sets and Java collections.
     */
    static final Set<String> MUTATING_METHODS = Set.of(
            "push", "pop", "shift", "unshift", "splice", "sort", "reverse", "fill", "copyWithin",
            "set", "add", "delete", "clear",
            "put", "putAll", "putIfAbsent", "remove", "removeIf", "addAll", "removeAll", "retainAll",
            "replaceAll", "compute", "computeIfAbsent", "computeIfPresent", "merge", "offer", "poll");

    private interface MutationCheck {
        @Nullable MutationInfo check(SyntaxNode node, Map<String, VariableInfo> variables, int start, int end);
    }

    private static final Map<NodeKind, MutationCheck> MUTATION_CHECKS = new EnumMap<>(NodeKind.class);

    static {
        MUTATION_CHECKS.put(NodeKind.ASSIGNMENT, VariableFlowAnalyzer::memberAssignment);
        MUTATION_CHECKS.put(NodeKind.UPDATE, VariableFlowAnalyzer::memberUpdate);
        MUTATION_CHECKS.put(NodeKind.CALL, VariableFlowAnalyzer::mutatingCall);
    }

    public VariableFlowAnalysis analyze(ExtractionCandidate candidate, Map<String, VariableInfo> variables,
            SyntaxNode function) {
        int start = candidate.startLine();
        int end = candidate.endLine();

        List<VariableInfo> inputs = new ArrayList<>();
        List<VariableInfo> outputs = new ArrayList<>();
        List<VariableInfo> internal = new ArrayList<>();
        for (VariableInfo variable : variables.values()) {
            boolean declaredBefore = variable.declarationLine() < start;
            if (declaredBefore && variable.isReadWithin(start, end)) {
                inputs.add(variable);
            } else if (variable.isDeclaredWithin(start, end)) {
                if (variable.isUsedAfter(end)) {
                    outputs.add(variable);
                } else {
                    internal.add(variable);
                }
            }
        }

        return new VariableFlowAnalysis(
                inputs,
                outputs,
                internal,
                mutations(variables, function, start, end),
                closures(variables, start, end),
                hasEarlyReturn(function, start, end),
                hasSelfReference(function, start, end));
    }

    private static List<MutationInfo> mutations(Map<String, VariableInfo> variables, SyntaxNode function,
            int start, int end) {
        Map<String, MutationInfo> unique = new LinkedHashMap<>();

        for (VariableInfo variable : variables.values()) {
            if (variable.isDeclaredWithin(start, end)) {
                continue;
            }
            for (VariableReference ref : variable.references()) {
                if (ref.kind().isWrite() && ref.isWithin(start, end)) {
                    MutationKind kind = ref.kind() == ReferenceKind.READ_WRITE
                            ? MutationKind.INCREMENT
                            : MutationKind.ASSIGNMENT;
                    MutationInfo mutation = new MutationInfo(variable, ref.line(), kind);
                    unique.putIfAbsent(mutation.key(), mutation);
                }
            }
        }

        walkInRange(function, start, end, VariableFlowAnalyzer::isNestedFunction, node -> {
            MutationCheck check = MUTATION_CHECKS.get(node.kind());
            if (check != null) {
                MutationInfo mutation = check.check(node, variables, start, end);
                if (mutation != null) {
                    unique.putIfAbsent(mutation.key(), mutation);
                }
            }
        });
        return new ArrayList<>(unique.values());
    }

    private static @Nullable MutationInfo memberAssignment(SyntaxNode node, Map<String, VariableInfo> variables,
            int start, int end) {
        return memberMutation(node.child(Role.LEFT), node, MutationKind.ASSIGNMENT, variables, start, end);
    }

    private static @Nullable MutationInfo memberUpdate(SyntaxNode node, Map<String, VariableInfo> variables,
            int start, int end) {
        return memberMutation(node.child(Role.ARGUMENT), node, MutationKind.INCREMENT, variables, start, end);
    }

    private static @Nullable MutationInfo mutatingCall(SyntaxNode node, Map<String, VariableInfo> variables,
            int start, int end) {
        SyntaxNode callee = node.child(Role.CALLEE);
        if (callee == null || !callee.is(NodeKind.MEMBER)) {
            return null;
        }
        SyntaxNode property = callee.child(Role.PROPERTY);
        if (property == null || !property.is(NodeKind.IDENTIFIER) || !MUTATING_METHODS.contains(property.name())) {
            return null;
        }
        return memberMutation(callee, node, MutationKind.METHOD_CALL, variables, start, end);
    }

    private static @Nullable MutationInfo memberMutation(@Nullable SyntaxNode target, SyntaxNode at,
            MutationKind kind, Map<String, VariableInfo> variables, int start, int end) {
        if (target == null || !target.is(NodeKind.MEMBER)) {
            return null;
        }
        String root = SyntaxTrees.rootIdentifier(target);
        VariableInfo variable = root == null ? null : variables.get(root);
        if (variable == null || variable.isDeclaredWithin(start, end)) {
            return null;
        }
        return new MutationInfo(variable, at.location().startLine(), kind);
    }

    private static List<ClosureInfo> closures(Map<String, VariableInfo> variables, int start, int end) {
        List<ClosureInfo> closures = new ArrayList<>();
        for (VariableInfo variable : variables.values()) {
            if (!variable.mutable() || !isReassigned(variable) || variable.declarationLine() >= start) {
                continue;
            }
            Stream.concat(variable.references().stream(), variable.capturedReferences().stream())
                    .filter(ref -> ref.isWithin(start, end))
                    .map(ref -> enclosingClosure(ref.node(), start, end))
                    .filter(Objects::nonNull)
                    .findFirst()
                    .ifPresent(closure -> closures.add(new ClosureInfo(variable,
                            closure.location().startLine(), closure.location().endLine())));
        }
        return closures;
    }

    /**
     * True when the variable is written anywhere other than where it is bound. A local
     * that is never reassigned behaves as a constant when a lambda captures it.
     */
    static boolean isReassigned(VariableInfo variable) {
        return Stream.concat(variable.references().stream(), variable.capturedReferences().stream())
                .anyMatch(ref -> ref.kind().isWrite() && !isBindingSite(ref.node()));
    }

    private static boolean isBindingSite(SyntaxNode identifier) {
        SyntaxNode current = identifier;
        SyntaxNode parent = current.parent();
        while (parent != null && (parent.kind().isPattern() || parent.is(NodeKind.PROPERTY)
                || (parent.is(NodeKind.ASSIGNMENT) && current.role() == Role.LEFT))) {
            current = parent;
            parent = current.parent();
        }
        return parent != null && parent.is(NodeKind.VARIABLE_DECLARATOR) && current.role() == Role.ID;
    }

    private static @Nullable SyntaxNode enclosingClosure(SyntaxNode identifier, int start, int end) {
        for (SyntaxNode current = identifier.parent(); current != null; current = current.parent()) {
            boolean literal = current.is(NodeKind.FUNCTION_EXPRESSION) || current.is(NodeKind.ARROW_FUNCTION);
            if (literal && current.location().isWithin(start, end)) {
                return current;
            }
        }
        return null;
    }

    private static boolean hasEarlyReturn(SyntaxNode function, int start, int end) {
        List<SyntaxNode> returns = new ArrayList<>();
        walkInRange(function, start, end, VariableFlowAnalyzer::isNestedFunction, node -> {
            int line = node.location().startLine();
            if (node.is(NodeKind.RETURN) && node.location().isKnown() && line >= start && line <= end) {
                returns.add(node);
            }
        });
        if (returns.isEmpty()) {
            return false;
        }
        if (returns.size() > 1) {
            return true;
        }
        return returns.get(0).location().startLine() < end - 1;
    }

    /**
     * Functions that bind their own receiver hide the enclosing one; arrow literals do not.
     */
    private static boolean hasSelfReference(SyntaxNode function, int start, int end) {
        boolean[] found = {false};
        Predicate<SyntaxNode> rebinds = node ->
                isNestedFunction(node) && node.kind().receiverBinding() == NodeKind.ReceiverBinding.REBINDING;
        walkInRange(function, start, end, rebinds, node -> {
            if (node.is(NodeKind.THIS)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    private static boolean isNestedFunction(SyntaxNode node) {
        return node.kind().isFunction();
    }

    /**
     * Visit the function's nodes that touch the range, not descending into pruned nodes.
     * The function itself is never pruned.
     */
    private static void walkInRange(SyntaxNode function, int start, int end, Predicate<SyntaxNode> prune,
            Consumer<SyntaxNode> visitor) {
        SyntaxTrees.walk(function,
                node -> node.location().isOutside(start, end) || prune.test(node),
                visitor);
    }
}
