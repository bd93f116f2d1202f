package com.raditha.cogent.extraction;

import com.raditha.cogent.model.ClosureInfo;
import com.raditha.cogent.model.Confidence;
import com.raditha.cogent.model.ExtractionCandidate;
import com.raditha.cogent.model.ExtractionIssue;
import com.raditha.cogent.model.ExtractionSuggestion;
import com.raditha.cogent.model.IssueType;
import com.raditha.cogent.model.MutationInfo;
import com.raditha.cogent.model.TypedVariable;
import com.raditha.cogent.model.VariableFlowAnalysis;
import com.raditha.cogent.model.VariableInfo;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Grades a candidate's flow analysis and writes the advice for it.
 */
public class SuggestionGenerator {

    /**
     * Name used in synthesized signatures. Choosing a good name is left to the reader.
     */
    public static final String PLACEHOLDER_NAME = "extracted";

    private static final int MAX_HIGH_CONFIDENCE_INPUTS = 3;
    private static final int MAX_HIGH_CONFIDENCE_OUTPUTS = 1;
    private static final int MAX_MEDIUM_CONFIDENCE_INPUTS = 5;
    private static final int MAX_MEDIUM_CONFIDENCE_OUTPUTS = 2;

    public ExtractionSuggestion suggest(ExtractionCandidate candidate, VariableFlowAnalysis flow) {
        Confidence confidence = confidence(flow);
        List<ExtractionIssue> issues = issues(flow);
        List<TypedVariable> inputs = flow.inputs().stream().map(VariableInfo::toTyped).toList();
        List<TypedVariable> outputs = flow.outputs().stream().map(VariableInfo::toTyped).toList();

        String signature = null;
        if (confidence != Confidence.LOW && issues.isEmpty()) {
            signature = signature(inputs, outputs);
        }

        return new ExtractionSuggestion(
                candidate.range(),
                candidate.complexity(),
                candidate.percentage(),
                confidence,
                inputs,
                outputs,
                signature,
                issues,
                remedies(issues));
    }

    static Confidence confidence(VariableFlowAnalysis flow) {
        int inputs = flow.inputs().size();
        int outputs = flow.outputs().size();
        if (inputs > MAX_MEDIUM_CONFIDENCE_INPUTS || outputs > MAX_MEDIUM_CONFIDENCE_OUTPUTS
                || !flow.mutations().isEmpty() || !flow.closures().isEmpty()) {
            return Confidence.LOW;
        }
        if (inputs > MAX_HIGH_CONFIDENCE_INPUTS || outputs > MAX_HIGH_CONFIDENCE_OUTPUTS || flow.hasEarlyReturn()) {
            return Confidence.MEDIUM;
        }
        return Confidence.HIGH;
    }

    private static List<ExtractionIssue> issues(VariableFlowAnalysis flow) {
        List<ExtractionIssue> issues = new ArrayList<>();
        for (MutationInfo mutation : flow.mutations()) {
            String name = mutation.variable().name();
            issues.add(new ExtractionIssue(IssueType.MUTATION,
                    "Mutates external variable '" + name + "'", mutation.line(), name));
        }
        for (ClosureInfo closure : flow.closures()) {
            String name = closure.variable().name();
            issues.add(new ExtractionIssue(IssueType.CLOSURE,
                    "Closure captures mutable variable '" + name + "'", closure.startLine(), name));
        }
        if (flow.inputs().size() > MAX_MEDIUM_CONFIDENCE_INPUTS) {
            issues.add(ExtractionIssue.of(IssueType.TOO_MANY_PARAMS,
                    "Would require " + flow.inputs().size() + " parameters"));
        }
        if (flow.outputs().size() > MAX_MEDIUM_CONFIDENCE_OUTPUTS) {
            issues.add(ExtractionIssue.of(IssueType.MULTIPLE_OUTPUTS,
                    "Would require returning " + flow.outputs().size() + " values"));
        }
        if (flow.hasEarlyReturn()) {
            issues.add(ExtractionIssue.of(IssueType.EARLY_RETURN,
                    "Contains early return statements that complicate extraction"));
        }
        if (flow.hasSelfReference()) {
            issues.add(ExtractionIssue.of(IssueType.SELF_REFERENCE,
                    "References the enclosing receiver ('this'), which an extracted function would not share"));
        }
        return issues;
    }

    private static List<String> remedies(List<ExtractionIssue> issues) {
        Set<String> remedies = new LinkedHashSet<>();
        for (ExtractionIssue issue : issues) {
            remedies.add(issue.type().remedy(issue.variable() == null ? "" : issue.variable()));
        }
        return new ArrayList<>(remedies);
    }

    static String signature(List<TypedVariable> inputs, List<TypedVariable> outputs) {
        String params = inputs.stream().map(TypedVariable::toDeclaration).collect(Collectors.joining(", "));
        return PLACEHOLDER_NAME + "(" + params + "): " + returnType(outputs);
    }

    private static String returnType(List<TypedVariable> outputs) {
        if (outputs.isEmpty()) {
            return "void";
        }
        if (outputs.size() == 1) {
            @Nullable String type = outputs.get(0).type();
            return type != null ? type : TypeRenderer.UNKNOWN;
        }
        return "{ " + outputs.stream().map(TypedVariable::toDeclaration).collect(Collectors.joining(", ")) + " }";
    }
}
