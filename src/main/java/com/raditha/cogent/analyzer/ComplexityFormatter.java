package com.raditha.cogent.analyzer;

import com.raditha.cogent.config.AnalysisConfig;
import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ComplexityResult;
import com.raditha.cogent.model.Confidence;
import com.raditha.cogent.model.ConstructKind;
import com.raditha.cogent.model.ExtractionIssue;
import com.raditha.cogent.model.ExtractionSuggestion;
import com.raditha.cogent.model.TypedVariable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders findings as text: headline, category summary, line breakdown, tips and
 * extraction advice.
 */
public class ComplexityFormatter {

    private static final int SUMMARY_CATEGORIES = 3;

    private final AnalysisConfig config;

    public ComplexityFormatter(AnalysisConfig config) {
        this.config = config;
    }

    public String cyclomaticMessage(ComplexityResult result) {
        return String.format("Function '%s' has cyclomatic complexity of %d. Maximum allowed is %d.",
                result.name(), result.cyclomatic(), config.maxCyclomatic())
                + summarize(result.cyclomaticPoints(), ComplexityPoint::label)
                + breakdown(result.cyclomaticPoints());
    }

    public String cognitiveMessage(ComplexityResult result, List<ExtractionSuggestion> suggestions) {
        return String.format("Function '%s' has Cognitive Complexity of %d. Maximum allowed is %d.",
                result.name(), result.cognitive(), config.maxCognitive())
                + summarize(result.cognitivePoints(), p -> p.construct().category())
                + breakdown(result.cognitivePoints())
                + tips(result.cognitivePoints())
                + extraction(suggestions);
    }

    /**
     * Top categories by summed contribution, e.g. {@code " [if: +3, for: +2]"}.
     * Empty when there are no points.
     */
    static String summarize(List<ComplexityPoint> points, Function<ComplexityPoint, String> category) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (ComplexityPoint point : points) {
            totals.merge(category.apply(point), point.contribution(), Integer::sum);
        }
        if (totals.isEmpty()) {
            return "";
        }
        return totals.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(SUMMARY_CATEGORIES)
                .map(e -> e.getKey() + ": +" + e.getValue())
                .collect(Collectors.joining(", ", " [", "]"));
    }

    /**
     * One line per point in line order. Points carrying the largest contribution are
     * marked as top offenders.
     */
    static String breakdown(List<ComplexityPoint> points) {
        if (points.isEmpty()) {
            return "";
        }
        int max = maxContribution(points);

        StringBuilder sb = new StringBuilder("\n\nBreakdown:");
        for (ComplexityPoint point : sortedByLine(points)) {
            boolean top = point.contribution() == max;
            sb.append('\n')
                    .append(top ? ">>>" : "   ")
                    .append(" Line ").append(point.line())
                    .append(": +").append(point.contribution())
                    .append(" for '").append(point.label()).append('\'');
            if (point.nestingLevel() > 0) {
                sb.append(" (incl. +").append(point.nestingLevel()).append(" nesting)");
            }
            if (top) {
                sb.append(" [top offender]");
            }
        }
        return sb.toString();
    }

    /**
     * Refactoring hints for the patterns that dominate a cognitive score. A threshold
     * of 0 switches the corresponding hint off.
     */
    String tips(List<ComplexityPoint> points) {
        if (points.isEmpty()) {
            return "";
        }
        List<String> tips = new ArrayList<>();

        ComplexityPoint top = topOffender(points);
        int nestingThreshold = config.nestingTipThreshold();
        if (nestingThreshold > 0 && top.nestingLevel() >= nestingThreshold) {
            tips.add(String.format(
                    "'%s' on line %d is nested %d levels deep; extract the nested block or use guard clauses",
                    top.label(), top.line(), top.nestingLevel()));
        }

        long elseIfs = points.stream().filter(p -> p.construct() == ConstructKind.ELSE_IF).count();
        int elseIfThreshold = config.elseIfChainThreshold();
        if (elseIfThreshold > 0 && elseIfs >= elseIfThreshold) {
            tips.add(String.format(
                    "%d else-if branches; a switch or a lookup table reads better", elseIfs));
        }

        long logical = points.stream().filter(p -> p.construct().isLogicalOperator()).count();
        int logicalThreshold = config.logicalOperatorThreshold();
        if (logicalThreshold > 0 && logical >= logicalThreshold) {
            tips.add(String.format(
                    "%d logical operator sequences; name the conditions with local variables or predicates",
                    logical));
        }

        if (tips.isEmpty()) {
            return "";
        }
        return tips.stream().map(t -> "\nTip: " + t).collect(Collectors.joining("", "\n", ""));
    }

    static String extraction(List<ExtractionSuggestion> suggestions) {
        if (suggestions.isEmpty()) {
            return "";
        }
        return suggestions.stream()
                .map(ComplexityFormatter::formatSuggestion)
                .collect(Collectors.joining("\n\n", "\n\nSmart extraction suggestions:\n\n", ""));
    }

    private static String formatSuggestion(ExtractionSuggestion suggestion) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("  Lines %d-%d: %s", suggestion.range().start(), suggestion.range().end(),
                suggestion.confidence().label()));
        lines.add(String.format("    Complexity: +%d (%d%% of total)", suggestion.complexity(),
                suggestion.percentage()));

        if (!suggestion.inputs().isEmpty()) {
            lines.add("    Inputs: " + variableList(suggestion.inputs()));
        }
        if (!suggestion.outputs().isEmpty()) {
            lines.add("    Outputs: " + variableList(suggestion.outputs()));
        }
        if (suggestion.suggestedSignature() != null) {
            lines.add("    Suggested: " + suggestion.suggestedSignature());
        }
        for (ExtractionIssue issue : suggestion.issues()) {
            String lineInfo = issue.line() != null ? " (line " + issue.line() + ")" : "";
            lines.add("    Issue: " + issue.description() + lineInfo);
        }
        if (suggestion.confidence() == Confidence.LOW) {
            for (String remedy : suggestion.suggestions()) {
                lines.add("    Suggestion: " + remedy);
            }
        }
        return String.join("\n", lines);
    }

    private static String variableList(List<TypedVariable> variables) {
        return variables.stream().map(TypedVariable::toDeclaration).collect(Collectors.joining(", "));
    }

    private static int maxContribution(List<ComplexityPoint> points) {
        return points.stream().mapToInt(ComplexityPoint::contribution).max().orElse(0);
    }

    /**
     * First point in line order with the largest contribution.
     */
    static ComplexityPoint topOffender(List<ComplexityPoint> points) {
        int max = maxContribution(points);
        return sortedByLine(points).stream()
                .filter(p -> p.contribution() == max)
                .findFirst()
                .orElseThrow();
    }

    private static List<ComplexityPoint> sortedByLine(List<ComplexityPoint> points) {
        return points.stream().sorted(Comparator.comparingInt(ComplexityPoint::line)).toList();
    }
}
