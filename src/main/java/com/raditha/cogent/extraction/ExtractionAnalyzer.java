package com.raditha.cogent.extraction;

import com.raditha.cogent.model.ComplexityPoint;
import com.raditha.cogent.model.ExtractionCandidate;
import com.raditha.cogent.model.ExtractionSuggestion;
import com.raditha.cogent.model.VariableFlowAnalysis;
import com.raditha.cogent.model.VariableInfo;
import com.raditha.cogent.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of extraction analysis: candidate ranges, their variable flow, and
 * a graded suggestion for each.
 */
public class ExtractionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionAnalyzer.class);

    private final ExtractionOptions options;
    private final BoundaryDetector boundaryDetector;
    private final VariableFlowAnalyzer flowAnalyzer = new VariableFlowAnalyzer();
    private final SuggestionGenerator suggestionGenerator = new SuggestionGenerator();

    public ExtractionAnalyzer() {
        this(ExtractionOptions.DEFAULTS);
    }

    public ExtractionAnalyzer(ExtractionOptions options) {
        this.options = options;
        this.boundaryDetector = new BoundaryDetector(options);
    }

    /**
     * Whether a function scoring {@code total} against a limit of {@code max} is far
     * enough over to be worth analyzing.
     */
    public boolean shouldAnalyze(int total, int max) {
        return total > max * options.multiplier();
    }

    /**
     * Suggestions for the function, one per selected candidate, in line order.
     *
     * @param function  the function literal
     * @param points    its cognitive points
     * @param total     its cognitive score
     * @param variables its tracked variables; nothing is suggested when empty
     */
    public List<ExtractionSuggestion> analyze(SyntaxNode function, List<ComplexityPoint> points, int total,
            Map<String, VariableInfo> variables) {
        if (variables.isEmpty()) {
            return List.of();
        }
        List<ExtractionCandidate> candidates = boundaryDetector.findCandidates(points, total);
        logger.debug("{} extraction candidates for function at {}", candidates.size(), function.location());

        List<ExtractionSuggestion> suggestions = new ArrayList<>();
        for (ExtractionCandidate candidate : candidates) {
            VariableFlowAnalysis flow = flowAnalyzer.analyze(candidate, variables, function);
            suggestions.add(suggestionGenerator.suggest(candidate, flow));
        }
        return suggestions;
    }
}
