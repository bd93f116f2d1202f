package com.raditha.cogent.model;

import java.util.List;

/**
 * How data flows into, out of and around a candidate range.
 *
 * @param inputs           declared before the range and read inside it
 * @param outputs          declared inside the range and used after it
 * @param internalOnly     declared inside the range and not used after it
 * @param mutations        writes to outer state made inside the range
 * @param closures         function literals in the range capturing mutable outer variables
 * @param hasEarlyReturn   the range returns somewhere other than its last line
 * @param hasSelfReference the range uses the enclosing receiver
 */
public record VariableFlowAnalysis(
        List<VariableInfo> inputs,
        List<VariableInfo> outputs,
        List<VariableInfo> internalOnly,
        List<MutationInfo> mutations,
        List<ClosureInfo> closures,
        boolean hasEarlyReturn,
        boolean hasSelfReference) {

    public VariableFlowAnalysis {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        internalOnly = List.copyOf(internalOnly);
        mutations = List.copyOf(mutations);
        closures = List.copyOf(closures);
    }
}
