package com.raditha.cogent.model;

/**
 * A write, inside a candidate range, to state declared outside it.
 *
 * @param variable the variable written directly or through a member chain
 * @param line     line of the write
 * @param kind     how it is written
 */
public record MutationInfo(VariableInfo variable, int line, MutationKind kind) {

    /**
     * Key used to report each variable at most once per line.
     */
    public String key() {
        return variable.name() + ":" + line;
    }
}
