package com.raditha.cogent.model;

/**
 * A function literal inside a candidate range that captures a mutable outer variable.
 *
 * @param variable  the captured variable
 * @param startLine first line of the capturing literal
 * @param endLine   last line of the capturing literal
 */
public record ClosureInfo(VariableInfo variable, int startLine, int endLine) {
}
