package com.raditha.cogent.model;

/**
 * Reasons an extraction is not straightforward, each with its remedy template.
 * A {@code %s} in the template is replaced by the variable involved.
 */
public enum IssueType {
    MUTATION("mutation", "Consider returning '%s' instead of mutating it"),
    CLOSURE("closure", "Pass '%s' as a parameter instead of closing over it"),
    TOO_MANY_PARAMS("too-many-params", "Consider grouping related parameters into an options object"),
    MULTIPLE_OUTPUTS("multiple-outputs", "Consider using a single object return type"),
    EARLY_RETURN("early-return", "Consider restructuring to avoid early returns, or handle them explicitly"),
    SELF_REFERENCE("self-reference",
            "Pass the receiver in explicitly or keep the extracted code as a method of the same type");

    private final String tag;
    private final String remedy;

    IssueType(String tag, String remedy) {
        this.tag = tag;
        this.remedy = remedy;
    }

    public String tag() {
        return tag;
    }

    public String remedy(String variable) {
        return remedy.contains("%s") ? String.format(remedy, variable) : remedy;
    }
}
