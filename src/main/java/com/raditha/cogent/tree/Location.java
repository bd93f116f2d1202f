package com.raditha.cogent.tree;

/**
 * Source position of a syntax node.
 *
 * @param startLine   first line (1-indexed, 0 when unknown)
 * @param startColumn first column
 * @param endLine     last line, inclusive
 * @param endColumn   last column
 */
public record Location(int startLine, int startColumn, int endLine, int endColumn) {

    /**
     * Stand-in for nodes that carry no position.
     */
    public static final Location ZERO = new Location(0, 0, 0, 0);

    public static Location of(int startLine, int endLine) {
        return new Location(startLine, 0, endLine, 0);
    }

    public boolean isKnown() {
        return startLine > 0;
    }

    /**
     * True when this location lies entirely before {@code from} or entirely after {@code to}.
     * Unknown locations are never outside.
     */
    public boolean isOutside(int from, int to) {
        return isKnown() && (endLine < from || startLine > to);
    }

    /**
     * True when this location starts and ends inside the line range.
     */
    public boolean isWithin(int from, int to) {
        return startLine >= from && endLine <= to;
    }

    public int getLineCount() {
        return endLine - startLine + 1;
    }

    @Override
    public String toString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }
}
