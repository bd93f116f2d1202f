package com.raditha.cogent.model;

/**
 * An inclusive range of source lines.
 *
 * @param start first line
 * @param end   last line, inclusive
 */
public record LineRange(int start, int end) {

    public boolean overlaps(LineRange other) {
        return start <= other.end && other.start <= end;
    }

    public boolean contains(int line) {
        return line >= start && line <= end;
    }

    public int getLineCount() {
        return end - start + 1;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
