package com.raditha.cogent.model;

import com.raditha.cogent.tree.Location;
import org.jspecify.annotations.Nullable;

/**
 * One contribution to a complexity score.
 *
 * @param construct    the construct charged
 * @param detail       label name for labeled jumps, otherwise null
 * @param amount       base increment
 * @param nestingLevel nesting penalty added on top of the base (0 for flat points)
 * @param location     where the construct is
 */
public record ComplexityPoint(
        ConstructKind construct,
        @Nullable String detail,
        int amount,
        int nestingLevel,
        Location location) {

    public static ComplexityPoint flat(ConstructKind construct, Location location) {
        return new ComplexityPoint(construct, null, 1, 0, location);
    }

    public static ComplexityPoint structural(ConstructKind construct, int nestingLevel, Location location) {
        return new ComplexityPoint(construct, null, 1, nestingLevel, location);
    }

    /**
     * Total this point adds to the score.
     */
    public int contribution() {
        return amount + nestingLevel;
    }

    public String tag() {
        return construct.tag();
    }

    public String label() {
        return construct.label(detail);
    }

    public int line() {
        return location.startLine();
    }
}
