package com.raditha.cogent.model;

import org.jspecify.annotations.Nullable;

/**
 * A variable name with its rendered type, if known.
 */
public record TypedVariable(String name, @Nullable String type) {

    /**
     * {@code name: type}, or just the name when the type is unknown.
     */
    public String toDeclaration() {
        return type != null ? name + ": " + type : name;
    }
}
