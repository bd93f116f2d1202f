package com.raditha.cogent.scope;

/**
 * Construct that introduced a variable binding.
 */
public enum DefinitionKind {
    PARAMETER,
    CATCH_CLAUSE,
    VARIABLE,
    IMPORT_BINDING,
    CLASS_NAME,
    FUNCTION_NAME
}
