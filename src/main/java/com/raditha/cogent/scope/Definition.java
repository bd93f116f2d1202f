package com.raditha.cogent.scope;

import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

/**
 * One place a variable is bound.
 *
 * @param kind        what kind of construct binds it
 * @param identifier  the binding identifier
 * @param node        the defining construct: the function for parameters, the declarator
 *                    for variables, the catch clause for catch parameters
 * @param declaration the enclosing variable declaration, for {@link DefinitionKind#VARIABLE}
 */
public record Definition(
        DefinitionKind kind,
        SyntaxNode identifier,
        SyntaxNode node,
        @Nullable SyntaxNode declaration) {
}
