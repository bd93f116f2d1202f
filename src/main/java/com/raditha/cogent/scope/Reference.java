package com.raditha.cogent.scope;

import com.raditha.cogent.model.ReferenceKind;
import com.raditha.cogent.tree.SyntaxNode;

/**
 * A resolved use of a variable.
 *
 * @param identifier the identifier node
 * @param kind       read, write or read-write
 * @param from       innermost scope the identifier occurs in
 * @param resolved   the variable it resolves to
 */
public record Reference(SyntaxNode identifier, ReferenceKind kind, Scope from, Variable resolved) {
}
