package com.raditha.cogent.extraction;

import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.stream.Collectors;

/**
 * Renders a declared type as short readable text for signatures and reports.
 */
public final class TypeRenderer {

    static final String UNKNOWN = "unknown";

    private TypeRenderer() {
    }

    /**
     * The declared type of a binding identifier, or null when it has none.
     */
    public static @Nullable String annotationOf(SyntaxNode identifier) {
        SyntaxNode annotation = identifier.child(Role.TYPE_ANNOTATION);
        return annotation == null ? null : render(annotation);
    }

    public static String render(SyntaxNode type) {
        return switch (type.kind()) {
            case TYPE_KEYWORD, TYPE_REFERENCE -> type.name() != null ? type.name() : UNKNOWN;
            case TYPE_ARRAY -> {
                SyntaxNode element = type.child(Role.ELEMENT_TYPE);
                yield (element == null ? UNKNOWN : render(element)) + "[]";
            }
            case TYPE_UNION -> join(type, " | ");
            case TYPE_INTERSECTION -> join(type, " & ");
            default -> UNKNOWN;
        };
    }

    private static String join(SyntaxNode type, String separator) {
        return type.children(Role.TYPES).stream()
                .map(TypeRenderer::render)
                .collect(Collectors.joining(separator));
    }
}
