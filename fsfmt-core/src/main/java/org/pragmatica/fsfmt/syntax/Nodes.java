package org.pragmatica.fsfmt.syntax;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for assembling child and token lists of syntax nodes.
 */
final class Nodes {
    private Nodes() {}

    static List<SyntaxNode> children(Object... parts) {
        var result = new ArrayList<SyntaxNode>();
        for (var part : parts) {
            collect(part, result, SyntaxNode.class);
        }
        return result;
    }

    static List<TokenRef> tokens(Object... parts) {
        var result = new ArrayList<TokenRef>();
        for (var part : parts) {
            collect(part, result, TokenRef.class);
        }
        return result;
    }

    private static <T> void collect(Object part, List<T> result, Class<T> type) {
        if (part == null) {
            return;
        }
        if (type.isInstance(part)) {
            result.add(type.cast(part));
        } else if (part instanceof Optional<?> optional) {
            optional.ifPresent(value -> collect(value, result, type));
        } else if (part instanceof Collection<?> collection) {
            collection.forEach(value -> collect(value, result, type));
        }
    }
}
