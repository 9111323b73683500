package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.syntax.NodeKind;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.SyntaxNode;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.syntax.TokenRef;

/**
 * Identity of a trivia attachment point. Two anchors are equal when kind and range are equal,
 * so lookups work on any tree built from the same source.
 */
public sealed interface Anchor {
    SourceRange range();

    record NodeAnchor(NodeKind kind, SourceRange range) implements Anchor {}

    record TokenAnchor(TokenKind kind, SourceRange range) implements Anchor {}

    static Anchor of(SyntaxNode node) {
        return new NodeAnchor(node.kind(), node.range());
    }

    static Anchor of(TokenRef token) {
        return new TokenAnchor(token.kind(), token.range());
    }
}
