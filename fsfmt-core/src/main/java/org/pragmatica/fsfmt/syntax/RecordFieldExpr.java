package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * {@code Name = value} inside a record expression.
 */
public record RecordFieldExpr(String name, TokenRef equals, Expr value, SourceRange range) implements SyntaxNode {
    @Override
    public NodeKind kind() {
        return NodeKind.RECORD_FIELD;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of(value);
    }

    @Override
    public List<TokenRef> anchorTokens() {
        return List.of(equals);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRecordField(this);
    }
}
