package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

public record MatchClause(Optional<TokenRef> bar,
                          Pat pattern,
                          Optional<Expr> guard,
                          TokenRef arrow,
                          Expr body,
                          SourceRange range) implements SyntaxNode {
    @Override
    public NodeKind kind() {
        return NodeKind.MATCH_CLAUSE;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(pattern, guard, body);
    }

    @Override
    public List<TokenRef> anchorTokens() {
        return Nodes.tokens(bar, arrow);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatchClause(this);
    }
}
