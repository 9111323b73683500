package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

public record UnionCase(Optional<TokenRef> bar, String name, List<FieldDecl> fields, SourceRange range)
implements SyntaxNode {
    public UnionCase {
        fields = List.copyOf(fields);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNION_CASE;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(fields);
    }

    @Override
    public List<TokenRef> anchorTokens() {
        return Nodes.tokens(bar);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnionCase(this);
    }
}
