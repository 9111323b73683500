package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

public record Attribute(String name, Optional<Expr> argument, SourceRange range) implements SyntaxNode {
    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(argument);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}
