package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * {@code [<A; B(1)>]}
 */
public record AttributeList(List<Attribute> attributes, SourceRange range) implements SyntaxNode {
    public AttributeList {
        attributes = List.copyOf(attributes);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE_LIST;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(attributes);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAttributeList(this);
    }
}
