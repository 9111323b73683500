package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Field of a record type or of a union case. Union case fields may be anonymous.
 */
public record FieldDecl(boolean mutable, Optional<String> name, SynType type, SourceRange range) implements SyntaxNode {
    @Override
    public NodeKind kind() {
        return NodeKind.FIELD_DECL;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of(type);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFieldDecl(this);
    }
}
