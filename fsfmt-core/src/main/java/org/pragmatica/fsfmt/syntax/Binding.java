package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * One {@code let} or {@code and} binding: head pattern, optional return type and body.
 */
public record Binding(boolean mutable,
                      boolean inline,
                      Pat head,
                      Optional<SynType> returnType,
                      TokenRef equals,
                      Expr body,
                      SourceRange range) implements SyntaxNode {
    /**
     * Function bindings have a named head with at least one parameter pattern.
     */
    public boolean isFunction() {
        return head instanceof Pat.LongIdent longIdent && !longIdent.args()
                                                                     .isEmpty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINDING;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(head, returnType, body);
    }

    @Override
    public List<TokenRef> anchorTokens() {
        return List.of(equals);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinding(this);
    }
}
