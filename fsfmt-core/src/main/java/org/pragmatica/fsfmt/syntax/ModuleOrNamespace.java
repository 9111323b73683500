package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Top-level module or namespace. Files without a header get an anonymous module.
 */
public record ModuleOrNamespace(Kind moduleKind,
                                Optional<TokenRef> keyword,
                                Optional<TokenRef> name,
                                String nameText,
                                boolean recursive,
                                List<ModuleDecl> decls,
                                SourceRange range) implements SyntaxNode {
    public enum Kind {
        ANONYMOUS_MODULE,
        NAMED_MODULE,
        NAMESPACE
    }

    public ModuleOrNamespace {
        decls = List.copyOf(decls);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE_OR_NAMESPACE;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(decls);
    }

    @Override
    public List<TokenRef> anchorTokens() {
        return Nodes.tokens(keyword, name);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitModuleOrNamespace(this);
    }
}
