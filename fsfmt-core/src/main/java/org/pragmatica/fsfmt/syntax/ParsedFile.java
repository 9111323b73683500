package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Root of a parsed source file.
 */
public record ParsedFile(List<ModuleOrNamespace> modules, SourceRange range) implements SyntaxNode {
    public ParsedFile {
        modules = List.copyOf(modules);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILE;
    }

    @Override
    public List<SyntaxNode> children() {
        return Nodes.children(modules);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFile(this);
    }
}
