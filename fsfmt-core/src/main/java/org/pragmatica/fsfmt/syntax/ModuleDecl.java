package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Declarations allowed at module level.
 */
public sealed interface ModuleDecl extends SyntaxNode {
    record Open(String name, SourceRange range) implements ModuleDecl {
        @Override
        public NodeKind kind() {
            return NodeKind.DECL_OPEN;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitOpen(this);
        }
    }

    record Let(List<AttributeList> attributes, boolean recursive, List<Binding> bindings, SourceRange range)
    implements ModuleDecl {
        public Let {
            attributes = List.copyOf(attributes);
            bindings = List.copyOf(bindings);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DECL_LET;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(attributes, bindings);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLetDecl(this);
        }
    }

    record Types(List<AttributeList> attributes, List<TypeDefn> definitions, SourceRange range) implements ModuleDecl {
        public Types {
            attributes = List.copyOf(attributes);
            definitions = List.copyOf(definitions);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DECL_TYPES;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(attributes, definitions);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypes(this);
        }
    }

    record NestedModule(String name, boolean recursive, TokenRef equals, List<ModuleDecl> decls, SourceRange range)
    implements ModuleDecl {
        public NestedModule {
            decls = List.copyOf(decls);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DECL_NESTED_MODULE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(decls);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(equals);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNestedModule(this);
        }
    }

    record DoExpr(Expr expr, SourceRange range) implements ModuleDecl {
        @Override
        public NodeKind kind() {
            return NodeKind.DECL_DO;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(expr);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDoExpr(this);
        }
    }

    /**
     * Compiler directive such as {@code #nowarn "40"}, kept verbatim.
     */
    record HashDirective(String text, SourceRange range) implements ModuleDecl {
        @Override
        public NodeKind kind() {
            return NodeKind.DECL_HASH_DIRECTIVE;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitHashDirective(this);
        }
    }
}
