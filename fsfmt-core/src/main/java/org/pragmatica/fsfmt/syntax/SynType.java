package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Type expressions used in annotations, fields and abbreviations.
 */
public sealed interface SynType extends SyntaxNode {
    record LongIdent(String name, SourceRange range) implements SynType {
        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_LONG_IDENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeLongIdent(this);
        }
    }

    record Var(String name, SourceRange range) implements SynType {
        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_VAR;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeVar(this);
        }
    }

    /**
     * Generic application, prefix {@code Map<string, int>} or postfix {@code int list}.
     */
    record App(SynType type, List<SynType> args, boolean postfix, SourceRange range) implements SynType {
        public App {
            args = List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_APP;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(type, args);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeApp(this);
        }
    }

    record Fun(SynType argument, SynType result, SourceRange range) implements SynType {
        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_FUN;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(argument, result);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeFun(this);
        }
    }

    record Tuple(List<SynType> items, SourceRange range) implements SynType {
        public Tuple {
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_TUPLE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(items);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeTuple(this);
        }
    }

    record Array(SynType element, SourceRange range) implements SynType {
        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_ARRAY;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(element);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeArray(this);
        }
    }

    record Paren(SynType inner, SourceRange range) implements SynType {
        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_PAREN;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(inner);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTypeParen(this);
        }
    }
}
