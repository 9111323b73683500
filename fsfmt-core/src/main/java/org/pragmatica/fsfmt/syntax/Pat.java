package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Patterns of bindings, lambdas and match clauses.
 */
public sealed interface Pat extends SyntaxNode {
    record Wild(SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_WILD;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatWild(this);
        }
    }

    record Named(String name, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_NAMED;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatNamed(this);
        }
    }

    record Const(ConstValue value, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_CONST;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatConst(this);
        }
    }

    /**
     * Union case or function head with argument patterns: {@code Some x}, {@code f a b}.
     */
    record LongIdent(String name, List<Pat> args, SourceRange range) implements Pat {
        public LongIdent {
            args = List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PAT_LONG_IDENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(args);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatLongIdent(this);
        }
    }

    record Paren(TokenRef lparen, Pat inner, TokenRef rparen, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_PAREN;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(inner);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(lparen, rparen);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatParen(this);
        }
    }

    record Tuple(List<Pat> items, SourceRange range) implements Pat {
        public Tuple {
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PAT_TUPLE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(items);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatTuple(this);
        }
    }

    record Typed(Pat pattern, SynType type, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_TYPED;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(pattern, type);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatTyped(this);
        }
    }

    record ArrayOrList(boolean array,
                       TokenRef open,
                       List<Pat> items,
                       TokenRef close,
                       SourceRange range) implements Pat {
        public ArrayOrList {
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PAT_ARRAY_OR_LIST;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(items);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(open, close);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatArrayOrList(this);
        }
    }

    record Cons(Pat head, Pat tail, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_CONS;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(head, tail);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatCons(this);
        }
    }

    record Or(Pat left, Pat right, SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_OR;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(left, right);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatOr(this);
        }
    }

    record Null(SourceRange range) implements Pat {
        @Override
        public NodeKind kind() {
            return NodeKind.PAT_NULL;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPatNull(this);
        }
    }
}
