package org.pragmatica.fsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Expressions.
 */
public sealed interface Expr extends SyntaxNode {
    record Const(ConstValue value, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_CONST;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConst(this);
        }
    }

    /**
     * Identifier or dotted long identifier such as {@code List.map}.
     */
    record Ident(String name, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_IDENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIdent(this);
        }
    }

    record Null(SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_NULL;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record Paren(TokenRef lparen, Expr inner, TokenRef rparen, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_PAREN;
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
            return visitor.visitParen(this);
        }
    }

    record Typed(Expr expr, SynType type, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_TYPED;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(expr, type);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTyped(this);
        }
    }

    record Tuple(List<Expr> items, List<TokenRef> commas, SourceRange range) implements Expr {
        public Tuple {
            items = List.copyOf(items);
            commas = List.copyOf(commas);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_TUPLE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(items);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return commas;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record ArrayOrList(boolean array,
                       TokenRef open,
                       List<Expr> items,
                       TokenRef close,
                       SourceRange range) implements Expr {
        public ArrayOrList {
            items = List.copyOf(items);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_ARRAY_OR_LIST;
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
            return visitor.visitArrayOrList(this);
        }
    }

    /**
     * Record construction, optionally copy-and-update: {@code { r with A = 1 }}.
     */
    record RecordExpr(TokenRef lbrace,
                      Optional<Expr> copyFrom,
                      List<RecordFieldExpr> fields,
                      TokenRef rbrace,
                      SourceRange range) implements Expr {
        public RecordExpr {
            fields = List.copyOf(fields);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_RECORD;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(copyFrom, fields);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(lbrace, rbrace);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRecord(this);
        }
    }

    /**
     * Braced computation body, the argument of a builder such as {@code seq { ... }}.
     */
    record Computation(TokenRef lbrace, Expr body, TokenRef rbrace, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_COMPUTATION;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(body);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(lbrace, rbrace);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitComputation(this);
        }
    }

    /**
     * Function application. High precedence application {@code f(x)} has no space before the argument.
     */
    record App(Expr function, List<Expr> args, boolean highPrecedence, SourceRange range) implements Expr {
        public App {
            args = List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_APP;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(function, args);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitApp(this);
        }
    }

    record Infix(String operator, SourceRange operatorRange, Expr left, Expr right, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_INFIX;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(left, right);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInfix(this);
        }
    }

    record Prefix(String operator, Expr operand, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_PREFIX;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(operand);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPrefix(this);
        }
    }

    record DotGet(Expr target, String member, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_DOT_GET;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(target);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDotGet(this);
        }
    }

    record Lambda(TokenRef fun, List<Pat> parameters, TokenRef arrow, Expr body, SourceRange range) implements Expr {
        public Lambda {
            parameters = List.copyOf(parameters);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_LAMBDA;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(parameters, body);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(fun, arrow);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    record MatchLambda(TokenRef function, List<MatchClause> clauses, SourceRange range) implements Expr {
        public MatchLambda {
            clauses = List.copyOf(clauses);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_MATCH_LAMBDA;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(clauses);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(function);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMatchLambda(this);
        }
    }

    record Match(TokenRef match,
                 Expr subject,
                 TokenRef with,
                 List<MatchClause> clauses,
                 SourceRange range) implements Expr {
        public Match {
            clauses = List.copyOf(clauses);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_MATCH;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(subject, clauses);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(match, with);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    /**
     * Conditional. An {@code elif} branch is a nested conditional whose keyword is {@code ELIF}
     * and whose parent has no else keyword.
     */
    record IfThenElse(TokenRef ifKeyword,
                      Expr condition,
                      TokenRef then,
                      Expr thenBranch,
                      Optional<TokenRef> elseKeyword,
                      Optional<Expr> elseBranch,
                      SourceRange range) implements Expr {
        public boolean isElif() {
            return ifKeyword.kind() == TokenKind.ELIF;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_IF_THEN_ELSE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(condition, thenBranch, elseBranch);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return Nodes.tokens(ifKeyword, then, elseKeyword);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIfThenElse(this);
        }
    }

    record LetOrUse(boolean use,
                    boolean recursive,
                    List<Binding> bindings,
                    Expr body,
                    SourceRange range) implements Expr {
        public LetOrUse {
            bindings = List.copyOf(bindings);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_LET_OR_USE;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(bindings, body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLetOrUse(this);
        }
    }

    record Sequential(Expr first, Expr second, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_SEQUENTIAL;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(first, second);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSequential(this);
        }
    }

    record ForEach(Pat pattern, Expr enumerable, Expr body, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_FOR_EACH;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(pattern, enumerable, body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitForEach(this);
        }
    }

    record While(Expr condition, Expr body, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_WHILE;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(condition, body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record TryWith(TokenRef tryKeyword,
                   Expr body,
                   TokenRef with,
                   List<MatchClause> clauses,
                   SourceRange range) implements Expr {
        public TryWith {
            clauses = List.copyOf(clauses);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_TRY_WITH;
        }

        @Override
        public List<SyntaxNode> children() {
            return Nodes.children(body, clauses);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(tryKeyword, with);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTryWith(this);
        }
    }

    record TryFinally(TokenRef tryKeyword,
                      Expr body,
                      TokenRef finallyKeyword,
                      Expr finallyBody,
                      SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_TRY_FINALLY;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(body, finallyBody);
        }

        @Override
        public List<TokenRef> anchorTokens() {
            return List.of(tryKeyword, finallyKeyword);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTryFinally(this);
        }
    }

    /**
     * {@code lazy}, {@code assert}, {@code yield} or {@code return} applied to an expression.
     */
    record KeywordApp(String keyword, Expr operand, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_KEYWORD_APP;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of(operand);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitKeywordApp(this);
        }
    }

    /**
     * Inline IL {@code (# ... #)}, kept as raw text.
     */
    record InlineIL(String text, SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_INLINE_IL;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInlineIL(this);
        }
    }

    /**
     * Placeholder produced by error recovery of a front end.
     */
    record FromParseError(SourceRange range) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_FROM_PARSE_ERROR;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFromParseError(this);
        }
    }
}
