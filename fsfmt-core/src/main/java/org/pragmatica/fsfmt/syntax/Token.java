package org.pragmatica.fsfmt.syntax;

/**
 * Lexical token with its exact source spelling.
 */
public record Token(TokenKind kind, SourceRange range, String text) {
    public static Token token(TokenKind kind, SourceRange range, String text) {
        return new Token(kind, range, text);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isOperator(String operator) {
        return kind == TokenKind.OPERATOR && text.equals(operator);
    }

    public int line() {
        return range.startLine();
    }

    public int column() {
        return range.startColumn();
    }

    public TokenRef ref() {
        return new TokenRef(kind, range);
    }
}
