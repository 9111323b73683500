package org.pragmatica.fsfmt.syntax;

import java.util.Map;
import java.util.Optional;

/**
 * Kinds of lexical tokens. Trivia kinds never reach the parser.
 */
public enum TokenKind {
    IDENT,
    INT,
    FLOAT,
    STRING,
    CHAR,
    TYPE_VAR,
    OPERATOR,

    // Keywords
    LET,
    REC,
    IN,
    IF,
    THEN,
    ELIF,
    ELSE,
    MATCH,
    WITH,
    FUNCTION,
    FUN,
    TYPE,
    MODULE,
    NAMESPACE,
    OPEN,
    OF,
    MUTABLE,
    INLINE,
    AND,
    TRUE,
    FALSE,
    NULL,
    DO,
    WHEN,
    FOR,
    WHILE,
    TRY,
    FINALLY,
    LAZY,
    ASSERT,
    USE,
    YIELD,
    RETURN,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACK,
    RBRACK,
    LBRACK_BAR,
    BAR_RBRACK,
    LBRACK_LESS,
    GREATER_RBRACK,
    LBRACE,
    RBRACE,
    LPAREN_HASH,
    COMMA,
    SEMICOLON,
    COLON,
    RARROW,
    EQUALS,
    BAR,
    UNDERSCORE,
    DOT,
    DOT_DOT,
    COLON_COLON,
    HASH_DIRECTIVE,

    // Trivia
    WHITESPACE,
    NEWLINE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    DIRECTIVE,
    INACTIVE_CODE,

    EOF;

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(Map.entry("let", LET),
                                                                         Map.entry("rec", REC),
                                                                         Map.entry("in", IN),
                                                                         Map.entry("if", IF),
                                                                         Map.entry("then", THEN),
                                                                         Map.entry("elif", ELIF),
                                                                         Map.entry("else", ELSE),
                                                                         Map.entry("match", MATCH),
                                                                         Map.entry("with", WITH),
                                                                         Map.entry("function", FUNCTION),
                                                                         Map.entry("fun", FUN),
                                                                         Map.entry("type", TYPE),
                                                                         Map.entry("module", MODULE),
                                                                         Map.entry("namespace", NAMESPACE),
                                                                         Map.entry("open", OPEN),
                                                                         Map.entry("of", OF),
                                                                         Map.entry("mutable", MUTABLE),
                                                                         Map.entry("inline", INLINE),
                                                                         Map.entry("and", AND),
                                                                         Map.entry("true", TRUE),
                                                                         Map.entry("false", FALSE),
                                                                         Map.entry("null", NULL),
                                                                         Map.entry("do", DO),
                                                                         Map.entry("when", WHEN),
                                                                         Map.entry("for", FOR),
                                                                         Map.entry("while", WHILE),
                                                                         Map.entry("try", TRY),
                                                                         Map.entry("finally", FINALLY),
                                                                         Map.entry("lazy", LAZY),
                                                                         Map.entry("assert", ASSERT),
                                                                         Map.entry("use", USE),
                                                                         Map.entry("yield", YIELD),
                                                                         Map.entry("return", RETURN));

    public static Optional<TokenKind> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    public boolean isTrivia() {
        return switch (this) {
            case WHITESPACE, NEWLINE, LINE_COMMENT, BLOCK_COMMENT, DIRECTIVE, INACTIVE_CODE -> true;
            default -> false;
        };
    }

    public boolean isLiteral() {
        return this == INT || this == FLOAT || this == STRING || this == CHAR;
    }
}
