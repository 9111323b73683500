package org.pragmatica.fsfmt.syntax;

import java.util.List;

/**
 * Ordered tokens covering the whole input without gaps, ending with {@link TokenKind#EOF}.
 */
public record TokenStream(List<Token> tokens) {
    public TokenStream {
        tokens = List.copyOf(tokens);
    }

    public static TokenStream tokenStream(List<Token> tokens) {
        return new TokenStream(tokens);
    }

    /**
     * Concatenation of all token texts. Equal to the lexed source.
     */
    public String text() {
        var builder = new StringBuilder();
        tokens.forEach(token -> builder.append(token.text()));
        return builder.toString();
    }
}
