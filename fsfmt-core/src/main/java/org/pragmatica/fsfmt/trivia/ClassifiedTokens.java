package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.syntax.Token;

import java.util.List;

/**
 * Token stream split into parser input and trivia, both in source order.
 *
 * @param significant tokens the parser consumes, ending with EOF
 * @param trivia      pieces to reattach after parsing
 */
public record ClassifiedTokens(List<Token> significant, List<TriviaPiece> trivia) {
    public ClassifiedTokens {
        significant = List.copyOf(significant);
        trivia = List.copyOf(trivia);
    }
}
