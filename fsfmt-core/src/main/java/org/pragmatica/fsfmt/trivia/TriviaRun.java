package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.syntax.SourceRange;

import java.util.List;

/**
 * Consecutive trivia pieces placed together on one anchor.
 */
public record TriviaRun(List<TriviaPiece> pieces) {
    public TriviaRun {
        if (pieces.isEmpty()) {
            throw new IllegalArgumentException("Trivia run must not be empty");
        }
        pieces = List.copyOf(pieces);
    }

    public static TriviaRun triviaRun(List<TriviaPiece> pieces) {
        return new TriviaRun(pieces);
    }

    public SourceRange range() {
        return first().range()
                      .union(last().range());
    }

    public TriviaPiece first() {
        return pieces.get(0);
    }

    public TriviaPiece last() {
        return pieces.get(pieces.size() - 1);
    }
}
