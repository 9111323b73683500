package org.pragmatica.fsfmt.trivia;

import java.util.List;
import java.util.Optional;

/**
 * All trivia attached to a single anchor, in source order within each placement.
 */
public record TriviaEntry(List<TriviaRun> before, List<TriviaRun> after, Optional<TriviaPiece> itself) {
    public static final TriviaEntry EMPTY = new TriviaEntry(List.of(), List.of(), Optional.empty());

    public TriviaEntry {
        before = List.copyOf(before);
        after = List.copyOf(after);
    }

    public boolean isEmpty() {
        return before.isEmpty() && after.isEmpty() && itself.isEmpty();
    }
}
