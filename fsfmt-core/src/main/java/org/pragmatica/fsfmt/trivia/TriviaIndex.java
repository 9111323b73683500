package org.pragmatica.fsfmt.trivia;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping from anchors to attached trivia, produced once per tree.
 */
public final class TriviaIndex {
    private static final TriviaIndex EMPTY = new TriviaIndex(Map.of());

    private final Map<Anchor, TriviaEntry> entries;

    private TriviaIndex(Map<Anchor, TriviaEntry> entries) {
        this.entries = entries;
    }

    public static TriviaIndex triviaIndex(Map<Anchor, TriviaEntry> entries) {
        return new TriviaIndex(new LinkedHashMap<>(entries));
    }

    public static TriviaIndex empty() {
        return EMPTY;
    }

    public TriviaEntry entry(Anchor anchor) {
        return entries.getOrDefault(anchor, TriviaEntry.EMPTY);
    }

    public boolean contains(Anchor anchor) {
        return entries.containsKey(anchor);
    }

    public Set<Anchor> anchors() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "TriviaIndex" + entries;
    }
}
