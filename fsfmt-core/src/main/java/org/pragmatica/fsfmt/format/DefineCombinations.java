package org.pragmatica.fsfmt.format;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Define sets a source is formatted under.
 * <p>
 * Up to {@value #EXHAUSTIVE_LIMIT} symbols every subset is used. Beyond that the empty set,
 * each single symbol and the full set are used. The empty set always comes first.
 */
final class DefineCombinations {
    static final int EXHAUSTIVE_LIMIT = 4;

    private DefineCombinations() {}

    static List<Set<String>> defineCombinations(Set<String> symbols) {
        var ordered = List.copyOf(symbols);
        var result = new ArrayList<Set<String>>();

        if (ordered.size() <= EXHAUSTIVE_LIMIT) {
            for (var size = 0; size <= ordered.size(); size++) {
                subsets(ordered, size, 0, new ArrayList<>(), result);
            }
            return result;
        }
        result.add(Set.of());
        ordered.forEach(symbol -> result.add(Set.of(symbol)));
        result.add(Set.copyOf(new LinkedHashSet<>(ordered)));
        return result;
    }

    private static void subsets(List<String> symbols,
                                int size,
                                int from,
                                List<String> current,
                                List<Set<String>> result) {
        if (current.size() == size) {
            result.add(Set.copyOf(current));
            return;
        }
        for (var i = from; i < symbols.size(); i++) {
            current.add(symbols.get(i));
            subsets(symbols, size, i + 1, current, result);
            current.remove(current.size() - 1);
        }
    }
}
