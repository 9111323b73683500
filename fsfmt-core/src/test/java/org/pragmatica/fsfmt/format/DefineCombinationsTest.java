package org.pragmatica.fsfmt.format;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DefineCombinationsTest {

    @Test
    void defineCombinations_isEmptySetOnly_withoutSymbols() {
        assertThat(DefineCombinations.defineCombinations(Set.of())).containsExactly(Set.of());
    }

    @Test
    void defineCombinations_enumeratesAllSubsets_forFewSymbols() {
        var combinations = DefineCombinations.defineCombinations(new LinkedHashSet<>(List.of("A", "B")));

        assertThat(combinations).containsExactly(Set.of(), Set.of("A"), Set.of("B"), Set.of("A", "B"));
    }

    @Test
    void defineCombinations_limitsSets_forManySymbols() {
        var symbols = new LinkedHashSet<>(List.of("A", "B", "C", "D", "E"));

        var combinations = DefineCombinations.defineCombinations(symbols);

        assertThat(combinations).hasSize(7);
        assertThat(combinations.get(0)).isEmpty();
        assertThat(combinations.get(1)).containsExactly("A");
        assertThat(combinations.get(6)).containsExactlyInAnyOrderElementsOf(symbols);
    }

    @Test
    void defineCombinations_coversEverySubset_atExhaustiveLimit() {
        var symbols = new LinkedHashSet<>(List.of("A", "B", "C", "D"));

        assertThat(DefineCombinations.defineCombinations(symbols)).hasSize(16)
                                                                  .doesNotHaveDuplicates();
    }
}
