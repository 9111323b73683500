package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.format.DefineMerger.Variant;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.fsfmt.format.ConditionalStructure.conditionalStructure;

class DefineMergerTest {
    private static final String SOURCE = "#if A\nlet a = 1\n#else\nlet a = 2\n#endif\n";

    @Test
    void activeChunks_followsNestedConditions() {
        var structure = conditionalStructure(SOURCE);

        assertThat(structure.chunkCount()).isEqualTo(4);
        assertThat(structure.symbols()).containsExactly("A");
        assertThat(structure.activeChunks(Set.of())).containsExactly(true, false, true, true);
        assertThat(structure.activeChunks(Set.of("A"))).containsExactly(true, true, false, true);
    }

    @Test
    void merge_takesEachChunk_fromVariantThatCompilesIt() {
        var withoutA = new Variant(Set.of(), "#if A\nlet a = 1\n#else\nlet a = 2 // formatted\n#endif\n");
        var withA = new Variant(Set.of("A"), "#if A\nlet a = 1 // formatted\n#else\nlet a = 2\n#endif\n");

        var merged = DefineMerger.merge(conditionalStructure(SOURCE), List.of(withoutA, withA));

        assertThat(merged).isEqualTo("#if A\nlet a = 1 // formatted\n#else\nlet a = 2 // formatted\n#endif\n");
    }

    @Test
    void merge_returnsSingleVariant_unchanged() {
        var only = new Variant(Set.of(), "let a = 1\n");

        assertThat(DefineMerger.merge(conditionalStructure("let a = 1"), List.of(only))).isEqualTo("let a = 1\n");
    }

    @Test
    void merge_fails_whenVariantLostDirective() {
        var withoutA = new Variant(Set.of(), SOURCE);
        var broken = new Variant(Set.of("A"), "#if A\nlet a = 1\n#endif\n");

        assertThatThrownBy(() -> DefineMerger.merge(conditionalStructure(SOURCE), List.of(withoutA, broken)))
                .isInstanceOf(FormattingException.class)
                .extracting(e -> ((FormattingException) e).error())
                .isInstanceOf(FormattingError.TriviaAttachmentInvariantViolation.class);
    }
}
