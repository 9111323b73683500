package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingException;
import org.pragmatica.fsfmt.syntax.SourceRange;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectiveExpressionTest {

    @Test
    void evaluate_combinesOperators() {
        assertThat(DirectiveExpression.evaluate(" A && !B", SourceRange.EMPTY, Set.of("A"))).isTrue();
        assertThat(DirectiveExpression.evaluate(" A && !B", SourceRange.EMPTY, Set.of("A", "B"))).isFalse();
        assertThat(DirectiveExpression.evaluate(" (A || B) && C", SourceRange.EMPTY, Set.of("B", "C"))).isTrue();
        assertThat(DirectiveExpression.evaluate(" !(A || B)", SourceRange.EMPTY, Set.of())).isTrue();
    }

    @Test
    void evaluate_ignoresTrailingComment() {
        assertThat(DirectiveExpression.evaluate(" DEBUG // diagnostics", SourceRange.EMPTY, Set.of("DEBUG"))).isTrue();
    }

    @Test
    void symbols_listsSymbolsInOrderOfAppearance() {
        assertThat(DirectiveExpression.symbols(" (NET || MONO) && !NET", SourceRange.EMPTY))
                .containsExactly("NET", "MONO");
    }

    @Test
    void evaluate_fails_onIncompleteCondition() {
        assertThatThrownBy(() -> DirectiveExpression.evaluate(" A &&", SourceRange.EMPTY, Set.of()))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("symbol expected");
    }
}
