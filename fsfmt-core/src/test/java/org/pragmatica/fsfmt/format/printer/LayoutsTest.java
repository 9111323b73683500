package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.trivia.TriviaIndex;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.fsfmt.format.printer.Layouts.*;

class LayoutsTest {
    private static final Layout COMPACT_LIST = text("[ 1; 2 ]");
    private static final Layout EXPANDED_LIST = sequence(text("[ 1"), indented(sequence(newline(), text("2 ]"))));

    @Test
    void tryCompact_keepsCompactForm_whenItFits() {
        assertThat(render(tryCompact(COMPACT_LIST, EXPANDED_LIST, 40))).isEqualTo("[ 1; 2 ]");
    }

    @Test
    void tryCompact_expands_whenWiderThanLimit() {
        assertThat(render(tryCompact(COMPACT_LIST, EXPANDED_LIST, 5))).isEqualTo("[ 1\n    2 ]");
    }

    @Test
    void tryCompact_expands_whenCompactFormBreaksLine() {
        var compact = sequence(text("a"), newline(), text("b"));

        assertThat(render(tryCompact(compact, text("expanded"), 80))).isEqualTo("expanded");
    }

    @Test
    void tryCompact_respectsMaxLineLength() {
        var config = FormatterConfig.defaultConfig()
                                    .withMaxLineLength(10);
        var context = RenderContext.renderContext(config, TriviaIndex.empty());

        sequence(text("let x = "), tryCompact(COMPACT_LIST, EXPANDED_LIST, 40)).apply(context);

        assertThat(context.output()).isEqualTo("let x = [ 1\n    2 ]");
    }

    @Test
    void forceExpanded_failsEnclosingTrial() {
        var compact = sequence(text("short "), forceExpanded(text("x")));

        assertThat(render(tryCompact(compact, text("expanded"), 80))).isEqualTo("expanded");
        assertThat(render(forceExpanded(text("x")))).isEqualTo("x");
    }

    @Test
    void newlineIfPending_breaksOnlyAfterRequest() {
        var requested = sequence(text("a"), RenderContext::requestNewline, newlineIfPending(), text("b"));

        assertThat(render(requested)).isEqualTo("a\nb");
        assertThat(render(sequence(text("a"), newlineIfPending(), text("b")))).isEqualTo("ab");
    }

    @Test
    void join_insertsSeparatorBetweenItems() {
        assertThat(render(join(text("; "), List.of(text("a"), text("b"), text("c"))))).isEqualTo("a; b; c");
        assertThat(render(join(text("; "), List.of()))).isEmpty();
    }

    @Test
    void atCurrentColumn_alignsFollowingLines() {
        var layout = sequence(text("x = "), atCurrentColumn(sequence(text("a"), newline(), text("+ b"))));

        assertThat(render(layout)).isEqualTo("x = a\n    + b");
    }

    @Test
    void when_skipsLayout_onFalseCondition() {
        assertThat(render(sequence(text("a"), when(false, text("b")), when(true, text("c"))))).isEqualTo("ac");
    }

    private static String render(Layout layout) {
        var context = RenderContext.renderContext(FormatterConfig.defaultConfig(), TriviaIndex.empty());
        return layout.apply(context)
                     .output();
    }
}
