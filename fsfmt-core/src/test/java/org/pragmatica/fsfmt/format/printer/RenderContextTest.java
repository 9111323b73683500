package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.trivia.Anchor;
import org.pragmatica.fsfmt.trivia.Placement;
import org.pragmatica.fsfmt.trivia.TriviaIndex;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderContextTest {
    private RenderContext context;

    @BeforeEach
    void setUp() {
        context = RenderContext.renderContext(FormatterConfig.defaultConfig(), TriviaIndex.empty());
    }

    @Test
    void write_padsIndentation_lazily() {
        context.write("let f =")
               .indent()
               .newline()
               .write("body")
               .unindent();

        assertThat(context.output()).isEqualTo("let f =\n    body");
        assertThat(context.column()).isEqualTo(8);
        assertThat(context.lineCount()).isEqualTo(1);
    }

    @Test
    void space_isNeverDoubled_norWrittenAtLineStart() {
        context.space()
               .write("a")
               .space()
               .space()
               .write("b");

        assertThat(context.output()).isEqualTo("a b");
    }

    @Test
    void newline_stripsTrailingSpaces() {
        context.write("a")
               .write(" ")
               .newline()
               .write("b");

        assertThat(context.output()).isEqualTo("a\nb");
    }

    @Test
    void write_dropsLeadingSpaces_atLineStart() {
        context.write("A // note")
               .requestNewline()
               .write(" | ")
               .write("B");

        assertThat(context.output()).isEqualTo("A // note\n| B");
    }

    @Test
    void requestNewline_breaksBeforeNextWrite() {
        context.write("x // note")
               .requestNewline();

        assertThat(context.atLineStart()).isTrue();
        context.write("y");
        assertThat(context.output()).isEqualTo("x // note\ny");
    }

    @Test
    void pinIndent_alignsContinuationLines() {
        context.write("f(")
               .pinIndent(context.nextColumn())
               .write("a")
               .newline()
               .write("b")
               .unindent();

        assertThat(context.output()).isEqualTo("f(a\n  b");
    }

    @Test
    void write_tracksColumn_afterMultiLineText() {
        context.write("\"\"\"first\nsecond\"\"\"");

        assertThat(context.column()).isEqualTo(9);
        assertThat(context.lineCount()).isEqualTo(1);
    }

    @Test
    void writeRaw_ignoresIndentation_atLineStart() {
        context.indent()
               .writeRaw("let inactive = 1");

        assertThat(context.output()).isEqualTo("let inactive = 1");
    }

    @Test
    void fork_commitsSuccessfulTrial() {
        context.write("ab");
        var trial = context.fork(10);
        trial.write("cd");

        context.commit(trial);

        assertThat(context.output()).isEqualTo("abcd");
        assertThat(context.column()).isEqualTo(4);
    }

    @Test
    void fork_overflows_onNewlineOrPastLimit() {
        var broken = context.fork(100);
        broken.write("a")
              .newline();
        var tooWide = context.fork(3);
        tooWide.write("abcd");

        assertThat(broken.overflowed()).isTrue();
        assertThat(tooWide.overflowed()).isTrue();
        assertThatThrownBy(() -> context.commit(broken)).isInstanceOf(IllegalStateException.class);
        assertThat(context.output()).isEmpty();
    }

    @Test
    void consume_isVisibleThroughTrials() {
        var anchor = new Anchor.TokenAnchor(TokenKind.IDENT, SourceRange.point(1, 0));

        assertThat(context.consume(anchor, Placement.BEFORE)).isTrue();
        assertThat(context.consume(anchor, Placement.BEFORE)).isFalse();

        var trial = context.fork(100);
        assertThat(trial.consume(anchor, Placement.BEFORE)).isFalse();
        assertThat(trial.consume(anchor, Placement.AFTER)).isTrue();
        assertThat(context.isConsumed(anchor, Placement.AFTER)).isFalse();

        context.commit(trial);
        assertThat(context.isConsumed(anchor, Placement.AFTER)).isTrue();
    }

    @Test
    void unindent_fails_whenUnbalanced() {
        assertThatThrownBy(() -> context.unindent()).isInstanceOf(IllegalStateException.class);
    }
}
