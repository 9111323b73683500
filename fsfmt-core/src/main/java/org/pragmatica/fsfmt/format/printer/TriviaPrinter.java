package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.trivia.Anchor;
import org.pragmatica.fsfmt.trivia.Placement;
import org.pragmatica.fsfmt.trivia.TriviaPiece;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlankLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlockComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.Directive;
import org.pragmatica.fsfmt.trivia.TriviaPiece.LineComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.VerbatimLiteral;
import org.pragmatica.fsfmt.trivia.TriviaRun;

import java.util.List;

/**
 * Splices attached trivia around the layouts of anchors.
 */
final class TriviaPrinter {
    private TriviaPrinter() {}

    /**
     * Wrap a layout with the trivia attached before and after its anchor.
     * <p>
     * Own-line trivia before an anchor reached in the middle of a line moves the anchor to the
     * next line, one level deeper.
     */
    static Layout around(Anchor anchor, Layout layout) {
        return context -> {
            var entry = context.trivia()
                               .entry(anchor);
            if (entry.before()
                     .isEmpty() && entry.after()
                                        .isEmpty()) {
                return layout.apply(context);
            }
            var before = !entry.before()
                               .isEmpty() && context.consume(anchor, Placement.BEFORE);
            var breakLine = before && needsOwnLine(entry.before()) && !context.atLineStart();
            if (breakLine) {
                context.indent()
                       .newline();
            }
            if (before) {
                entry.before()
                     .forEach(run -> printBefore(context, run));
            }
            layout.apply(context);
            if (breakLine) {
                context.unindent();
            }
            if (!entry.after()
                      .isEmpty() && context.consume(anchor, Placement.AFTER)) {
                entry.after()
                     .forEach(run -> printAfter(context, run));
            }
            return context;
        };
    }

    /**
     * Literal text: the original spelling when one is attached, otherwise the canonical text.
     */
    static Layout literal(Anchor anchor, String canonical) {
        return context -> {
            var itself = context.trivia()
                                .entry(anchor)
                                .itself();
            if (itself.isPresent() && context.consume(anchor, Placement.ITSELF)) {
                return context.write(verbatimText(itself.get()));
            }
            return context.write(canonical);
        };
    }

    private static String verbatimText(TriviaPiece piece) {
        if (piece instanceof VerbatimLiteral literal) {
            return literal.text();
        }
        throw FormattingError.invariantViolation(piece.range(), "only literals can replace a node")
                             .exception();
    }

    private static boolean needsOwnLine(List<TriviaRun> runs) {
        return runs.stream()
                   .anyMatch(run -> !isInline(run));
    }

    private static boolean isInline(TriviaRun run) {
        return run.pieces()
                  .size() == 1 && run.first() instanceof BlockComment block && !block.followedByNewline();
    }

    private static void printBefore(RenderContext context, TriviaRun run) {
        if (isInline(run)) {
            context.write(((BlockComment) run.first()).text())
                   .write(" ");
            return;
        }
        context.ensureLineStart();
        for (var piece : run.pieces()) {
            printOwnLine(context, piece);
            context.newline();
        }
    }

    private static void printAfter(RenderContext context, TriviaRun run) {
        var first = run.first();
        if (run.pieces()
               .size() == 1 && first instanceof LineComment line && line.afterSourceCode()) {
            context.space()
                   .write(line.text())
                   .requestNewline();
            return;
        }
        if (isInline(run) || (first instanceof BlockComment block && !block.precededByNewline())) {
            context.space()
                   .write(((BlockComment) first).text());
            return;
        }
        context.ensureLineStart();
        var pieces = run.pieces();
        for (var i = 0; i < pieces.size(); i++) {
            if (i > 0) {
                context.newline();
            }
            printOwnLine(context, pieces.get(i));
        }
        if (first instanceof BlankLine) {
            context.newline();
        } else {
            context.requestNewline();
        }
    }

    private static void printOwnLine(RenderContext context, TriviaPiece piece) {
        if (piece instanceof LineComment line) {
            context.write(line.text());
        } else if (piece instanceof BlockComment block) {
            context.write(block.text());
        } else if (piece instanceof Directive directive) {
            var lines = directive.lines();
            for (var i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    context.newline();
                }
                var line = lines.get(i);
                if (line.conditional()) {
                    context.write(line.text());
                } else {
                    context.writeRaw(line.text());
                }
            }
        } else if (!(piece instanceof BlankLine)) {
            throw FormattingError.invariantViolation(piece.range(), "literal spelling placed outside its node")
                                 .exception();
        }
    }
}
