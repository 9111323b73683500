package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.syntax.SourceRange;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Non-significant lexical content that must survive formatting.
 */
public sealed interface TriviaPiece {
    SourceRange range();

    /**
     * Line comment including the leading {@code //}, without the line terminator.
     */
    record LineComment(String text, SourceRange range, boolean afterSourceCode) implements TriviaPiece {}

    /**
     * Block comment including its delimiters.
     */
    record BlockComment(String text, SourceRange range, boolean precededByNewline, boolean followedByNewline)
    implements TriviaPiece {
        public boolean isOwnLine() {
            return precededByNewline && followedByNewline;
        }
    }

    /**
     * Conditional directive lines together with the inactive code between them, kept as opaque text.
     */
    record Directive(List<DirectiveLine> lines, SourceRange range) implements TriviaPiece {
        public Directive {
            lines = List.copyOf(lines);
        }

        public String text() {
            return lines.stream()
                        .map(DirectiveLine::text)
                        .collect(Collectors.joining("\n"));
        }
    }

    /**
     * One line of a directive span. Conditional lines are trimmed; inactive code keeps its indentation.
     */
    record DirectiveLine(String text, boolean conditional) {}

    record BlankLine(SourceRange range) implements TriviaPiece {}

    /**
     * Original spelling of a literal whose tree node only holds the decoded value.
     */
    record VerbatimLiteral(String text, SourceRange range) implements TriviaPiece {}
}
