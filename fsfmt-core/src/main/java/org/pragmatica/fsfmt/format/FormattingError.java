package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.syntax.SourceRange;

/**
 * Terminal failure of a format operation. Every error carries the source range it refers to.
 */
public sealed interface FormattingError {
    SourceRange range();

    String message();

    /**
     * The front end could not produce a tree for some region.
     */
    record InputParseError(SourceRange range, String detail) implements FormattingError {
        @Override
        public String message() {
            return "Parse error at " + position(range) + ": " + detail;
        }
    }

    /**
     * A node kind reachable in the tree has no renderer.
     */
    record UnsupportedConstruct(SourceRange range, String construct) implements FormattingError {
        @Override
        public String message() {
            return "Unsupported construct " + construct + " at " + position(range);
        }
    }

    /**
     * Internal bookkeeping failure of trivia collection or emission.
     */
    record TriviaAttachmentInvariantViolation(SourceRange range, String detail) implements FormattingError {
        @Override
        public String message() {
            return "Trivia invariant violated at " + position(range) + ": " + detail;
        }
    }

    /**
     * Unterminated comment or conditional directive.
     */
    record MalformedTrivia(SourceRange range, String detail) implements FormattingError {
        @Override
        public String message() {
            return "Malformed trivia at " + position(range) + ": " + detail;
        }
    }

    static FormattingError inputParseError(SourceRange range, String detail) {
        return new InputParseError(range, detail);
    }

    static FormattingError unsupportedConstruct(SourceRange range, String construct) {
        return new UnsupportedConstruct(range, construct);
    }

    static FormattingError invariantViolation(SourceRange range, String detail) {
        return new TriviaAttachmentInvariantViolation(range, detail);
    }

    static FormattingError malformedTrivia(SourceRange range, String detail) {
        return new MalformedTrivia(range, detail);
    }

    default FormattingException exception() {
        return new FormattingException(this);
    }

    default <T> FormatResult<T> result() {
        return FormatResult.failure(this);
    }

    private static String position(SourceRange range) {
        return range.startLine() + ":" + (range.startColumn() + 1);
    }
}
