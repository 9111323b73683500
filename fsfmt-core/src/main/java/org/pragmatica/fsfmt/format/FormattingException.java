package org.pragmatica.fsfmt.format;

/**
 * Carries a {@link FormattingError} out of deeply recursive code. Converted back into a
 * {@link FormatResult} at the {@link Formatter} boundary.
 */
public final class FormattingException extends RuntimeException {
    private final FormattingError error;

    public FormattingException(FormattingError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    public FormattingError error() {
        return error;
    }
}
