package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.shared.SourceFile;

/**
 * Source code formatter.
 */
public interface Formatter {
    /**
     * Format the source file, returning it with formatted content.
     */
    FormatResult<SourceFile> format(SourceFile source);

    /**
     * Check whether the source file is already formatted.
     */
    FormatResult<Boolean> isFormatted(SourceFile source);

    FormatterConfig config();
}
