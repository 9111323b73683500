package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.syntax.SourceRange;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for the formatter.
 *
 * @param indentSize                         spaces per indentation level
 * @param maxLineLength                      hard limit for compact layouts
 * @param maxInfixOperatorExpression         width budget of an infix chain
 * @param maxRecordWidth                     width budget of a record expression or definition
 * @param maxArrayOrListWidth                width budget of a list or array expression
 * @param maxValueBindingWidth               width budget of a value binding body
 * @param maxFunctionBindingWidth            width budget of a function binding body
 * @param maxIfThenElseShortWidth            width budget of a single-line conditional
 * @param maxArgumentsWidth                  width budget of a function application
 * @param spaceBeforeColon                   write {@code x : int} instead of {@code x: int}
 * @param spaceAroundDelimiter               write {@code [ 1; 2 ]} instead of {@code [1; 2]}
 * @param multilineBlockBracketsOnSameColumn put brackets of expanded collections on their own lines
 * @param semicolonAtEndOfLine               end each line of an expanded collection with {@code ;}
 * @param insertFinalNewline                 terminate the output with exactly one newline
 */
public record FormatterConfig(int indentSize,
                              int maxLineLength,
                              int maxInfixOperatorExpression,
                              int maxRecordWidth,
                              int maxArrayOrListWidth,
                              int maxValueBindingWidth,
                              int maxFunctionBindingWidth,
                              int maxIfThenElseShortWidth,
                              int maxArgumentsWidth,
                              boolean spaceBeforeColon,
                              boolean spaceAroundDelimiter,
                              boolean multilineBlockBracketsOnSameColumn,
                              boolean semicolonAtEndOfLine,
                              boolean insertFinalNewline) {
    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_MAX_LINE_LENGTH = 120;

    public FormatterConfig {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
    }

    /**
     * Default configuration.
     */
    public static FormatterConfig defaultConfig() {
        return new FormatterConfig(DEFAULT_INDENT_SIZE,
                                   DEFAULT_MAX_LINE_LENGTH,
                                   50,
                                   40,
                                   40,
                                   80,
                                   40,
                                   40,
                                   80,
                                   false,
                                   true,
                                   false,
                                   false,
                                   true);
    }

    public FormatterConfig withIndentSize(int indentSize) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxLineLength(int maxLineLength) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxInfixOperatorExpression(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   width,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxRecordWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   width,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxArrayOrListWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   width,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxValueBindingWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   width,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxFunctionBindingWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   width,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxIfThenElseShortWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   width,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMaxArgumentsWidth(int width) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   width,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withSpaceBeforeColon(boolean value) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   value,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withSpaceAroundDelimiter(boolean value) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   value,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withMultilineBlockBracketsOnSameColumn(boolean value) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   value,
                                   semicolonAtEndOfLine,
                                   insertFinalNewline);
    }

    public FormatterConfig withSemicolonAtEndOfLine(boolean value) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   value,
                                   insertFinalNewline);
    }

    public FormatterConfig withInsertFinalNewline(boolean value) {
        return new FormatterConfig(indentSize,
                                   maxLineLength,
                                   maxInfixOperatorExpression,
                                   maxRecordWidth,
                                   maxArrayOrListWidth,
                                   maxValueBindingWidth,
                                   maxFunctionBindingWidth,
                                   maxIfThenElseShortWidth,
                                   maxArgumentsWidth,
                                   spaceBeforeColon,
                                   spaceAroundDelimiter,
                                   multilineBlockBracketsOnSameColumn,
                                   semicolonAtEndOfLine,
                                   value);
    }

    /**
     * Build a configuration from kebab-case properties such as {@code max-line-length=100}.
     * Missing keys keep their default values.
     */
    public static FormatterConfig fromProperties(Properties properties) {
        var defaults = defaultConfig();
        return new FormatterConfig(intValue(properties, "indent-size", defaults.indentSize()),
                                   intValue(properties, "max-line-length", defaults.maxLineLength()),
                                   intValue(properties,
                                            "max-infix-operator-expression",
                                            defaults.maxInfixOperatorExpression()),
                                   intValue(properties, "max-record-width", defaults.maxRecordWidth()),
                                   intValue(properties, "max-array-or-list-width", defaults.maxArrayOrListWidth()),
                                   intValue(properties, "max-value-binding-width", defaults.maxValueBindingWidth()),
                                   intValue(properties,
                                            "max-function-binding-width",
                                            defaults.maxFunctionBindingWidth()),
                                   intValue(properties,
                                            "max-if-then-else-short-width",
                                            defaults.maxIfThenElseShortWidth()),
                                   intValue(properties, "max-arguments-width", defaults.maxArgumentsWidth()),
                                   booleanValue(properties, "space-before-colon", defaults.spaceBeforeColon()),
                                   booleanValue(properties, "space-around-delimiter", defaults.spaceAroundDelimiter()),
                                   booleanValue(properties,
                                                "multiline-block-brackets-on-same-column",
                                                defaults.multilineBlockBracketsOnSameColumn()),
                                   booleanValue(properties,
                                                "semicolon-at-end-of-line",
                                                defaults.semicolonAtEndOfLine()),
                                   booleanValue(properties, "insert-final-newline", defaults.insertFinalNewline()));
    }

    /**
     * Load a properties file. Invalid values fail with an input error pointing at the file start.
     */
    public static FormatResult<FormatterConfig> load(Path path) {
        var properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            return FormattingError.inputParseError(SourceRange.EMPTY,
                                                   "cannot read configuration " + path + ": " + e.getMessage())
                                  .result();
        }
        try {
            return FormatResult.success(fromProperties(properties));
        } catch (IllegalArgumentException e) {
            return FormattingError.inputParseError(SourceRange.EMPTY,
                                                   "invalid configuration " + path + ": " + e.getMessage())
                                  .result();
        }
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        var value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean defaultValue) {
        var value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim()
                            .toLowerCase()) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + value);
        };
    }
}
