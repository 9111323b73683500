package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.ConstValue;
import org.pragmatica.fsfmt.syntax.Token;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts literal token spellings into semantic constant values.
 */
final class Literals {
    private Literals() {}

    static ConstValue constValue(Token token) {
        try {
            return switch (token.kind()) {
                case INT -> integer(token.text());
                case FLOAT -> floating(token.text());
                case STRING -> new ConstValue.Str(string(token.text()));
                case CHAR -> new ConstValue.Char(character(token.text()));
                case TRUE -> new ConstValue.Bool(true);
                case FALSE -> new ConstValue.Bool(false);
                default -> throw new IllegalArgumentException("not a literal: " + token.kind());
            };
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw FormattingError.inputParseError(token.range(), "invalid literal " + token.text())
                                 .exception();
        }
    }

    private static ConstValue integer(String literal) {
        var negative = literal.startsWith("-");
        var text = negative
                   ? literal.substring(1)
                   : literal;
        var suffixStart = text.length();
        var radix = 10;
        var digitsStart = 0;
        if (text.length() > 2 && text.charAt(0) == '0' && "xXoObB".indexOf(text.charAt(1)) >= 0) {
            radix = switch (Character.toLowerCase(text.charAt(1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            digitsStart = 2;
        }
        while (suffixStart > digitsStart && Character.digit(text.charAt(suffixStart - 1), radix) < 0) {
            suffixStart--;
        }
        var digits = text.substring(digitsStart, suffixStart)
                         .replace("_", "");
        var value = new BigInteger(digits, radix);
        return new ConstValue.Int(negative
                                  ? value.negate()
                                  : value,
                                  text.substring(suffixStart));
    }

    private static ConstValue floating(String text) {
        var suffixStart = text.length();
        while (suffixStart > 0 && Character.isLetter(text.charAt(suffixStart - 1))
               && !isExponentMarker(text, suffixStart - 1)) {
            suffixStart--;
        }
        var digits = text.substring(0, suffixStart)
                         .replace("_", "");
        return new ConstValue.Float(new BigDecimal(digits), text.substring(suffixStart));
    }

    private static boolean isExponentMarker(String text, int index) {
        var c = text.charAt(index);
        return (c == 'e' || c == 'E') && index + 1 < text.length()
               && (Character.isDigit(text.charAt(index + 1)) || text.charAt(index + 1) == '+'
                   || text.charAt(index + 1) == '-');
    }

    static String string(String text) {
        var body = text.endsWith("B")
                   ? text.substring(0, text.length() - 1)
                   : text;
        var prefix = 0;
        while (body.charAt(prefix) == '$' || body.charAt(prefix) == '@') {
            prefix++;
        }
        var verbatim = body.substring(0, prefix)
                           .contains("@");
        if (body.startsWith("\"\"\"", prefix)) {
            return body.substring(prefix + 3, body.length() - 3);
        }
        var content = body.substring(prefix + 1, body.length() - 1);
        return verbatim
               ? content.replace("\"\"", "\"")
               : unescape(content);
    }

    private static int character(String text) {
        var body = text.endsWith("B")
                   ? text.substring(0, text.length() - 1)
                   : text;
        return unescape(body.substring(1, body.length() - 1)).codePointAt(0);
    }

    private static String unescape(String content) {
        var builder = new StringBuilder();
        var index = 0;
        while (index < content.length()) {
            var c = content.charAt(index);
            if (c != '\\' || index + 1 >= content.length()) {
                builder.append(c);
                index++;
                continue;
            }
            var next = content.charAt(index + 1);
            switch (next) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                case 'b' -> builder.append('\b');
                case 'a' -> builder.append('\u0007');
                case 'f' -> builder.append('\f');
                case 'v' -> builder.append('\u000B');
                case '0' -> builder.append('\0');
                case 'u', 'U' -> {
                    var digits = next == 'u'
                                 ? 4
                                 : 8;
                    if (!hasHexDigits(content, index + 2, digits)) {
                        // an incomplete escape is a plain backslash
                        builder.append(c);
                        index++;
                        continue;
                    }
                    builder.appendCodePoint(Integer.parseInt(content.substring(index + 2, index + 2 + digits), 16));
                    index += digits;
                }
                case '\n' -> {
                    // line continuation: skip the newline and the indentation of the next line
                    index += 2;
                    while (index < content.length() && (content.charAt(index) == ' ' || content.charAt(index) == '\t')) {
                        index++;
                    }
                    continue;
                }
                default -> builder.append(next);
            }
            index += 2;
        }
        return builder.toString();
    }

    private static boolean hasHexDigits(String content, int start, int count) {
        if (start + count > content.length()) {
            return false;
        }
        for (var i = start; i < start + count; i++) {
            if (Character.digit(content.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
