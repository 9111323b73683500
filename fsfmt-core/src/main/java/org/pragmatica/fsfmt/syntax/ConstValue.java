package org.pragmatica.fsfmt.syntax;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Semantic value of a literal. The original spelling is not kept here; it travels as
 * verbatim literal trivia.
 */
public sealed interface ConstValue {
    /**
     * Canonical spelling used when no verbatim spelling is attached.
     */
    String canonicalText();

    record Int(BigInteger value, String suffix) implements ConstValue {
        @Override
        public String canonicalText() {
            return value.toString() + suffix;
        }
    }

    record Float(BigDecimal value, String suffix) implements ConstValue {
        @Override
        public String canonicalText() {
            var text = value.toPlainString();
            return (text.contains(".")
                    ? text
                    : text + ".0") + suffix;
        }
    }

    record Str(String value) implements ConstValue {
        @Override
        public String canonicalText() {
            var builder = new StringBuilder("\"");
            value.codePoints()
                 .forEach(codePoint -> builder.append(escape(codePoint, '"')));
            return builder.append('"')
                          .toString();
        }
    }

    record Char(int codePoint) implements ConstValue {
        @Override
        public String canonicalText() {
            return "'" + escape(codePoint, '\'') + "'";
        }
    }

    record Bool(boolean value) implements ConstValue {
        @Override
        public String canonicalText() {
            return Boolean.toString(value);
        }
    }

    record Unit() implements ConstValue {
        @Override
        public String canonicalText() {
            return "()";
        }
    }

    static ConstValue integer(BigInteger value, String suffix) {
        return new Int(value, suffix);
    }

    static ConstValue floating(BigDecimal value, String suffix) {
        return new Float(value, suffix);
    }

    static ConstValue string(String value) {
        return new Str(value);
    }

    static ConstValue character(int codePoint) {
        return new Char(codePoint);
    }

    static ConstValue bool(boolean value) {
        return new Bool(value);
    }

    static ConstValue unit() {
        return new Unit();
    }

    private static String escape(int codePoint, char quote) {
        return switch (codePoint) {
            case '\n' -> "\\n";
            case '\t' -> "\\t";
            case '\r' -> "\\r";
            case '\b' -> "\\b";
            case '\\' -> "\\\\";
            default -> codePoint == quote
                       ? "\\" + quote
                       : new String(Character.toChars(codePoint));
        };
    }
}
