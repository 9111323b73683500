package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.SourceRange;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Condition of an {@code #if} directive: symbols combined with {@code !}, {@code &&}, {@code ||}
 * and parentheses.
 */
public final class DirectiveExpression {
    private final String text;
    private final SourceRange range;
    private int pos;

    private DirectiveExpression(String text, SourceRange range) {
        this.text = text;
        this.range = range;
    }

    /**
     * Evaluate the condition against the active symbols.
     */
    public static boolean evaluate(String condition, SourceRange range, Set<String> defines) {
        var expression = new DirectiveExpression(condition, range);
        var result = expression.parseOr(defines, new LinkedHashSet<>());
        expression.expectEnd();
        return result;
    }

    /**
     * Symbols referenced by the condition, in order of appearance.
     */
    public static Set<String> symbols(String condition, SourceRange range) {
        var expression = new DirectiveExpression(condition, range);
        var symbols = new LinkedHashSet<String>();
        expression.parseOr(Set.of(), symbols);
        expression.expectEnd();
        return symbols;
    }

    private boolean parseOr(Set<String> defines, Set<String> symbols) {
        var value = parseAnd(defines, symbols);
        while (consume("||")) {
            value = parseAnd(defines, symbols) | value;
        }
        return value;
    }

    private boolean parseAnd(Set<String> defines, Set<String> symbols) {
        var value = parseUnary(defines, symbols);
        while (consume("&&")) {
            value = parseUnary(defines, symbols) & value;
        }
        return value;
    }

    private boolean parseUnary(Set<String> defines, Set<String> symbols) {
        if (consume("!")) {
            return !parseUnary(defines, symbols);
        }
        if (consume("(")) {
            var value = parseOr(defines, symbols);
            if (!consume(")")) {
                throw fail("missing ')'");
            }
            return value;
        }
        skipSpaces();
        var start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        if (start == pos) {
            throw fail("symbol expected");
        }
        var symbol = text.substring(start, pos);
        symbols.add(symbol);
        return defines.contains(symbol);
    }

    private boolean consume(String expected) {
        skipSpaces();
        if (text.startsWith(expected, pos)) {
            pos += expected.length();
            return true;
        }
        return false;
    }

    private void expectEnd() {
        skipSpaces();
        if (pos < text.length() && !text.startsWith("//", pos)) {
            throw fail("unexpected '" + text.substring(pos) + "'");
        }
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private RuntimeException fail(String detail) {
        return FormattingError.malformedTrivia(range, "invalid #if condition '" + text.trim() + "': " + detail)
                              .exception();
    }
}
