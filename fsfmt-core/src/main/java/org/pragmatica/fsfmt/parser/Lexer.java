package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.syntax.TokenStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static org.pragmatica.fsfmt.syntax.SourceRange.sourceRange;

/**
 * Splits source text into a gapless token stream for one define set.
 * <p>
 * Code in active conditional branches is tokenized normally. Lines of inactive branches become
 * {@link TokenKind#INACTIVE_CODE} tokens and conditional directive lines become
 * {@link TokenKind#DIRECTIVE} tokens, so the concatenated token texts always equal the input.
 */
public final class Lexer {
    private static final String OPERATOR_CHARS = "!%&*+-/<=>?@^|~$";

    private final String source;
    private final Set<String> defines;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Conditional> conditionals = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int column;

    private record Conditional(boolean parentActive, boolean condition, boolean inElse, SourceRange range) {
        boolean active() {
            return parentActive && (inElse != condition);
        }

        Conditional flip(SourceRange elseRange) {
            return new Conditional(parentActive, condition, true, elseRange);
        }
    }

    private Lexer(String source, Set<String> defines) {
        this.source = source;
        this.defines = Set.copyOf(defines);
    }

    public static TokenStream tokenize(String source, Set<String> defines) {
        return new Lexer(source, defines).run();
    }

    private TokenStream run() {
        while (pos < source.length()) {
            if (atLineStart() && isConditionalDirectiveLine()) {
                lexDirectiveLine();
            } else if (!active() && atLineStart()) {
                lexInactiveLine();
            } else {
                lexToken();
            }
        }
        if (!conditionals.isEmpty()) {
            throw FormattingError.malformedTrivia(conditionals.peek()
                                                              .range(),
                                                  "#if without matching #endif")
                                 .exception();
        }
        tokens.add(Token.token(TokenKind.EOF, SourceRange.point(line, column), ""));
        return TokenStream.tokenStream(tokens);
    }

    // ===== Conditional compilation =====

    private boolean active() {
        return conditionals.isEmpty() || conditionals.peek()
                                                     .active();
    }

    /**
     * True when nothing but whitespace precedes the current position on its line.
     */
    private boolean atLineStart() {
        var index = pos - 1;
        while (index >= 0 && source.charAt(index) != '\n') {
            if (source.charAt(index) != ' ' && source.charAt(index) != '\t') {
                return false;
            }
            index--;
        }
        return true;
    }

    private boolean isConditionalDirectiveLine() {
        return isConditionalDirective(restOfLine());
    }

    /**
     * True when the line is an {@code #if}, {@code #else} or {@code #endif} directive.
     */
    public static boolean isConditionalDirective(String line) {
        var text = line.trim();
        return directiveWord(text, "#if") || directiveWord(text, "#else") || directiveWord(text, "#endif");
    }

    static boolean directiveWord(String text, String word) {
        return text.startsWith(word) && (text.length() == word.length()
                                         || Character.isWhitespace(text.charAt(word.length()))
                                         || text.startsWith("//", word.length()));
    }

    private void lexDirectiveLine() {
        lexWhitespace();
        var startLine = line;
        var startColumn = column;
        var text = restOfLine();
        var range = sourceRange(startLine, startColumn, startLine, startColumn + text.length());
        var trimmed = text.trim();

        if (directiveWord(trimmed, "#if")) {
            var condition = trimmed.substring(3);
            var value = DirectiveExpression.evaluate(condition, range, defines);
            conditionals.push(new Conditional(active(), value, false, range));
        } else if (directiveWord(trimmed, "#else")) {
            if (conditionals.isEmpty() || conditionals.peek()
                                                      .inElse()) {
                throw FormattingError.malformedTrivia(range, "#else without matching #if")
                                     .exception();
            }
            conditionals.push(conditionals.pop()
                                          .flip(range));
        } else {
            if (conditionals.isEmpty()) {
                throw FormattingError.malformedTrivia(range, "#endif without matching #if")
                                     .exception();
            }
            conditionals.pop();
        }
        emit(TokenKind.DIRECTIVE, text.length());
    }

    private void lexInactiveLine() {
        var text = restOfLine();
        if (!text.isEmpty()) {
            emit(TokenKind.INACTIVE_CODE, text.length());
        }
        if (pos < source.length()) {
            emit(TokenKind.NEWLINE, 1);
        }
    }

    private String restOfLine() {
        var end = source.indexOf('\n', pos);
        return source.substring(pos, end < 0
                                     ? source.length()
                                     : end);
    }

    // ===== Tokens =====

    private void lexToken() {
        var c = source.charAt(pos);

        if (c == '\n') {
            emit(TokenKind.NEWLINE, 1);
        } else if (c == ' ' || c == '\t' || c == '\r') {
            lexWhitespace();
        } else if (c == '#' && atLineStart()) {
            emit(TokenKind.HASH_DIRECTIVE, restOfLine().stripTrailing()
                                                      .length());
        } else if (lookingAt("//")) {
            emit(TokenKind.LINE_COMMENT, restOfLine().length());
        } else if (lookingAt("(*)")) {
            emit(TokenKind.LPAREN, 1);
            emit(TokenKind.OPERATOR, 1);
            emit(TokenKind.RPAREN, 1);
        } else if (lookingAt("(*")) {
            lexBlockComment();
        } else if (lookingAt("(#")) {
            lexInlineIL();
        } else if (lookingAt("\"\"\"") || lookingAt("$\"\"\"")) {
            lexTripleQuotedString();
        } else if (lookingAt("@\"") || lookingAt("$@\"") || lookingAt("@$\"")) {
            lexVerbatimString();
        } else if (c == '"' || lookingAt("$\"")) {
            lexString();
        } else if (c == '\'') {
            lexQuote();
        } else if (Character.isDigit(c)) {
            lexNumber();
        } else if (lookingAt("``")) {
            lexBacktickIdent();
        } else if (Character.isLetter(c) || c == '_') {
            lexIdent();
        } else {
            lexPunctuation(c);
        }
    }

    private void lexWhitespace() {
        var end = pos;
        while (end < source.length() && (source.charAt(end) == ' ' || source.charAt(end) == '\t'
                                         || source.charAt(end) == '\r')) {
            end++;
        }
        if (end > pos) {
            emit(TokenKind.WHITESPACE, end - pos);
        }
    }

    private void lexBlockComment() {
        var depth = 0;
        var end = pos;
        while (end < source.length()) {
            if (source.startsWith("(*", end)) {
                depth++;
                end += 2;
            } else if (source.startsWith("*)", end)) {
                depth--;
                end += 2;
                if (depth == 0) {
                    emit(TokenKind.BLOCK_COMMENT, end - pos);
                    return;
                }
            } else {
                end++;
            }
        }
        throw FormattingError.malformedTrivia(SourceRange.point(line, column), "unterminated block comment")
                             .exception();
    }

    private void lexInlineIL() {
        var end = source.indexOf("#)", pos + 2);
        if (end < 0) {
            throw parseError("unterminated inline IL");
        }
        emit(TokenKind.LPAREN_HASH, end + 2 - pos);
    }

    private void lexTripleQuotedString() {
        var start = pos + (source.charAt(pos) == '$'
                           ? 4
                           : 3);
        var end = source.indexOf("\"\"\"", start);
        if (end < 0) {
            throw parseError("unterminated string");
        }
        emit(TokenKind.STRING, withByteSuffix(end + 3) - pos);
    }

    private void lexVerbatimString() {
        var end = pos + (source.charAt(pos + 1) == '"'
                         ? 2
                         : 3);
        while (end < source.length()) {
            if (source.charAt(end) == '"') {
                if (end + 1 < source.length() && source.charAt(end + 1) == '"') {
                    end += 2;
                    continue;
                }
                emit(TokenKind.STRING, withByteSuffix(end + 1) - pos);
                return;
            }
            end++;
        }
        throw parseError("unterminated string");
    }

    private void lexString() {
        var end = pos + (source.charAt(pos) == '$'
                         ? 2
                         : 1);
        while (end < source.length()) {
            var c = source.charAt(end);
            if (c == '\\') {
                end += 2;
            } else if (c == '"') {
                emit(TokenKind.STRING, withByteSuffix(end + 1) - pos);
                return;
            } else {
                end++;
            }
        }
        throw parseError("unterminated string");
    }

    private int withByteSuffix(int end) {
        return end < source.length() && source.charAt(end) == 'B'
               ? end + 1
               : end;
    }

    /**
     * Character literal or type variable.
     */
    private void lexQuote() {
        if (pos + 1 < source.length() && source.charAt(pos + 1) == '\\') {
            var end = source.indexOf('\'', pos + 3);
            if (end < 0 || end > source.indexOf('\n', pos) && source.indexOf('\n', pos) >= 0) {
                throw parseError("unterminated character literal");
            }
            emit(TokenKind.CHAR, withByteSuffix(end + 1) - pos);
        } else if (pos + 2 < source.length() && source.charAt(pos + 2) == '\'') {
            emit(TokenKind.CHAR, withByteSuffix(pos + 3) - pos);
        } else if (pos + 1 < source.length() && isIdentStart(source.charAt(pos + 1))) {
            var end = pos + 1;
            while (end < source.length() && isIdentPart(source.charAt(end))) {
                end++;
            }
            emit(TokenKind.TYPE_VAR, end - pos);
        } else {
            throw parseError("unexpected quote");
        }
    }

    /**
     * A minus sign directly followed by a digit is part of the literal unless it follows an operand
     * without whitespace on its left or with whitespace on its right.
     */
    private boolean startsNegativeNumber() {
        if (pos + 1 >= source.length() || !Character.isDigit(source.charAt(pos + 1))) {
            return false;
        }
        var previous = lastSignificant();
        if (previous == null) {
            return true;
        }
        return switch (previous.kind()) {
            case IDENT, INT, FLOAT, STRING, CHAR, TRUE, FALSE, NULL, RPAREN, RBRACK, BAR_RBRACK, RBRACE ->
                tokens.get(tokens.size() - 1)
                      .is(TokenKind.WHITESPACE);
            default -> true;
        };
    }

    private Token lastSignificant() {
        for (var index = tokens.size() - 1; index >= 0; index--) {
            if (!tokens.get(index)
                       .kind()
                       .isTrivia()) {
                return tokens.get(index);
            }
        }
        return null;
    }

    private void lexNumber() {
        var start = source.charAt(pos) == '-'
                    ? pos + 1
                    : pos;
        var end = start;
        var floating = false;
        if (source.charAt(start) == '0' && start + 1 < source.length()
            && "xXoObB".indexOf(source.charAt(start + 1)) >= 0) {
            end += 2;
            while (end < source.length() && (Character.digit(source.charAt(end), 16) >= 0
                                             || source.charAt(end) == '_')) {
                end++;
            }
        } else {
            end = digits(end);
            if (end + 1 < source.length() && source.charAt(end) == '.' && Character.isDigit(source.charAt(end + 1))) {
                floating = true;
                end = digits(end + 1);
            } else if (end < source.length() && source.charAt(end) == '.'
                       && (end + 1 >= source.length() || !isFloatDotFollower(source.charAt(end + 1)))) {
                floating = true;
                end++;
            }
            if (end < source.length() && (source.charAt(end) == 'e' || source.charAt(end) == 'E')) {
                var exponent = end + 1;
                if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                    exponent++;
                }
                if (exponent < source.length() && Character.isDigit(source.charAt(exponent))) {
                    floating = true;
                    end = digits(exponent);
                }
            }
        }
        var suffixStart = end;
        while (end < source.length() && Character.isLetter(source.charAt(end))) {
            end++;
        }
        var suffix = source.substring(suffixStart, end);
        if (suffix.equals("f") || suffix.equals("F") || suffix.equals("m") || suffix.equals("M")) {
            floating = true;
        }
        emit(floating
             ? TokenKind.FLOAT
             : TokenKind.INT,
             end - pos);
    }

    private static boolean isFloatDotFollower(char c) {
        return c == '.' || Character.isLetter(c) || c == '_';
    }

    private int digits(int from) {
        var end = from;
        while (end < source.length() && (Character.isDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        return end;
    }

    private void lexBacktickIdent() {
        var end = source.indexOf("``", pos + 2);
        if (end < 0) {
            throw parseError("unterminated identifier");
        }
        emit(TokenKind.IDENT, end + 2 - pos);
    }

    private void lexIdent() {
        var end = pos;
        while (end < source.length() && isIdentPart(source.charAt(end))) {
            end++;
        }
        var text = source.substring(pos, end);
        if (text.equals("_")) {
            emit(TokenKind.UNDERSCORE, 1);
        } else {
            emit(TokenKind.keyword(text)
                          .orElse(TokenKind.IDENT),
                 text.length());
        }
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private void lexPunctuation(char c) {
        if (lookingAt("[|")) {
            emit(TokenKind.LBRACK_BAR, 2);
        } else if (lookingAt("|]")) {
            emit(TokenKind.BAR_RBRACK, 2);
        } else if (lookingAt("[<")) {
            emit(TokenKind.LBRACK_LESS, 2);
        } else if (lookingAt(">]")) {
            emit(TokenKind.GREATER_RBRACK, 2);
        } else if (lookingAt("..")) {
            emit(TokenKind.DOT_DOT, 2);
        } else if (lookingAt("::")) {
            emit(TokenKind.COLON_COLON, 2);
        } else if (lookingAt(":=") || lookingAt(":?>") || lookingAt(":>") || lookingAt(":?")) {
            emit(TokenKind.OPERATOR, lookingAt(":?>")
                                     ? 3
                                     : 2);
        } else if (c == '-' && startsNegativeNumber()) {
            lexNumber();
        } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
            lexOperator();
        } else {
            var kind = switch (c) {
                case '(' -> TokenKind.LPAREN;
                case ')' -> TokenKind.RPAREN;
                case '[' -> TokenKind.LBRACK;
                case ']' -> TokenKind.RBRACK;
                case '{' -> TokenKind.LBRACE;
                case '}' -> TokenKind.RBRACE;
                case ',' -> TokenKind.COMMA;
                case ';' -> TokenKind.SEMICOLON;
                case ':' -> TokenKind.COLON;
                case '.' -> TokenKind.DOT;
                default -> throw parseError("unexpected character '" + c + "'");
            };
            emit(kind, 1);
        }
    }

    private void lexOperator() {
        var end = pos;
        while (end < source.length() && OPERATOR_CHARS.indexOf(source.charAt(end)) >= 0
               && !source.startsWith("|]", end) && !source.startsWith(">]", end) && !source.startsWith("//", end)
               && !source.startsWith("(*", end)) {
            end++;
        }
        var text = source.substring(pos, end);
        var kind = switch (text) {
            case "=" -> TokenKind.EQUALS;
            case "|" -> TokenKind.BAR;
            case "->" -> TokenKind.RARROW;
            default -> TokenKind.OPERATOR;
        };
        emit(kind, text.length());
    }

    private boolean lookingAt(String text) {
        return source.startsWith(text, pos);
    }

    private void emit(TokenKind kind, int length) {
        var startLine = line;
        var startColumn = column;
        var text = source.substring(pos, pos + length);
        for (var i = 0; i < length; i++) {
            if (source.charAt(pos + i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        pos += length;
        tokens.add(Token.token(kind, sourceRange(startLine, startColumn, line, column), text));
    }

    private RuntimeException parseError(String detail) {
        return FormattingError.inputParseError(SourceRange.point(line, column), detail)
                              .exception();
    }
}
