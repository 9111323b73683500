package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenStream;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlankLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlockComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.Directive;
import org.pragmatica.fsfmt.trivia.TriviaPiece.DirectiveLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.LineComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.VerbatimLiteral;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.fsfmt.syntax.TokenKind.*;

/**
 * Partitions a token stream into significant tokens and trivia pieces.
 * <p>
 * Literal tokens are both: the parser needs them, and their exact spelling is recorded as
 * {@link VerbatimLiteral} trivia. Whitespace and newlines produce no pieces except blank lines
 * between the first and last content of the file.
 */
public final class TokenClassifier {
    private final List<Token> tokens;
    private final List<Token> significant = new ArrayList<>();
    private final List<TriviaPiece> trivia = new ArrayList<>();
    private boolean lineHasContent;
    private boolean lineHasCode;

    private TokenClassifier(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static ClassifiedTokens classify(TokenStream stream) {
        return new TokenClassifier(stream.tokens()).run();
    }

    private ClassifiedTokens run() {
        var index = 0;
        while (index < tokens.size()) {
            var token = tokens.get(index);
            switch (token.kind()) {
                case WHITESPACE -> index++;
                case NEWLINE -> {
                    if (!lineHasContent) {
                        trivia.add(new BlankLine(SourceRange.point(token.line(), 0)));
                    }
                    lineHasContent = false;
                    lineHasCode = false;
                    index++;
                }
                case LINE_COMMENT -> {
                    trivia.add(new LineComment(token.text(), token.range(), lineHasCode));
                    lineHasContent = true;
                    index++;
                }
                case BLOCK_COMMENT -> {
                    trivia.add(new BlockComment(token.text(),
                                                token.range(),
                                                !lineHasContent,
                                                followedByNewline(index)));
                    lineHasContent = true;
                    index++;
                }
                case DIRECTIVE, INACTIVE_CODE -> index = directive(index);
                default -> {
                    significant.add(token);
                    if (token.kind()
                             .isLiteral()) {
                        trivia.add(new VerbatimLiteral(token.text(), token.range()));
                    }
                    lineHasContent = !token.is(EOF);
                    lineHasCode = lineHasContent;
                    index++;
                }
            }
        }
        return new ClassifiedTokens(significant, dropOuterBlankLines(trivia));
    }

    private boolean followedByNewline(int index) {
        for (var i = index + 1; i < tokens.size(); i++) {
            var kind = tokens.get(i)
                             .kind();
            if (kind != WHITESPACE) {
                return kind == NEWLINE || kind == EOF;
            }
        }
        return true;
    }

    /**
     * Collect a maximal span of directive and inactive lines separated only by whitespace.
     *
     * @return index of the first token after the span
     */
    private int directive(int start) {
        var last = start;
        for (var i = start + 1; i < tokens.size(); i++) {
            var kind = tokens.get(i)
                             .kind();
            if (kind == DIRECTIVE || kind == INACTIVE_CODE) {
                last = i;
            } else if (kind != WHITESPACE && kind != NEWLINE) {
                break;
            }
        }
        var lines = new ArrayList<DirectiveLine>();
        DirectiveLine current = null;
        for (var i = start; i <= last; i++) {
            var token = tokens.get(i);
            switch (token.kind()) {
                case DIRECTIVE -> current = new DirectiveLine(token.text()
                                                                   .trim(), true);
                case INACTIVE_CODE -> current = new DirectiveLine(token.text()
                                                                       .stripTrailing(), false);
                case NEWLINE -> {
                    lines.add(current == null
                              ? new DirectiveLine("", false)
                              : current);
                    current = null;
                }
                default -> {}
            }
        }
        lines.add(current);
        trivia.add(new Directive(lines,
                                 tokens.get(start)
                                       .range()
                                       .union(tokens.get(last)
                                                    .range())));
        lineHasContent = true;
        lineHasCode = false;
        return last + 1;
    }

    private List<TriviaPiece> dropOuterBlankLines(List<TriviaPiece> pieces) {
        var firstContent = firstContentLine(pieces);
        var lastContent = lastContentLine(pieces);
        var result = new ArrayList<TriviaPiece>();
        for (var piece : pieces) {
            if (piece instanceof BlankLine blank) {
                var line = blank.range()
                                .startLine();
                if (line < firstContent || line > lastContent) {
                    continue;
                }
            }
            result.add(piece);
        }
        return result;
    }

    private int firstContentLine(List<TriviaPiece> pieces) {
        var line = Integer.MAX_VALUE;
        for (var token : significant) {
            if (!token.is(EOF)) {
                line = token.line();
                break;
            }
        }
        for (var piece : pieces) {
            if (!(piece instanceof BlankLine)) {
                line = Math.min(line,
                                piece.range()
                                     .startLine());
                break;
            }
        }
        return line;
    }

    private int lastContentLine(List<TriviaPiece> pieces) {
        var line = 0;
        for (var token : significant) {
            if (!token.is(EOF)) {
                line = Math.max(line,
                                token.range()
                                     .endLine());
            }
        }
        for (var piece : pieces) {
            if (!(piece instanceof BlankLine)) {
                line = Math.max(line,
                                piece.range()
                                     .endLine());
            }
        }
        return line;
    }
}
