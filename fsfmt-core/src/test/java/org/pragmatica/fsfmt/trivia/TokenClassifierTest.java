package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.parser.Lexer;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlankLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlockComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.Directive;
import org.pragmatica.fsfmt.trivia.TriviaPiece.DirectiveLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.LineComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.VerbatimLiteral;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenClassifierTest {

    @Test
    void classify_separatesSignificantTokens_fromTrivia() {
        var classified = classify("let x = 1 // trailing\n");

        assertThat(classified.significant()).extracting(Token::kind)
                                            .containsExactly(TokenKind.LET,
                                                             TokenKind.IDENT,
                                                             TokenKind.EQUALS,
                                                             TokenKind.INT,
                                                             TokenKind.EOF);
        assertThat(classified.trivia()).containsExactly(new VerbatimLiteral("1", SourceRange.sourceRange(1, 8, 1, 9)),
                                                        new LineComment("// trailing",
                                                                        SourceRange.sourceRange(1, 10, 1, 21),
                                                                        true));
    }

    @Test
    void classify_marksOwnLineComment_asNotAfterCode() {
        var comments = piecesOf(classify("// own\nlet x = y\n"), LineComment.class);

        assertThat(comments).hasSize(1);
        assertThat(comments.get(0)
                           .afterSourceCode()).isFalse();
    }

    @Test
    void classify_recordsBlockCommentSurroundings() {
        var inline = piecesOf(classify("let y = 1 + (* mid *) 1\n"), BlockComment.class).get(0);
        var ownLine = piecesOf(classify("(* doc *)\nlet y = x\n"), BlockComment.class).get(0);

        assertThat(inline.precededByNewline()).isFalse();
        assertThat(inline.followedByNewline()).isFalse();
        assertThat(ownLine.precededByNewline()).isTrue();
        assertThat(ownLine.followedByNewline()).isTrue();
        assertThat(ownLine.isOwnLine()).isTrue();
    }

    @Test
    void classify_keepsBlankLinesBetweenContent_only() {
        var inner = piecesOf(classify("let a = b\n\n\nlet c = d\n"), BlankLine.class);
        var outer = piecesOf(classify("\n\nlet a = b\n\n\n"), BlankLine.class);

        assertThat(inner).extracting(blank -> blank.range()
                                                   .startLine())
                         .containsExactly(2, 3);
        assertThat(outer).isEmpty();
    }

    @Test
    void classify_groupsDirectiveAndInactiveLines() {
        var directives = piecesOf(classify("#if A\nlet a = 1\n#else\nlet a = 2\n#endif\n"), Directive.class);

        assertThat(directives).hasSize(2);
        assertThat(directives.get(0)
                             .lines()).containsExactly(new DirectiveLine("#if A", true),
                                                       new DirectiveLine("let a = 1", false),
                                                       new DirectiveLine("#else", true));
        assertThat(directives.get(1)
                             .text()).isEqualTo("#endif");
    }

    @Test
    void classify_recordsEveryLiteralSpelling() {
        var literals = piecesOf(classify("let s = @\"a\\b\"\nlet n = 0x1A\n"), VerbatimLiteral.class);

        assertThat(literals).extracting(VerbatimLiteral::text)
                            .containsExactly("@\"a\\b\"", "0x1A");
    }

    private static ClassifiedTokens classify(String source) {
        return TokenClassifier.classify(Lexer.tokenize(source, Set.of()));
    }

    private static <T extends TriviaPiece> List<T> piecesOf(ClassifiedTokens classified, Class<T> type) {
        return classified.trivia()
                         .stream()
                         .filter(type::isInstance)
                         .map(type::cast)
                         .collect(Collectors.toList());
    }
}
