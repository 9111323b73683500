package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.parser.Lexer;
import org.pragmatica.fsfmt.parser.Parser;
import org.pragmatica.fsfmt.syntax.NodeKind;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.trivia.Anchor.NodeAnchor;
import org.pragmatica.fsfmt.trivia.Anchor.TokenAnchor;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlankLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlockComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.LineComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.VerbatimLiteral;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.fsfmt.syntax.SourceRange.sourceRange;

class TriviaAttacherTest {

    @Test
    void attach_placesTrailingComment_afterInnermostNodeOnLine() {
        var index = attach("let x = 1 // trailing\n");
        var entry = index.entry(new NodeAnchor(NodeKind.EXPR_CONST, sourceRange(1, 8, 1, 9)));

        assertThat(entry.after()).hasSize(1);
        assertThat(entry.after()
                        .get(0)
                        .first()).isInstanceOf(LineComment.class);
        assertThat(entry.itself()).containsInstanceOf(VerbatimLiteral.class);
    }

    @Test
    void attach_placesOwnLineComment_beforeNextExpression() {
        var index = attach("let f () =\n    // COMMENT\n    x + x\n");
        var entry = index.entry(new NodeAnchor(NodeKind.EXPR_INFIX, sourceRange(3, 4, 3, 9)));

        assertThat(entry.before()).hasSize(1);
        assertThat(((LineComment) entry.before()
                                       .get(0)
                                       .first()).text()).isEqualTo("// COMMENT");
    }

    @Test
    void attach_placesInlineBlockComment_beforeFollowingOperand() {
        var index = attach("let y = 1 + (* mid *) 1\n");
        var entry = index.entry(new NodeAnchor(NodeKind.EXPR_CONST, sourceRange(1, 22, 1, 23)));

        assertThat(entry.before()).hasSize(1);
        assertThat(entry.before()
                        .get(0)
                        .first()).isInstanceOf(BlockComment.class);
    }

    @Test
    void attach_placesBlankLine_beforeFollowingDeclaration() {
        var index = attach("let a = 1\n\nlet b = 2\n");
        var entry = index.entry(new NodeAnchor(NodeKind.DECL_LET, sourceRange(3, 0, 3, 9)));

        assertThat(entry.before()).hasSize(1);
        assertThat(entry.before()
                        .get(0)
                        .first()).isInstanceOf(BlankLine.class);
    }

    @Test
    void attach_placesCommentAfterOpeningBrace_onBraceToken() {
        var index = attach("let r =\n    { // foo\n      A = 1 }\n");
        var entry = index.entry(new TokenAnchor(TokenKind.LBRACE, sourceRange(2, 4, 2, 5)));

        assertThat(entry.after()).hasSize(1);
        assertThat(((LineComment) entry.after()
                                       .get(0)
                                       .first()).text()).isEqualTo("// foo");
    }

    @Test
    void attach_mergesConsecutiveOwnLineComments_intoOneRun() {
        var index = attach("// a\n// b\nlet x = 1\n");
        var entry = index.entry(new NodeAnchor(NodeKind.MODULE_OR_NAMESPACE, sourceRange(3, 0, 3, 9)));

        assertThat(entry.before()).hasSize(1);
        assertThat(entry.before()
                        .get(0)
                        .pieces()).hasSize(2);
    }

    @Test
    void attach_placesCommentAtEndOfFile_afterLastDeclarationInItsColumn() {
        var index = attach("let a = 1\n// end\n");
        var entry = index.entry(new NodeAnchor(NodeKind.DECL_LET, sourceRange(1, 0, 1, 9)));

        assertThat(entry.after()).hasSize(1);
        assertThat(index.entry(new NodeAnchor(NodeKind.MODULE_OR_NAMESPACE, sourceRange(1, 0, 1, 9)))
                        .after()).isEmpty();
    }

    @Test
    void attach_keepsCommentClosingIndentedBody_insideBody() {
        var index = attach("let foo a =\n    call p1 p2\n    // bar\n");
        var entry = index.entry(new NodeAnchor(NodeKind.EXPR_APP, sourceRange(2, 4, 2, 14)));

        assertThat(entry.after()).hasSize(1);
        assertThat(((LineComment) entry.after()
                                       .get(0)
                                       .first()).text()).isEqualTo("// bar");
    }

    @Test
    void attach_keepsSeparateRuns_forCommentsAroundBlankLine() {
        var index = attach("// a\n\n// b\nlet x = 1\n");
        var entry = index.entry(new NodeAnchor(NodeKind.MODULE_OR_NAMESPACE, sourceRange(4, 0, 4, 9)));

        assertThat(entry.before()).hasSize(3);
        assertThat(entry.before()
                        .get(0)
                        .first()).isInstanceOf(LineComment.class);
        assertThat(entry.before()
                        .get(1)
                        .first()).isInstanceOf(BlankLine.class);
        assertThat(((LineComment) entry.before()
                                       .get(2)
                                       .first()).text()).isEqualTo("// b");
    }

    @Test
    void attach_placesTrailingComments_afterConditionalKeywords() {
        var index = attach("let v =\n    if a then // note\n        b\n    else // c\n        c\n");

        assertThat(index.entry(new TokenAnchor(TokenKind.THEN, sourceRange(2, 9, 2, 13)))
                        .after()).hasSize(1);
        assertThat(index.entry(new TokenAnchor(TokenKind.ELSE, sourceRange(4, 4, 4, 8)))
                        .after()).hasSize(1);
    }

    @Test
    void attach_placesTrailingComment_afterTupleComma() {
        var index = attach("let t =\n    (1, // a\n     2)\n");
        var entry = index.entry(new TokenAnchor(TokenKind.COMMA, sourceRange(2, 6, 2, 7)));

        assertThat(entry.after()).hasSize(1);
    }

    @Test
    void attach_placesOwnLineComment_beforeNextOrPatternAlternative() {
        var index = attach("let f x =\n    match x with\n    | A\n    // c\n    | B -> 1\n");
        var entry = index.entry(new NodeAnchor(NodeKind.PAT_NAMED, sourceRange(5, 6, 5, 7)));

        assertThat(entry.before()).hasSize(1);
    }

    @Test
    void attach_fallsBackToFile_whenThereIsNoCode() {
        var index = attach("// only\n");

        assertThat(index.size()).isEqualTo(1);
        var anchor = index.anchors()
                          .iterator()
                          .next();
        assertThat(((NodeAnchor) anchor).kind()).isEqualTo(NodeKind.FILE);
        assertThat(index.entry(anchor)
                        .after()).hasSize(1);
    }

    @Test
    void attach_keepsEveryPiece_exactlyOnce() {
        var index = attach("// head\nlet f x =\n    (* why *)\n    x * 2 // double\n\nlet g = f 1\n");
        var placed = index.anchors()
                          .stream()
                          .map(index::entry)
                          .mapToLong(entry -> entry.before()
                                                   .stream()
                                                   .mapToLong(run -> run.pieces()
                                                                        .size())
                                                   .sum() + entry.after()
                                                                 .stream()
                                                                 .mapToLong(run -> run.pieces()
                                                                                      .size())
                                                                 .sum() + (entry.itself()
                                                                                .isPresent()
                                                                           ? 1
                                                                           : 0))
                          .sum();

        // three comments and a blank line, plus the literals 2 and 1
        assertThat(placed).isEqualTo(6);
    }

    private static TriviaIndex attach(String source) {
        var classified = TokenClassifier.classify(Lexer.tokenize(source, Set.of()));
        var file = Parser.parse(classified.significant());
        return TriviaAttacher.attach(file, classified);
    }
}
