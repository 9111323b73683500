package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.format.FormattingException;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.fsfmt.syntax.TokenKind.*;

class LexerTest {

    @Test
    void tokenize_coversSourceWithoutGaps() {
        var source = "let f x =\n    // comment\n    x + (* inline *) 1\n";

        var stream = Lexer.tokenize(source, Set.of());

        assertThat(stream.text()).isEqualTo(source);
        assertThat(stream.tokens()
                         .get(stream.tokens()
                                    .size() - 1)
                         .kind()).isEqualTo(EOF);
    }

    @Test
    void tokenize_recognizesKeywordsAndPunctuation() {
        var kinds = significantKinds("let rec f (x: int) = [| x; 2 |]");

        assertThat(kinds).containsExactly(LET, REC, IDENT, LPAREN, IDENT, COLON, IDENT, RPAREN, EQUALS,
                                          LBRACK_BAR, IDENT, SEMICOLON, INT, BAR_RBRACK, EOF);
    }

    @Test
    void tokenize_keepsLiteralSpelling() {
        var tokens = significant("let a = 0x1A\nlet b = @\"C:\\temp\"\nlet c = 1.0e3");

        assertThat(textsOf(tokens, INT)).containsExactly("0x1A");
        assertThat(textsOf(tokens, STRING)).containsExactly("@\"C:\\temp\"");
        assertThat(textsOf(tokens, FLOAT)).containsExactly("1.0e3");
    }

    @Test
    void tokenize_treatsMinusAsSign_onlyWhenDetachedFromOperand() {
        assertThat(significantKinds("f -1")).containsExactly(IDENT, INT, EOF);
        assertThat(significantKinds("a-1")).containsExactly(IDENT, OPERATOR, INT, EOF);
        assertThat(significantKinds("a - 1")).containsExactly(IDENT, OPERATOR, INT, EOF);
    }

    @Test
    void tokenize_splitsOperatorBeforeComment() {
        var tokens = Lexer.tokenize("a +(* c *) b", Set.of())
                          .tokens();

        assertThat(tokens).extracting(Token::kind)
                          .contains(OPERATOR, BLOCK_COMMENT);
        assertThat(textsOf(tokens, OPERATOR)).containsExactly("+");
    }

    @Test
    void tokenize_emitsInactiveCode_forDisabledBranch() {
        var source = "#if DEBUG\nlet x = 1\n#else\nlet x = 2\n#endif\n";

        var inactiveDebug = Lexer.tokenize(source, Set.of())
                                 .tokens();
        var activeDebug = Lexer.tokenize(source, Set.of("DEBUG"))
                               .tokens();

        assertThat(textsOf(inactiveDebug, INACTIVE_CODE)).containsExactly("let x = 1");
        assertThat(textsOf(activeDebug, INACTIVE_CODE)).containsExactly("let x = 2");
        assertThat(textsOf(activeDebug, DIRECTIVE)).containsExactly("#if DEBUG", "#else", "#endif");
    }

    @Test
    void tokenize_evaluatesNestedConditions() {
        var source = "#if A\n#if B\nboth\n#endif\n#endif\n";

        assertThat(textsOf(Lexer.tokenize(source, Set.of("A")).tokens(), INACTIVE_CODE)).containsExactly("both");
        assertThat(textsOf(Lexer.tokenize(source, Set.of("A", "B")).tokens(), IDENT)).containsExactly("both");
    }

    @Test
    void tokenize_fails_onUnterminatedBlockComment() {
        assertThatThrownBy(() -> Lexer.tokenize("let x = 1 (* open", Set.of()))
                .isInstanceOf(FormattingException.class)
                .extracting(e -> ((FormattingException) e).error())
                .isInstanceOf(FormattingError.MalformedTrivia.class);
    }

    @Test
    void tokenize_fails_onUnbalancedDirectives() {
        assertThatThrownBy(() -> Lexer.tokenize("#endif\n", Set.of()))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("#endif without matching #if");
        assertThatThrownBy(() -> Lexer.tokenize("#if A\nlet x = 1\n", Set.of()))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("#if without matching #endif");
    }

    @Test
    void isConditionalDirective_matchesWholeDirectiveWords() {
        assertThat(Lexer.isConditionalDirective("  #if DEBUG")).isTrue();
        assertThat(Lexer.isConditionalDirective("#endif // DEBUG")).isTrue();
        assertThat(Lexer.isConditionalDirective("#iffy")).isFalse();
        assertThat(Lexer.isConditionalDirective("#load \"x.fsx\"")).isFalse();
    }

    private static List<Token> significant(String source) {
        return Lexer.tokenize(source, Set.of())
                    .tokens()
                    .stream()
                    .filter(token -> !token.kind()
                                           .isTrivia())
                    .collect(Collectors.toList());
    }

    private static List<TokenKind> significantKinds(String source) {
        return significant(source).stream()
                                  .map(Token::kind)
                                  .collect(Collectors.toList());
    }

    private static List<String> textsOf(List<Token> tokens, TokenKind kind) {
        return tokens.stream()
                     .filter(token -> token.is(kind))
                     .map(Token::text)
                     .collect(Collectors.toList());
    }
}
