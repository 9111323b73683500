package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.shared.SourceFile;

import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

class FsFormatterTest {

    private FsFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = FsFormatter.fsFormatter();
    }

    @Test
    void format_keepsOwnLineComment_insideFunctionBody() {
        assertFormatted("let f () =\n    // COMMENT\n    x + x\n", "let f () =\n    // COMMENT\n    x + x\n");
    }

    @Test
    void format_reindentsComment_withBody() {
        var narrow = FsFormatter.fsFormatter(FormatterConfig.defaultConfig()
                                                            .withIndentSize(2));

        assertThat(narrow.formatSource("let f () =\n    // COMMENT\n    x + x\n")
                         .unwrap()).isEqualTo("let f () =\n  // COMMENT\n  x + x\n");
    }

    @Test
    void format_keepsTrailingLineComment() {
        assertFormatted("let x = 1 // trailing\n", "let x = 1 // trailing\n");
    }

    @Test
    void format_keepsInlineBlockComment() {
        assertFormatted("let y = 1 + (* mid *) 1\n", "let y = 1 + (* mid *) 1\n");
    }

    @Test
    void format_keepsBlankLineBetweenDeclarations() {
        assertFormatted("let a = 1\n\nlet b = 2\n", "let a = 1\n\nlet b = 2\n");
    }

    @Test
    void format_keepsCommentAtEndOfFile() {
        assertFormatted("let a = 1\n// end\n", "let a = 1\n// end\n");
    }

    @Test
    void format_keepsFileWithOnlyComment() {
        assertFormatted("// only\n", "// only\n");
    }

    @Test
    void format_normalizesSpacing() {
        assertFormatted("let  x=1\n", "let x = 1\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {"let n = 0x1A\n", "let s = @\"C:\\temp\"\n"})
    void format_preservesLiteralSpelling(String source) {
        assertFormatted(source, source);
    }

    @Test
    void format_compactsShortList() {
        assertFormatted("let xs = [1;2;3]\n", "let xs = [ 1; 2; 3 ]\n");
    }

    @Test
    void format_expandsLongList() {
        var source = "let xs = [ 1000000; 2000000; 3000000; 4000000; 5000000 ]\n";

        assertFormatted(source,
                        "let xs =\n    [ 1000000\n      2000000\n      3000000\n      4000000\n      5000000 ]\n");
    }

    @Test
    void format_keepsListOnOneLine_whenWidthAllows() {
        var wide = FsFormatter.fsFormatter(FormatterConfig.defaultConfig()
                                                          .withMaxArrayOrListWidth(60));
        var source = "let xs = [ 1000000; 2000000; 3000000; 4000000; 5000000 ]\n";

        assertThat(wide.formatSource(source)
                       .unwrap()).isEqualTo(source);
    }

    @Test
    void format_compactsShortIfThenElse() {
        assertFormatted("let v =\n    if cond then\n        a\n    else\n        b\n", "let v = if cond then a else b\n");
    }

    @Test
    void format_keepsCommentAfterOpeningBrace() {
        var formatted = formatter.formatSource("let r =\n    { // foo\n      A = 1 }\n")
                                 .unwrap();

        assertThat(formatted).contains("{ // foo\n");
        assertThat(formatted).contains("\n      A = 1");
    }

    @Test
    void format_keepsBothBranchesOfConditionalCode() {
        var source = "#if DEBUG\nlet x = 1\n#else\nlet x = 2\n#endif\n";

        assertFormatted(source, source);
    }

    @Test
    void format_returnsEmptyOutput_forEmptyInput() {
        assertFormatted("", "");
    }

    @Test
    void format_normalizesLineEndings() {
        assertFormatted("let x = 1\r\n", "let x = 1\n");
    }

    @Test
    void format_omitsFinalNewline_whenDisabled() {
        var bare = FsFormatter.fsFormatter(FormatterConfig.defaultConfig()
                                                          .withInsertFinalNewline(false));

        assertThat(bare.formatSource("let x = 1\n")
                       .unwrap()).isEqualTo("let x = 1");
    }

    @Test
    void format_isIdempotent() {
        var once = formatter.formatSource("let  f x=\n  match x with\n  | 1 -> \"one\"\n  | _ -> \"many\"\n")
                            .unwrap();

        assertThat(formatter.formatSource(once)
                            .unwrap()).isEqualTo(once);
    }

    @Test
    void format_reportsUnterminatedComment() {
        assertFailure("let x = 1 (* open\n", FormattingError.MalformedTrivia.class);
    }

    @Test
    void format_reportsUnsupportedConstruct() {
        assertFailure("let x = (# \"nop\" #)\n", FormattingError.UnsupportedConstruct.class);
    }

    @Test
    void format_reportsParseErrors() {
        assertFailure("let x = )\n", FormattingError.InputParseError.class);
        assertFailure("type = int", FormattingError.InputParseError.class);
    }

    @Test
    void format_keepsFileName() {
        var source = SourceFile.sourceFile(Path.of("src", "Program.fs"), "let  x=1\n");

        formatter.format(source)
                 .onFailure(cause -> fail("Format failed: " + cause.message()))
                 .onSuccess(formatted -> {
                     assertThat(formatted.fileName()).isEqualTo(source.fileName());
                     assertThat(formatted.content()).isEqualTo("let x = 1\n");
                 });
    }

    @Test
    void format_keepsIncompleteUnicodeEscape_asWritten() {
        assertFormatted("let s = \"\\u12\"\n", "let s = \"\\u12\"\n");
        assertFormatted("let s = \"x\\U0001\"\n", "let s = \"x\\U0001\"\n");
    }

    @Test
    void format_keepsCommentsBetweenOrPatternAlternatives() {
        var source = "let f x =\n" + "    match x with\n" + "    | A // inline comment\n" + "    // line comment\n"
                     + "    | B -> Some()\n" + "    | _ -> None\n";

        assertFormatted(source, source);
    }

    @Test
    void format_movesCommentAfterBar_aboveNextAlternative() {
        assertFormatted("let f x = match x with | A |\n // c\n B -> 1\n",
                        "let f x =\n    match x with\n    | A\n    // c\n    | B -> 1\n");
    }

    @Test
    void format_keepsTrailingComment_afterTupleComma() {
        var source = "let t =\n    (1, // a\n     2)\n";

        assertFormatted(source, source);
    }

    @Test
    void format_keepsCommentClosingFunctionBody_insideBody() {
        var source = "let foo a =\n" + "    someLongFunctionCall parameterOne parameterTwo parameterThree\n" + "    // bar\n";

        assertFormatted(source, source);
    }

    @Test
    void format_keepsCommentClosingNestedModule_insideModule() {
        var source = "module M =\n    let a = 1\n    // end\n";

        assertFormatted(source, source);
    }

    @Test
    void format_keepsCommentsAfterConditionalKeywords() {
        var source = "let v =\n    if a then // note\n        b\n    else // c\n        c\n";

        assertFormatted(source, source);
    }

    @Test
    void format_keepsCommentCentered_inEmptyList() {
        assertFormatted("let l = [ (* c *) ]\n", "let l = [ (* c *) ]\n");
        assertFormatted("let l = [(* c *)]\n", "let l = [ (* c *) ]\n");
    }

    @Test
    void format_honorsColonSpacing_inReturnType() {
        var spaced = FsFormatter.fsFormatter(FormatterConfig.defaultConfig()
                                                            .withSpaceBeforeColon(true));

        assertFormatted("let f (x: int) : int = x\n", "let f (x: int): int = x\n");
        assertThat(spaced.formatSource("let f (x: int): int = x\n")
                         .unwrap()).isEqualTo("let f (x : int) : int = x\n");
    }

    @Test
    void isFormatted_detectsUnformattedSource() {
        assertThat(formatter.isFormatted(SourceFile.sourceFile(Path.of("A.fs"), "let x = 1\n"))
                            .unwrap()).isTrue();
        assertThat(formatter.isFormatted(SourceFile.sourceFile(Path.of("B.fs"), "let x=1\n"))
                            .unwrap()).isFalse();
    }

    private void assertFormatted(String source, String expected) {
        formatter.formatSource(source)
                 .onFailure(cause -> fail("Format failed: " + cause.message()))
                 .onSuccess(formatted -> assertThat(formatted).isEqualTo(expected));
    }

    private void assertFailure(String source, Class<? extends FormattingError> errorType) {
        var result = formatter.formatSource(source);

        assertThat(result.isFailure()).isTrue();
        result.onFailure(error -> assertThat(error).isInstanceOf(errorType));
    }
}
