package org.pragmatica.fsfmt.parser;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.format.FormattingException;
import org.pragmatica.fsfmt.syntax.Binding;
import org.pragmatica.fsfmt.syntax.Expr;
import org.pragmatica.fsfmt.syntax.ModuleDecl;
import org.pragmatica.fsfmt.syntax.ModuleOrNamespace;
import org.pragmatica.fsfmt.syntax.ParsedFile;
import org.pragmatica.fsfmt.syntax.SynType;
import org.pragmatica.fsfmt.syntax.TypeDefn;
import org.pragmatica.fsfmt.trivia.TokenClassifier;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    @Test
    void parse_buildsFunctionBinding() {
        var binding = firstBinding(parse("let f x = x + 1\n"));

        assertThat(binding.isFunction()).isTrue();
        assertThat(binding.body()).isInstanceOf(Expr.Infix.class);
        assertThat(((Expr.Infix) binding.body()).operator()).isEqualTo("+");
    }

    @Test
    void parse_respectsOperatorPrecedence() {
        var body = (Expr.Infix) firstBinding(parse("let v = a + b * c\n")).body();

        assertThat(body.operator()).isEqualTo("+");
        assertThat(body.right()).isInstanceOf(Expr.Infix.class);
        assertThat(((Expr.Infix) body.right()).operator()).isEqualTo("*");
    }

    @Test
    void parse_endsBindingBody_atOffsideLine() {
        var decls = decls(parse("let a =\n    1\nlet b = 2\n"));

        assertThat(decls).hasSize(2)
                         .allMatch(decl -> decl instanceof ModuleDecl.Let);
    }

    @Test
    void parse_buildsSequence_fromAlignedLines() {
        var body = firstBinding(parse("let main () =\n    printfn \"a\"\n    printfn \"b\"\n")).body();

        assertThat(body).isInstanceOf(Expr.Sequential.class);
        var sequential = (Expr.Sequential) body;
        assertThat(sequential.first()).isInstanceOf(Expr.App.class);
        assertThat(sequential.second()).isInstanceOf(Expr.App.class);
    }

    @Test
    void parse_recognizesNamedModuleHeader() {
        var module = parse("module Shop.Orders\n\nlet total = 0\n").modules()
                                                                    .get(0);

        assertThat(module.moduleKind()).isEqualTo(ModuleOrNamespace.Kind.NAMED_MODULE);
        assertThat(module.nameText()).isEqualTo("Shop.Orders");
        assertThat(module.decls()).hasSize(1);
    }

    @Test
    void parse_distinguishesUnionFromAbbreviation() {
        var abbreviation = firstType(parse("type Id = int\n"));
        var union = firstType(parse("type Color = Red | Green\n"));

        assertThat(abbreviation).isInstanceOf(TypeDefn.Abbreviation.class);
        assertThat(union).isInstanceOf(TypeDefn.UnionType.class);
        assertThat(((TypeDefn.UnionType) union).cases()).hasSize(2);
    }

    @Test
    void parse_splitsClosingAnglesOfNestedGenerics() {
        var binding = firstBinding(parse("let x: Map<string, list<int>> = m\n"));

        assertThat(binding.returnType()).containsInstanceOf(SynType.App.class);
        var type = (SynType.App) binding.returnType()
                                        .orElseThrow();
        assertThat(type.args()).hasSize(2);
        assertThat(type.args()
                       .get(1)).isInstanceOf(SynType.App.class);
    }

    @Test
    void parse_fails_onUnexpectedToken() {
        assertThatThrownBy(() -> parse("let x = )\n"))
                .isInstanceOf(FormattingException.class)
                .extracting(e -> ((FormattingException) e).error())
                .isInstanceOf(FormattingError.InputParseError.class);
        assertThatThrownBy(() -> parse("type = int\n"))
                .isInstanceOf(FormattingException.class)
                .hasMessageContaining("expected type name");
    }

    private static ParsedFile parse(String source) {
        return Parser.parse(TokenClassifier.classify(Lexer.tokenize(source, Set.of()))
                                           .significant());
    }

    private static List<ModuleDecl> decls(ParsedFile file) {
        return file.modules()
                   .get(0)
                   .decls();
    }

    private static Binding firstBinding(ParsedFile file) {
        return ((ModuleDecl.Let) decls(file).get(0)).bindings()
                                                    .get(0);
    }

    private static TypeDefn firstType(ParsedFile file) {
        return ((ModuleDecl.Types) decls(file).get(0)).definitions()
                                                      .get(0);
    }
}
