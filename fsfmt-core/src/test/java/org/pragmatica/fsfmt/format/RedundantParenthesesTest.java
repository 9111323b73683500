package org.pragmatica.fsfmt.format;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

class RedundantParenthesesTest {
    private static final String LONG_CONDITION = "f" + "o".repeat(75);
    private static final String LONG_ELIF_CONDITION = "ba" + "z".repeat(95);

    private FsFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = FsFormatter.fsFormatter();
    }

    @Test
    void format_dropsParentheses_aroundIfCondition() {
        assertFormatted("let v = if (foo) then bar else baz\n", "let v = if foo then bar else baz\n");
    }

    @Test
    void format_dropsParentheses_aroundLongIfCondition() {
        assertFormatted("let v =\n    if (" + LONG_CONDITION + ") then\n        bar else baz\n",
                        "let v =\n    if " + LONG_CONDITION + " then\n        bar\n    else\n        baz\n");
    }

    @Test
    void format_dropsParentheses_aroundElifCondition() {
        assertFormatted("let v =\n    if foo then bar\n    elif (baz) then foobar\n    else qux\n",
                        "let v =\n    if foo then\n        bar\n    elif baz then\n        foobar\n    else\n        qux\n");
    }

    @Test
    void format_dropsParentheses_aroundLongElifCondition() {
        assertFormatted("if foo then bar\nelif (" + LONG_ELIF_CONDITION + ") then foobar\n",
                        "if foo then\n    bar\nelif " + LONG_ELIF_CONDITION + " then\n    foobar\n");
    }

    @Test
    void format_keepsParentheses_aroundThenBranch() {
        assertFormatted("let v =\n    if foo then (bar)\n    elif baz then foobar\n    else qux\n",
                        "let v =\n    if foo then\n        (bar)\n    elif baz then\n        foobar\n    else\n        qux\n");
    }

    @Test
    void format_keepsParentheses_aroundElifBranch() {
        assertFormatted("let v =\n    if foo then bar\n    elif baz then (foobar)\n    else qux\n",
                        "let v =\n    if foo then\n        bar\n    elif baz then\n        (foobar)\n    else\n        qux\n");
    }

    @Test
    void format_keepsParentheses_aroundCompoundCondition() {
        assertFormatted("let v = if (a && b) then c else d\n", "let v = if (a && b) then c else d\n");
    }

    @Test
    void format_dropsParentheses_aroundSingleUnionCaseArgument() {
        assertFormatted("let f foo =\n    match foo with\n    | None -> ()\n    | Some(bar) -> ()\n",
                        "let f foo =\n    match foo with\n    | None -> ()\n    | Some bar -> ()\n");
    }

    @Test
    void format_dropsParentheses_aroundArgumentOfAnyUnionCase() {
        assertFormatted("let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing(bar) -> ()\n",
                        "let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing bar -> ()\n");
    }

    @Test
    void format_dropsParentheses_insideTuplePattern() {
        assertFormatted("let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing(bar), baz -> ()\n",
                        "let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing bar, baz -> ()\n");
    }

    @Test
    void format_keepsParentheses_aroundTupleArgument() {
        var source = "let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing (bar, baz) -> ()\n";

        assertFormatted(source, source);
        assertFormatted(source.replace("OtherThing (", "OtherThing("), source);
    }

    @Test
    void format_keepsParentheses_aroundNestedUnionCase() {
        var source = "let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing (AndLastThing bar) -> ()\n";

        assertFormatted(source, source);
    }

    @Test
    void format_keepsParentheses_aroundConsPattern() {
        var source = "let f foo =\n    match foo with\n    | Something -> ()\n    | OtherThing (head :: tail) -> ()\n";

        assertFormatted(source, source);
    }

    private void assertFormatted(String source, String expected) {
        formatter.formatSource(source)
                 .onFailure(cause -> fail("Format failed: " + cause.message()))
                 .onSuccess(formatted -> assertThat(formatted).isEqualTo(expected));
    }
}
