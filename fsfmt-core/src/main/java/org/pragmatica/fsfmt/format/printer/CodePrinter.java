package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.ParsedFile;
import org.pragmatica.fsfmt.trivia.Anchor;
import org.pragmatica.fsfmt.trivia.Placement;
import org.pragmatica.fsfmt.trivia.TriviaIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a parsed file with its trivia into formatted text.
 */
public final class CodePrinter {
    private static final Logger log = LoggerFactory.getLogger(CodePrinter.class);

    private final FormatterConfig config;

    private CodePrinter(FormatterConfig config) {
        this.config = config;
    }

    public static CodePrinter codePrinter(FormatterConfig config) {
        return new CodePrinter(config);
    }

    /**
     * Print the tree. Fails with a {@link org.pragmatica.fsfmt.format.FormattingException} when a
     * node cannot be rendered or attached trivia was not emitted.
     */
    public String print(ParsedFile file, TriviaIndex trivia) {
        var renderer = new NodeRenderer(config);
        var layout = renderer.render(file);
        var context = RenderContext.renderContext(config, trivia);
        layout.apply(context);
        verifyAllEmitted(context, trivia);
        log.debug("Rendered {} lines, widest column {}", context.lineCount(), context.widestColumn());
        return finish(context.output());
    }

    private static void verifyAllEmitted(RenderContext context, TriviaIndex trivia) {
        for (var anchor : trivia.anchors()) {
            var entry = trivia.entry(anchor);
            check(context, anchor, Placement.BEFORE, !entry.before()
                                                           .isEmpty());
            check(context, anchor, Placement.AFTER, !entry.after()
                                                          .isEmpty());
            check(context, anchor, Placement.ITSELF, entry.itself()
                                                          .isPresent());
        }
    }

    private static void check(RenderContext context, Anchor anchor, Placement placement, boolean present) {
        if (present && !context.isConsumed(anchor, placement)) {
            throw FormattingError.invariantViolation(anchor.range(),
                                                     placement + " trivia of " + anchor + " was not emitted")
                                 .exception();
        }
    }

    /**
     * Strip trailing blank space and end with exactly one newline when configured.
     */
    private String finish(String output) {
        var end = output.length();
        while (end > 0 && Character.isWhitespace(output.charAt(end - 1))) {
            end--;
        }
        var trimmed = output.substring(0, end);
        if (trimmed.isEmpty() || !config.insertFinalNewline()) {
            return trimmed;
        }
        return trimmed + "\n";
    }
}
