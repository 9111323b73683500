package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.format.DefineMerger.Variant;
import org.pragmatica.fsfmt.format.printer.CodePrinter;
import org.pragmatica.fsfmt.parser.Lexer;
import org.pragmatica.fsfmt.parser.Parser;
import org.pragmatica.fsfmt.shared.SourceFile;
import org.pragmatica.fsfmt.trivia.TokenClassifier;
import org.pragmatica.fsfmt.trivia.TriviaAttacher;

import java.util.ArrayList;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.pragmatica.fsfmt.format.ConditionalStructure.conditionalStructure;
import static org.pragmatica.fsfmt.format.DefineCombinations.defineCombinations;

/**
 * Trivia-preserving formatter.
 * <p>
 * The source is formatted once per define set its conditional directives make relevant. Each
 * pass tokenizes, separates trivia, parses, attaches trivia to the tree and prints it. The
 * outputs are then merged so every conditional branch comes from a pass that compiled it.
 */
public final class FsFormatter implements Formatter {
    private static final Logger log = LoggerFactory.getLogger(FsFormatter.class);

    private final FormatterConfig config;
    private final CodePrinter printer;

    private FsFormatter(FormatterConfig config) {
        this.config = config;
        this.printer = CodePrinter.codePrinter(config);
    }

    public static FsFormatter fsFormatter() {
        return fsFormatter(FormatterConfig.defaultConfig());
    }

    public static FsFormatter fsFormatter(FormatterConfig config) {
        return new FsFormatter(config);
    }

    @Override
    public FormatResult<SourceFile> format(SourceFile source) {
        log.debug("Formatting {}", source.fileName());
        return formatSource(source.content()).map(source::withContent)
                                             .onFailure(error -> log.debug("Formatting {} failed: {}",
                                                                           source.fileName(),
                                                                           error.message()));
    }

    @Override
    public FormatResult<Boolean> isFormatted(SourceFile source) {
        return formatSource(source.content()).map(formatted -> formatted.equals(normalize(source.content())));
    }

    @Override
    public FormatterConfig config() {
        return config;
    }

    /**
     * Format source text.
     */
    public FormatResult<String> formatSource(String source) {
        var normalized = normalize(source);
        return FormatResult.lift(() -> formatAllVariants(normalized));
    }

    private String formatAllVariants(String source) {
        var structure = conditionalStructure(source);
        var combinations = defineCombinations(structure.symbols());
        if (combinations.size() > 1) {
            log.debug("Formatting under {} define sets: {}", combinations.size(), combinations);
        }
        var variants = new ArrayList<Variant>();
        for (var defines : combinations) {
            variants.add(new Variant(defines, formatVariant(source, defines)));
        }
        return DefineMerger.merge(structure, variants);
    }

    private String formatVariant(String source, Set<String> defines) {
        var tokens = Lexer.tokenize(source, defines);
        var classified = TokenClassifier.classify(tokens);
        var file = Parser.parse(classified.significant());
        var trivia = TriviaAttacher.attach(file, classified);
        log.trace("Defines {}: {} significant tokens, {} trivia anchors",
                  defines,
                  classified.significant()
                            .size(),
                  trivia.size());
        return printer.print(file, trivia);
    }

    private static String normalize(String source) {
        return source.replace("\r\n", "\n");
    }
}
