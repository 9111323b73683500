package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.parser.Lexer;
import org.pragmatica.fsfmt.syntax.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Combines the outputs formatted under different define sets into one text.
 * <p>
 * Every output is cut at its conditional directive lines. Each chunk is taken from the first
 * variant that compiles it; a chunk no variant compiles comes from the first variant, where it
 * is kept as inactive text.
 */
final class DefineMerger {
    record Variant(Set<String> defines, String output) {}

    private DefineMerger() {}

    static String merge(ConditionalStructure structure, List<Variant> variants) {
        if (variants.isEmpty()) {
            throw FormattingError.invariantViolation(SourceRange.EMPTY, "no formatted variants to merge")
                                 .exception();
        }
        if (structure.isEmpty() || variants.size() == 1) {
            return variants.get(0)
                           .output();
        }
        var split = new ArrayList<SplitOutput>();
        for (var variant : variants) {
            var output = SplitOutput.splitOutput(variant.output());
            if (output.directives()
                      .size() != structure.directives()
                                          .size()) {
                throw FormattingError.invariantViolation(SourceRange.EMPTY,
                                                         "output under defines " + variant.defines() + " has "
                                                         + output.directives()
                                                                 .size() + " directives, source has "
                                                         + structure.directives()
                                                                    .size())
                                     .exception();
            }
            split.add(output);
        }
        var active = variants.stream()
                             .map(variant -> structure.activeChunks(variant.defines()))
                             .toList();
        var merged = new StringBuilder();
        for (var chunk = 0; chunk < structure.chunkCount(); chunk++) {
            if (chunk > 0) {
                merged.append(split.get(0)
                                   .directives()
                                   .get(chunk - 1));
            }
            merged.append(split.get(source(active, chunk))
                               .chunks()
                               .get(chunk));
        }
        return merged.toString();
    }

    private static int source(List<boolean[]> active, int chunk) {
        for (var i = 0; i < active.size(); i++) {
            if (active.get(i)[chunk]) {
                return i;
            }
        }
        return 0;
    }

    private record SplitOutput(List<String> chunks, List<String> directives) {
        static SplitOutput splitOutput(String output) {
            var chunks = new ArrayList<String>();
            var directives = new ArrayList<String>();
            var current = new StringBuilder();

            for (var line : output.split("(?<=\n)")) {
                if (Lexer.isConditionalDirective(line)) {
                    chunks.add(current.toString());
                    directives.add(line);
                    current.setLength(0);
                } else {
                    current.append(line);
                }
            }
            chunks.add(current.toString());
            return new SplitOutput(chunks, directives);
        }
    }
}
