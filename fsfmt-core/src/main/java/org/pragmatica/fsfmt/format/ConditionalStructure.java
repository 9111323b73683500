package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.parser.DirectiveExpression;
import org.pragmatica.fsfmt.parser.Lexer;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;

import java.util.ArrayDeque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conditional directives of a source in order of appearance.
 * <p>
 * The directives split the source into chunks: chunk 0 precedes the first directive and chunk
 * {@code i} follows directive {@code i}.
 */
record ConditionalStructure(List<Token> directives) {
    static ConditionalStructure conditionalStructure(String source) {
        var directives = Lexer.tokenize(source, Set.of())
                              .tokens()
                              .stream()
                              .filter(token -> token.is(TokenKind.DIRECTIVE))
                              .collect(Collectors.toList());
        return new ConditionalStructure(List.copyOf(directives));
    }

    boolean isEmpty() {
        return directives.isEmpty();
    }

    int chunkCount() {
        return directives.size() + 1;
    }

    /**
     * Symbols referenced by all {@code #if} conditions, in order of first appearance.
     */
    Set<String> symbols() {
        var symbols = new LinkedHashSet<String>();
        for (var directive : directives) {
            condition(directive).ifPresent(condition -> symbols.addAll(DirectiveExpression.symbols(condition,
                                                                                                   directive.range())));
        }
        return symbols;
    }

    /**
     * Which chunks are compiled under the define set.
     */
    boolean[] activeChunks(Set<String> defines) {
        var active = new boolean[chunkCount()];
        var frames = new ArrayDeque<Frame>();
        active[0] = true;
        for (var i = 0; i < directives.size(); i++) {
            var directive = directives.get(i);
            var text = directive.text()
                                .trim();
            var condition = condition(directive);
            if (condition.isPresent()) {
                var enclosing = frames.isEmpty() || frames.peek()
                                                          .active();
                frames.push(new Frame(enclosing,
                                      DirectiveExpression.evaluate(condition.get(), directive.range(), defines),
                                      false));
            } else if (text.startsWith("#else")) {
                requireOpen(frames, directive.range());
                frames.push(frames.pop()
                                  .flip());
            } else {
                requireOpen(frames, directive.range());
                frames.pop();
            }
            active[i + 1] = frames.isEmpty() || frames.peek()
                                                      .active();
        }
        return active;
    }

    private static Optional<String> condition(Token directive) {
        var text = directive.text()
                            .trim();
        if (text.startsWith("#if")) {
            return Optional.of(text.substring(3));
        }
        return Optional.empty();
    }

    private static void requireOpen(ArrayDeque<Frame> frames, SourceRange range) {
        if (frames.isEmpty()) {
            throw FormattingError.malformedTrivia(range, "directive without matching #if")
                                 .exception();
        }
    }

    private record Frame(boolean enclosingActive, boolean condition, boolean inElse) {
        boolean active() {
            return enclosingActive && (inElse != condition);
        }

        Frame flip() {
            return new Frame(enclosingActive, condition, true);
        }
    }
}
