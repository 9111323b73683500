package org.pragmatica.fsfmt.trivia;

import org.pragmatica.fsfmt.format.FormattingError;
import org.pragmatica.fsfmt.syntax.NodeKind;
import org.pragmatica.fsfmt.syntax.ParsedFile;
import org.pragmatica.fsfmt.syntax.SourceRange;
import org.pragmatica.fsfmt.syntax.SyntaxNode;
import org.pragmatica.fsfmt.syntax.Token;
import org.pragmatica.fsfmt.syntax.TokenKind;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlankLine;
import org.pragmatica.fsfmt.trivia.TriviaPiece.BlockComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.LineComment;
import org.pragmatica.fsfmt.trivia.TriviaPiece.VerbatimLiteral;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every trivia piece to an anchor of the tree by source position alone.
 * <p>
 * Pieces are first grouped into runs: own-line line comments on consecutive lines form one run,
 * as do own-line block comments; every other piece is a run of its own. A run is then placed:
 * <ol>
 *   <li>an inline block comment followed by code on its line goes before the outermost anchor starting next;</li>
 *   <li>a run preceded by code on its line goes after the innermost anchor ending last on that line;</li>
 *   <li>otherwise before the outermost anchor starting first after the run;</li>
 *   <li>at the end of input, after the innermost anchor ending last before the run that starts in the run's
 *   column, or the outermost one when none does;</li>
 *   <li>after the file node when the tree has no other anchor.</li>
 * </ol>
 * Literal spellings replace the constant node with exactly their range.
 */
public final class TriviaAttacher {
    private static final Logger log = LoggerFactory.getLogger(TriviaAttacher.class);

    private final ParsedFile file;
    private final List<Candidate> candidates = new ArrayList<>();
    private final Map<Anchor, EntryBuilder> entries = new LinkedHashMap<>();
    private final Map<Integer, List<SourceRange>> codeByLine = new LinkedHashMap<>();
    private final Map<SourceRange, Anchor> constants = new HashMap<>();

    private record Candidate(Anchor anchor, int depth) {
        SourceRange range() {
            return anchor.range();
        }
    }

    private static final class EntryBuilder {
        private final List<TriviaRun> before = new ArrayList<>();
        private final List<TriviaRun> after = new ArrayList<>();
        private TriviaPiece itself;

        TriviaEntry build() {
            return new TriviaEntry(before, after, Optional.ofNullable(itself));
        }
    }

    private TriviaAttacher(ParsedFile file, List<Token> significant) {
        this.file = file;
        collect(file, 0);
        for (var candidate : candidates) {
            if (candidate.anchor() instanceof Anchor.NodeAnchor node && isConst(node.kind())) {
                constants.putIfAbsent(node.range(), node);
            }
        }
        for (var token : significant) {
            if (!token.is(TokenKind.EOF)) {
                codeByLine.computeIfAbsent(token.line(), line -> new ArrayList<>())
                          .add(token.range());
            }
        }
    }

    /**
     * Build the trivia index for a tree parsed from the given classified tokens.
     */
    public static TriviaIndex attach(ParsedFile file, ClassifiedTokens classified) {
        return new TriviaAttacher(file, classified.significant()).run(classified.trivia());
    }

    private TriviaIndex run(List<TriviaPiece> trivia) {
        var literals = new ArrayList<VerbatimLiteral>();
        var pieces = new ArrayList<TriviaPiece>();
        for (var piece : trivia) {
            if (piece instanceof VerbatimLiteral literal) {
                literals.add(literal);
            } else {
                pieces.add(piece);
            }
        }
        literals.forEach(this::attachLiteral);
        groupRuns(pieces).forEach(this::place);

        var result = new LinkedHashMap<Anchor, TriviaEntry>();
        entries.forEach((anchor, builder) -> result.put(anchor, builder.build()));
        log.debug("Attached {} trivia pieces to {} anchors", trivia.size(), result.size());
        return TriviaIndex.triviaIndex(result);
    }

    // ===== Candidates =====

    private void collect(SyntaxNode node, int depth) {
        if (node.kind() != NodeKind.FILE && !node.range()
                                                 .isEmpty()) {
            candidates.add(new Candidate(Anchor.of(node), depth));
        }
        for (var token : node.anchorTokens()) {
            candidates.add(new Candidate(Anchor.of(token), depth + 1));
        }
        for (var child : node.children()) {
            collect(child, depth + 1);
        }
    }

    // ===== Runs =====

    private static List<TriviaRun> groupRuns(List<TriviaPiece> pieces) {
        var runs = new ArrayList<TriviaRun>();
        var current = new ArrayList<TriviaPiece>();
        for (var piece : pieces) {
            if (!current.isEmpty() && !continuesRun(current.get(current.size() - 1), piece)) {
                runs.add(TriviaRun.triviaRun(current));
                current = new ArrayList<>();
            }
            current.add(piece);
        }
        if (!current.isEmpty()) {
            runs.add(TriviaRun.triviaRun(current));
        }
        return runs;
    }

    private static boolean continuesRun(TriviaPiece previous, TriviaPiece next) {
        var consecutive = next.range()
                              .startLine() == previous.range()
                                                      .endLine() + 1;
        if (previous instanceof LineComment prev && next instanceof LineComment line) {
            return consecutive && !prev.afterSourceCode() && !line.afterSourceCode();
        }
        if (previous instanceof BlockComment prev && next instanceof BlockComment block) {
            return consecutive && prev.isOwnLine() && block.isOwnLine();
        }
        return false;
    }

    // ===== Placement =====

    private void attachLiteral(VerbatimLiteral literal) {
        var anchor = constants.get(literal.range());
        if (anchor == null) {
            throw FormattingError.invariantViolation(literal.range(),
                                                     "no constant node for literal " + literal.text())
                                 .exception();
        }
        entry(anchor).itself = literal;
    }

    private static boolean isConst(NodeKind kind) {
        return kind == NodeKind.EXPR_CONST || kind == NodeKind.PAT_CONST;
    }

    private void place(TriviaRun run) {
        var range = run.range();
        var first = run.first();

        if (first instanceof BlockComment block && !block.followedByNewline() && hasCodeAfter(range)) {
            var target = outermostStartingAtOrAfter(range.endLine(), range.endColumn());
            if (target.isPresent()) {
                attach(target.get(), Placement.BEFORE, run);
                return;
            }
        }
        if (!(first instanceof BlankLine) && hasCodeBefore(range)) {
            var target = innermostEndingLastOnLine(range.startLine(), range.startColumn());
            if (target.isPresent()) {
                attach(target.get(), Placement.AFTER, run);
                return;
            }
        }
        var next = outermostStartingAtOrAfter(range.endLine(), range.endColumn());
        if (next.isPresent()) {
            attach(next.get(), Placement.BEFORE, run);
            return;
        }
        var previous = endingLastBefore(range.startLine(), range.startColumn());
        if (previous.isPresent()) {
            attach(previous.get(), Placement.AFTER, run);
            return;
        }
        attach(Anchor.of(file), Placement.AFTER, run);
    }

    private void attach(Anchor anchor, Placement placement, TriviaRun run) {
        log.trace("{} {} {}", placement, anchor, run);
        var entry = entry(anchor);
        if (placement == Placement.BEFORE) {
            entry.before.add(run);
        } else {
            entry.after.add(run);
        }
    }

    private EntryBuilder entry(Anchor anchor) {
        return entries.computeIfAbsent(anchor, key -> new EntryBuilder());
    }

    private boolean hasCodeBefore(SourceRange range) {
        return codeByLine.getOrDefault(range.startLine(), List.of())
                         .stream()
                         .anyMatch(code -> code.endsAtOrBefore(range.startLine(), range.startColumn()));
    }

    private boolean hasCodeAfter(SourceRange range) {
        return codeByLine.getOrDefault(range.endLine(), List.of())
                         .stream()
                         .anyMatch(code -> code.startsAtOrAfter(range.endLine(), range.endColumn()));
    }

    private Optional<Anchor> outermostStartingAtOrAfter(int line, int column) {
        Candidate best = null;
        for (var candidate : candidates) {
            var range = candidate.range();
            if (!range.startsAtOrAfter(line, column)) {
                continue;
            }
            if (best == null || range.compareStart(best.range()) < 0 || (range.compareStart(best.range()) == 0
                                                                        && isOuter(candidate, best))) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best)
                       .map(Candidate::anchor);
    }

    private Optional<Anchor> innermostEndingLastOnLine(int line, int column) {
        Candidate best = null;
        for (var candidate : candidates) {
            var range = candidate.range();
            if (range.endLine() != line || range.endColumn() > column) {
                continue;
            }
            if (best == null || range.compareEnd(best.range()) > 0 || (range.compareEnd(best.range()) == 0
                                                                      && isOuter(best, candidate))) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best)
                       .map(Candidate::anchor);
    }

    /**
     * Of the anchors ending last before the position, the innermost one starting in the given column, so a
     * comment closing an indented block stays in that block. Falls back to the outermost one.
     */
    private Optional<Anchor> endingLastBefore(int line, int column) {
        Candidate outermost = null;
        Candidate aligned = null;
        for (var candidate : candidates) {
            var range = candidate.range();
            if (!range.endsAtOrBefore(line, column)) {
                continue;
            }
            if (outermost != null && range.compareEnd(outermost.range()) < 0) {
                continue;
            }
            if (outermost != null && range.compareEnd(outermost.range()) > 0) {
                outermost = null;
                aligned = null;
            }
            if (outermost == null || isOuter(candidate, outermost)) {
                outermost = candidate;
            }
            if (range.startColumn() == column && (aligned == null || isOuter(aligned, candidate))) {
                aligned = candidate;
            }
        }
        return Optional.ofNullable(aligned != null
                                   ? aligned
                                   : outermost)
                       .map(Candidate::anchor);
    }

    /**
     * True when {@code a} encloses {@code b}: a strictly larger range, or the same range higher in the tree.
     */
    private static boolean isOuter(Candidate a, Candidate b) {
        var ar = a.range();
        var br = b.range();
        if (ar.equals(br)) {
            return a.depth() < b.depth();
        }
        return ar.compareStart(br) <= 0 && ar.compareEnd(br) >= 0;
    }
}
