package org.pragmatica.fsfmt.format.printer;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.trivia.Anchor;
import org.pragmatica.fsfmt.trivia.Placement;
import org.pragmatica.fsfmt.trivia.TriviaIndex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable output state of one render.
 * <p>
 * Indentation is written lazily: a newline only resets the column, and the indent of the line
 * is padded on its first write. A trial context created by {@link #fork(int)} starts with an empty
 * buffer and the same position; it turns into a no-op once it needs a newline or passes its
 * column limit, and {@link #commit(RenderContext)} appends it to its parent.
 */
public final class RenderContext {
    private static final int UNLIMITED = Integer.MAX_VALUE;

    private final FormatterConfig config;
    private final TriviaIndex trivia;
    private final RenderContext parent;
    private final int maxColumn;
    private final StringBuilder output = new StringBuilder();
    private final Set<Consumed> consumed = new HashSet<>();
    private Deque<Integer> indents = new ArrayDeque<>();
    private int column;
    private boolean lineHasContent;
    private boolean pendingNewline;
    private int lines;
    private int widest;
    private boolean overflowed;

    private record Consumed(Anchor anchor, Placement placement) {}

    private RenderContext(FormatterConfig config, TriviaIndex trivia, RenderContext parent, int maxColumn) {
        this.config = config;
        this.trivia = trivia;
        this.parent = parent;
        this.maxColumn = maxColumn;
    }

    public static RenderContext renderContext(FormatterConfig config, TriviaIndex trivia) {
        var context = new RenderContext(config, trivia, null, UNLIMITED);
        context.indents.push(0);
        return context;
    }

    public FormatterConfig config() {
        return config;
    }

    public TriviaIndex trivia() {
        return trivia;
    }

    // ===== Writing =====

    /**
     * Append text. Text with embedded newlines (multi-line strings and comments) is written as is
     * and leaves the column after its last line. Leading spaces are dropped at the start of a line.
     */
    public RenderContext write(String text) {
        if (overflowed || text.isEmpty()) {
            return this;
        }
        newlineIfPending();
        if (!lineHasContent) {
            // separators never lead a line
            text = text.stripLeading();
            if (text.isEmpty()) {
                return this;
            }
            output.append(" ".repeat(currentIndent()));
            column = currentIndent();
        }
        output.append(text);
        lineHasContent = true;
        var lastBreak = text.lastIndexOf('\n');
        if (lastBreak < 0) {
            column += text.length();
        } else {
            lines += (int) text.chars()
                               .filter(c -> c == '\n')
                               .count();
            column = text.length() - lastBreak - 1;
        }
        track();
        return this;
    }

    /**
     * Append text at column zero, ignoring the indentation. Used for inactive code.
     */
    public RenderContext writeRaw(String text) {
        if (overflowed) {
            return this;
        }
        newlineIfPending();
        if (lineHasContent) {
            return write(text);
        }
        output.append(text);
        column = text.length();
        lineHasContent = !text.isEmpty();
        track();
        return this;
    }

    /**
     * Single separating space. Never doubled and never written at line start.
     */
    public RenderContext space() {
        if (overflowed || pendingNewline || !lineHasContent || endsWithSpace()) {
            return this;
        }
        return write(" ");
    }

    public RenderContext newline() {
        if (overflowed) {
            return this;
        }
        if (isTrial()) {
            overflowed = true;
            return this;
        }
        pendingNewline = false;
        while (endsWithSpace()) {
            output.setLength(output.length() - 1);
        }
        output.append('\n');
        column = 0;
        lineHasContent = false;
        lines++;
        return this;
    }

    /**
     * Break the line unless nothing was written on it yet.
     */
    public RenderContext ensureLineStart() {
        if (pendingNewline || lineHasContent) {
            newline();
        }
        return this;
    }

    /**
     * Request a line break before the next write. Set after a trailing line comment.
     */
    public RenderContext requestNewline() {
        pendingNewline = true;
        return this;
    }

    /**
     * Break the line now if a newline was requested.
     */
    public RenderContext newlineIfPending() {
        if (pendingNewline) {
            newline();
        }
        return this;
    }

    private boolean endsWithSpace() {
        return output.length() > 0 && output.charAt(output.length() - 1) == ' ';
    }

    private void track() {
        widest = Math.max(widest, column);
        if (column > maxColumn) {
            overflowed = true;
        }
    }

    // ===== Indentation =====

    public int currentIndent() {
        return indents.peek();
    }

    /**
     * Column where the next write starts.
     */
    public int nextColumn() {
        return pendingNewline || !lineHasContent
               ? currentIndent()
               : column;
    }

    public RenderContext indent() {
        indents.push(currentIndent() + config.indentSize());
        return this;
    }

    public RenderContext pinIndent(int column) {
        indents.push(column);
        return this;
    }

    public RenderContext unindent() {
        if (indents.size() == 1) {
            throw new IllegalStateException("Unbalanced unindent");
        }
        indents.pop();
        return this;
    }

    // ===== Trials =====

    /**
     * Trial context sharing the current position. It overflows past {@code limit} or on a newline.
     */
    public RenderContext fork(int limit) {
        var trial = new RenderContext(config, trivia, this, Math.min(limit, maxColumn));
        trial.indents = new ArrayDeque<>(indents);
        trial.column = column;
        trial.lineHasContent = lineHasContent;
        trial.pendingNewline = pendingNewline;
        trial.widest = column;
        return trial;
    }

    /**
     * Adopt the output and state of a successful trial forked from this context.
     */
    public RenderContext commit(RenderContext trial) {
        if (trial.parent != this) {
            throw new IllegalStateException("Trial was not forked from this context");
        }
        if (trial.overflowed) {
            throw new IllegalStateException("Cannot commit an overflowed trial");
        }
        output.append(trial.output);
        indents = new ArrayDeque<>(trial.indents);
        column = trial.column;
        lineHasContent = trial.lineHasContent;
        pendingNewline = trial.pendingNewline;
        lines += trial.lines;
        consumed.addAll(trial.consumed);
        track();
        return this;
    }

    /**
     * Fail this trial without writing anything.
     */
    public RenderContext abandon() {
        if (!isTrial()) {
            throw new IllegalStateException("Only a trial context can be abandoned");
        }
        overflowed = true;
        return this;
    }

    public boolean isTrial() {
        return parent != null;
    }

    public boolean overflowed() {
        return overflowed;
    }

    // ===== Trivia bookkeeping =====

    /**
     * Mark trivia of the anchor as emitted.
     *
     * @return false when it was already emitted in this context or an enclosing one
     */
    public boolean consume(Anchor anchor, Placement placement) {
        var key = new Consumed(anchor, placement);
        if (isConsumed(key)) {
            return false;
        }
        consumed.add(key);
        return true;
    }

    public boolean isConsumed(Anchor anchor, Placement placement) {
        return isConsumed(new Consumed(anchor, placement));
    }

    private boolean isConsumed(Consumed key) {
        for (var context = this; context != null; context = context.parent) {
            if (context.consumed.contains(key)) {
                return true;
            }
        }
        return false;
    }

    // ===== Results =====

    public String output() {
        return output.toString();
    }

    public int column() {
        return column;
    }

    public int lineCount() {
        return lines;
    }

    public int widestColumn() {
        return widest;
    }

    public boolean atLineStart() {
        return pendingNewline || !lineHasContent;
    }
}
