package org.pragmatica.fsfmt.format.printer;

import java.util.ArrayList;
import java.util.List;

/**
 * Layout combinators.
 */
public final class Layouts {
    private static final Layout EMPTY = context -> context;

    private Layouts() {}

    public static Layout empty() {
        return EMPTY;
    }

    public static Layout text(String text) {
        return context -> context.write(text);
    }

    public static Layout space() {
        return RenderContext::space;
    }

    public static Layout newline() {
        return RenderContext::newline;
    }

    public static Layout newlineIfPending() {
        return RenderContext::newlineIfPending;
    }

    /**
     * Run the layout one indentation level deeper.
     */
    public static Layout indented(Layout layout) {
        return context -> layout.apply(context.indent())
                                .unindent();
    }

    /**
     * Run the layout with the indentation pinned to the column of the next write, so that
     * continuation lines align under its first character.
     */
    public static Layout atCurrentColumn(Layout layout) {
        return context -> layout.apply(context.pinIndent(context.nextColumn()))
                                .unindent();
    }

    /**
     * Run the layout with the indentation set a fixed number of columns right of the current
     * indentation, independent of what was written on the line so far.
     */
    public static Layout indentedBy(int columns, Layout layout) {
        return context -> layout.apply(context.pinIndent(context.currentIndent() + columns))
                                .unindent();
    }

    public static Layout sequence(Layout... layouts) {
        return sequence(List.of(layouts));
    }

    public static Layout sequence(List<Layout> layouts) {
        var steps = List.copyOf(layouts);
        return context -> {
            for (var step : steps) {
                step.apply(context);
                if (context.overflowed()) {
                    break;
                }
            }
            return context;
        };
    }

    public static Layout join(Layout separator, List<Layout> layouts) {
        var steps = new ArrayList<Layout>();
        for (var i = 0; i < layouts.size(); i++) {
            if (i > 0) {
                steps.add(separator);
            }
            steps.add(layouts.get(i));
        }
        return sequence(steps);
    }

    public static Layout when(boolean condition, Layout layout) {
        return condition
               ? layout
               : EMPTY;
    }

    /**
     * Layout that always spans lines. Inside a trial it fails at once, so the enclosing
     * {@link #tryCompact} picks its expanded shape.
     */
    public static Layout forceExpanded(Layout layout) {
        return context -> context.isTrial()
                          ? context.abandon()
                          : layout.apply(context);
    }

    /**
     * Render {@code compact} if it stays on one line within {@code maxWidth} columns of the
     * current position and within the line length limit; otherwise render {@code expanded}.
     */
    public static Layout tryCompact(Layout compact, Layout expanded, int maxWidth) {
        return context -> {
            if (context.overflowed()) {
                return context;
            }
            var start = context.nextColumn();
            var limit = (int) Math.min((long) start + maxWidth,
                                       context.config()
                                              .maxLineLength());
            var trial = context.fork(limit);
            compact.apply(trial);
            if (!trial.overflowed()) {
                return context.commit(trial);
            }
            return expanded.apply(context);
        };
    }
}
