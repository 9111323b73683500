package org.pragmatica.fsfmt.syntax;

/**
 * Half-open region of source text.
 * <p>
 * Lines are 1-based, columns are 0-based and the end position is exclusive.
 * Ranges are ordered by start position, then by end position.
 */
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) implements Comparable<SourceRange> {
    public static final SourceRange EMPTY = new SourceRange(1, 0, 1, 0);

    public SourceRange {
        if (startLine < 1 || endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Invalid range " + startLine + ":" + startColumn + "-" + endLine + ":"
                                               + endColumn);
        }
    }

    public static SourceRange sourceRange(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceRange(startLine, startColumn, endLine, endColumn);
    }

    public static SourceRange point(int line, int column) {
        return new SourceRange(line, column, line, column);
    }

    /**
     * Smallest range covering both this range and the other one.
     */
    public SourceRange union(SourceRange other) {
        var start = compareStart(other) <= 0
                    ? this
                    : other;
        var end = compareEnd(other) >= 0
                  ? this
                  : other;
        return new SourceRange(start.startLine, start.startColumn, end.endLine, end.endColumn);
    }

    public boolean contains(SourceRange other) {
        return compareStart(other) <= 0 && compareEnd(other) >= 0;
    }

    public boolean isEmpty() {
        return startLine == endLine && startColumn == endColumn;
    }

    public boolean isMultiLine() {
        return endLine > startLine;
    }

    /**
     * True when this range ends at or before the given position.
     */
    public boolean endsAtOrBefore(int line, int column) {
        return endLine < line || (endLine == line && endColumn <= column);
    }

    /**
     * True when this range starts at or after the given position.
     */
    public boolean startsAtOrAfter(int line, int column) {
        return startLine > line || (startLine == line && startColumn >= column);
    }

    public int compareStart(SourceRange other) {
        return startLine != other.startLine
               ? Integer.compare(startLine, other.startLine)
               : Integer.compare(startColumn, other.startColumn);
    }

    public int compareEnd(SourceRange other) {
        return endLine != other.endLine
               ? Integer.compare(endLine, other.endLine)
               : Integer.compare(endColumn, other.endColumn);
    }

    @Override
    public int compareTo(SourceRange other) {
        var byStart = compareStart(other);
        return byStart != 0
               ? byStart
               : compareEnd(other);
    }

    @Override
    public String toString() {
        return "(" + startLine + "," + startColumn + "-" + endLine + "," + endColumn + ")";
    }
}
