package org.pragmatica.latex.tree;

/**
 * A range in LaTeX source from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Span starting where this one starts and ending where {@code other} ends.
     */
    public SourceSpan through(SourceSpan other) {
        return new SourceSpan(start, other.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
