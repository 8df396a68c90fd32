package org.pragmatica.cliffs.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive), as character offsets.
 */
public record SourceSpan(int start, int end) {

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    public SourceSpan merge(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
