package io.github.cyfko.fetchql.core.parsing;

/**
 * Location of a construct inside the FetchXML source text.
 * <p>
 * The offset is zero-based and counts characters; line and column are one-based
 * so they can be shown verbatim to a user editing the query.
 * </p>
 *
 * @param offset zero-based character offset
 * @param line   one-based line number
 * @param column one-based column number
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SourcePosition(int offset, int line, int column) {

    public SourcePosition {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are one-based, got: " + line + ":" + column);
        }
    }

    /**
     * Computes the position of {@code offset} within {@code text}.
     * <p>
     * A line break is {@code \n}; a preceding {@code \r} counts as part of the previous line.
     * Offsets past the end of the text are clamped to the end.
     * </p>
     *
     * @param text   the source text
     * @param offset zero-based character offset
     * @return the resolved position
     */
    public static SourcePosition of(CharSequence text, int offset) {
        int end = Math.min(Math.max(offset, 0), text.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(end, line, end - lineStart + 1);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
