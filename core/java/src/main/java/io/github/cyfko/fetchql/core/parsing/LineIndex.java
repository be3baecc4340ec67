package io.github.cyfko.fetchql.core.parsing;

import java.util.Arrays;

/**
 * Offset to line/column lookup over a source text, built once per tokenizer run.
 */
final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    LineIndex(CharSequence text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = text.length();
    }

    SourcePosition at(int offset) {
        int clamped = Math.min(Math.max(offset, 0), length);
        int index = Arrays.binarySearch(lineStarts, clamped);
        int line = index >= 0 ? index : -index - 2;
        return new SourcePosition(clamped, line + 1, clamped - lineStarts[line] + 1);
    }
}
