package ai.porting.lst.builder;

import ai.porting.lst.tree.SourceBuffer;
import ai.porting.lst.tree.Span;
import java.util.Arrays;

/**
 * Maps byte offsets to 1-based line numbers using the sorted offsets of every line start.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int sourceLength;

    private LineIndex(int[] lineStarts, int sourceLength) {
        this.lineStarts = lineStarts;
        this.sourceLength = sourceLength;
    }

    public static LineIndex of(SourceBuffer source) {
        CharSequence chars = source.chars();
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < chars.length(); i++) {
            if (chars.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), chars.length());
    }

    /**
     * Line of the largest line start not after {@code offset}.
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > sourceLength) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + sourceLength + "]");
        }
        int found = Arrays.binarySearch(lineStarts, offset);
        return found >= 0 ? found + 1 : -found - 1;
    }

    public Span span(int start, int end) {
        return new Span(start, end, lineOf(start), lineOf(end));
    }
}
