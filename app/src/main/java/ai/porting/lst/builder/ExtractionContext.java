package ai.porting.lst.builder;

import ai.porting.lst.tree.SourceBuffer;
import ai.porting.lst.tree.SourceSlice;
import ai.porting.lst.tree.Span;
import java.util.Objects;

/**
 * Per-build state shared by the recognizers: the source buffer, its line index and the brace scanner.
 */
public record ExtractionContext(SourceBuffer source, LineIndex lines, LexicalScanner scanner) {

    public ExtractionContext {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(scanner, "scanner");
    }

    public static ExtractionContext of(SourceBuffer source) {
        return new ExtractionContext(source, LineIndex.of(source), new LexicalScanner());
    }

    public CharSequence chars() {
        return source.chars();
    }

    public Span span(int start, int end) {
        return lines.span(start, end);
    }

    public SourceSlice slice(int start, int end) {
        return source.slice(start, end);
    }

    /**
     * Offset of the next {@code '\n'} at or after {@code from}, or the source length.
     */
    public int lineEnd(int from) {
        CharSequence chars = source.chars();
        for (int i = from; i < chars.length(); i++) {
            if (chars.charAt(i) == '\n') {
                return i;
            }
        }
        return chars.length();
    }
}
