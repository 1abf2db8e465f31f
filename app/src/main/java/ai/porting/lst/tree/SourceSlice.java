package ai.porting.lst.tree;

import com.fasterxml.jackson.annotation.JsonValue;
import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * View of a byte range of a {@link SourceBuffer}. Parent and child nodes alias the same buffer.
 */
public final class SourceSlice {

    private final SourceBuffer buffer;
    private final int start;
    private final int end;

    SourceSlice(SourceBuffer buffer, int start, int end) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        if (start < 0 || end < start || end > buffer.length()) {
            throw new IllegalArgumentException("Invalid slice [" + start + ", " + end + ") for buffer of length " + buffer.length());
        }
        this.start = start;
        this.end = end;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public byte[] bytes() {
        return buffer.copyOfRange(start, end);
    }

    public void appendTo(ByteArrayOutputStream target) {
        buffer.writeRange(target, start, end);
    }

    /**
     * UTF-8 decoding of the slice; this is the form written to JSON.
     */
    @JsonValue
    public String text() {
        return buffer.decode(start, end);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourceSlice slice)) {
            return false;
        }
        return start == slice.start && end == slice.end && buffer == slice.buffer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(buffer), start, end);
    }

    @Override
    public String toString() {
        return text();
    }
}
