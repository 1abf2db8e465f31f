package ai.porting.lst.tree;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable raw source bytes shared by every node of one document.
 *
 * <p>{@link #chars()} exposes the bytes as a one-char-per-byte sequence (ISO-8859-1), so character offsets
 * found by pattern matching are byte offsets.
 */
public final class SourceBuffer {

    private final byte[] bytes;
    private final String chars;

    public SourceBuffer(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        this.bytes = bytes.clone();
        this.chars = new String(this.bytes, StandardCharsets.ISO_8859_1);
    }

    public int length() {
        return bytes.length;
    }

    public CharSequence chars() {
        return chars;
    }

    public SourceSlice slice(int start, int end) {
        return new SourceSlice(this, start, end);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    byte[] copyOfRange(int start, int end) {
        return Arrays.copyOfRange(bytes, start, end);
    }

    void writeRange(ByteArrayOutputStream target, int start, int end) {
        target.write(bytes, start, end - start);
    }

    String decode(int start, int end) {
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }
}
