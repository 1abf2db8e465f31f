package ai.porting.lst.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Half-open byte range with the 1-based lines of its two ends.
 */
@JsonPropertyOrder({"start_byte", "end_byte", "start_line", "end_line"})
public record Span(
        @JsonProperty("start_byte") int startByte,
        @JsonProperty("end_byte") int endByte,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine) {

    public Span {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid byte range [" + startByte + ", " + endByte + ")");
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine);
        }
    }

    public int width() {
        return endByte - startByte;
    }

    public boolean encloses(Span other) {
        return startByte <= other.startByte && other.endByte <= endByte;
    }

    public boolean overlaps(Span other) {
        return startByte < other.endByte && other.startByte < endByte;
    }
}
