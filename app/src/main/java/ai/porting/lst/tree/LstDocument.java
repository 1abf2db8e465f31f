package ai.porting.lst.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;

/**
 * Root aggregate of a Lossless Semantic Tree. The root {@code nodes} tile {@code [0, sourceLength)}.
 */
@JsonPropertyOrder({"version", "file", "source_hash", "source_length", "nodes"})
public record LstDocument(
        @JsonProperty("version") String version,
        @JsonProperty("file") String file,
        @JsonProperty("source_hash") String sourceHash,
        @JsonProperty("source_length") int sourceLength,
        @JsonProperty("nodes") List<Node> nodes) {

    public LstDocument {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(sourceHash, "sourceHash");
        if (sourceLength < 0) {
            throw new IllegalArgumentException("sourceLength must not be negative");
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /**
     * Concatenates the bytes of the root nodes in order.
     */
    public byte[] reconstruct() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(sourceLength);
        for (Node node : nodes) {
            node.text().appendTo(out);
        }
        return out.toByteArray();
    }
}
