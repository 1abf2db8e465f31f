package ai.porting.lst.verify;

import ai.porting.lst.json.LstDocumentReader;
import ai.porting.lst.tree.LstDocument;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the root nodes of a document concatenate back to the exact source bytes.
 */
public class RoundTripVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoundTripVerifier.class);

    private final LstDocumentReader reader;

    public RoundTripVerifier() {
        this(new LstDocumentReader());
    }

    public RoundTripVerifier(LstDocumentReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public VerificationResult verify(LstDocument document, byte[] source) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(source, "source");
        return compare(document.file(), source, document.reconstruct());
    }

    /**
     * Verifies a persisted document against the file it names, resolved against {@code root}.
     */
    public VerificationResult verify(Path lstJson, Path root) {
        Objects.requireNonNull(lstJson, "lstJson");
        Objects.requireNonNull(root, "root");
        JsonNode document;
        try {
            document = reader.read(lstJson);
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            LOGGER.warn("Cannot read {}: {}", lstJson, ex.getMessage());
            return VerificationResult.failed(lstJson.toString(), "unreadable document: " + ex.getMessage());
        }
        String file = document.path("file").asText("");
        if (file.isBlank()) {
            return VerificationResult.failed(lstJson.toString(), "document has no file");
        }
        Path sourcePath = root.resolve(file);
        byte[] source;
        try {
            source = Files.readAllBytes(sourcePath);
        } catch (IOException ex) {
            LOGGER.warn("Cannot read source {} for {}: {}", sourcePath, lstJson, ex.getMessage());
            return VerificationResult.failed(file, "source not readable: " + sourcePath);
        }
        return compare(file, source, concatenateText(document).getBytes(StandardCharsets.UTF_8));
    }

    private String concatenateText(JsonNode document) {
        StringBuilder rebuilt = new StringBuilder();
        for (JsonNode node : document.path("nodes")) {
            rebuilt.append(node.path("text").asText(""));
        }
        return rebuilt.toString();
    }

    private VerificationResult compare(String file, byte[] source, byte[] rebuilt) {
        int mismatch = Arrays.mismatch(source, rebuilt);
        VerificationResult result = VerificationResult.compared(file, source.length, rebuilt.length, mismatch);
        if (!result.ok()) {
            LOGGER.warn("Round trip failed for {} at byte {}", file, mismatch);
        }
        return result;
    }
}
