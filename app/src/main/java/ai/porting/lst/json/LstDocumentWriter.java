package ai.porting.lst.json;

import ai.porting.lst.tree.LstDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Persists LST documents as UTF-8 JSON.
 */
public class LstDocumentWriter {

    /**
     * Writes the document into {@code outputDir} under {@link LstJson#documentFileName(String)}.
     */
    public Path writeTo(Path outputDir, LstDocument document) {
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(document, "document");
        Path target = outputDir.resolve(LstJson.documentFileName(document.file()));
        write(target, document);
        return target;
    }

    public void write(Path target, LstDocument document) {
        if (target == null || document == null) {
            throw new IllegalArgumentException("target and document must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            LstJson.mapper().writeValue(target.toFile(), document);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write LST document: " + target, ex);
        }
    }

    public String toJson(LstDocument document) {
        try {
            return LstJson.mapper().writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize LST document for " + document.file(), ex);
        }
    }
}
