package ai.porting.lst.json;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads persisted LST documents as JSON trees. Consumers navigate them as plain data.
 */
public class LstDocumentReader {

    public JsonNode read(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            JsonNode document = LstJson.mapper().readTree(path.toFile());
            if (document == null || !document.isObject() || !document.has("nodes")) {
                throw new IllegalArgumentException("Not an LST document: " + path);
            }
            return document;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read LST document: " + path, ex);
        }
    }

    /**
     * Expands files and directories into the sorted list of {@code *.lst.json} files they contain.
     */
    public List<Path> findDocuments(List<Path> inputs) {
        TreeSet<Path> documents = new TreeSet<>();
        for (Path input : inputs) {
            if (Files.isRegularFile(input)) {
                documents.add(input.toAbsolutePath().normalize());
                continue;
            }
            if (!Files.isDirectory(input)) {
                throw new IllegalArgumentException("Input does not exist: " + input);
            }
            try (Stream<Path> walk = Files.walk(input)) {
                documents.addAll(walk
                        .filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().endsWith(LstJson.DOCUMENT_SUFFIX))
                        .map(path -> path.toAbsolutePath().normalize())
                        .collect(Collectors.toList()));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to walk " + input, ex);
            }
        }
        return new ArrayList<>(documents);
    }
}
