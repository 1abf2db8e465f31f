package ai.porting.lst.index;

import ai.porting.lst.json.LstDocumentReader;
import ai.porting.lst.json.LstJson;
import ai.porting.lst.tree.NodeKind;
import ai.porting.lst.tree.Span;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects named declarations from LST documents into a cross-file lookup table.
 */
public class SymbolIndexer {

    static final Set<String> SYMBOL_KINDS = Set.of(
            NodeKind.NAMESPACE.wireName(),
            NodeKind.CLASS.wireName(),
            NodeKind.STRUCT.wireName(),
            NodeKind.FUNCTION.wireName(),
            NodeKind.USING.wireName());

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolIndexer.class);
    private static final Comparator<SymbolKey> KEY_ORDER = Comparator
            .comparing(SymbolKey::kind)
            .thenComparing(SymbolKey::name);

    private final LstDocumentReader reader;

    public SymbolIndexer() {
        this(new LstDocumentReader());
    }

    public SymbolIndexer(LstDocumentReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public List<SymbolEntry> indexFiles(List<Path> documents) {
        List<JsonNode> parsed = new ArrayList<>(documents.size());
        for (Path path : documents) {
            parsed.add(reader.read(path));
        }
        return index(parsed);
    }

    /**
     * Entries sorted by kind, then name; locations in document and traversal order.
     */
    public List<SymbolEntry> index(List<JsonNode> documents) {
        Map<SymbolKey, List<SymbolLocation>> symbols = new TreeMap<>(KEY_ORDER);
        for (JsonNode document : documents) {
            String file = document.path("file").asText("");
            walk(document.path("nodes"), file, symbols);
        }
        List<SymbolEntry> entries = new ArrayList<>(symbols.size());
        symbols.forEach((key, locations) -> entries.add(new SymbolEntry(key.kind(), key.name(), locations)));
        LOGGER.debug("Indexed {} symbols from {} documents", entries.size(), documents.size());
        return entries;
    }

    public void write(Path target, List<SymbolEntry> entries) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            LstJson.mapper().writeValue(target.toFile(), entries);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write symbol index: " + target, ex);
        }
    }

    private void walk(JsonNode nodes, String file, Map<SymbolKey, List<SymbolLocation>> symbols) {
        for (JsonNode node : nodes) {
            String kind = node.path("kind").asText("");
            if (SYMBOL_KINDS.contains(kind)) {
                JsonNode name = node.path("name");
                SymbolKey key = new SymbolKey(kind, name.isTextual() ? name.asText() : "");
                symbols.computeIfAbsent(key, ignored -> new ArrayList<>())
                        .add(new SymbolLocation(file, toSpan(node.path("span"))));
            }
            walk(node.path("children"), file, symbols);
        }
    }

    private Span toSpan(JsonNode span) {
        try {
            return LstJson.mapper().treeToValue(span, Span.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed span: " + span, ex);
        }
    }

    private record SymbolKey(String kind, String name) {
    }
}
