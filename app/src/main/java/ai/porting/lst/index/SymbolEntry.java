package ai.porting.lst.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * All locations of one {@code (kind, name)} pair. Unnamed symbols use the empty name.
 */
@JsonPropertyOrder({"kind", "name", "locations"})
public record SymbolEntry(
        @JsonProperty("kind") String kind,
        @JsonProperty("name") String name,
        @JsonProperty("locations") List<SymbolLocation> locations) {

    public SymbolEntry {
        Objects.requireNonNull(kind, "kind");
        name = name == null ? "" : name;
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
