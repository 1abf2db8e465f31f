package ai.porting.lst.index;

import ai.porting.lst.tree.Span;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Where a symbol occurs.
 */
public record SymbolLocation(@JsonProperty("file") String file, @JsonProperty("span") Span span) {

    public SymbolLocation {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(span, "span");
    }
}
