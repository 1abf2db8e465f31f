package ai.porting.lst.tree;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Structural fragment kinds. Declaration order is the precedence used when two candidates share a span.
 */
public enum NodeKind {
    NAMESPACE,
    FUNCTION,
    CLASS,
    STRUCT,
    USING,
    INCLUDE,
    MACRO,
    OTHER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBraceBearing() {
        return this == NAMESPACE || this == CLASS || this == STRUCT || this == FUNCTION;
    }
}
