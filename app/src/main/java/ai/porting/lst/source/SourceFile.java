package ai.porting.lst.source;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source file to build, with the identifier recorded in its LST document.
 */
public record SourceFile(Path path, String identifier) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }
}
