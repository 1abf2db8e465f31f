package ai.porting.lst.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Reads variables of the current process.
     */
    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
