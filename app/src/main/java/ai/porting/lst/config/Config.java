package ai.porting.lst.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Mode mode,
        Path root,
        Path outputDir,
        List<Path> inputs,
        int threads,
        Set<String> sourceExtensions,
        boolean trackedOnly,
        Path indexOutput,
        boolean stdout,
        LogFormat logFormat,
        boolean verbose
) {

    public static final Set<String> DEFAULT_SOURCE_EXTENSIONS = Set.of("cpp", "cc", "cxx", "h", "hpp", "hh", "inl");

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(indexOutput, "indexOutput");
        Objects.requireNonNull(logFormat, "logFormat");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        if (stdout && mode != Mode.BUILD) {
            throw new IllegalArgumentException("--stdout can only be used in build mode");
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        sourceExtensions = sourceExtensions == null || sourceExtensions.isEmpty()
                ? DEFAULT_SOURCE_EXTENSIONS
                : sourceExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
