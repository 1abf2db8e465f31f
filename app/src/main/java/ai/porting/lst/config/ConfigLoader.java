package ai.porting.lst.config;

import ai.porting.lst.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "LST_MODE";
    static final String ENV_ROOT = "LST_ROOT";
    static final String ENV_OUTPUT_DIR = "LST_OUTPUT_DIR";
    static final String ENV_THREADS = "LST_THREADS";
    static final String ENV_SOURCE_EXTENSIONS = "LST_SOURCE_EXTENSIONS";
    static final String ENV_TRACKED_ONLY = "LST_TRACKED_ONLY";
    static final String ENV_INDEX_OUTPUT = "LST_INDEX_OUTPUT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_OUTPUT_DIRECTORY = "lst-out";
    static final String DEFAULT_INDEX_FILE = "symbols.index.json";

    private final EnvironmentReader environmentReader;
    private final int availableProcessors;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, Runtime.getRuntime().availableProcessors());
    }

    ConfigLoader(EnvironmentReader environmentReader, int availableProcessors) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.availableProcessors = Math.max(1, availableProcessors);
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path root = absolute(firstNonBlank(arguments.root(), ENV_ROOT, "."));
        Path outputDir = Optional.ofNullable(arguments.outputDir())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_OUTPUT_DIR).filter(ConfigLoader::isNotBlank))
                .map(ConfigLoader::absolute)
                .orElse(root.resolve(DEFAULT_OUTPUT_DIRECTORY));
        Path indexOutput = Optional.ofNullable(arguments.indexOutput())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_INDEX_OUTPUT).filter(ConfigLoader::isNotBlank))
                .map(ConfigLoader::absolute)
                .orElse(outputDir.resolve(DEFAULT_INDEX_FILE));

        int threads = resolveThreads(arguments);

        Set<String> extensions = Optional.ofNullable(arguments.extensions())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_SOURCE_EXTENSIONS).filter(ConfigLoader::isNotBlank))
                .map(ConfigLoader::parseExtensions)
                .orElse(Config.DEFAULT_SOURCE_EXTENSIONS);

        boolean trackedOnly = arguments.trackedOnly() || environmentReader.get(ENV_TRACKED_ONLY)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        List<Path> inputs = arguments.paths().stream()
                .map(path -> path.toAbsolutePath().normalize())
                .collect(Collectors.toList());
        if (inputs.isEmpty()) {
            inputs = List.of(mode.readsDocuments() ? outputDir : root);
        }

        return new Config(mode, root, outputDir, inputs, threads, extensions, trackedOnly, indexOutput,
                arguments.stdout(), logFormat, arguments.verbose());
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.BUILD);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveThreads(CliArguments arguments) {
        Integer cliThreads = arguments.threads();
        if (cliThreads != null) {
            if (cliThreads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1");
            }
            return cliThreads;
        }
        return environmentReader.get(ENV_THREADS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseThreadCount)
                .orElse(availableProcessors);
    }

    private static int parseThreadCount(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_THREADS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_THREADS + " must be an integer", ex);
        }
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static Path absolute(String raw) {
        return Path.of(raw.trim()).toAbsolutePath().normalize();
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
