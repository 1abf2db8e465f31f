package ai.porting.lst.cli;

import ai.porting.lst.config.LogFormat;
import ai.porting.lst.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "lst-builder", mixinStandardHelpOptions = true, version = "lst-builder 0.1",
        description = "Builds, verifies and indexes Lossless Semantic Trees of C/C++ sources")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "What to do: build, verify or index")
    private Mode mode;

    @CommandLine.Option(names = "--root", description = "Repository root; document file names are relative to it", paramLabel = "DIR")
    private String root;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Directory for .lst.json documents", paramLabel = "DIR")
    private String outputDir;

    @CommandLine.Option(names = "--threads", description = "Number of build workers", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--extensions", description = "Comma-separated source extensions", paramLabel = "LIST")
    private String extensions;

    @CommandLine.Option(names = "--tracked-only", description = "Only build files tracked in the Git index of the root")
    private boolean trackedOnly;

    @CommandLine.Option(names = "--index-out", description = "Symbol index output file (index mode)", paramLabel = "FILE")
    private String indexOutput;

    @CommandLine.Option(names = "--stdout", description = "Print the document of a single source file instead of writing it")
    private boolean stdout;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    @CommandLine.Parameters(description = "Source files or directories (build), documents or directories (verify, index)",
            paramLabel = "PATH", arity = "0..*")
    private List<Path> paths = new ArrayList<>();

    public Mode mode() {
        return mode;
    }

    public String root() {
        return root;
    }

    public String outputDir() {
        return outputDir;
    }

    public Integer threads() {
        return threads;
    }

    public String extensions() {
        return extensions;
    }

    public boolean trackedOnly() {
        return trackedOnly;
    }

    public String indexOutput() {
        return indexOutput;
    }

    public boolean stdout() {
        return stdout;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public List<Path> paths() {
        return paths == null ? List.of() : paths;
    }
}
