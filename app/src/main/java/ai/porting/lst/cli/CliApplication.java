package ai.porting.lst.cli;

import ai.porting.lst.batch.BatchBuildService;
import ai.porting.lst.batch.BatchOutcome;
import ai.porting.lst.batch.LstBuildException;
import ai.porting.lst.builder.LstBuilder;
import ai.porting.lst.config.Config;
import ai.porting.lst.config.ConfigLoader;
import ai.porting.lst.config.EnvironmentReader;
import ai.porting.lst.index.SymbolEntry;
import ai.porting.lst.index.SymbolIndexer;
import ai.porting.lst.json.LstDocumentReader;
import ai.porting.lst.json.LstDocumentWriter;
import ai.porting.lst.logging.LoggingConfigurator;
import ai.porting.lst.source.SourceDiscoveryException;
import ai.porting.lst.source.SourceFile;
import ai.porting.lst.source.SourceFileLocator;
import ai.porting.lst.verify.RoundTripVerifier;
import ai.porting.lst.verify.VerificationResult;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the build, verify and index flows.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final SourceFileLocator sourceFileLocator;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new SourceFileLocator(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, SourceFileLocator sourceFileLocator, PrintWriter out) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.sourceFileLocator = Objects.requireNonNull(sourceFileLocator, "sourceFileLocator");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Running {} (root={} out={})", config.mode(), config.root(), config.outputDir());

        try {
            return switch (config.mode()) {
                case BUILD -> runBuild(config);
                case VERIFY -> runVerify(config);
                case INDEX -> runIndex(config);
            };
        } catch (SourceDiscoveryException | LstBuildException | UncheckedIOException | IllegalArgumentException ex) {
            LOGGER.error("{} failed: {}", config.mode(), ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int runBuild(Config config) {
        List<SourceFile> files = sourceFileLocator.locate(config.root(), config.inputs(),
                config.sourceExtensions(), config.trackedOnly());
        BatchBuildService batchBuildService = new BatchBuildService(new LstBuilder(), new LstDocumentWriter(),
                config.threads());

        if (config.stdout()) {
            if (files.size() != 1) {
                LOGGER.error("--stdout needs exactly one source file, found {}", files.size());
                return EXIT_FAILURE;
            }
            out.println(new LstDocumentWriter().toJson(batchBuildService.build(files.get(0))));
            out.flush();
            return EXIT_OK;
        }

        BatchOutcome outcome = batchBuildService.buildAll(files, config.outputDir());
        if (!outcome.succeeded()) {
            LOGGER.warn("LST build failed for files: {}", String.join(", ", outcome.failedFiles()));
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int runVerify(Config config) {
        List<Path> documents = new LstDocumentReader().findDocuments(config.inputs());
        RoundTripVerifier verifier = new RoundTripVerifier();
        int mismatches = 0;
        for (Path document : documents) {
            VerificationResult result = verifier.verify(document, config.root());
            out.println(result.describe());
            if (!result.ok()) {
                mismatches++;
            }
        }
        out.flush();
        LOGGER.info("Verified {} documents, {} mismatched", documents.size(), mismatches);
        return mismatches == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int runIndex(Config config) {
        List<Path> documents = new LstDocumentReader().findDocuments(config.inputs());
        SymbolIndexer indexer = new SymbolIndexer();
        List<SymbolEntry> entries = indexer.indexFiles(documents);
        indexer.write(config.indexOutput(), entries);
        LOGGER.info("Wrote {} with {} symbols from {} documents", config.indexOutput(), entries.size(), documents.size());
        return EXIT_OK;
    }
}
