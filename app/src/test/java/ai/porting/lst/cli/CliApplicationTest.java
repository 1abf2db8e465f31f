package ai.porting.lst.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.porting.lst.config.ConfigLoader;
import ai.porting.lst.json.LstJson;
import ai.porting.lst.source.SourceFileLocator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String SOURCE = "#include <vector>\nnamespace app {\nint run() {\n  return 0;\n}\n}\n";

    @TempDir
    Path root;

    private StringWriter output;
    private CliApplication application;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/main.cpp"), SOURCE);
        output = new StringWriter();
        application = new CliApplication(new ConfigLoader(key -> Optional.empty()), new SourceFileLocator(),
                new PrintWriter(output, true));
    }

    @Test
    void buildVerifyAndIndexShareTheOutputDirectory() {
        int built = application.run(new String[] {"--root", root.toString(), "--threads", "1"});

        assertThat(built).isZero();
        assertThat(root.resolve("lst-out/src__main.cpp.lst.json")).exists();

        int verified = application.run(new String[] {"--mode", "verify", "--root", root.toString()});

        assertThat(verified).isZero();
        assertThat(output.toString()).contains("src/main.cpp: OK");

        int indexed = application.run(new String[] {"--mode", "index", "--root", root.toString()});

        assertThat(indexed).isZero();
        assertThat(root.resolve("lst-out/symbols.index.json")).exists();
    }

    @Test
    void verifyFailsWhenTheSourceChanged() throws Exception {
        assertThat(application.run(new String[] {"--root", root.toString()})).isZero();
        Files.writeString(root.resolve("src/main.cpp"), SOURCE.replace("return 0", "return 1"));

        int exitCode = application.run(new String[] {"--mode", "verify", "--root", root.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(output.toString()).contains("src/main.cpp: MISMATCH");
    }

    @Test
    void malformedDocumentDoesNotStopVerification() throws Exception {
        assertThat(application.run(new String[] {"--root", root.toString()})).isZero();
        Files.writeString(root.resolve("lst-out/a_broken.lst.json"), "{\"nodes\": [");

        int exitCode = application.run(new String[] {"--mode", "verify", "--root", root.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(output.toString())
                .contains("a_broken.lst.json: MISMATCH  unreadable document")
                .contains("src/main.cpp: OK");
    }

    @Test
    void stdoutPrintsTheDocumentOfOneFile() throws Exception {
        int exitCode = application.run(new String[] {
                "--root", root.toString(), "--stdout", root.resolve("src/main.cpp").toString()});

        assertThat(exitCode).isZero();
        JsonNode document = LstJson.mapper().readTree(output.toString());
        assertThat(document.path("file").asText()).isEqualTo("src/main.cpp");
        assertThat(document.path("source_length").asInt()).isEqualTo(SOURCE.length());
        assertThat(root.resolve("lst-out")).doesNotExist();
    }

    @Test
    void stdoutNeedsExactlyOneFile() throws Exception {
        Files.writeString(root.resolve("src/other.cpp"), "int x;\n");

        int exitCode = application.run(new String[] {"--root", root.toString(), "--stdout"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void missingInputFailsWithoutThrowing() {
        int exitCode = application.run(new String[] {
                "--root", root.toString(), root.resolve("src/missing.cpp").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(root.resolve("lst-out")).doesNotExist();
    }

    @Test
    void invalidOptionsReturnUsageExitCode() {
        assertThat(application.run(new String[] {"--mode", "compile"})).isEqualTo(2);
        assertThat(application.run(new String[] {"--threads", "0"})).isEqualTo(2);
    }

    @Test
    void helpIsNotAnError() {
        assertThat(application.run(new String[] {"--help"})).isZero();
    }
}
