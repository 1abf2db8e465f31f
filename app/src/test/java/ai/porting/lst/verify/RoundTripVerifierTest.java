package ai.porting.lst.verify;

import static org.assertj.core.api.Assertions.assertThat;

import ai.porting.lst.builder.LstBuilder;
import ai.porting.lst.json.LstDocumentWriter;
import ai.porting.lst.tree.LstDocument;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RoundTripVerifierTest {

    private static final String SOURCE = "// café\nnamespace n {\nint f() {\n  return '}';\n}\n}\n";

    private final RoundTripVerifier verifier = new RoundTripVerifier();

    @Test
    void inMemoryDocumentMatchesItsSource() {
        byte[] source = SOURCE.getBytes(StandardCharsets.UTF_8);
        LstDocument document = new LstBuilder().build("a.cpp", source);

        VerificationResult result = verifier.verify(document, source);

        assertThat(result.ok()).isTrue();
        assertThat(result.sourceLength()).isEqualTo(source.length);
        assertThat(result.rebuiltLength()).isEqualTo(source.length);
        assertThat(result.firstMismatch()).isEqualTo(-1);
        assertThat(result.describe()).startsWith("a.cpp: OK");
    }

    @Test
    void reportsTheFirstDifferingByte() {
        byte[] source = SOURCE.getBytes(StandardCharsets.UTF_8);
        LstDocument document = new LstBuilder().build("a.cpp", source);
        byte[] edited = source.clone();
        edited[3] = 'X';

        VerificationResult result = verifier.verify(document, edited);

        assertThat(result.ok()).isFalse();
        assertThat(result.firstMismatch()).isEqualTo(3);
        assertThat(result.describe()).contains("MISMATCH").contains("byte 3");
    }

    @Test
    void persistedDocumentMatchesTheFileOnDisk(@TempDir Path root) throws Exception {
        Path lstJson = persist(root);

        VerificationResult result = verifier.verify(lstJson, root);

        assertThat(result.ok()).isTrue();
        assertThat(result.file()).isEqualTo("src/a.cpp");
    }

    @Test
    void editedSourceIsAMismatch(@TempDir Path root) throws Exception {
        Path lstJson = persist(root);
        Files.writeString(root.resolve("src/a.cpp"), SOURCE + "int tail;\n", StandardCharsets.UTF_8);

        VerificationResult result = verifier.verify(lstJson, root);

        assertThat(result.ok()).isFalse();
        assertThat(result.rebuiltLength()).isLessThan(result.sourceLength());
    }

    @Test
    void missingSourceIsAFailedResult(@TempDir Path root) throws Exception {
        Path lstJson = persist(root);
        Files.delete(root.resolve("src/a.cpp"));

        VerificationResult result = verifier.verify(lstJson, root);

        assertThat(result.ok()).isFalse();
        assertThat(result.detail()).contains("not readable");
        assertThat(result.describe()).startsWith("src/a.cpp: MISMATCH");
    }

    @Test
    void malformedDocumentIsAFailedResult(@TempDir Path root) throws Exception {
        Path broken = root.resolve("broken.lst.json");
        Files.writeString(broken, "{\"file\": \"src/a.cpp\", \"nodes\": [", StandardCharsets.UTF_8);
        Path notADocument = root.resolve("other.lst.json");
        Files.writeString(notADocument, "[1, 2]", StandardCharsets.UTF_8);

        VerificationResult truncated = verifier.verify(broken, root);
        VerificationResult wrongShape = verifier.verify(notADocument, root);

        assertThat(truncated.ok()).isFalse();
        assertThat(truncated.file()).isEqualTo(broken.toString());
        assertThat(truncated.detail()).startsWith("unreadable document");
        assertThat(wrongShape.ok()).isFalse();
        assertThat(wrongShape.detail()).contains("Not an LST document");
    }

    private static Path persist(Path root) throws Exception {
        byte[] source = SOURCE.getBytes(StandardCharsets.UTF_8);
        Files.createDirectories(root.resolve("src"));
        Files.write(root.resolve("src/a.cpp"), source);
        LstDocument document = new LstBuilder().build("src/a.cpp", source);
        return new LstDocumentWriter().writeTo(root.resolve("lst-out"), document);
    }
}
