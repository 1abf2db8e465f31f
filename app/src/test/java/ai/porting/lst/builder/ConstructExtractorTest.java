package ai.porting.lst.builder;

import static org.assertj.core.api.Assertions.assertThat;

import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.NodeKind;
import ai.porting.lst.tree.SourceBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConstructExtractorTest {

    @Test
    void poolsCandidatesOfEveryRecognizerInStartOrder() {
        String source = "#include <vector>\nusing std::vector;\nnamespace n {\nstruct S {\n  int f() { return 1; }\n};\n}\n#define N 1\n";

        List<Node> candidates = new ConstructExtractor().extract(context(source));

        assertThat(candidates).extracting(Node::kind).containsExactly(
                NodeKind.INCLUDE, NodeKind.USING, NodeKind.NAMESPACE, NodeKind.STRUCT, NodeKind.FUNCTION,
                NodeKind.MACRO);
        assertThat(candidates).isSortedAccordingTo(ConstructExtractor.CANDIDATE_ORDER);
    }

    @Test
    void sameStartPutsTheWiderCandidateFirst() {
        String source = "struct X* make() {\n  return nullptr;\n}\n";

        List<Node> candidates = new ConstructExtractor().extract(context(source));

        assertThat(candidates).extracting(Node::kind).containsExactly(NodeKind.FUNCTION, NodeKind.STRUCT);
    }

    @Test
    void usesOnlyTheGivenRecognizers() {
        ConstructExtractor extractor = new ConstructExtractor(List.of(new IncludeRecognizer()));

        List<Node> candidates = extractor.extract(context("#include <a>\n#define B 2\nvoid f() {}\n"));

        assertThat(candidates).extracting(Node::kind).containsExactly(NodeKind.INCLUDE);
    }

    private static ExtractionContext context(String source) {
        return ExtractionContext.of(new SourceBuffer(source.getBytes(StandardCharsets.UTF_8)));
    }
}
