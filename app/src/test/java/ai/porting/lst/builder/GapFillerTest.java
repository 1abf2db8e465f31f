package ai.porting.lst.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.NodeKind;
import ai.porting.lst.tree.SourceBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class GapFillerTest {

    private final GapFiller gapFiller = new GapFiller();

    @Test
    void fillsLeadingInnerAndTrailingGaps() {
        ExtractionContext context = context("abcdefghij");
        Node include = Node.leaf(NodeKind.INCLUDE, null, context.span(2, 4), context.slice(2, 4));
        Node macro = Node.leaf(NodeKind.MACRO, null, context.span(6, 8), context.slice(6, 8));

        List<Node> filled = gapFiller.fill(context, List.of(include, macro));

        assertThat(filled).extracting(Node::kind).containsExactly(
                NodeKind.OTHER, NodeKind.INCLUDE, NodeKind.OTHER, NodeKind.MACRO, NodeKind.OTHER);
        assertThat(filled).extracting(node -> node.text().text()).containsExactly("ab", "cd", "ef", "gh", "ij");
        assertThat(filled.get(0).name()).isNull();
        assertThat(filled.get(0).children()).isEmpty();
    }

    @Test
    void adjacentRootsNeedNoFiller() {
        ExtractionContext context = context("abcd");
        Node first = Node.leaf(NodeKind.USING, null, context.span(0, 2), context.slice(0, 2));
        Node second = Node.leaf(NodeKind.USING, null, context.span(2, 4), context.slice(2, 4));

        assertThat(gapFiller.fill(context, List.of(first, second))).containsExactly(first, second);
    }

    @Test
    void sourceWithoutRootsBecomesOneGap() {
        assertThat(gapFiller.fill(context("int x;\n"), List.of()))
                .singleElement()
                .satisfies(node -> assertThat(node.text().text()).isEqualTo("int x;\n"));
        assertThat(gapFiller.fill(context(""), List.of())).isEmpty();
    }

    @Test
    void overlappingRootsAreAnInternalError() {
        ExtractionContext context = context("abcdef");
        Node first = Node.leaf(NodeKind.MACRO, null, context.span(0, 4), context.slice(0, 4));
        Node second = Node.leaf(NodeKind.MACRO, null, context.span(2, 6), context.slice(2, 6));

        assertThatThrownBy(() -> gapFiller.fill(context, List.of(first, second)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("byte 2");
    }

    private static ExtractionContext context(String source) {
        return ExtractionContext.of(new SourceBuffer(source.getBytes(StandardCharsets.UTF_8)));
    }
}
