package ai.porting.lst.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NodeTest {

    private final SourceBuffer buffer = new SourceBuffer("int f() { return 1; }\n".getBytes(StandardCharsets.UTF_8));

    @Test
    void textMustCoverTheSpan() {
        assertThatThrownBy(() -> Node.leaf(NodeKind.OTHER, null, new Span(0, 3, 1, 1), buffer.slice(0, 4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("span");
    }

    @Test
    void onlyBraceBearingKindsCarryABody() {
        Span span = new Span(0, 21, 1, 1);
        Span body = new Span(8, 21, 1, 1);

        assertThatThrownBy(() -> new Node(NodeKind.MACRO, null, span, null, body, null, buffer.slice(0, 21), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("macro");
        assertThat(new Node(NodeKind.FUNCTION, "f", span, new Span(0, 8, 1, 1), body, buffer.slice(0, 8),
                buffer.slice(0, 21), null).children()).isEmpty();
    }

    @Test
    void childrenAreCopied() {
        Node child = Node.leaf(NodeKind.OTHER, null, new Span(10, 19, 1, 1), buffer.slice(10, 19));
        List<Node> children = new ArrayList<>(List.of(child));
        Node parent = Node.leaf(NodeKind.OTHER, null, new Span(0, 21, 1, 1), buffer.slice(0, 21))
                .withChildren(children);

        children.clear();

        assertThat(parent.children()).containsExactly(child);
    }

    @Test
    void slicesShareTheBufferAndDecodeUtf8() {
        SourceBuffer utf8 = new SourceBuffer("ä{}".getBytes(StandardCharsets.UTF_8));
        SourceSlice whole = utf8.slice(0, 4);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        whole.appendTo(out);

        assertThat(whole.text()).isEqualTo("ä{}");
        assertThat(utf8.slice(2, 4).text()).isEqualTo("{}");
        assertThat(out.toByteArray()).isEqualTo(utf8.bytes());
        assertThat(whole).isEqualTo(utf8.slice(0, 4)).isNotEqualTo(buffer.slice(0, 4));
        assertThatThrownBy(() -> utf8.slice(2, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void documentReconstructsFromRootSlices() {
        Node head = Node.gap(new Span(0, 8, 1, 1), buffer.slice(0, 8));
        Node tail = Node.gap(new Span(8, 22, 1, 2), buffer.slice(8, 22));

        LstDocument document = new LstDocument("0.1", "a.cpp", "hash", 22, List.of(head, tail));

        assertThat(document.reconstruct()).isEqualTo(buffer.bytes());
    }

    @Test
    void kindsUseLowerCaseWireNames() {
        assertThat(NodeKind.NAMESPACE.wireName()).isEqualTo("namespace");
        assertThat(NodeKind.STRUCT.isBraceBearing()).isTrue();
        assertThat(NodeKind.MACRO.isBraceBearing()).isFalse();
    }
}
