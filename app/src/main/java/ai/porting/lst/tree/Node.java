package ai.porting.lst.tree;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Structural fragment of a source file.
 *
 * <p>{@code name}, {@code headerSpan}, {@code bodySpan} and {@code header} may be {@code null}; they are
 * written as JSON {@code null}. {@code text} covers the whole span including the bytes of any children.
 */
@JsonPropertyOrder({"kind", "name", "span", "header_span", "body_span", "header", "text", "children"})
public record Node(
        @JsonProperty("kind") NodeKind kind,
        @JsonProperty("name") String name,
        @JsonProperty("span") Span span,
        @JsonProperty("header_span") Span headerSpan,
        @JsonProperty("body_span") Span bodySpan,
        @JsonProperty("header") SourceSlice header,
        @JsonProperty("text") SourceSlice text,
        @JsonProperty("children") List<Node> children) {

    public Node {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(text, "text");
        if (text.start() != span.startByte() || text.end() != span.endByte()) {
            throw new IllegalArgumentException("text must cover the node span");
        }
        if (bodySpan != null && !kind.isBraceBearing()) {
            throw new IllegalArgumentException(kind.wireName() + " nodes cannot carry a body");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Node without header or body, e.g. an include line or a gap.
     */
    public static Node leaf(NodeKind kind, String name, Span span, SourceSlice text) {
        return new Node(kind, name, span, null, null, null, text, List.of());
    }

    public static Node gap(Span span, SourceSlice text) {
        return leaf(NodeKind.OTHER, null, span, text);
    }

    public boolean hasBody() {
        return bodySpan != null;
    }

    public Node withChildren(List<Node> newChildren) {
        return new Node(kind, name, span, headerSpan, bodySpan, header, text, newChildren);
    }
}
