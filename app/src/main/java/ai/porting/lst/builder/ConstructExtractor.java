package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs every recognizer over the source and pools the candidates in start order.
 */
public class ConstructExtractor {

    /**
     * Start offset, then the wider span first, then kind precedence.
     */
    public static final Comparator<Node> CANDIDATE_ORDER = Comparator
            .comparingInt((Node node) -> node.span().startByte())
            .thenComparing(Comparator.comparingInt((Node node) -> node.span().width()).reversed())
            .thenComparing(Node::kind);

    private final List<ConstructRecognizer> recognizers;

    public ConstructExtractor() {
        this(List.of(
                new IncludeRecognizer(),
                new NamespaceRecognizer(),
                new TypeRecognizer(),
                new FunctionRecognizer(),
                new UsingRecognizer(),
                new MacroRecognizer()));
    }

    public ConstructExtractor(List<ConstructRecognizer> recognizers) {
        this.recognizers = List.copyOf(Objects.requireNonNull(recognizers, "recognizers"));
    }

    public List<Node> extract(ExtractionContext context) {
        List<Node> candidates = new ArrayList<>();
        for (ConstructRecognizer recognizer : recognizers) {
            candidates.addAll(recognizer.recognize(context));
        }
        candidates.sort(CANDIDATE_ORDER);
        return candidates;
    }
}
