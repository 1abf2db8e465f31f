package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.NodeKind;
import ai.porting.lst.tree.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for constructs whose header ends at an opening brace. The body runs to the matching closing brace;
 * when none is found the node keeps its header only.
 */
abstract class BraceConstructRecognizer implements ConstructRecognizer {

    /**
     * A line start (leading blank lines included) or a position right after {@code '{'}, {@code '}'} or
     * {@code ';'} on the same line.
     */
    static final String STATEMENT_START = "(?:^\\s*|(?<=[{};])[ \\t]*)";

    static final int FLAGS = Pattern.MULTILINE | Pattern.UNIX_LINES;

    private static final Logger LOGGER = LoggerFactory.getLogger(BraceConstructRecognizer.class);

    private final Pattern pattern;

    BraceConstructRecognizer(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Kind of the matched construct, or {@code null} to skip the match.
     */
    abstract NodeKind kindOf(Matcher matcher);

    abstract String nameOf(Matcher matcher);

    @Override
    public List<Node> recognize(ExtractionContext context) {
        List<Node> nodes = new ArrayList<>();
        Matcher matcher = pattern.matcher(context.chars());
        while (matcher.find()) {
            NodeKind kind = kindOf(matcher);
            if (kind == null) {
                continue;
            }
            nodes.add(slice(context, matcher, kind, nameOf(matcher)));
        }
        return nodes;
    }

    private Node slice(ExtractionContext context, Matcher matcher, NodeKind kind, String name) {
        int start = matcher.start();
        int open = matcher.end() - 1;
        Span headerSpan = context.span(start, open);
        OptionalInt close = context.scanner().findMatchingBrace(context.chars(), open);
        if (close.isEmpty()) {
            LOGGER.debug("No closing brace for {} {} at line {}; keeping header only",
                    kind.wireName(), name, headerSpan.startLine());
            return new Node(kind, name, headerSpan, headerSpan, null, context.slice(start, open),
                    context.slice(start, open), List.of());
        }
        int end = close.getAsInt() + 1;
        return new Node(kind, name, context.span(start, end), headerSpan, context.span(open, end),
                context.slice(start, open), context.slice(start, end), List.of());
    }
}
