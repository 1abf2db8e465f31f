package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for preprocessor lines. A node starts at the line start where the pattern matches (blank lines in
 * front of the directive included) and ends before the newline of its last line.
 */
abstract class LineDirectiveRecognizer implements ConstructRecognizer {

    private final NodeKind kind;
    private final Pattern pattern;

    LineDirectiveRecognizer(NodeKind kind, Pattern pattern) {
        this.kind = kind;
        this.pattern = pattern;
    }

    @Override
    public List<Node> recognize(ExtractionContext context) {
        List<Node> nodes = new ArrayList<>();
        Matcher matcher = pattern.matcher(context.chars());
        int searchFrom = 0;
        while (searchFrom <= context.chars().length() && matcher.find(searchFrom)) {
            int start = matcher.start();
            int end = directiveEnd(context, matcher.end());
            nodes.add(Node.leaf(kind, null, context.span(start, end), context.slice(start, end)));
            searchFrom = end;
        }
        return nodes;
    }

    int directiveEnd(ExtractionContext context, int from) {
        return context.lineEnd(from);
    }
}
