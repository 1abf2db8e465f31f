package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Using-declarations, using-directives and alias declarations, up to and including the {@code ';'}.
 */
public class UsingRecognizer implements ConstructRecognizer {

    private static final Pattern USING = Pattern.compile(
            BraceConstructRecognizer.STATEMENT_START + "using\\s+[\\w:<>\\s=,]+;", BraceConstructRecognizer.FLAGS);

    @Override
    public List<Node> recognize(ExtractionContext context) {
        List<Node> nodes = new ArrayList<>();
        Matcher matcher = USING.matcher(context.chars());
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            nodes.add(Node.leaf(NodeKind.USING, null, context.span(start, end), context.slice(start, end)));
        }
        return nodes;
    }
}
