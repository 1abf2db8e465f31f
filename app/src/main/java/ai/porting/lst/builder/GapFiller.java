package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Inserts {@code other} nodes between and around the roots so that they tile the whole source.
 */
public class GapFiller {

    public List<Node> fill(ExtractionContext context, List<Node> roots) {
        List<Node> filled = new ArrayList<>(roots.size() * 2 + 1);
        int cursor = 0;
        for (Node root : roots) {
            int start = root.span().startByte();
            if (start < cursor) {
                throw new IllegalStateException("Root nodes overlap at byte " + start);
            }
            if (cursor < start) {
                filled.add(Node.gap(context.span(cursor, start), context.slice(cursor, start)));
            }
            filled.add(root);
            cursor = root.span().endByte();
        }
        int length = context.source().length();
        if (cursor < length) {
            filled.add(Node.gap(context.span(cursor, length), context.slice(cursor, length)));
        }
        return filled;
    }
}
