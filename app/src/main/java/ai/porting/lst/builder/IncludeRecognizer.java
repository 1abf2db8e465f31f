package ai.porting.lst.builder;

import ai.porting.lst.tree.NodeKind;
import java.util.regex.Pattern;

/**
 * {@code #include} lines.
 */
public class IncludeRecognizer extends LineDirectiveRecognizer {

    static final Pattern INCLUDE = Pattern.compile("^\\s*#[ \\t]*include\\b",
            Pattern.MULTILINE | Pattern.UNIX_LINES);

    public IncludeRecognizer() {
        super(NodeKind.INCLUDE, INCLUDE);
    }
}
