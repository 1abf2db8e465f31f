package ai.porting.lst.builder;

import ai.porting.lst.tree.NodeKind;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code namespace NAME {}} blocks.
 */
public class NamespaceRecognizer extends BraceConstructRecognizer {

    private static final Pattern NAMESPACE = Pattern.compile(
            STATEMENT_START + "namespace\\s+([A-Za-z_][\\w:]*)\\s*\\{", FLAGS);

    public NamespaceRecognizer() {
        super(NAMESPACE);
    }

    @Override
    NodeKind kindOf(Matcher matcher) {
        return NodeKind.NAMESPACE;
    }

    @Override
    String nameOf(Matcher matcher) {
        return matcher.group(1);
    }
}
