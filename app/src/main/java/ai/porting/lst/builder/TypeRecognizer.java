package ai.porting.lst.builder;

import ai.porting.lst.tree.NodeKind;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Class and struct definitions, optionally templated. Forward declarations end at {@code ';'} and are not
 * matched.
 */
public class TypeRecognizer extends BraceConstructRecognizer {

    private static final Pattern TYPE = Pattern.compile(
            STATEMENT_START + "(?:template\\s*<[^;{}]*>\\s*)?(class|struct)\\s+([A-Za-z_][\\w:]*)[^;{]*\\{", FLAGS);

    public TypeRecognizer() {
        super(TYPE);
    }

    @Override
    NodeKind kindOf(Matcher matcher) {
        return "class".equals(matcher.group(1)) ? NodeKind.CLASS : NodeKind.STRUCT;
    }

    @Override
    String nameOf(Matcher matcher) {
        return matcher.group(2);
    }
}
