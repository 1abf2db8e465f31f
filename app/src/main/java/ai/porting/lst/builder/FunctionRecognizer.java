package ai.porting.lst.builder;

import ai.porting.lst.tree.NodeKind;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Function definitions: return-type-like tokens, a possibly qualified name, a parameter list, optional
 * trailing qualifiers or return type, then the body.
 */
public class FunctionRecognizer extends BraceConstructRecognizer {

    private static final String TYPE_TOKEN = "[\\w:<>*&]+";

    // Tokens on one line, separated by blanks.
    private static final String TYPE_LINE = TYPE_TOKEN + "(?:[ \\t]+" + TYPE_TOKEN + ")*";

    private static final String LINE_BREAK = "[ \\t]*\n[ \\t]*";

    /**
     * The return type spans at most two lines and the name may start on the next one. Runs of plain words
     * must not extend a match across many lines.
     */
    private static final Pattern FUNCTION = Pattern.compile(
            STATEMENT_START
                    + "(?!(?:public|protected|private)\\s*:)"
                    + "(?=[A-Za-z_])" + TYPE_LINE + "(?:" + LINE_BREAK + TYPE_LINE + ")?"
                    + "(?:[ \\t]+|" + LINE_BREAK + ")"
                    + "([A-Za-z_][\\w:]*(?:~[A-Za-z_]\\w*)?)"
                    + "\\s*\\(([^;{}]*)\\)\\s*"
                    + "(?:(?:const|noexcept|override|final)\\s*)*"
                    + "(?:->\\s*[\\w:<>]+\\s*)?"
                    + "\\{",
            FLAGS);

    // Statements such as "else if (ready) {" look like signatures.
    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "sizeof", "do", "else", "case", "new", "delete");

    public FunctionRecognizer() {
        super(FUNCTION);
    }

    @Override
    NodeKind kindOf(Matcher matcher) {
        return KEYWORDS.contains(matcher.group(1)) ? null : NodeKind.FUNCTION;
    }

    @Override
    String nameOf(Matcher matcher) {
        return matcher.group(1);
    }
}
