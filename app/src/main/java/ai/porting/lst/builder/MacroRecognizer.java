package ai.porting.lst.builder;

import ai.porting.lst.tree.NodeKind;
import java.util.regex.Pattern;

/**
 * Preprocessor lines other than includes. Lines continued with a trailing backslash belong to the macro.
 */
public class MacroRecognizer extends LineDirectiveRecognizer {

    private static final Pattern DIRECTIVE = Pattern.compile("^\\s*#(?![ \\t]*include\\b)",
            Pattern.MULTILINE | Pattern.UNIX_LINES);

    public MacroRecognizer() {
        super(NodeKind.MACRO, DIRECTIVE);
    }

    @Override
    int directiveEnd(ExtractionContext context, int from) {
        CharSequence chars = context.chars();
        int end = context.lineEnd(from);
        while (end < chars.length() && continuesOnNextLine(chars, end)) {
            end = context.lineEnd(end + 1);
        }
        return end;
    }

    private static boolean continuesOnNextLine(CharSequence chars, int newline) {
        int i = newline - 1;
        if (i >= 0 && chars.charAt(i) == '\r') {
            i--;
        }
        return i >= 0 && chars.charAt(i) == '\\';
    }
}
