package ai.porting.lst.builder;

import java.util.OptionalInt;

/**
 * Finds the brace closing a given opening brace, ignoring braces inside string and character literals and
 * comments.
 */
public class LexicalScanner {

    /**
     * @param source text to scan, one char per byte
     * @param openOffset offset of the opening {@code '{'}
     * @return offset of the matching {@code '}'}, or empty when the input ends first
     */
    public OptionalInt findMatchingBrace(CharSequence source, int openOffset) {
        if (openOffset < 0 || openOffset >= source.length() || source.charAt(openOffset) != '{') {
            throw new IllegalArgumentException("No opening brace at offset " + openOffset);
        }
        int length = source.length();
        ScanState state = ScanState.NORMAL;
        int depth = 0;
        int i = openOffset;
        while (i < length) {
            char ch = source.charAt(i);
            char next = i + 1 < length ? source.charAt(i + 1) : '\0';
            switch (state) {
                case IN_STRING, IN_CHAR -> {
                    if (ch == '\\') {
                        i += 2;
                        continue;
                    }
                    if (ch == state.closingQuote()) {
                        state = ScanState.NORMAL;
                    }
                }
                case IN_LINE_COMMENT -> {
                    if (ch == '\n') {
                        state = ScanState.NORMAL;
                    }
                }
                case IN_BLOCK_COMMENT -> {
                    if (ch == '*' && next == '/') {
                        state = ScanState.NORMAL;
                        i += 2;
                        continue;
                    }
                }
                case NORMAL -> {
                    if (ch == '"') {
                        state = ScanState.IN_STRING;
                    } else if (ch == '\'') {
                        state = ScanState.IN_CHAR;
                    } else if (ch == '/' && next == '/') {
                        state = ScanState.IN_LINE_COMMENT;
                        i += 2;
                        continue;
                    } else if (ch == '/' && next == '*') {
                        state = ScanState.IN_BLOCK_COMMENT;
                        i += 2;
                        continue;
                    } else if (ch == '{') {
                        depth++;
                    } else if (ch == '}') {
                        depth--;
                        if (depth == 0) {
                            return OptionalInt.of(i);
                        }
                    }
                }
            }
            i++;
        }
        return OptionalInt.empty();
    }
}
