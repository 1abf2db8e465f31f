package ai.porting.lst.builder;

/**
 * Lexical states of the brace scanner.
 */
public enum ScanState {
    NORMAL,
    IN_STRING,
    IN_CHAR,
    IN_LINE_COMMENT,
    IN_BLOCK_COMMENT;

    char closingQuote() {
        return switch (this) {
            case IN_STRING -> '"';
            case IN_CHAR -> '\'';
            default -> throw new IllegalStateException(this + " is not a literal state");
        };
    }
}
