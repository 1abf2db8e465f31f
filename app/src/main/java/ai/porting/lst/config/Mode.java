package ai.porting.lst.config;

/**
 * What the CLI does with its inputs.
 */
public enum Mode {
    BUILD,
    VERIFY,
    INDEX;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return BUILD;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw + " (expected build, verify or index)");
    }

    /**
     * Verify and index read documents from the output directory by default.
     */
    public boolean readsDocuments() {
        return this != BUILD;
    }
}
