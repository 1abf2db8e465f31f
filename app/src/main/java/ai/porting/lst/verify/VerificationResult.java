package ai.porting.lst.verify;

/**
 * Outcome of a round-trip check. {@code firstMismatch} is the first differing byte offset, or -1.
 */
public record VerificationResult(String file, boolean ok, int sourceLength, int rebuiltLength, int firstMismatch,
                                 String detail) {

    public static VerificationResult compared(String file, int sourceLength, int rebuiltLength, int firstMismatch) {
        return new VerificationResult(file, firstMismatch < 0, sourceLength, rebuiltLength, firstMismatch, null);
    }

    public static VerificationResult failed(String file, String detail) {
        return new VerificationResult(file, false, -1, -1, -1, detail);
    }

    public String describe() {
        if (detail != null) {
            return file + ": MISMATCH  " + detail;
        }
        String summary = file + ": " + (ok ? "OK" : "MISMATCH")
                + "  len(src)=" + sourceLength + " len(rebuilt)=" + rebuiltLength;
        return ok ? summary : summary + " first difference at byte " + firstMismatch;
    }
}
