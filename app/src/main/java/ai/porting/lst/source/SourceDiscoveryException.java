package ai.porting.lst.source;

/**
 * Raised when input paths cannot be walked or the Git index cannot be read.
 */
public class SourceDiscoveryException extends RuntimeException {

    public SourceDiscoveryException(String message) {
        super(message);
    }

    public SourceDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
