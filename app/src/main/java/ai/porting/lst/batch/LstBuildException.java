package ai.porting.lst.batch;

/**
 * Runtime exception used to propagate failures to read a source file or persist its document.
 */
public class LstBuildException extends RuntimeException {

    public LstBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
