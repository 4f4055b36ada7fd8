package ai.dualpdf.translator.pdf;

/**
 * Runtime exception raised when two documents cannot be combined or a merged document cannot be split.
 */
public class MergeException extends RuntimeException {

    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
