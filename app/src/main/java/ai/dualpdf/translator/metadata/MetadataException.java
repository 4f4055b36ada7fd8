package ai.dualpdf.translator.metadata;

/**
 * Runtime exception raised when metadata cannot be written to a document.
 */
public class MetadataException extends RuntimeException {

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
