package ai.dualpdf.translator.translate;

/**
 * Runtime exception used when the translator cannot be used at all.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
