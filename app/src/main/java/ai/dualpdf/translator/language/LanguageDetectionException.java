package ai.dualpdf.translator.language;

/**
 * Runtime exception raised when the labeling service cannot classify a page.
 */
public class LanguageDetectionException extends RuntimeException {

    public LanguageDetectionException(String message) {
        super(message);
    }

    public LanguageDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
