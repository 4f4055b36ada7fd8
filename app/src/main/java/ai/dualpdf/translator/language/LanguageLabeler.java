package ai.dualpdf.translator.language;

/**
 * Classifies a rendered page image. Implementations return the model's raw answer; see
 * {@link LanguageLabel#normalize(String)}.
 */
@FunctionalInterface
public interface LanguageLabeler {

    String label(String base64Jpeg);
}
