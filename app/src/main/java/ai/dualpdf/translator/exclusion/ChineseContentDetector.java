package ai.dualpdf.translator.exclusion;

import ai.dualpdf.translator.language.LanguageVerdict;
import java.nio.file.Path;

/**
 * Judges whether the body text of a document is predominantly Chinese.
 */
@FunctionalInterface
public interface ChineseContentDetector {

    LanguageVerdict judge(Path pdf) throws Exception;
}
