package ai.dualpdf.translator.cli;

import ai.dualpdf.translator.translate.TranslationServiceKind;
import picocli.CommandLine;

/**
 * Parses the translation service option.
 */
public class TranslationServiceConverter implements CommandLine.ITypeConverter<TranslationServiceKind> {

    @Override
    public TranslationServiceKind convert(String value) {
        return TranslationServiceKind.fromString(value);
    }
}
