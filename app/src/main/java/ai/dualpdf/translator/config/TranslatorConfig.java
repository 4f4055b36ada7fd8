package ai.dualpdf.translator.config;

import ai.dualpdf.translator.translate.TranslationServiceKind;
import ai.dualpdf.translator.translate.TranslatorSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the external translator.
 */
public record TranslatorConfig(Optional<Path> executable,
                               String langIn,
                               String langOut,
                               TranslationServiceKind service,
                               String siliconflowModel,
                               Optional<String> siliconflowBase,
                               int qps,
                               Duration timeout) {

    public TranslatorConfig {
        executable = executable == null ? Optional.empty() : executable;
        langIn = requireNonBlank(langIn, "langIn");
        langOut = requireNonBlank(langOut, "langOut");
        service = Objects.requireNonNull(service, "service");
        siliconflowModel = siliconflowModel == null ? "" : siliconflowModel;
        siliconflowBase = siliconflowBase == null ? Optional.empty() : siliconflowBase;
        if (qps <= 0) {
            throw new IllegalArgumentException("qps must be positive");
        }
        Objects.requireNonNull(timeout, "timeout");
    }

    public TranslatorSettings toSettings(Secrets secrets) {
        Path exe = executable.orElseThrow(() -> new IllegalStateException("Translator executable must be configured"));
        return new TranslatorSettings(exe, langIn, langOut, service, siliconflowModel, secrets.serviceApiKey(),
                siliconflowBase, qps, timeout);
    }

    public Optional<String> recordedModel() {
        return service.recordedModel(siliconflowModel);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
