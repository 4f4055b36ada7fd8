package ai.dualpdf.translator.translate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to build a command line for the external translator.
 */
public record TranslatorSettings(Path executable,
                                 String langIn,
                                 String langOut,
                                 TranslationServiceKind service,
                                 String serviceModel,
                                 Optional<String> serviceApiKey,
                                 Optional<String> serviceBaseUrl,
                                 int qps,
                                 Duration timeout) {

    public TranslatorSettings {
        Objects.requireNonNull(executable, "executable");
        langIn = requireNonBlank(langIn, "langIn");
        langOut = requireNonBlank(langOut, "langOut");
        Objects.requireNonNull(service, "service");
        serviceModel = serviceModel == null ? "" : serviceModel.trim();
        serviceApiKey = serviceApiKey == null ? Optional.empty() : serviceApiKey.filter(value -> !value.isBlank());
        serviceBaseUrl = serviceBaseUrl == null ? Optional.empty() : serviceBaseUrl.filter(value -> !value.isBlank());
        if (qps <= 0) {
            throw new IllegalArgumentException("qps must be positive");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (service == TranslationServiceKind.SILICONFLOW_PRO && serviceModel.isEmpty()) {
            throw new IllegalArgumentException("siliconflow_pro requires a model name");
        }
    }

    /**
     * Model name recorded in the metadata of translated documents.
     */
    public Optional<String> effectiveModel() {
        return service.recordedModel(serviceModel);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
