package ai.dualpdf.translator.translate;

import java.util.Locale;
import java.util.Optional;

/**
 * Backend the external translator is told to use.
 */
public enum TranslationServiceKind {
    SILICONFLOW_FREE("siliconflow_free"),
    SILICONFLOW_PRO("siliconflow_pro"),
    DEFAULT("default");

    static final String FREE_SERVICE_MODEL = "Qwen/Qwen2.5-7B-Instruct";

    private final String configValue;

    TranslationServiceKind(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Model name recorded in the metadata of documents translated through this service.
     */
    public Optional<String> recordedModel(String configuredModel) {
        return switch (this) {
            case SILICONFLOW_FREE -> Optional.of(FREE_SERVICE_MODEL);
            case SILICONFLOW_PRO -> Optional.ofNullable(configuredModel).filter(model -> !model.isBlank());
            case DEFAULT -> Optional.empty();
        };
    }

    public static TranslationServiceKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TranslationServiceKind kind : values()) {
            if (kind.configValue.equals(normalized)) {
                return kind;
            }
        }
        if ("auto".equals(normalized)) {
            return DEFAULT;
        }
        throw new IllegalArgumentException("Unknown translation service: " + value);
    }
}
