package ai.dualpdf.translator.language;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and sampling parameters for one labeling backend.
 */
public record LabelerSettings(String baseUrl, String apiKey, String model, ImageDetail detail, Duration timeout) {

    static final String SYSTEM_PROMPT = "Return the language classification only, without reasoning";
    static final String USER_PROMPT = "Is the main language of this PDF page Chinese or non-Chinese? Answer only: 中文 or 非中文";

    private static final String THINKING_MODEL = "GLM-4.1V-9B-Thinking";

    public LabelerSettings {
        baseUrl = requireNonBlank(baseUrl, "baseUrl");
        model = requireNonBlank(model, "model");
        apiKey = apiKey == null ? "" : apiKey;
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Reasoning models need room to think before they answer.
     */
    public double temperature() {
        return isThinkingModel() ? 0.7 : 0.0;
    }

    public int maxTokens() {
        return isThinkingModel() ? 512 : 16;
    }

    private boolean isThinkingModel() {
        return model.contains(THINKING_MODEL);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
