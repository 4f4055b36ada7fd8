package ai.dualpdf.translator.config;

import java.util.Optional;

/**
 * Holds API keys for the translation backend and the page-labeling service.
 */
public record Secrets(Optional<String> serviceApiKey, Optional<String> labelerApiKey) {

    public Secrets {
        serviceApiKey = serviceApiKey == null ? Optional.empty() : serviceApiKey.filter(value -> !value.isBlank());
        labelerApiKey = labelerApiKey == null ? Optional.empty() : labelerApiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[serviceApiKey=" + (serviceApiKey.isPresent() ? "****" : "<unset>")
                + ", labelerApiKey=" + (labelerApiKey.isPresent() ? "****" : "<unset>") + "]";
    }
}
