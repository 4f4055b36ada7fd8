package ai.dualpdf.translator.config;

import ai.dualpdf.translator.language.ImageDetail;
import ai.dualpdf.translator.language.LabelerSettings;
import ai.dualpdf.translator.language.LabelerTransport;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for page-language labeling.
 */
public record LabelerConfig(LabelerTransport transport,
                            String model,
                            String baseUrl,
                            int pagesToSample,
                            int dpi,
                            ImageDetail detail,
                            Duration perPageTimeout) {

    public LabelerConfig {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(perPageTimeout, "perPageTimeout");
        if (pagesToSample <= 0) {
            throw new IllegalArgumentException("pagesToSample must be positive");
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive");
        }
    }

    public LabelerSettings toSettings(Secrets secrets) {
        return new LabelerSettings(baseUrl, secrets.labelerApiKey().orElse(""), model, detail, perPageTimeout);
    }
}
