package ai.dualpdf.translator.metadata;

import ai.dualpdf.translator.pdf.PageSize;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Content of the canonical metadata attachment. Model, page sizes and gap are only meaningful once a
 * document has been translated.
 */
public record TranslationMetadata(MetadataStatus status,
                                  Instant runTime,
                                  Optional<String> model,
                                  List<PageSize> sourcePageSizes,
                                  double gapPt,
                                  List<PageSize> resultPageSizes) {

    public TranslationMetadata {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(runTime, "runTime");
        model = model == null ? Optional.empty() : model;
        sourcePageSizes = List.copyOf(sourcePageSizes == null ? List.of() : sourcePageSizes);
        resultPageSizes = List.copyOf(resultPageSizes == null ? List.of() : resultPageSizes);
        if (gapPt < 0 || Double.isNaN(gapPt)) {
            throw new IllegalArgumentException("gapPt must be zero or greater");
        }
    }

    public static TranslationMetadata untranslated(Instant runTime) {
        return new TranslationMetadata(MetadataStatus.UNTRANSLATED, runTime, Optional.empty(), List.of(), 0.0, List.of());
    }

    public static TranslationMetadata translated(Instant runTime, Optional<String> model,
                                                 List<PageSize> sourcePageSizes, double gapPt,
                                                 List<PageSize> resultPageSizes) {
        return new TranslationMetadata(MetadataStatus.TRANSLATED, runTime, model, sourcePageSizes, gapPt, resultPageSizes);
    }
}
