package ai.dualpdf.translator.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * One line of the outcome log. The timestamp is added when the row is written.
 */
public record OutcomeRow(OutcomeStatus status,
                         Path pdf,
                         String reason,
                         OptionalInt pages,
                         OptionalLong sizeBytes,
                         Optional<Duration> duration) {

    public OutcomeRow {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(pdf, "pdf");
        reason = reason == null ? "" : reason;
        pages = pages == null ? OptionalInt.empty() : pages;
        sizeBytes = sizeBytes == null ? OptionalLong.empty() : sizeBytes;
        duration = duration == null ? Optional.empty() : duration;
    }

    public static OutcomeRow of(OutcomeStatus status, Path pdf, String reason) {
        return new OutcomeRow(status, pdf, reason, OptionalInt.empty(), OptionalLong.empty(), Optional.empty());
    }
}
