package ai.dualpdf.translator.translate;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the translated artifact ended up, or why there is none.
 */
public record EscalationOutcome(Optional<Path> monoPath, boolean usedOcr, int invocations, String failureReason) {

    public EscalationOutcome {
        Objects.requireNonNull(monoPath, "monoPath");
        failureReason = failureReason == null ? "" : failureReason;
    }

    static EscalationOutcome success(Path monoPath, boolean usedOcr, int invocations) {
        return new EscalationOutcome(Optional.of(monoPath), usedOcr, invocations, "");
    }

    static EscalationOutcome failure(String reason, boolean usedOcr, int invocations) {
        return new EscalationOutcome(Optional.empty(), usedOcr, invocations, reason);
    }

    public boolean succeeded() {
        return monoPath.isPresent();
    }
}
