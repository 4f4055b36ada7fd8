package ai.dualpdf.translator.translate;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one invocation round (all watermark variants) of the external translator.
 */
public record InvocationResult(Optional<FailureKind> failure, String reason, int processRuns) {

    public InvocationResult {
        Objects.requireNonNull(failure, "failure");
        reason = reason == null ? "" : reason;
    }

    public static InvocationResult ok(int processRuns) {
        return new InvocationResult(Optional.empty(), "OK", processRuns);
    }

    public static InvocationResult failed(FailureKind kind, String reason, int processRuns) {
        return new InvocationResult(Optional.of(kind), reason, processRuns);
    }

    public boolean succeeded() {
        return failure.isEmpty();
    }
}
