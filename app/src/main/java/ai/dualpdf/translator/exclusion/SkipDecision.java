package ai.dualpdf.translator.exclusion;

import java.util.Objects;

/**
 * Result of running the exclusion chain for one document.
 */
public record SkipDecision(boolean excluded, String reason, String detail) {

    private static final SkipDecision PROCEED = new SkipDecision(false, "", "");

    public SkipDecision {
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }

    public static SkipDecision proceed() {
        return PROCEED;
    }

    public static SkipDecision exclude(String reason, String detail) {
        return new SkipDecision(true, reason, detail);
    }

    /**
     * Reason and detail joined the way the outcome log records them.
     */
    public String describe() {
        return detail.isEmpty() ? reason : reason + ":" + detail;
    }
}
