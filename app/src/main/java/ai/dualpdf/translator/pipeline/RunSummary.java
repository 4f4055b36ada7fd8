package ai.dualpdf.translator.pipeline;

import java.nio.file.Path;

/**
 * Counters reported at the end of a batch.
 */
public record RunSummary(int done, int skipped, int failed, int wouldTranslate, Path outcomeLog) {

    public int total() {
        return done + skipped + failed + wouldTranslate;
    }

    @Override
    public String toString() {
        return "done=%d skipped=%d failed=%d%s log=%s".formatted(done, skipped, failed,
                wouldTranslate > 0 ? " would_translate=" + wouldTranslate : "", outcomeLog);
    }
}
