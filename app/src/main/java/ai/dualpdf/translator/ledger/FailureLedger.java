package ai.dualpdf.translator.ledger;

import java.nio.file.Path;
import java.util.Map;

/**
 * Cross-run attempt counter used as a circuit breaker for documents that keep failing.
 */
public interface FailureLedger {

    int MAX_FAILURES = 3;

    /**
     * Returns a snapshot of every recorded path and its failure count.
     */
    Map<String, Integer> read();

    int count(Path document);

    /**
     * Increments the count for the document and persists the ledger. Persistence is best-effort.
     *
     * @return the new count
     */
    int incrementAndPersist(Path document);

    default boolean isExhausted(Path document) {
        return count(document) >= MAX_FAILURES;
    }

    static String keyOf(Path document) {
        return document.toAbsolutePath().normalize().toString();
    }
}
