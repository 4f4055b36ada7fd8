package ai.dualpdf.translator.ledger;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ledger fake that keeps counts in memory.
 */
public class InMemoryFailureLedger implements FailureLedger {

    private final Map<String, Integer> counts = new TreeMap<>();

    @Override
    public Map<String, Integer> read() {
        return Map.copyOf(counts);
    }

    @Override
    public int count(Path document) {
        return counts.getOrDefault(FailureLedger.keyOf(document), 0);
    }

    @Override
    public int incrementAndPersist(Path document) {
        return counts.merge(FailureLedger.keyOf(document), 1, Integer::sum);
    }
}
