package ai.dualpdf.translator.ledger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Failure ledger persisted as {@code path,count} lines, rewritten in key order on every increment.
 */
public class FileFailureLedger implements FailureLedger {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileFailureLedger.class);

    private final Path ledgerFile;
    private Map<String, Integer> counts;

    public FileFailureLedger(Path ledgerFile) {
        this.ledgerFile = Objects.requireNonNull(ledgerFile, "ledgerFile");
    }

    public Path ledgerFile() {
        return ledgerFile;
    }

    @Override
    public synchronized Map<String, Integer> read() {
        counts = load(ledgerFile);
        return Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    @Override
    public synchronized int count(Path document) {
        return counts().getOrDefault(FailureLedger.keyOf(document), 0);
    }

    @Override
    public synchronized int incrementAndPersist(Path document) {
        String key = FailureLedger.keyOf(document);
        int updated = counts().merge(key, 1, Integer::sum);
        persist();
        return updated;
    }

    private Map<String, Integer> counts() {
        if (counts == null) {
            counts = load(ledgerFile);
        }
        return counts;
    }

    private void persist() {
        List<String> lines = new ArrayList<>(counts.size());
        new TreeMap<>(counts).forEach((path, count) -> lines.add(path + "," + count));
        try {
            Path parent = ledgerFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(ledgerFile, lines, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Unable to write failure ledger {}: {}", ledgerFile, ex.getMessage());
        }
    }

    static Map<String, Integer> load(Path file) {
        Map<String, Integer> loaded = new TreeMap<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            return loaded;
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Unable to read failure ledger {}: {}", file, ex.getMessage());
            return loaded;
        }
        for (String raw : lines) {
            String line = raw.strip();
            int separator = line.lastIndexOf(',');
            if (separator <= 0 || separator == line.length() - 1) {
                continue;
            }
            String countText = line.substring(separator + 1);
            if (!countText.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
                continue;
            }
            try {
                loaded.put(line.substring(0, separator), Integer.parseInt(countText));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring oversized ledger count in line '{}'", line);
            }
        }
        return loaded;
    }
}
