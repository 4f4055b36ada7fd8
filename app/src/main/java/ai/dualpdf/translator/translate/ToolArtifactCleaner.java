package ai.dualpdf.translator.translate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the CSV files the translator leaves in its working directory. Files passed as protected, such as
 * the outcome log, are never touched.
 */
public class ToolArtifactCleaner {

    static final Duration CLOCK_SLACK = Duration.ofSeconds(1);

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolArtifactCleaner.class);

    private final Set<Path> protectedFiles;

    public ToolArtifactCleaner() {
        this(Set.of());
    }

    public ToolArtifactCleaner(Set<Path> protectedFiles) {
        this.protectedFiles = protectedFiles.stream()
                .map(path -> path.toAbsolutePath().normalize())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Deletes {@code *.csv} files in {@code directory} modified at or after {@code since} minus one second.
     *
     * @return number of files removed
     */
    public int removeNewCsvFiles(Path directory, Instant since) {
        Instant threshold = since.minus(CLOCK_SLACK);
        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .filter(path -> !protectedFiles.contains(path.toAbsolutePath().normalize()))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            LOGGER.debug("Could not list {}: {}", directory, ex.getMessage());
            return 0;
        }
        int removed = 0;
        for (Path csv : candidates) {
            try {
                if (!Files.getLastModifiedTime(csv).toInstant().isBefore(threshold) && Files.deleteIfExists(csv)) {
                    removed++;
                }
            } catch (IOException ex) {
                LOGGER.debug("Could not remove {}: {}", csv.getFileName(), ex.getMessage());
            }
        }
        if (removed > 0) {
            LOGGER.info("Removed {} translator CSV file(s) from {}", removed, directory);
        }
        return removed;
    }
}
