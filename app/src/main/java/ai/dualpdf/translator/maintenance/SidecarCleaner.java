package ai.dualpdf.translator.maintenance;

import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the leftovers of interrupted or blocked runs: sidecar copies written when a target was locked and
 * temporary ASCII-named translator inputs.
 */
public class SidecarCleaner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SidecarCleaner.class);

    public CleanupReport clean(Path root) {
        List<Path> leftovers = findLeftovers(root);
        int deleted = 0;
        int failures = 0;
        long freed = 0;
        for (Path file : leftovers) {
            try {
                long size = Files.size(file);
                Files.delete(file);
                deleted++;
                freed += size;
                LOGGER.info("Deleted {} ({} bytes)", root.relativize(file), size);
            } catch (IOException ex) {
                failures++;
                LOGGER.warn("Could not delete {}: {}", root.relativize(file), ex.getMessage());
            }
        }
        LOGGER.info("Cleanup finished: deleted {} file(s), freed {} bytes", deleted, freed);
        return new CleanupReport(deleted, freed, failures);
    }

    List<Path> findLeftovers(Path root) {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(SidecarCleaner::isLeftover)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan " + root, ex);
        }
    }

    static boolean isLeftover(Path file) {
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(SidecarPaths.UPDATED_SIDECAR_SUFFIX)
                || lower.endsWith(SidecarPaths.MERGED_SIDECAR_SUFFIX)
                || (name.startsWith(SidecarPaths.TEMP_INPUT_PREFIX) && lower.endsWith(".pdf"));
    }
}
