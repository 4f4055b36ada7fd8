package ai.dualpdf.translator.writer;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces or deletes files that another process may be holding open, retrying with exponential backoff.
 * Exhaustion is reported through return values; none of the operations throw.
 */
public class AtomicFileTransaction {

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicFileTransaction.class);

    public static final int DEFAULT_REPLACE_ATTEMPTS = 10;
    public static final Duration DEFAULT_REPLACE_DELAY = Duration.ofMillis(100);
    public static final int DEFAULT_DELETE_ATTEMPTS = 5;
    public static final Duration DEFAULT_DELETE_DELAY = Duration.ofMillis(50);

    private final int replaceAttempts;
    private final Duration replaceInitialDelay;
    private final int deleteAttempts;
    private final Duration deleteInitialDelay;
    private final Sleeper sleeper;

    public AtomicFileTransaction() {
        this(DEFAULT_REPLACE_ATTEMPTS, DEFAULT_REPLACE_DELAY, DEFAULT_DELETE_ATTEMPTS, DEFAULT_DELETE_DELAY, Sleeper.THREAD);
    }

    public AtomicFileTransaction(int replaceAttempts, Duration replaceInitialDelay,
                                 int deleteAttempts, Duration deleteInitialDelay, Sleeper sleeper) {
        if (replaceAttempts < 1 || deleteAttempts < 1) {
            throw new IllegalArgumentException("attempt counts must be at least 1");
        }
        this.replaceAttempts = replaceAttempts;
        this.replaceInitialDelay = Objects.requireNonNull(replaceInitialDelay, "replaceInitialDelay");
        this.deleteAttempts = deleteAttempts;
        this.deleteInitialDelay = Objects.requireNonNull(deleteInitialDelay, "deleteInitialDelay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Moves {@code source} over {@code destination}, atomically where the file system allows it.
     *
     * @return {@code true} once the move succeeded, {@code false} when every attempt hit a sharing violation
     *         or the source vanished
     */
    public boolean replaceWithRetry(Path source, Path destination) {
        for (int attempt = 0; attempt < replaceAttempts; attempt++) {
            try {
                move(source, destination);
                return true;
            } catch (NoSuchFileException ex) {
                LOGGER.warn("Cannot replace {}: source {} does not exist", destination, source);
                return false;
            } catch (IOException ex) {
                if (!isSharingViolation(ex) || attempt == replaceAttempts - 1) {
                    LOGGER.warn("Replacing {} failed after {} attempt(s): {}", destination, attempt + 1, ex.getMessage());
                    return false;
                }
                if (!backoff(replaceInitialDelay, attempt)) {
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Deletes a file, tolerating transient locks. A missing file counts as deleted.
     */
    public boolean deleteWithRetry(Path path) {
        for (int attempt = 0; attempt < deleteAttempts; attempt++) {
            try {
                Files.deleteIfExists(path);
                return true;
            } catch (IOException ex) {
                if (attempt == deleteAttempts - 1) {
                    LOGGER.warn("Deleting {} failed after {} attempt(s): {}", path, attempt + 1, ex.getMessage());
                    return false;
                }
                if (!backoff(deleteInitialDelay, attempt)) {
                    return false;
                }
            }
        }
        return false;
    }

    /**
     * Commits a finished temporary file over its destination. When the destination stays locked the work is
     * kept in a sidecar next to it instead of being discarded.
     */
    public CommitResult commitOrSidecar(Path temporary, Path destination, String sidecarSuffix) {
        try {
            if (replaceWithRetry(temporary, destination)) {
                return CommitResult.replaced(destination);
            }
            Path sidecar = SidecarPaths.sidecarFor(destination, sidecarSuffix);
            LOGGER.warn("Destination {} is locked; saving result to sidecar {}", destination.getFileName(), sidecar.getFileName());
            if (replaceWithRetry(temporary, sidecar)) {
                return CommitResult.sidecar(sidecar);
            }
            return CommitResult.failed(destination);
        } finally {
            if (Files.exists(temporary)) {
                deleteWithRetry(temporary);
            }
        }
    }

    private void move(Path source, Path destination) throws IOException {
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private boolean backoff(Duration initialDelay, int attempt) {
        Duration delay = initialDelay.multipliedBy(1L << Math.min(attempt, 20));
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("File retry interrupted");
            return false;
        }
    }

    static boolean isSharingViolation(IOException ex) {
        // AccessDeniedException is a FileSystemException; Windows reports locks as either
        return ex instanceof FileSystemException && !(ex instanceof NoSuchFileException);
    }

    /**
     * Pause strategy between attempts, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
