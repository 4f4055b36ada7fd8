package ai.dualpdf.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileTransactionTest {

    @TempDir
    Path tempDir;

    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicFileTransaction transaction =
            new AtomicFileTransaction(4, Duration.ofMillis(100), 3, Duration.ofMillis(50), sleeps::add);

    @Test
    void replacesExistingDestination() throws Exception {
        Path source = Files.writeString(tempDir.resolve("new.pdf"), "new");
        Path destination = Files.writeString(tempDir.resolve("doc.pdf"), "old");

        assertThat(transaction.replaceWithRetry(source, destination)).isTrue();

        assertThat(destination).hasContent("new");
        assertThat(source).doesNotExist();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void missingSourceFailsWithoutRetrying() {
        assertThat(transaction.replaceWithRetry(tempDir.resolve("absent.pdf"), tempDir.resolve("doc.pdf"))).isFalse();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void lockedDestinationBacksOffExponentially() throws Exception {
        Path source = Files.writeString(tempDir.resolve("new.pdf"), "new");
        Path locked = Files.createDirectory(tempDir.resolve("doc.pdf"));
        Files.writeString(locked.resolve("holder"), "x");

        assertThat(transaction.replaceWithRetry(source, locked)).isFalse();

        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        assertThat(source).exists();
    }

    @Test
    void commitFallsBackToSidecar() throws Exception {
        Path temporary = Files.writeString(tempDir.resolve("doc_tmp_0a1b2c3d.pdf"), "merged");
        Path locked = Files.createDirectory(tempDir.resolve("doc.pdf"));
        Files.writeString(locked.resolve("holder"), "x");

        CommitResult result = transaction.commitOrSidecar(temporary, locked, SidecarPaths.MERGED_SIDECAR_SUFFIX);

        assertThat(result.status()).isEqualTo(CommitResult.Status.SIDECAR);
        assertThat(result.committed()).isTrue();
        assertThat(result.location()).isEqualTo(tempDir.resolve("doc.pdf2zh-merged.pdf"));
        assertThat(result.location()).hasContent("merged");
        assertThat(temporary).doesNotExist();
    }

    @Test
    void commitReplacesWhenDestinationIsFree() throws Exception {
        Path temporary = Files.writeString(tempDir.resolve("doc_tmp_0a1b2c3d.pdf"), "merged");
        Path destination = Files.writeString(tempDir.resolve("doc.pdf"), "original");

        CommitResult result = transaction.commitOrSidecar(temporary, destination, SidecarPaths.MERGED_SIDECAR_SUFFIX);

        assertThat(result.status()).isEqualTo(CommitResult.Status.REPLACED);
        assertThat(destination).hasContent("merged");
    }

    @Test
    void deleteTreatsMissingFileAsDeleted() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.pdf"), "x");

        assertThat(transaction.deleteWithRetry(file)).isTrue();
        assertThat(transaction.deleteWithRetry(file)).isTrue();
        assertThat(file).doesNotExist();
    }

    @Test
    void deleteGivesUpOnNonEmptyDirectory() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("dir"));
        Files.writeString(directory.resolve("child"), "x");

        assertThat(transaction.deleteWithRetry(directory)).isFalse();
        assertThat(sleeps).containsExactly(Duration.ofMillis(50), Duration.ofMillis(100));
    }
}
