package ai.dualpdf.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolArtifactCleanerTest {

    @TempDir
    Path tempDir;

    @Test
    void removesOnlyCsvFilesWrittenSinceTheRunStarted() throws Exception {
        Instant started = Instant.parse("2024-05-01T08:30:00Z");
        Path old = csv("old.csv", started.minusSeconds(60));
        Path slack = csv("slack.csv", started.minusMillis(500));
        Path fresh = csv("fresh.CSV", started.plusSeconds(5));
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "x");

        int removed = new ToolArtifactCleaner().removeNewCsvFiles(tempDir, started);

        assertThat(removed).isEqualTo(2);
        assertThat(old).exists();
        assertThat(slack).doesNotExist();
        assertThat(fresh).doesNotExist();
        assertThat(notes).exists();
    }

    @Test
    void neverRemovesProtectedFiles() throws Exception {
        Instant started = Instant.parse("2024-05-01T08:30:00Z");
        Path outcomeLog = csv("batch_translate_log.csv", started.plusSeconds(1));

        int removed = new ToolArtifactCleaner(Set.of(outcomeLog)).removeNewCsvFiles(tempDir, started);

        assertThat(removed).isZero();
        assertThat(outcomeLog).exists();
    }

    @Test
    void missingDirectoryRemovesNothing() {
        assertThat(new ToolArtifactCleaner().removeNewCsvFiles(tempDir.resolve("absent"), Instant.now())).isZero();
    }

    private Path csv(String name, Instant modified) throws Exception {
        Path file = Files.writeString(tempDir.resolve(name), "a,b\n");
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }
}
