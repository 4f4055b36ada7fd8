package ai.dualpdf.translator.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileFailureLedgerTest {

    @TempDir
    Path tempDir;

    @Test
    void incrementsAndPersistsCounts() throws Exception {
        Path ledgerFile = tempDir.resolve("fail_log.txt");
        Path document = tempDir.resolve("a.pdf");
        FileFailureLedger ledger = new FileFailureLedger(ledgerFile);

        assertThat(ledger.incrementAndPersist(document)).isEqualTo(1);
        assertThat(ledger.incrementAndPersist(document)).isEqualTo(2);

        assertThat(Files.readAllLines(ledgerFile, StandardCharsets.UTF_8))
                .containsExactly(FailureLedger.keyOf(document) + ",2");
        assertThat(new FileFailureLedger(ledgerFile).count(document)).isEqualTo(2);
    }

    @Test
    void exhaustedAfterThreeFailures() {
        Path document = tempDir.resolve("b.pdf");
        FileFailureLedger ledger = new FileFailureLedger(tempDir.resolve("fail_log.txt"));

        ledger.incrementAndPersist(document);
        ledger.incrementAndPersist(document);
        assertThat(ledger.isExhausted(document)).isFalse();

        ledger.incrementAndPersist(document);
        assertThat(ledger.isExhausted(document)).isTrue();
    }

    @Test
    void missingFileReadsAsEmpty() {
        FileFailureLedger ledger = new FileFailureLedger(tempDir.resolve("absent.txt"));

        assertThat(ledger.read()).isEmpty();
        assertThat(ledger.count(tempDir.resolve("x.pdf"))).isZero();
    }

    @Test
    void skipsMalformedLinesAndKeepsPathsWithCommas() throws Exception {
        Path ledgerFile = tempDir.resolve("fail_log.txt");
        Files.write(ledgerFile, List.of(
                "/data/Smith, J-2020-Title.pdf,2",
                "garbage",
                "/data/other.pdf,abc",
                "/data/trailing.pdf,",
                ""), StandardCharsets.UTF_8);

        FileFailureLedger ledger = new FileFailureLedger(ledgerFile);

        assertThat(ledger.read()).containsOnlyKeys("/data/Smith, J-2020-Title.pdf")
                .containsEntry("/data/Smith, J-2020-Title.pdf", 2);
    }

    @Test
    void unwritableLedgerDoesNotThrow() throws Exception {
        Path directoryInTheWay = Files.createDirectory(tempDir.resolve("ledger"));
        FileFailureLedger ledger = new FileFailureLedger(directoryInTheWay);

        assertThat(ledger.incrementAndPersist(tempDir.resolve("c.pdf"))).isEqualTo(1);
    }
}
