package ai.dualpdf.translator.maintenance;

import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.StampResult;
import ai.dualpdf.translator.metadata.TranslationMetadata;
import ai.dualpdf.translator.pdf.PageGeometry;
import ai.dualpdf.translator.pdf.PageSize;
import ai.dualpdf.translator.pipeline.DocumentScanner;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings documents merged by older runs up to date: for every {@code X.pdf} next to an {@code X_original.pdf},
 * the original gets an {@code untranslated} marker and the merged document gets the {@code translated} marker,
 * with the gap inferred from page geometry, plus a link to its original.
 */
public class PairMetadataBackfill {

    private static final Logger LOGGER = LoggerFactory.getLogger(PairMetadataBackfill.class);

    private final DocumentScanner scanner;
    private final DocumentStamper stamper;
    private final AtomicFileTransaction transaction;
    private final Clock clock;
    private final Optional<String> modelName;

    public PairMetadataBackfill(DocumentScanner scanner,
                                DocumentStamper stamper,
                                AtomicFileTransaction transaction,
                                Clock clock,
                                Optional<String> modelName) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.stamper = Objects.requireNonNull(stamper, "stamper");
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.modelName = modelName == null ? Optional.empty() : modelName;
    }

    public PairReport run(Path root, boolean dryRun) {
        int staleRemoved = dryRun ? 0 : removeStaleTemporaries(root);
        List<Pair> pairs = findPairs(root);
        if (pairs.isEmpty()) {
            LOGGER.info("No translated/original pairs found under {}", root);
            return new PairReport(0, 0, 0, 0, staleRemoved);
        }
        LOGGER.info("Found {} pair(s) under {}", pairs.size(), root);

        int updated = 0;
        int unchanged = 0;
        int failed = 0;
        for (Pair pair : pairs) {
            try {
                if (process(pair, dryRun)) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (IOException | RuntimeException ex) {
                failed++;
                LOGGER.warn("Could not backfill {}: {}", pair.merged().getFileName(), ex.getMessage());
            }
        }
        LOGGER.info("Backfill finished: {} updated, {} unchanged, {} failed", updated, unchanged, failed);
        return new PairReport(pairs.size(), updated, unchanged, failed, staleRemoved);
    }

    List<Pair> findPairs(Path root) {
        List<Pair> pairs = new ArrayList<>();
        for (Path document : scanner.scan(root)) {
            if (SidecarPaths.isBackup(document)) {
                continue;
            }
            Path original = SidecarPaths.backupFor(document);
            if (Files.isRegularFile(original)) {
                pairs.add(new Pair(document, original));
            }
        }
        return pairs;
    }

    private boolean process(Pair pair, boolean dryRun) throws IOException {
        List<PageSize> sourceSizes = PageGeometry.read(pair.original());
        List<PageSize> resultSizes = PageGeometry.read(pair.merged());
        double gap = MetadataManager.inferGap(sourceSizes, resultSizes);
        if (dryRun) {
            LOGGER.info("(dry-run) {}: gap ~{} pt, {} source page(s), {} merged page(s)",
                    pair.merged().getFileName(), gap, sourceSizes.size(), resultSizes.size());
            return false;
        }

        StampResult original = stamper.stampInPlace(pair.original(), TranslationMetadata.untranslated(clock.instant()),
                Optional.empty());
        TranslationMetadata translated = TranslationMetadata.translated(clock.instant(), modelName, sourceSizes, gap,
                resultSizes);
        StampResult merged = stamper.stampInPlace(pair.merged(), translated, Optional.of(pair.original()));
        merged.attachmentFailure().ifPresent(error ->
                LOGGER.warn("Link to {} not added: {}", pair.original().getFileName(), error));
        boolean changed = original.changed() || merged.changed();
        if (changed) {
            LOGGER.info("Updated {} (gap ~{} pt)", pair.merged().getFileName(), gap);
        }
        return changed;
    }

    private int removeStaleTemporaries(Path root) {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, "*" + SidecarPaths.TEMP_MARKER + "*.pdf")) {
            for (Path stale : stream) {
                if (transaction.deleteWithRetry(stale)) {
                    removed++;
                } else {
                    LOGGER.warn("Could not remove stale temporary {}", stale.getFileName());
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + root, ex);
        }
        return removed;
    }

    record Pair(Path merged, Path original) {
    }
}
