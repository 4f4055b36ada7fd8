package ai.dualpdf.translator.maintenance;

import ai.dualpdf.translator.exclusion.DocumentNameValidator;
import ai.dualpdf.translator.language.SideBySideDetector;
import ai.dualpdf.translator.language.SideBySideVerdict;
import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.MetadataReadResult;
import ai.dualpdf.translator.metadata.StampResult;
import ai.dualpdf.translator.metadata.TranslationMetadata;
import ai.dualpdf.translator.pdf.PageGeometry;
import ai.dualpdf.translator.pdf.PageSize;
import ai.dualpdf.translator.pipeline.DocumentScanner;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives documents that have neither a metadata marker nor an {@code _original} twin their first marker. Whether a
 * document is a side-by-side translation is decided by labeling the two halves of its pages separately.
 */
public class OrphanMetadataBackfill {

    static final String HAS_METADATA = "has_metadata";
    static final String IS_BACKUP = "is_backup";
    static final String IS_GENERATED = "is_generated";
    static final String HAS_ORIGINAL_PAIR = "has_original_pair";
    static final String FILENAME_CONTAINS_CHINESE = "filename_contains_chinese";
    static final String BAD_NAME_PATTERN = "bad_name_pattern";
    static final String CONTAINS_KEYWORD = "contains_keyword";

    private static final Logger LOGGER = LoggerFactory.getLogger(OrphanMetadataBackfill.class);

    private final DocumentScanner scanner;
    private final MetadataManager metadataManager;
    private final DocumentStamper stamper;
    private final SideBySideDetector detector;
    private final Clock clock;
    private final Optional<String> modelName;
    private final List<String> keywords;

    public OrphanMetadataBackfill(DocumentScanner scanner,
                                  MetadataManager metadataManager,
                                  DocumentStamper stamper,
                                  SideBySideDetector detector,
                                  Clock clock,
                                  Optional<String> modelName,
                                  List<String> keywords) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.metadataManager = Objects.requireNonNull(metadataManager, "metadataManager");
        this.stamper = Objects.requireNonNull(stamper, "stamper");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.modelName = modelName == null ? Optional.empty() : modelName;
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public OrphanReport run(Path root, boolean dryRun) {
        List<Path> documents = scanner.scan(root);
        LOGGER.info("Found {} PDF(s) under {}", documents.size(), root);

        int candidates = 0;
        int stamped = 0;
        int skipped = 0;
        int failed = 0;
        for (Path document : documents) {
            try {
                Optional<String> reason = skipReason(document);
                if (reason.isPresent()) {
                    skipped++;
                    LOGGER.info("Skipped {} ({})", document.getFileName(), reason.get());
                    continue;
                }
                candidates++;
                if (dryRun) {
                    LOGGER.info("(dry-run) would label {}", document.getFileName());
                } else if (process(document)) {
                    stamped++;
                }
            } catch (IOException | RuntimeException ex) {
                failed++;
                LOGGER.warn("Could not add metadata to {}: {}", document.getFileName(), ex.getMessage());
            }
        }
        LOGGER.info("Orphan backfill finished: {} scanned, {} stamped, {} skipped, {} failed",
                documents.size(), stamped, skipped, failed);
        return new OrphanReport(documents.size(), candidates, stamped, skipped, failed);
    }

    Optional<String> skipReason(Path document) throws IOException {
        if (metadataManager.read(document).outcome() != MetadataReadResult.Outcome.NO_METADATA_FOUND) {
            return Optional.of(HAS_METADATA);
        }
        String name = document.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (SidecarPaths.isBackup(document)) {
            return Optional.of(IS_BACKUP);
        }
        if (lower.endsWith(".mono.pdf") || lower.endsWith(".dual.pdf")
                || lower.endsWith(SidecarPaths.MERGED_SIDECAR_SUFFIX)
                || lower.endsWith(SidecarPaths.UPDATED_SIDECAR_SUFFIX)) {
            return Optional.of(IS_GENERATED);
        }
        if (Files.exists(SidecarPaths.backupFor(document))) {
            return Optional.of(HAS_ORIGINAL_PAIR);
        }
        if (DocumentNameValidator.containsCjk(name)) {
            return Optional.of(FILENAME_CONTAINS_CHINESE);
        }
        if (!DocumentNameValidator.isNormalizedName(SidecarPaths.stem(document))) {
            return Optional.of(BAD_NAME_PATTERN);
        }
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return Optional.of(CONTAINS_KEYWORD + ": " + keyword);
            }
        }
        return Optional.empty();
    }

    private boolean process(Path document) throws IOException {
        SideBySideVerdict verdict = detector.judge(document);
        TranslationMetadata metadata;
        if (verdict.translated()) {
            List<PageSize> resultSizes = PageGeometry.read(document);
            List<PageSize> sourceSizes = resultSizes.stream()
                    .map(size -> new PageSize(size.w() / 2, size.h()))
                    .toList();
            metadata = TranslationMetadata.translated(clock.instant(), modelName, sourceSizes, 0.0, resultSizes);
        } else {
            metadata = TranslationMetadata.untranslated(clock.instant());
        }
        StampResult result = stamper.stampInPlace(document, metadata, Optional.empty());
        LOGGER.info("{}: {} ({})", document.getFileName(), metadata.status().wireValue(), verdict.describe());
        return result.changed();
    }
}
