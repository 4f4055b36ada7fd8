package ai.dualpdf.translator.pipeline;

import ai.dualpdf.translator.config.Config;
import ai.dualpdf.translator.exclusion.DocumentCandidate;
import ai.dualpdf.translator.exclusion.ExclusionEvaluator;
import ai.dualpdf.translator.exclusion.SkipDecision;
import ai.dualpdf.translator.ledger.FailureLedger;
import ai.dualpdf.translator.logging.SimpleJsonLayout;
import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.StampResult;
import ai.dualpdf.translator.metadata.TranslationMetadata;
import ai.dualpdf.translator.pdf.MergeException;
import ai.dualpdf.translator.pdf.MergeResult;
import ai.dualpdf.translator.pdf.PageCounter;
import ai.dualpdf.translator.pdf.PageGeometry;
import ai.dualpdf.translator.pdf.PageMergeEngine;
import ai.dualpdf.translator.pdf.PageSize;
import ai.dualpdf.translator.translate.EscalationOutcome;
import ai.dualpdf.translator.translate.ToolArtifactCleaner;
import ai.dualpdf.translator.translate.TranslationEscalation;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import ai.dualpdf.translator.writer.CommitResult;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Sequential batch driver: for each PDF under the root, decide whether to translate it, translate, back up the
 * original, merge original and translation side by side and commit the result in place. A failure affects only
 * the document at hand.
 */
public class BatchOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final DocumentScanner scanner;
    private final ExclusionEvaluator exclusionEvaluator;
    private final Optional<TranslationEscalation> escalation;
    private final FailureLedger ledger;
    private final PageCounter pageCounter;
    private final PageMergeEngine mergeEngine;
    private final DocumentStamper stamper;
    private final AtomicFileTransaction transaction;
    private final ToolArtifactCleaner cleaner;
    private final OutcomeLog outcomeLog;
    private final Clock clock;

    public BatchOrchestrator(DocumentScanner scanner,
                             ExclusionEvaluator exclusionEvaluator,
                             Optional<TranslationEscalation> escalation,
                             FailureLedger ledger,
                             PageCounter pageCounter,
                             PageMergeEngine mergeEngine,
                             DocumentStamper stamper,
                             AtomicFileTransaction transaction,
                             ToolArtifactCleaner cleaner,
                             OutcomeLog outcomeLog,
                             Clock clock) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.exclusionEvaluator = Objects.requireNonNull(exclusionEvaluator, "exclusionEvaluator");
        this.escalation = Objects.requireNonNull(escalation, "escalation");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.pageCounter = Objects.requireNonNull(pageCounter, "pageCounter");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
        this.stamper = Objects.requireNonNull(stamper, "stamper");
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.outcomeLog = Objects.requireNonNull(outcomeLog, "outcomeLog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RunSummary run(Config config) throws IOException {
        Path root = config.pdfRoot().orElseThrow(() -> new IllegalArgumentException("PDF root is required"));
        if (!config.dryRun() && escalation.isEmpty()) {
            throw new IllegalStateException("Translation requires a configured translator");
        }
        outcomeLog.ensureHeader();
        List<Path> documents = scanner.scan(root);
        LOGGER.info("Found {} PDF file(s) under {}", documents.size(), root);
        if (!config.skipKeywords().isEmpty()) {
            LOGGER.info("Loaded {} exclusion keyword(s): {}", config.skipKeywords().size(),
                    String.join(", ", config.skipKeywords()));
        }

        Counters counters = new Counters();
        int attempts = 0;
        int index = 0;
        boolean limitReached = false;
        for (Path document : documents) {
            index++;
            MDC.put(SimpleJsonLayout.DOCUMENT_KEY, document.getFileName().toString());
            try {
                DocumentCandidate candidate = DocumentCandidate.of(document, pageCounter);
                SkipDecision decision = exclusionEvaluator.evaluate(candidate);
                if (decision.excluded()) {
                    recordSkip(config, candidate, decision, index, documents.size());
                    counters.skipped++;
                    continue;
                }
                if (config.maxFilesPerRun() > 0 && attempts >= config.maxFilesPerRun()) {
                    LOGGER.info("Reached the limit of {} translation(s) for this run", config.maxFilesPerRun());
                    limitReached = true;
                    break;
                }
                attempts++;
                LOGGER.info("[{}/{}] Processing {}", index, documents.size(), document.getFileName());
                if (config.dryRun()) {
                    outcomeLog.append(row(OutcomeStatus.WOULD_TRANSLATE, candidate, "dry_run", null));
                    counters.wouldTranslate++;
                    continue;
                }
                if (translate(config, candidate)) {
                    counters.done++;
                } else {
                    counters.failed++;
                }
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected failure while processing {}", document, ex);
                ledger.incrementAndPersist(document);
                outcomeLog.append(OutcomeRow.of(OutcomeStatus.FAILED, document, "unexpected:" + describe(ex)));
                counters.failed++;
            } finally {
                if (!limitReached) {
                    LOGGER.info("Progress {}/{}: done {}, skipped {}, failed {}", index, documents.size(),
                            counters.done, counters.skipped, counters.failed);
                }
                MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
            }
        }

        RunSummary summary = new RunSummary(counters.done, counters.skipped, counters.failed,
                counters.wouldTranslate, outcomeLog.file());
        LOGGER.info("Finished: generated {}, skipped {}, failed {}. Log: {}", summary.done(), summary.skipped(),
                summary.failed(), summary.outcomeLog());
        return summary;
    }

    /**
     * Translates and merges one document.
     *
     * @return {@code true} when the merged document was committed
     */
    boolean translate(Config config, DocumentCandidate candidate) {
        Path document = candidate.path();
        Path directory = document.toAbsolutePath().getParent();
        Instant started = clock.instant();
        OptionalInt pages = pageCounter.pageCount(document);

        EscalationOutcome translation = escalation.orElseThrow().translate(document);
        if (!translation.succeeded()) {
            return fail(candidate, pages, started, translation.failureReason(), Optional.empty());
        }
        Path mono = translation.monoPath().orElseThrow();

        Path backup = SidecarPaths.backupFor(document);
        try {
            Files.copy(document, backup, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException ex) {
            return fail(candidate, pages, started, "backup_failed:" + describe(ex), Optional.empty());
        }
        stampBackup(candidate, pages, backup, started);

        Path merged = SidecarPaths.temporaryFor(document);
        Path stamped = SidecarPaths.temporaryFor(document);
        Optional<String> commitNote;
        try {
            List<PageSize> sourceSizes = PageGeometry.read(document);
            MergeResult result = mergeEngine.merge(document, mono, config.gap(), merged);
            TranslationMetadata metadata = TranslationMetadata.translated(clock.instant(),
                    config.translatorConfig().recordedModel(),
                    sourceSizes, config.gap(), result.pageSizes());
            StampResult stamp = stamper.stampInto(merged, stamped, metadata, Optional.of(backup));
            stamp.attachmentFailure().ifPresent(error -> outcomeLog.append(
                    row(OutcomeStatus.ATTACHMENT_FAILED, candidate, "attachment_error:" + error, pages, started)));
            transaction.deleteWithRetry(merged);

            CommitResult commit = transaction.commitOrSidecar(stamped, document, SidecarPaths.MERGED_SIDECAR_SUFFIX);
            if (!commit.committed()) {
                throw new MergeException("could not replace " + document.getFileName());
            }
            commitNote = commit.status() == CommitResult.Status.SIDECAR
                    ? Optional.of("sidecar:" + commit.location().getFileName())
                    : Optional.empty();
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Merge failure detail", ex);
            return fail(candidate, pages, started, "merge_failed:" + describe(ex), Optional.of(backup));
        } finally {
            transaction.deleteWithRetry(merged);
            transaction.deleteWithRetry(stamped);
        }

        if (config.deletesMono()) {
            if (transaction.deleteWithRetry(mono)) {
                LOGGER.info("Deleted intermediate {}", mono.getFileName());
            } else {
                LOGGER.warn("Could not delete intermediate {}", mono.getFileName());
            }
        }
        if (config.deleteAllExceptFinal() && commitNote.isEmpty()) {
            if (transaction.deleteWithRetry(backup)) {
                LOGGER.info("Deleted backup {}", backup.getFileName());
            } else {
                LOGGER.warn("Could not delete backup {}", backup.getFileName());
            }
        }
        cleaner.removeNewCsvFiles(directory, started);

        OutcomeStatus status = translation.usedOcr() ? OutcomeStatus.OK_OCR : OutcomeStatus.OK;
        String reason = commitNote.orElse(translation.usedOcr() ? "ocr" : "");
        outcomeLog.append(row(status, candidate, reason, pages, started));
        LOGGER.info("Done{}: {} (backup {}, {} s)", translation.usedOcr() ? " with OCR" : "", document.getFileName(),
                backup.getFileName(), Duration.between(started, clock.instant()).toSeconds());
        return true;
    }

    private void stampBackup(DocumentCandidate candidate, OptionalInt pages, Path backup, Instant started) {
        try {
            StampResult result = stamper.stampInPlace(backup, TranslationMetadata.untranslated(clock.instant()),
                    Optional.empty());
            result.commit()
                    .filter(commit -> commit.status() != CommitResult.Status.REPLACED)
                    .ifPresent(commit -> outcomeLog.append(row(OutcomeStatus.METADATA_FAILED, candidate,
                            "original_metadata_error:" + commit.status().name().toLowerCase(Locale.ROOT),
                            pages, started)));
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Could not stamp backup {}: {}", backup.getFileName(), describe(ex));
            outcomeLog.append(row(OutcomeStatus.METADATA_FAILED, candidate,
                    "original_metadata_error:" + describe(ex), pages, started));
        }
    }

    private boolean fail(DocumentCandidate candidate, OptionalInt pages, Instant started, String reason,
                         Optional<Path> createdBackup) {
        Path document = candidate.path();
        int failures = ledger.incrementAndPersist(document);
        createdBackup.ifPresent(backup -> {
            if (!transaction.deleteWithRetry(backup)) {
                LOGGER.warn("Could not remove backup {} after failure", backup.getFileName());
            }
        });
        Path directory = document.toAbsolutePath().getParent();
        cleaner.removeNewCsvFiles(directory, started);
        outcomeLog.append(row(OutcomeStatus.FAILED, candidate, reason, pages, started));
        LOGGER.warn("Failed {} ({}), failure count {}", document.getFileName(), reason, failures);
        return false;
    }

    private void recordSkip(Config config, DocumentCandidate candidate, SkipDecision decision, int index, int total) {
        OutcomeRow row = new OutcomeRow(OutcomeStatus.SKIPPED, candidate.path(), decision.describe(),
                candidate.knownPageCount(), OptionalLong.of(candidate.sizeBytes()), Optional.empty());
        outcomeLog.append(row);
        if (config.suppressSkippedOutput()) {
            LOGGER.debug("Skipped {}: {}", candidate.name(), decision.describe());
        } else {
            LOGGER.info("[{}/{}] Skipped {}: {}", index, total, candidate.name(), decision.describe());
        }
    }

    private OutcomeRow row(OutcomeStatus status, DocumentCandidate candidate, String reason, Instant started) {
        return row(status, candidate, reason, candidate.knownPageCount(), started);
    }

    private OutcomeRow row(OutcomeStatus status, DocumentCandidate candidate, String reason, OptionalInt pages,
                           Instant started) {
        Optional<Duration> duration = started == null
                ? Optional.empty()
                : Optional.of(Duration.between(started, clock.instant()));
        return new OutcomeRow(status, candidate.path(), reason, pages, OptionalLong.of(candidate.sizeBytes()), duration);
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    private static final class Counters {
        private int done;
        private int skipped;
        private int failed;
        private int wouldTranslate;
    }
}
