package ai.dualpdf.translator.translate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives up to three translator invocations for one document, each more permissive than the last: plain, then
 * with the OCR workaround, then with OCR once more if a nominal success left no artifact behind.
 */
public class TranslationEscalation {

    public static final int MAX_INVOCATIONS = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationEscalation.class);

    private final TranslationInvoker invoker;
    private final ToolArtifactCleaner cleaner;
    private final Clock clock;

    public TranslationEscalation(TranslationInvoker invoker, ToolArtifactCleaner cleaner, Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EscalationOutcome translate(Path source) {
        Path directory = source.toAbsolutePath().getParent();
        boolean usedOcr = false;
        int invocations = 0;

        Instant started = clock.instant();
        InvocationResult first = invoker.invoke(source, directory, false);
        invocations++;
        if (!first.succeeded()) {
            LOGGER.warn("First translation attempt failed ({}), retrying with OCR workaround", first.reason());
            cleaner.removeNewCsvFiles(directory, started);
            Instant retried = clock.instant();
            InvocationResult second = invoker.invoke(source, directory, true);
            invocations++;
            cleaner.removeNewCsvFiles(directory, retried);
            if (!second.succeeded()) {
                return EscalationOutcome.failure("pdf2zh_failed:" + second.reason(), true, invocations);
            }
            usedOcr = true;
        }

        Optional<Path> mono = invoker.locator().locate(source);
        if (mono.isPresent()) {
            return EscalationOutcome.success(mono.get(), usedOcr, invocations);
        }
        if (usedOcr) {
            return EscalationOutcome.failure("mono_pdf_not_found", true, invocations);
        }

        LOGGER.warn("No mono output found for {}, retrying with OCR workaround", source.getFileName());
        Instant third = clock.instant();
        InvocationResult last = invoker.invoke(source, directory, true);
        invocations++;
        cleaner.removeNewCsvFiles(directory, third);
        if (!last.succeeded()) {
            return EscalationOutcome.failure("mono_pdf_not_found_and_ocr_failed:" + last.reason(), true, invocations);
        }
        int total = invocations;
        return invoker.locator().locate(source)
                .map(path -> EscalationOutcome.success(path, true, total))
                .orElseGet(() -> EscalationOutcome.failure("mono_pdf_not_found_after_ocr", true, total));
    }
}
