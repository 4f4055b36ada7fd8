package ai.dualpdf.translator.translate;

import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external translator once for a document, trying each watermark spelling until one exits cleanly.
 * Documents whose names are not plain printable ASCII are translated through an ASCII-named copy.
 */
public class TranslationInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationInvoker.class);

    private final TranslatorSettings settings;
    private final TranslatorCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;
    private final MonoOutputLocator locator;
    private final Clock clock;

    public TranslationInvoker(TranslatorSettings settings, ProcessRunner processRunner, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.commandBuilder = new TranslatorCommandBuilder(settings);
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
        this.locator = new MonoOutputLocator(settings.langOut());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MonoOutputLocator locator() {
        return locator;
    }

    public InvocationResult invoke(Path input, Path outputDir, boolean ocr) {
        Path toProcess = input;
        Path temporaryInput = null;
        if (!isPrintableAscii(input.getFileName().toString())) {
            temporaryInput = outputDir.resolve(SidecarPaths.TEMP_INPUT_PREFIX + clock.millis() + ".pdf");
            try {
                Files.copy(input, temporaryInput, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (IOException ex) {
                LOGGER.warn("Could not copy {} to an ASCII name: {}", input.getFileName(), ex.getMessage());
                deleteQuietly(temporaryInput);
                return InvocationResult.failed(FailureKind.TEMP_FILE_IO, "temp_copy_failed: " + ex.getMessage(), 0);
            }
            toProcess = temporaryInput;
        }

        try {
            InvocationResult result = runVariants(toProcess, outputDir, ocr);
            if (temporaryInput == null || !result.succeeded()) {
                return result;
            }
            return adoptTemporaryOutput(input, temporaryInput, outputDir, result.processRuns());
        } finally {
            if (temporaryInput != null) {
                deleteQuietly(temporaryInput);
            }
        }
    }

    private InvocationResult runVariants(Path input, Path outputDir, boolean ocr) {
        String lastReason = "";
        FailureKind lastKind = FailureKind.UNEXPECTED;
        int runs = 0;
        for (List<String> command : commandBuilder.variants(input, outputDir, ocr)) {
            runs++;
            LOGGER.debug("Running {}", TranslatorCommandBuilder.redact(command));
            ProcessResult result;
            try {
                result = processRunner.run(command, outputDir, settings.timeout());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return InvocationResult.failed(FailureKind.UNEXPECTED, "interrupted", runs);
            } catch (IOException | RuntimeException ex) {
                lastReason = "exception: " + ex.getMessage();
                lastKind = FailureKind.UNEXPECTED;
                LOGGER.debug("Translator variant failed", ex);
                continue;
            }
            switch (result.status()) {
                case TIMED_OUT:
                    return InvocationResult.failed(FailureKind.TIMEOUT, "timeout", runs);
                case NOT_STARTED:
                    LOGGER.error("Translator could not be started: {}", result.detail());
                    return InvocationResult.failed(FailureKind.EXECUTABLE_NOT_FOUND, "executable_not_found", runs);
                default:
                    break;
            }
            if (result.succeeded()) {
                return InvocationResult.ok(runs);
            }
            lastReason = "exit=" + result.exitCode();
            lastKind = FailureKind.EXIT_CODE;
        }
        return InvocationResult.failed(lastKind, lastReason, runs);
    }

    private InvocationResult adoptTemporaryOutput(Path original, Path temporaryInput, Path outputDir, int runs) {
        Optional<Path> produced = MonoOutputLocator.newestMatching(outputDir, SidecarPaths.stem(temporaryInput));
        if (produced.isEmpty()) {
            return InvocationResult.failed(FailureKind.OUTPUT_NOT_FOUND, "temp_output_not_found", runs);
        }
        Path target = outputDir.resolve(locator.expectedPath(original).getFileName().toString());
        try {
            Files.move(produced.get(), target, StandardCopyOption.REPLACE_EXISTING);
            return InvocationResult.ok(runs);
        } catch (IOException ex) {
            return InvocationResult.failed(FailureKind.TEMP_FILE_IO, "temp_rename_failed: " + ex.getMessage(), runs);
        }
    }

    static boolean isPrintableAscii(String name) {
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (ch < 0x20 || ch > 0x7e) {
                return false;
            }
        }
        return true;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove temporary input {}: {}", path.getFileName(), ex.getMessage());
        }
    }
}
