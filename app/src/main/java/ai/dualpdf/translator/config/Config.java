package ai.dualpdf.translator.config;

import ai.dualpdf.translator.exclusion.ExclusionSettings;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments, environment values and
 * the optional configuration file.
 */
public record Config(
        Mode mode,
        Optional<Path> pdfRoot,
        Path logDir,
        Path failureLedger,
        boolean dryRun,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        LabelerConfig labelerConfig,
        SkipRules skipRules,
        List<String> skipKeywords,
        long maxSizeBytes,
        int maxPages,
        double gap,
        boolean deleteMonoPdf,
        boolean deleteAllExceptFinal,
        boolean suppressSkippedOutput,
        int maxFilesPerRun,
        PdfOperands operands,
        Secrets secrets
) {

    public static final String OUTCOME_LOG_NAME = "batch_translate_log.csv";

    /**
     * Explicit files for the standalone merge and split modes.
     */
    public record PdfOperands(Optional<Path> left, Optional<Path> right, Optional<Path> input,
                              Optional<Path> output, Optional<Double> gap) {

        public PdfOperands {
            left = left == null ? Optional.empty() : left;
            right = right == null ? Optional.empty() : right;
            input = input == null ? Optional.empty() : input;
            output = output == null ? Optional.empty() : output;
            gap = gap == null ? Optional.empty() : gap;
        }

        public static PdfOperands none() {
            return new PdfOperands(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
                    Optional.empty());
        }
    }

    public Config {
        Objects.requireNonNull(mode, "mode");
        pdfRoot = pdfRoot == null ? Optional.empty() : pdfRoot;
        Objects.requireNonNull(logDir, "logDir");
        Objects.requireNonNull(failureLedger, "failureLedger");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        Objects.requireNonNull(labelerConfig, "labelerConfig");
        Objects.requireNonNull(skipRules, "skipRules");
        skipKeywords = skipKeywords == null ? List.of() : List.copyOf(skipKeywords);
        operands = operands == null ? PdfOperands.none() : operands;
        secrets = secrets == null ? Secrets.none() : secrets;
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive");
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive");
        }
        if (gap < 0 || Double.isNaN(gap)) {
            throw new IllegalArgumentException("gap must be zero or greater");
        }
        if (maxFilesPerRun < 0) {
            throw new IllegalArgumentException("maxFilesPerRun must be greater than or equal to zero");
        }
        if (mode.scansRoot() && pdfRoot.isEmpty()) {
            throw new IllegalArgumentException("PDF root directory must be provided for " + mode.name().toLowerCase(Locale.ROOT) + " mode");
        }
        if (mode == Mode.TRANSLATE && !dryRun && translatorConfig.executable().isEmpty()) {
            throw new IllegalArgumentException("Translator executable must be provided unless running in dry-run mode");
        }
        if (mode == Mode.MERGE && (operands.left().isEmpty() || operands.right().isEmpty() || operands.output().isEmpty())) {
            throw new IllegalArgumentException("merge mode requires --left, --right and --output");
        }
        if (mode == Mode.SPLIT && (operands.input().isEmpty() || operands.output().isEmpty())) {
            throw new IllegalArgumentException("split mode requires --input and --output");
        }
    }

    public Path outcomeLog() {
        return logDir.resolve(OUTCOME_LOG_NAME);
    }

    public ExclusionSettings exclusionSettings() {
        return new ExclusionSettings(skipRules.enabledRules(), skipKeywords, maxPages, maxSizeBytes);
    }

    public boolean deletesMono() {
        return deleteMonoPdf || deleteAllExceptFinal;
    }
}
