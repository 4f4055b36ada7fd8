package ai.dualpdf.translator.cli;

import ai.dualpdf.translator.config.Config;
import ai.dualpdf.translator.config.ConfigLoader;
import ai.dualpdf.translator.config.LabelerConfig;
import ai.dualpdf.translator.config.SystemEnvironmentReader;
import ai.dualpdf.translator.exclusion.ChineseContentDetector;
import ai.dualpdf.translator.exclusion.ExclusionEvaluator;
import ai.dualpdf.translator.ledger.FailureLedger;
import ai.dualpdf.translator.ledger.FileFailureLedger;
import ai.dualpdf.translator.language.LanguageLabeler;
import ai.dualpdf.translator.language.LanguageLabelerFactory;
import ai.dualpdf.translator.language.PdfLanguageDetector;
import ai.dualpdf.translator.language.SideBySideDetector;
import ai.dualpdf.translator.logging.LoggingConfigurator;
import ai.dualpdf.translator.maintenance.CleanupReport;
import ai.dualpdf.translator.maintenance.OrphanMetadataBackfill;
import ai.dualpdf.translator.maintenance.OrphanReport;
import ai.dualpdf.translator.maintenance.PairMetadataBackfill;
import ai.dualpdf.translator.maintenance.PairReport;
import ai.dualpdf.translator.maintenance.SidecarCleaner;
import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.MetadataReadResult;
import ai.dualpdf.translator.pdf.MergeException;
import ai.dualpdf.translator.pdf.MergeResult;
import ai.dualpdf.translator.pdf.PageMergeEngine;
import ai.dualpdf.translator.pdf.PdfBoxPageCounter;
import ai.dualpdf.translator.pipeline.BatchOrchestrator;
import ai.dualpdf.translator.pipeline.DocumentScanner;
import ai.dualpdf.translator.pipeline.OutcomeLog;
import ai.dualpdf.translator.pipeline.RunSummary;
import ai.dualpdf.translator.translate.ProcessRunner;
import ai.dualpdf.translator.translate.SystemProcessRunner;
import ai.dualpdf.translator.translate.ToolArtifactCleaner;
import ai.dualpdf.translator.translate.TranslationEscalation;
import ai.dualpdf.translator.translate.TranslationException;
import ai.dualpdf.translator.translate.TranslationInvoker;
import ai.dualpdf.translator.translate.TranslatorSettings;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the mode-specific services.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final ProcessRunner processRunner;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SystemProcessRunner(), Clock.systemDefaultZone());
    }

    CliApplication(ConfigLoader configLoader, ProcessRunner processRunner, Clock clock) {
        this.configLoader = configLoader;
        this.processRunner = processRunner;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println("Configuration error: " + ex.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode (dryRun={})", config.mode(), config.dryRun());

        try {
            return switch (config.mode()) {
                case TRANSLATE -> translate(config);
                case CLEANUP -> cleanup(config);
                case BACKFILL -> backfill(config);
                case ORPHANS -> orphans(config);
                case MERGE -> merge(config);
                case SPLIT -> split(config);
            };
        } catch (TranslationException | MergeException | IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("{}", ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int translate(Config config) throws IOException {
        AtomicFileTransaction transaction = new AtomicFileTransaction();
        MetadataManager metadataManager = new MetadataManager();
        PdfBoxPageCounter pageCounter = new PdfBoxPageCounter();
        FailureLedger ledger = new FileFailureLedger(config.failureLedger());
        OutcomeLog outcomeLog = new OutcomeLog(config.outcomeLog(), clock);
        ToolArtifactCleaner cleaner = new ToolArtifactCleaner(Set.of(outcomeLog.file()));

        Optional<TranslationEscalation> escalation = Optional.empty();
        if (!config.dryRun()) {
            TranslatorSettings settings = config.translatorConfig().toSettings(config.secrets());
            if (!Files.isRegularFile(settings.executable())) {
                throw new TranslationException("Translator executable not found: " + settings.executable());
            }
            TranslationInvoker invoker = new TranslationInvoker(settings, processRunner, clock);
            escalation = Optional.of(new TranslationEscalation(invoker, cleaner, clock));
        }

        ExclusionEvaluator evaluator = ExclusionEvaluator.standard(config.exclusionSettings(), ledger, metadataManager,
                createDetector(config));
        BatchOrchestrator orchestrator = new BatchOrchestrator(new DocumentScanner(), evaluator, escalation, ledger,
                pageCounter, new PageMergeEngine(), new DocumentStamper(metadataManager, transaction), transaction,
                cleaner, outcomeLog, clock);
        RunSummary summary = orchestrator.run(config);
        LOGGER.info("{}", summary);
        return EXIT_OK;
    }

    private ChineseContentDetector createDetector(Config config) {
        if (!config.skipRules().chineseContent()) {
            return null;
        }
        LabelerConfig labelerConfig = config.labelerConfig();
        LanguageLabeler labeler = LanguageLabelerFactory.create(labelerConfig.transport(),
                labelerConfig.toSettings(config.secrets()));
        LOGGER.info("Chinese content detection enabled with model '{}'", labelerConfig.model());
        return new PdfLanguageDetector(labeler, labelerConfig.pagesToSample(), labelerConfig.dpi(),
                PdfLanguageDetector.DEFAULT_SEED);
    }

    private int cleanup(Config config) {
        CleanupReport report = new SidecarCleaner().clean(config.pdfRoot().orElseThrow());
        return report.failures() == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int backfill(Config config) {
        AtomicFileTransaction transaction = new AtomicFileTransaction();
        PairMetadataBackfill backfill = new PairMetadataBackfill(new DocumentScanner(),
                new DocumentStamper(new MetadataManager(), transaction), transaction, clock,
                config.translatorConfig().recordedModel());
        PairReport report = backfill.run(config.pdfRoot().orElseThrow(), config.dryRun());
        return report.failed() == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int orphans(Config config) {
        LabelerConfig labelerConfig = config.labelerConfig();
        LanguageLabeler labeler = LanguageLabelerFactory.create(labelerConfig.transport(),
                labelerConfig.toSettings(config.secrets()));
        SideBySideDetector detector = new SideBySideDetector(labeler, labelerConfig.pagesToSample(),
                labelerConfig.dpi(), PdfLanguageDetector.DEFAULT_SEED);
        MetadataManager metadataManager = new MetadataManager();
        OrphanMetadataBackfill backfill = new OrphanMetadataBackfill(new DocumentScanner(), metadataManager,
                new DocumentStamper(metadataManager, new AtomicFileTransaction()), detector, clock,
                config.translatorConfig().recordedModel(), config.exclusionSettings().keywords());
        OrphanReport report = backfill.run(config.pdfRoot().orElseThrow(), config.dryRun());
        return report.failed() == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private int merge(Config config) throws IOException {
        Config.PdfOperands operands = config.operands();
        double gap = operands.gap().orElse(config.gap());
        MergeResult result = new PageMergeEngine().merge(operands.left().orElseThrow(), operands.right().orElseThrow(),
                gap, operands.output().orElseThrow());
        LOGGER.info("Merged {} page(s) into {}", result.pages(), result.output());
        return EXIT_OK;
    }

    private int split(Config config) throws IOException {
        Config.PdfOperands operands = config.operands();
        Path input = operands.input().orElseThrow();
        double gap;
        if (operands.gap().isPresent()) {
            gap = operands.gap().get();
        } else {
            MetadataReadResult metadata = new MetadataManager().read(input);
            gap = metadata.gapPt().orElse(0.0);
            LOGGER.info("Using gap {} pt ({})", gap, metadata.gapPt().isPresent() ? "from metadata" : "default");
        }
        MergeResult result = new PageMergeEngine().split(input, gap, operands.output().orElseThrow());
        LOGGER.info("Split {} page(s) into {}", result.pages(), result.output());
        return EXIT_OK;
    }
}
