package ai.dualpdf.translator.cli;

import ai.dualpdf.translator.config.LogFormat;
import ai.dualpdf.translator.config.Mode;
import ai.dualpdf.translator.translate.TranslationServiceKind;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "dual-pdf-translator", mixinStandardHelpOptions = true,
        description = "Batch-translates PDFs and merges each translation beside its original page")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class,
            description = "Execution mode: translate, cleanup, backfill, orphans, merge or split")
    private Mode mode;

    @CommandLine.Option(names = "--config", description = "JSON configuration file", paramLabel = "FILE")
    private Path configFile;

    @CommandLine.Option(names = "--pdf-root", description = "Directory scanned for PDFs", paramLabel = "DIR")
    private Path pdfRoot;

    @CommandLine.Option(names = "--pdf2zh-exe", description = "Path to the external translator executable", paramLabel = "EXE")
    private Path translatorExecutable;

    @CommandLine.Option(names = "--log-dir", description = "Directory for the outcome log (defaults to the PDF root)", paramLabel = "DIR")
    private Path logDir;

    @CommandLine.Option(names = "--fail-log", description = "Failure ledger file (defaults to fail_log.txt beside the executable)", paramLabel = "FILE")
    private Path failureLedger;

    @CommandLine.Option(names = "--dry-run", description = "Evaluate exclusions and report without modifying files")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--lang-in", description = "Source language code", paramLabel = "LANG")
    private String langIn;

    @CommandLine.Option(names = "--lang-out", description = "Target language code", paramLabel = "LANG")
    private String langOut;

    @CommandLine.Option(names = "--service", converter = TranslationServiceConverter.class,
            description = "Translation service: siliconflow_free, siliconflow_pro or default")
    private TranslationServiceKind service;

    @CommandLine.Option(names = "--qps", description = "Request rate passed to the translator", paramLabel = "N")
    private Integer qps;

    @CommandLine.Option(names = "--gap", description = "Gap in points between original and translated page", paramLabel = "PT")
    private Double gap;

    @CommandLine.Option(names = "--max-pages", description = "Skip documents with more pages", paramLabel = "N")
    private Integer maxPages;

    @CommandLine.Option(names = "--max-time", description = "Translator timeout per invocation in seconds", paramLabel = "SECONDS")
    private Long maxTimeSeconds;

    @CommandLine.Option(names = "--limit", description = "Maximum number of documents to translate in this run", paramLabel = "COUNT")
    private Integer translationLimit;

    @CommandLine.Option(names = "--detect-chinese", negatable = true,
            description = "Skip documents whose pages a vision model labels as Chinese")
    private Boolean detectChinese;

    @CommandLine.Option(names = "--left", description = "merge mode: document kept on the left", paramLabel = "PDF")
    private Path left;

    @CommandLine.Option(names = "--right", description = "merge mode: document drawn on the right", paramLabel = "PDF")
    private Path right;

    @CommandLine.Option(names = "--input", description = "split mode: merged document", paramLabel = "PDF")
    private Path input;

    @CommandLine.Option(names = "--output", description = "merge/split mode: output file", paramLabel = "PDF")
    private Path output;

    public Mode mode() {
        return mode;
    }

    public Path configFile() {
        return configFile;
    }

    public Path pdfRoot() {
        return pdfRoot;
    }

    public Path translatorExecutable() {
        return translatorExecutable;
    }

    public Path logDir() {
        return logDir;
    }

    public Path failureLedger() {
        return failureLedger;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String langIn() {
        return langIn;
    }

    public String langOut() {
        return langOut;
    }

    public TranslationServiceKind service() {
        return service;
    }

    public Integer qps() {
        return qps;
    }

    public Double gap() {
        return gap;
    }

    public Integer maxPages() {
        return maxPages;
    }

    public Long maxTimeSeconds() {
        return maxTimeSeconds;
    }

    public Integer translationLimit() {
        return translationLimit;
    }

    public Boolean detectChinese() {
        return detectChinese;
    }

    public Path left() {
        return left;
    }

    public Path right() {
        return right;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }
}
