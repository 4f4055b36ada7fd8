package ai.dualpdf.translator.config;

import ai.dualpdf.translator.cli.CliArguments;
import ai.dualpdf.translator.language.ImageDetail;
import ai.dualpdf.translator.language.LabelerTransport;
import ai.dualpdf.translator.translate.TranslationServiceKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance. Each option is taken from the CLI, then the environment, then the
 * configuration file, then a default.
 */
public class ConfigLoader {

    static final String ENV_CONFIG_FILE = "CONFIG_FILE";
    static final String ENV_MODE = "MODE";
    static final String ENV_PDF_ROOT = "PDF_ROOT";
    static final String ENV_PDF2ZH_EXE = "PDF2ZH_EXE";
    static final String ENV_LOG_DIR = "LOG_DIR";
    static final String ENV_FAIL_LOG = "FAIL_LOG";
    static final String ENV_DRY_RUN = "DRY_RUN";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LANG_IN = "LANG_IN";
    static final String ENV_LANG_OUT = "LANG_OUT";
    static final String ENV_TRANSLATION_SERVICE = "TRANSLATION_SERVICE";
    static final String ENV_SILICONFLOW_MODEL = "SILICONFLOW_MODEL";
    static final String ENV_SILICONFLOW_BASE = "SILICONFLOW_BASE";
    static final String ENV_SILICONFLOW_API_KEY = "SILICONFLOW_API_KEY";
    static final String ENV_VLM_API_KEY = "VLM_API_KEY";
    static final String ENV_VLM_MODEL = "VLM_MODEL";
    static final String ENV_VLM_BASE = "VLM_BASE";
    static final String ENV_VLM_TRANSPORT = "VLM_TRANSPORT";
    static final String ENV_QPS = "QPS_LIMIT";
    static final String ENV_GAP = "GAP";
    static final String ENV_MAX_PAGES = "MAX_PAGES";
    static final String ENV_MAX_SIZE_BYTES = "MAX_SIZE_BYTES";
    static final String ENV_MAX_TIME = "MAX_TIME";
    static final String ENV_MAX_FILES_PER_RUN = "MAX_FILES_PER_RUN";
    static final String ENV_SKIP_KEYWORDS = "SKIP_KEYWORDS";

    static final Path DEFAULT_CONFIG_FILE = Path.of("configs", "config.json");
    static final String LEDGER_FILE_NAME = "fail_log.txt";

    private static final String DEFAULT_LANG_IN = "en";
    private static final String DEFAULT_LANG_OUT = "zh-CN";
    private static final int DEFAULT_QPS = 20;
    private static final double DEFAULT_GAP = 0.0;
    private static final long DEFAULT_MAX_SIZE_BYTES = 104_857_600L;
    private static final int DEFAULT_MAX_PAGES = 500;
    private static final long DEFAULT_MAX_TIME_SECONDS = 7200L;
    private static final String DEFAULT_SILICONFLOW_MODEL = "Qwen/Qwen3-8B";
    private static final String DEFAULT_VLM_MODEL = "deepseek-ai/deepseek-vl2";
    private static final String DEFAULT_VLM_BASE = "https://api.siliconflow.cn/v1";
    private static final int DEFAULT_VLM_PAGES = 5;
    private static final int DEFAULT_VLM_DPI = 150;
    private static final long DEFAULT_VLM_TIMEOUT_SECONDS = 600L;
    private static final List<String> DEFAULT_SKIP_KEYWORDS =
            List.of("clear", "clean", "supplement", "pdf2zh-updated", "pdf2zh-merged");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        ConfigFile file = resolveConfigFile(arguments);

        Mode mode = arguments.mode() != null
                ? arguments.mode()
                : env(ENV_MODE).map(Mode::from).orElse(Mode.TRANSLATE);
        boolean dryRun = arguments.dryRun() || env(ENV_DRY_RUN).map(ConfigFile::parseBoolean).orElse(false);
        LogFormat logFormat = arguments.logFormat() != null
                ? arguments.logFormat()
                : env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT);

        Optional<Path> pdfRoot = path(arguments.pdfRoot(), ENV_PDF_ROOT, file, "pdf_root");
        Optional<Path> executable = path(arguments.translatorExecutable(), ENV_PDF2ZH_EXE, file, "pdf2zh_exe");
        Path logDir = path(arguments.logDir(), ENV_LOG_DIR, file, "log_dir")
                .or(() -> pdfRoot)
                .orElse(Path.of("."));
        Path ledger = path(arguments.failureLedger(), ENV_FAIL_LOG, file, "fail_log")
                .orElseGet(() -> defaultLedger(executable, logDir));

        TranslationServiceKind service = arguments.service() != null
                ? arguments.service()
                : text(null, ENV_TRANSLATION_SERVICE, file, "translation_service")
                .map(TranslationServiceKind::fromString)
                .orElse(TranslationServiceKind.SILICONFLOW_FREE);
        Duration maxTime = Duration.ofSeconds(positive("max_time",
                integer(arguments.maxTimeSeconds(), ENV_MAX_TIME, file, "max_time").orElse(DEFAULT_MAX_TIME_SECONDS)));
        TranslatorConfig translatorConfig = new TranslatorConfig(
                executable,
                text(arguments.langIn(), ENV_LANG_IN, file, "lang_in").orElse(DEFAULT_LANG_IN),
                text(arguments.langOut(), ENV_LANG_OUT, file, "lang_out").orElse(DEFAULT_LANG_OUT),
                service,
                text(null, ENV_SILICONFLOW_MODEL, file, "siliconflow_model").orElse(DEFAULT_SILICONFLOW_MODEL),
                text(null, ENV_SILICONFLOW_BASE, file, "siliconflow_base"),
                (int) positive("qps_limit", integer(toLong(arguments.qps()), ENV_QPS, file, "qps_limit").orElse((long) DEFAULT_QPS)),
                maxTime);

        LabelerConfig labelerConfig = new LabelerConfig(
                text(null, ENV_VLM_TRANSPORT, file, "vlm_transport").map(LabelerTransport::fromString).orElse(LabelerTransport.AUTO),
                text(null, ENV_VLM_MODEL, file, "vlm_model").orElse(DEFAULT_VLM_MODEL),
                text(null, ENV_VLM_BASE, file, "vlm_base").orElse(DEFAULT_VLM_BASE),
                (int) file.number("vlm_k_pages").orElse((long) DEFAULT_VLM_PAGES).longValue(),
                (int) file.number("vlm_dpi").orElse((long) DEFAULT_VLM_DPI).longValue(),
                file.string("vlm_detail").map(ImageDetail::fromString).orElse(ImageDetail.LOW),
                Duration.ofSeconds(file.number("vlm_per_page_timeout").orElse(DEFAULT_VLM_TIMEOUT_SECONDS)));

        SkipRules defaults = SkipRules.defaults();
        SkipRules skipRules = new SkipRules(
                file.bool("skip_translated_by_metadata").orElse(defaults.translatedByMetadata()),
                file.bool("skip_contains_skip_keywords").orElse(defaults.keywords()),
                file.bool("skip_filename_contains_chinese").orElse(defaults.filenameContainsChinese()),
                file.bool("skip_filename_format_check").orElse(defaults.filenameFormat()),
                file.bool("skip_max_pages").orElse(defaults.maxPages()),
                file.bool("skip_max_file_size").orElse(defaults.maxFileSize()),
                Optional.ofNullable(arguments.detectChinese())
                        .or(() -> file.bool("skip_chinese_pdf_vlm"))
                        .orElse(defaults.chineseContent()));

        List<String> skipKeywords = env(ENV_SKIP_KEYWORDS)
                .map(ConfigLoader::parseList)
                .or(() -> file.stringList("skip_keywords"))
                .orElse(DEFAULT_SKIP_KEYWORDS);

        long maxSizeBytes = integer(null, ENV_MAX_SIZE_BYTES, file, "max_size_bytes").orElse(DEFAULT_MAX_SIZE_BYTES);
        int maxPages = (int) integer(toLong(arguments.maxPages()), ENV_MAX_PAGES, file, "max_pages")
                .orElse((long) DEFAULT_MAX_PAGES).longValue();
        double gap = Optional.ofNullable(arguments.gap())
                .or(() -> env(ENV_GAP).map(raw -> parseDouble(ENV_GAP, raw)))
                .or(() -> file.decimal("gap"))
                .orElse(DEFAULT_GAP);

        int maxFilesPerRun = resolveMaxFilesPerRun(arguments);

        Secrets secrets = new Secrets(
                env(ENV_SILICONFLOW_API_KEY).or(() -> file.string("siliconflow_api_key")),
                env(ENV_VLM_API_KEY)
                        .or(() -> file.string("vlm_api_key"))
                        .or(() -> env(ENV_SILICONFLOW_API_KEY)));

        Config.PdfOperands operands = new Config.PdfOperands(
                Optional.ofNullable(arguments.left()),
                Optional.ofNullable(arguments.right()),
                Optional.ofNullable(arguments.input()),
                Optional.ofNullable(arguments.output()),
                Optional.ofNullable(arguments.gap()));

        return new Config(mode, pdfRoot, logDir, ledger, dryRun, logFormat, translatorConfig, labelerConfig,
                skipRules, skipKeywords, maxSizeBytes, maxPages, gap,
                file.bool("delete_mono_pdf").orElse(true),
                file.bool("delete_all_except_final").orElse(false),
                file.bool("suppress_skipped_output").orElse(true),
                maxFilesPerRun, operands, secrets);
    }

    private ConfigFile resolveConfigFile(CliArguments arguments) {
        if (arguments.configFile() != null) {
            return ConfigFile.load(arguments.configFile());
        }
        Optional<Path> fromEnv = env(ENV_CONFIG_FILE).map(Path::of);
        if (fromEnv.isPresent()) {
            return ConfigFile.load(fromEnv.get());
        }
        if (Files.isRegularFile(DEFAULT_CONFIG_FILE)) {
            return ConfigFile.load(DEFAULT_CONFIG_FILE);
        }
        return ConfigFile.empty();
    }

    private int resolveMaxFilesPerRun(CliArguments arguments) {
        Integer limit = arguments.translationLimit();
        if (limit != null) {
            if (limit < 0) {
                throw new IllegalArgumentException("--limit must be zero or greater");
            }
            return limit;
        }
        return env(ENV_MAX_FILES_PER_RUN)
                .map(raw -> parseNonNegativeInteger(ENV_MAX_FILES_PER_RUN, raw))
                .orElse(0);
    }

    private static Path defaultLedger(Optional<Path> executable, Path logDir) {
        return executable
                .map(Path::toAbsolutePath)
                .map(Path::getParent)
                .orElse(logDir)
                .resolve(LEDGER_FILE_NAME);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key).filter(ConfigLoader::isNotBlank).map(String::trim);
    }

    private Optional<String> text(String cliValue, String envKey, ConfigFile file, String fileKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.trim());
        }
        return env(envKey).or(() -> file.string(fileKey));
    }

    private Optional<Path> path(Path cliValue, String envKey, ConfigFile file, String fileKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return env(envKey).or(() -> file.string(fileKey)).map(Path::of);
    }

    private Optional<Long> integer(Long cliValue, String envKey, ConfigFile file, String fileKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return env(envKey).map(raw -> parseNonNegativeLong(envKey, raw)).or(() -> file.number(fileKey));
    }

    private static Long toLong(Integer value) {
        return value == null ? null : value.longValue();
    }

    private static long positive(String field, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    private static int parseNonNegativeInteger(String field, String raw) {
        long value = parseNonNegativeLong(field, raw);
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(field + " is too large");
        }
        return (int) value;
    }

    private static long parseNonNegativeLong(String field, String raw) {
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(field + " must be an integer", ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be zero or greater");
        }
        return value;
    }

    private static double parseDouble(String field, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(field + " must be a number", ex);
        }
    }
}
