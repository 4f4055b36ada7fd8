package ai.dualpdf.translator.translate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the argument vector of one translator invocation. Only the monolingual output is requested; merging
 * is done afterwards by this tool.
 */
public class TranslatorCommandBuilder {

    public static final List<String> WATERMARK_MODES = List.of("NoWaterMark", "no_watermark");

    static final String OCR_FLAG = "--ocr-workaround";
    private static final String API_KEY_FLAG = "--siliconflow-api-key";

    private final TranslatorSettings settings;

    public TranslatorCommandBuilder(TranslatorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<String> build(Path input, Path outputDir, String watermarkMode, boolean ocr) {
        List<String> command = new ArrayList<>();
        command.add(settings.executable().toString());
        command.add("--no-dual");
        command.add("--lang-in");
        command.add(settings.langIn());
        command.add("--lang-out");
        command.add(settings.langOut());
        command.add("--watermark-output-mode");
        command.add(watermarkMode);
        command.add("--qps");
        command.add(Integer.toString(settings.qps()));
        command.add("--no-auto-extract-glossary");
        command.add("--output");
        command.add(outputDir.toString());
        command.add(input.toString());
        if (ocr) {
            command.add(OCR_FLAG);
        }
        appendServiceFlags(command);
        return List.copyOf(command);
    }

    /**
     * One command per watermark spelling, in the order they should be tried.
     */
    public List<List<String>> variants(Path input, Path outputDir, boolean ocr) {
        List<List<String>> variants = new ArrayList<>();
        for (String mode : WATERMARK_MODES) {
            variants.add(build(input, outputDir, mode, ocr));
        }
        return List.copyOf(variants);
    }

    /**
     * Copy of {@code command} safe to log.
     */
    public static List<String> redact(List<String> command) {
        List<String> redacted = new ArrayList<>(command);
        for (int i = 0; i < redacted.size() - 1; i++) {
            if (API_KEY_FLAG.equals(redacted.get(i))) {
                redacted.set(i + 1, "****");
            }
        }
        return redacted;
    }

    private void appendServiceFlags(List<String> command) {
        switch (settings.service()) {
            case SILICONFLOW_FREE -> command.add("--siliconflowfree");
            case SILICONFLOW_PRO -> {
                command.add("--siliconflow");
                command.add("--siliconflow-model");
                command.add(settings.serviceModel());
                settings.serviceApiKey().ifPresent(key -> {
                    command.add(API_KEY_FLAG);
                    command.add(key);
                });
                settings.serviceBaseUrl().ifPresent(base -> {
                    command.add("--siliconflow-base");
                    command.add(base);
                });
            }
            case DEFAULT -> {
                // translator picks its own backend
            }
        }
    }
}
