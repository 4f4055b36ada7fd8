package ai.dualpdf.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TranslatorCommandBuilderTest {

    private static final Path EXE = Path.of("/opt/pdf2zh/pdf2zh.exe");

    @Test
    void buildsMonoOnlyCommandForFreeService() {
        TranslatorCommandBuilder builder = new TranslatorCommandBuilder(settings(TranslationServiceKind.SILICONFLOW_FREE,
                "", Optional.empty()));

        List<String> command = builder.build(Path.of("/docs/a.pdf"), Path.of("/docs"), "NoWaterMark", false);

        assertThat(command).containsExactly(EXE.toString(), "--no-dual", "--lang-in", "en", "--lang-out", "zh",
                "--watermark-output-mode", "NoWaterMark", "--qps", "10", "--no-auto-extract-glossary",
                "--output", "/docs", "/docs/a.pdf", "--siliconflowfree");
    }

    @Test
    void addsOcrFlagAndProServiceOptions() {
        TranslatorCommandBuilder builder = new TranslatorCommandBuilder(settings(TranslationServiceKind.SILICONFLOW_PRO,
                "Qwen/Qwen2.5-72B-Instruct", Optional.of("sk-secret")));

        List<String> command = builder.build(Path.of("/docs/a.pdf"), Path.of("/docs"), "no_watermark", true);

        assertThat(command).contains("--ocr-workaround", "--siliconflow", "--siliconflow-model",
                "Qwen/Qwen2.5-72B-Instruct", "--siliconflow-api-key", "sk-secret");
        assertThat(TranslatorCommandBuilder.redact(command)).doesNotContain("sk-secret").contains("****");
    }

    @Test
    void defaultServiceAddsNoServiceFlags() {
        TranslatorCommandBuilder builder = new TranslatorCommandBuilder(settings(TranslationServiceKind.DEFAULT,
                "", Optional.empty()));

        List<String> command = builder.build(Path.of("a.pdf"), Path.of("."), "NoWaterMark", false);

        assertThat(command).last().isEqualTo("a.pdf");
    }

    @Test
    void variantsFollowWatermarkOrder() {
        TranslatorCommandBuilder builder = new TranslatorCommandBuilder(settings(TranslationServiceKind.DEFAULT,
                "", Optional.empty()));

        List<List<String>> variants = builder.variants(Path.of("a.pdf"), Path.of("."), false);

        assertThat(variants).hasSize(2);
        assertThat(variants.get(0)).contains("NoWaterMark");
        assertThat(variants.get(1)).contains("no_watermark");
    }

    @Test
    void proServiceRequiresModel() {
        assertThatThrownBy(() -> settings(TranslationServiceKind.SILICONFLOW_PRO, " ", Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recordedModelDependsOnService() {
        assertThat(settings(TranslationServiceKind.SILICONFLOW_FREE, "ignored", Optional.empty()).effectiveModel())
                .contains("Qwen/Qwen2.5-7B-Instruct");
        assertThat(settings(TranslationServiceKind.SILICONFLOW_PRO, "m", Optional.empty()).effectiveModel())
                .contains("m");
        assertThat(settings(TranslationServiceKind.DEFAULT, "m", Optional.empty()).effectiveModel()).isEmpty();
    }

    private static TranslatorSettings settings(TranslationServiceKind service, String model, Optional<String> key) {
        return new TranslatorSettings(EXE, "en", "zh", service, model, key, Optional.empty(), 10,
                Duration.ofMinutes(30));
    }
}
