package ai.dualpdf.translator.maintenance;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dualpdf.translator.language.LanguageDetectionException;
import ai.dualpdf.translator.language.LanguageLabeler;
import ai.dualpdf.translator.language.SideBySideDetector;
import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.MetadataReadResult;
import ai.dualpdf.translator.metadata.TranslationMetadata;
import ai.dualpdf.translator.pdf.PageSize;
import ai.dualpdf.translator.pdf.PdfFixtures;
import ai.dualpdf.translator.pipeline.DocumentScanner;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrphanMetadataBackfillTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:30:00Z"), ZoneOffset.UTC);
    private static final PageSize SIDE_BY_SIDE = new PageSize(1190.0, 842.0);

    @TempDir
    Path root;

    private final MetadataManager metadataManager = new MetadataManager();
    private final DocumentStamper stamper = new DocumentStamper(metadataManager, new AtomicFileTransaction());

    @Test
    void sideBySideDocumentIsMarkedTranslated() throws Exception {
        Path document = PdfFixtures.create(root.resolve("Smith-2020-Deep Learning.pdf"), 2, SIDE_BY_SIDE);
        RecordingLabeler labeler = new RecordingLabeler("English", "中文");

        OrphanReport report = backfill(labeler).run(root, false);

        assertThat(report).isEqualTo(new OrphanReport(1, 1, 1, 0, 0));
        assertThat(labeler.calls).isEqualTo(4);
        MetadataReadResult result = metadataManager.read(document);
        assertThat(result.outcome()).isEqualTo(MetadataReadResult.Outcome.TRANSLATED);
        assertThat(result.gapPt()).hasValue(0.0);
    }

    @Test
    void singleLanguageDocumentIsMarkedUntranslated() throws Exception {
        Path document = PdfFixtures.create(root.resolve("Lee-2019-Graph Networks.pdf"), 2);

        OrphanReport report = backfill(new RecordingLabeler("English", "English")).run(root, false);

        assertThat(report.stamped()).isEqualTo(1);
        assertThat(metadataManager.read(document).outcome()).isEqualTo(MetadataReadResult.Outcome.UNTRANSLATED);
    }

    @Test
    void documentsWithMetadataOrPairsAreSkippedWithoutLabeling() throws Exception {
        Path marked = PdfFixtures.create(root.resolve("Kim-2018-Attention.pdf"), 1);
        stamper.stampInPlace(marked, TranslationMetadata.untranslated(CLOCK.instant()), Optional.empty());
        Path paired = PdfFixtures.create(root.resolve("Lee-2019-Graph.pdf"), 1);
        Path backup = PdfFixtures.create(root.resolve("Lee-2019-Graph_original.pdf"), 1);
        byte[] pairedBefore = Files.readAllBytes(paired);
        RecordingLabeler labeler = new RecordingLabeler("English", "中文");
        OrphanMetadataBackfill backfill = backfill(labeler);

        OrphanReport report = backfill.run(root, false);

        assertThat(report).isEqualTo(new OrphanReport(3, 0, 0, 3, 0));
        assertThat(labeler.calls).isZero();
        assertThat(backfill.skipReason(marked)).hasValue(OrphanMetadataBackfill.HAS_METADATA);
        assertThat(backfill.skipReason(paired)).hasValue(OrphanMetadataBackfill.HAS_ORIGINAL_PAIR);
        assertThat(backfill.skipReason(backup)).hasValue(OrphanMetadataBackfill.IS_BACKUP);
        assertThat(Files.readAllBytes(paired)).isEqualTo(pairedBefore);
    }

    @Test
    void namingRulesApplyBeforeLabeling() throws Exception {
        OrphanMetadataBackfill backfill = backfill(new RecordingLabeler("English", "中文"));

        assertThat(backfill.skipReason(PdfFixtures.create(root.resolve("史密斯-2023-标题.pdf"), 1)))
                .hasValue(OrphanMetadataBackfill.FILENAME_CONTAINS_CHINESE);
        assertThat(backfill.skipReason(PdfFixtures.create(root.resolve("notes.pdf"), 1)))
                .hasValue(OrphanMetadataBackfill.BAD_NAME_PATTERN);
        assertThat(backfill.skipReason(PdfFixtures.create(root.resolve("Smith-2020-Deep Learning.mono.pdf"), 1)))
                .hasValue(OrphanMetadataBackfill.IS_GENERATED);
        assertThat(backfill.skipReason(PdfFixtures.create(root.resolve("Smith-2020-Supplement Data.pdf"), 1)))
                .hasValue(OrphanMetadataBackfill.CONTAINS_KEYWORD + ": supplement");
        assertThat(backfill.skipReason(PdfFixtures.create(root.resolve("Smith-2020-Deep Learning.pdf"), 1)))
                .isEmpty();
    }

    @Test
    void dryRunNeitherLabelsNorWrites() throws Exception {
        Path document = PdfFixtures.create(root.resolve("Smith-2020-Deep Learning.pdf"), 2, SIDE_BY_SIDE);
        byte[] before = Files.readAllBytes(document);
        RecordingLabeler labeler = new RecordingLabeler("English", "中文");

        OrphanReport report = backfill(labeler).run(root, true);

        assertThat(report).isEqualTo(new OrphanReport(1, 1, 0, 0, 0));
        assertThat(labeler.calls).isZero();
        assertThat(Files.readAllBytes(document)).isEqualTo(before);
    }

    @Test
    void labelingFailureLeavesDocumentUnmarked() throws Exception {
        Path document = PdfFixtures.create(root.resolve("Smith-2020-Deep Learning.pdf"), 1);
        LanguageLabeler failing = base64 -> {
            throw new LanguageDetectionException("Labeling endpoint returned HTTP 500");
        };

        OrphanReport report = backfill(failing).run(root, false);

        assertThat(report.failed()).isEqualTo(1);
        assertThat(metadataManager.read(document).outcome()).isEqualTo(MetadataReadResult.Outcome.NO_METADATA_FOUND);
    }

    private OrphanMetadataBackfill backfill(LanguageLabeler labeler) {
        return new OrphanMetadataBackfill(new DocumentScanner(), metadataManager, stamper,
                new SideBySideDetector(labeler, 3, 24, 1L), CLOCK, Optional.of("Qwen/Qwen2.5-7B-Instruct"),
                List.of("supplement", "clean"));
    }

    private static final class RecordingLabeler implements LanguageLabeler {

        private final List<String> answers = new ArrayList<>();
        private int calls;

        RecordingLabeler(String leftAnswer, String rightAnswer) {
            answers.add(leftAnswer);
            answers.add(rightAnswer);
        }

        @Override
        public String label(String base64Jpeg) {
            return answers.get(calls++ % 2);
        }
    }
}
