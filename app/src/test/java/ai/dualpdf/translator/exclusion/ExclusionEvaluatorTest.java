package ai.dualpdf.translator.exclusion;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dualpdf.translator.exclusion.ExclusionSettings.OptionalRule;
import ai.dualpdf.translator.language.LanguageVerdict;
import ai.dualpdf.translator.ledger.FileFailureLedger;
import ai.dualpdf.translator.ledger.InMemoryFailureLedger;
import ai.dualpdf.translator.metadata.DocumentStamper;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.TranslationMetadata;
import ai.dualpdf.translator.pdf.PageCounter;
import ai.dualpdf.translator.pdf.PdfBoxPageCounter;
import ai.dualpdf.translator.pdf.PdfFixtures;
import ai.dualpdf.translator.writer.AtomicFileTransaction;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExclusionEvaluatorTest {

    private static final Set<OptionalRule> DEFAULT_RULES = EnumSet.of(OptionalRule.TRANSLATED_METADATA,
            OptionalRule.KEYWORDS, OptionalRule.CHINESE_FILENAME, OptionalRule.NAME_PATTERN, OptionalRule.MAX_PAGES,
            OptionalRule.MAX_SIZE);

    @TempDir
    Path tempDir;

    private InMemoryFailureLedger ledger;
    private MetadataManager metadataManager;
    private PageCounter pageCounter;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryFailureLedger();
        metadataManager = new MetadataManager();
        pageCounter = new PdfBoxPageCounter();
    }

    @Test
    void wellFormedDocumentProceeds() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Deep Learning.pdf"), 2);

        SkipDecision decision = evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf));

        assertThat(decision.excluded()).isFalse();
    }

    @Test
    void ledgerRuleWinsOverEveryOtherRule() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("论文_original.pdf"), 1);
        for (int i = 0; i < 3; i++) {
            ledger.incrementAndPersist(pdf);
        }

        SkipDecision decision = evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf));

        assertThat(decision.describe()).isEqualTo(ExclusionEvaluator.TOO_MANY_FAILURES);
    }

    @Test
    void failuresPersistedByEarlierRunsExcludeOnNextRun() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Deep Learning.pdf"), 1);
        Path ledgerFile = tempDir.resolve("fail_log.txt");
        for (int run = 0; run < 3; run++) {
            new FileFailureLedger(ledgerFile).incrementAndPersist(pdf);
        }

        ExclusionEvaluator evaluator = ExclusionEvaluator.standard(
                new ExclusionSettings(DEFAULT_RULES, List.of("supplement"), 50, 50_000_000L),
                new FileFailureLedger(ledgerFile), metadataManager, null);
        SkipDecision decision = evaluator.evaluate(candidate(pdf));

        assertThat(decision.excluded()).isTrue();
        assertThat(decision.reason()).isEqualTo("too_many_failures");
    }

    @Test
    void backupsAndGeneratedOutputsAreExcluded() throws Exception {
        Path backup = PdfFixtures.create(tempDir.resolve("Smith-2020-Title_original.pdf"), 1);
        Path mono = PdfFixtures.create(tempDir.resolve("Smith-2020-Title.no_watermark.zh.mono.pdf"), 1);
        Path dual = PdfFixtures.create(tempDir.resolve("Smith-2020-Title.DUAL.pdf"), 1);
        ExclusionEvaluator evaluator = evaluator(DEFAULT_RULES, null);

        assertThat(evaluator.evaluate(candidate(backup)).reason()).isEqualTo(ExclusionEvaluator.IS_BACKUP_ORIGINAL);
        assertThat(evaluator.evaluate(candidate(mono)).reason()).isEqualTo(ExclusionEvaluator.IS_GENERATED_OUTPUT);
        assertThat(evaluator.evaluate(candidate(dual)).reason()).isEqualTo(ExclusionEvaluator.IS_GENERATED_OUTPUT);
    }

    @Test
    void translatedMetadataExcludesWithDetail() throws Exception {
        Path source = PdfFixtures.create(tempDir.resolve("source.pdf"), 1);
        Path pdf = tempDir.resolve("Smith-2020-Title.pdf");
        new DocumentStamper(metadataManager, new AtomicFileTransaction()).stampInto(source, pdf,
                TranslationMetadata.translated(Instant.parse("2024-01-01T00:00:00Z"), Optional.empty(),
                        List.of(PdfFixtures.A4), 0.0, List.of()), Optional.empty());

        SkipDecision decision = evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf));

        assertThat(decision.describe()).isEqualTo("already_translated_by_metadata:already_translated");
    }

    @Test
    void metadataRuleCanBeDisabled() throws Exception {
        Path source = PdfFixtures.create(tempDir.resolve("source.pdf"), 1);
        Path pdf = tempDir.resolve("Smith-2020-Title.pdf");
        new DocumentStamper(metadataManager, new AtomicFileTransaction()).stampInto(source, pdf,
                TranslationMetadata.translated(Instant.EPOCH, Optional.empty(), List.of(), 0.0, List.of()),
                Optional.empty());
        Set<OptionalRule> rules = EnumSet.copyOf(DEFAULT_RULES);
        rules.remove(OptionalRule.TRANSLATED_METADATA);

        assertThat(evaluator(rules, null).evaluate(candidate(pdf)).excluded()).isFalse();
    }

    @Test
    void keywordMatchIsCaseInsensitive() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Supplementary Material.pdf"), 1);
        ExclusionEvaluator evaluator = ExclusionEvaluator.standard(
                new ExclusionSettings(DEFAULT_RULES, List.of("SUPPLEMENTARY"), 50, 50_000_000L),
                ledger, metadataManager, null);

        assertThat(evaluator.evaluate(candidate(pdf)).reason()).isEqualTo(ExclusionEvaluator.CONTAINS_KEYWORDS);
    }

    @Test
    void existingBackupMeansAlreadyProcessed() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Title.pdf"), 1);
        Files.copy(pdf, tempDir.resolve("Smith-2020-Title_original.pdf"));

        assertThat(evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf)).reason())
                .isEqualTo(ExclusionEvaluator.BACKUP_EXISTS);
    }

    @Test
    void chineseFileNameIsCheckedBeforeNamePattern() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("史密斯-2023-标题.pdf"), 1);

        assertThat(evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf)).reason())
                .isEqualTo(ExclusionEvaluator.FILENAME_CONTAINS_CHINESE);
    }

    @Test
    void nonConformingNameIsExcluded() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("download (3).pdf"), 1);

        assertThat(evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf)).reason())
                .isEqualTo(ExclusionEvaluator.BAD_NAME_PATTERN);
    }

    @Test
    void unreadablePageCountIsExcluded() throws Exception {
        Path pdf = Files.writeString(tempDir.resolve("Smith-2020-Broken.pdf"), "not a pdf");

        SkipDecision decision = evaluator(DEFAULT_RULES, null).evaluate(candidate(pdf));

        assertThat(decision.reason()).isEqualTo(ExclusionEvaluator.PAGE_COUNT_FAILED);
    }

    @Test
    void pageAndSizeLimitsUseConfiguredThresholds() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Long.pdf"), 4);
        ExclusionEvaluator byPages = ExclusionEvaluator.standard(
                new ExclusionSettings(DEFAULT_RULES, List.of(), 3, 50_000_000L), ledger, metadataManager, null);
        ExclusionEvaluator bySize = ExclusionEvaluator.standard(
                new ExclusionSettings(DEFAULT_RULES, List.of(), 50, 10L), ledger, metadataManager, null);

        assertThat(byPages.evaluate(candidate(pdf)).reason()).isEqualTo("pages_gt_3");
        assertThat(bySize.evaluate(candidate(pdf)).reason()).isEqualTo("size_gt_10");
    }

    @Test
    void chineseContentVerdictIsRecorded() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Title.pdf"), 5);
        Set<OptionalRule> rules = EnumSet.copyOf(DEFAULT_RULES);
        rules.add(OptionalRule.CHINESE_CONTENT);

        SkipDecision decision = evaluator(rules, path -> new LanguageVerdict(3, 2, 5)).evaluate(candidate(pdf));

        assertThat(decision.describe()).isEqualTo("chinese_pdf_vlm:vlm_detected: zh=3, non_zh=2, total=5");
    }

    @Test
    void detectorFailureDoesNotExclude() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Title.pdf"), 5);
        Set<OptionalRule> rules = EnumSet.copyOf(DEFAULT_RULES);
        rules.add(OptionalRule.CHINESE_CONTENT);

        SkipDecision decision = evaluator(rules, path -> {
            throw new IOException("labeler offline");
        }).evaluate(candidate(pdf));

        assertThat(decision.excluded()).isFalse();
    }

    @Test
    void detectorIsNotConsultedWhenEarlierRuleMatches() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("notes.pdf"), 1);
        Set<OptionalRule> rules = EnumSet.copyOf(DEFAULT_RULES);
        rules.add(OptionalRule.CHINESE_CONTENT);
        AtomicInteger calls = new AtomicInteger();

        SkipDecision decision = evaluator(rules, path -> {
            calls.incrementAndGet();
            return new LanguageVerdict(0, 1, 1);
        }).evaluate(candidate(pdf));

        assertThat(decision.reason()).isEqualTo(ExclusionEvaluator.BAD_NAME_PATTERN);
        assertThat(calls).hasValue(0);
    }

    @Test
    void pageCountIsReadLazily() throws Exception {
        Path pdf = PdfFixtures.create(tempDir.resolve("Smith-2020-Title_original.pdf"), 1);
        AtomicInteger reads = new AtomicInteger();
        DocumentCandidate candidate = DocumentCandidate.of(pdf, path -> {
            reads.incrementAndGet();
            return OptionalInt.of(1);
        });

        evaluator(DEFAULT_RULES, null).evaluate(candidate);

        assertThat(reads).hasValue(0);
        assertThat(candidate.knownPageCount()).isEmpty();
    }

    @Test
    void ruleOrderIsFixed() {
        Set<OptionalRule> rules = EnumSet.allOf(OptionalRule.class);

        assertThat(evaluator(rules, path -> new LanguageVerdict(0, 0, 0)).ruleTags()).containsExactly(
                ExclusionEvaluator.TOO_MANY_FAILURES,
                ExclusionEvaluator.IS_BACKUP_ORIGINAL,
                ExclusionEvaluator.IS_GENERATED_OUTPUT,
                ExclusionEvaluator.ALREADY_TRANSLATED,
                ExclusionEvaluator.CONTAINS_KEYWORDS,
                ExclusionEvaluator.BACKUP_EXISTS,
                ExclusionEvaluator.FILENAME_CONTAINS_CHINESE,
                ExclusionEvaluator.BAD_NAME_PATTERN,
                ExclusionEvaluator.PAGE_COUNT_FAILED,
                "pages_gt_50",
                "size_gt_50000000",
                ExclusionEvaluator.CHINESE_PDF);
    }

    private ExclusionEvaluator evaluator(Set<OptionalRule> rules, ChineseContentDetector detector) {
        return ExclusionEvaluator.standard(new ExclusionSettings(rules, List.of("supplement"), 50, 50_000_000L),
                ledger, metadataManager, detector);
    }

    private DocumentCandidate candidate(Path pdf) {
        return DocumentCandidate.of(pdf, pageCounter);
    }
}
