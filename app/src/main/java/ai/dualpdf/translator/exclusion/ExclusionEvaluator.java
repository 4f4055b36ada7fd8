package ai.dualpdf.translator.exclusion;

import ai.dualpdf.translator.exclusion.ExclusionSettings.OptionalRule;
import ai.dualpdf.translator.language.LanguageVerdict;
import ai.dualpdf.translator.ledger.FailureLedger;
import ai.dualpdf.translator.metadata.MetadataManager;
import ai.dualpdf.translator.metadata.MetadataReadResult;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered chain of exclusion rules; the first rule that matches decides. A rule whose check throws is
 * treated as not matching, so an unreachable service or unreadable attachment never blocks a document.
 */
public class ExclusionEvaluator {

    public static final String TOO_MANY_FAILURES = "too_many_failures";
    public static final String IS_BACKUP_ORIGINAL = "is_backup_original";
    public static final String IS_GENERATED_OUTPUT = "is_generated_output";
    public static final String ALREADY_TRANSLATED = "already_translated_by_metadata";
    public static final String CONTAINS_KEYWORDS = "contains_exclusion_keywords";
    public static final String BACKUP_EXISTS = "backup_exists";
    public static final String FILENAME_CONTAINS_CHINESE = "filename_contains_chinese";
    public static final String BAD_NAME_PATTERN = "bad_name_pattern";
    public static final String PAGE_COUNT_FAILED = "page_count_failed";
    public static final String CHINESE_PDF = "chinese_pdf_vlm";

    private static final Logger LOGGER = LoggerFactory.getLogger(ExclusionEvaluator.class);

    private final List<ExclusionRule> rules;

    public ExclusionEvaluator(List<ExclusionRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Builds the standard chain in its fixed priority order.
     */
    public static ExclusionEvaluator standard(ExclusionSettings settings,
                                              FailureLedger ledger,
                                              MetadataManager metadataManager,
                                              ChineseContentDetector detector) {
        List<ExclusionRule> rules = new ArrayList<>();
        rules.add(ExclusionRule.when(TOO_MANY_FAILURES, candidate -> ledger.isExhausted(candidate.path())));
        rules.add(ExclusionRule.when(IS_BACKUP_ORIGINAL, candidate -> SidecarPaths.isBackup(candidate.path())));
        rules.add(ExclusionRule.when(IS_GENERATED_OUTPUT, candidate -> {
            String lower = candidate.name().toLowerCase(Locale.ROOT);
            return lower.endsWith(".mono.pdf") || lower.endsWith(".dual.pdf");
        }));
        if (settings.isEnabled(OptionalRule.TRANSLATED_METADATA)) {
            rules.add(new ExclusionRule(ALREADY_TRANSLATED, candidate -> {
                MetadataReadResult result = metadataManager.read(candidate.path());
                return result.isTranslated() ? Optional.of("already_translated") : Optional.empty();
            }));
        }
        if (settings.isEnabled(OptionalRule.KEYWORDS)) {
            rules.add(ExclusionRule.when(CONTAINS_KEYWORDS, candidate -> {
                String lower = candidate.name().toLowerCase(Locale.ROOT);
                return settings.keywords().stream().anyMatch(lower::contains);
            }));
        }
        rules.add(ExclusionRule.when(BACKUP_EXISTS,
                candidate -> Files.exists(SidecarPaths.backupFor(candidate.path()))));
        if (settings.isEnabled(OptionalRule.CHINESE_FILENAME)) {
            rules.add(ExclusionRule.when(FILENAME_CONTAINS_CHINESE,
                    candidate -> DocumentNameValidator.containsCjk(candidate.name())));
        }
        if (settings.isEnabled(OptionalRule.NAME_PATTERN)) {
            rules.add(ExclusionRule.when(BAD_NAME_PATTERN,
                    candidate -> !DocumentNameValidator.isNormalizedName(candidate.stem())));
        }
        rules.add(ExclusionRule.when(PAGE_COUNT_FAILED, candidate -> candidate.pageCount().isEmpty()));
        if (settings.isEnabled(OptionalRule.MAX_PAGES)) {
            rules.add(ExclusionRule.when("pages_gt_" + settings.maxPages(), candidate -> {
                OptionalInt pages = candidate.pageCount();
                return pages.isPresent() && pages.getAsInt() > settings.maxPages();
            }));
        }
        if (settings.isEnabled(OptionalRule.MAX_SIZE)) {
            rules.add(ExclusionRule.when("size_gt_" + settings.maxSizeBytes(),
                    candidate -> candidate.sizeBytes() >= settings.maxSizeBytes()));
        }
        if (settings.isEnabled(OptionalRule.CHINESE_CONTENT) && detector != null) {
            rules.add(new ExclusionRule(CHINESE_PDF, candidate -> {
                LanguageVerdict verdict = detector.judge(candidate.path());
                return verdict.chinese() ? Optional.of(verdict.describe()) : Optional.empty();
            }));
        }
        return new ExclusionEvaluator(rules);
    }

    public SkipDecision evaluate(DocumentCandidate candidate) {
        for (ExclusionRule rule : rules) {
            Optional<String> match;
            try {
                match = rule.check().test(candidate);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while evaluating {} for {}", rule.tag(), candidate.name());
                continue;
            } catch (Exception ex) {
                LOGGER.warn("Rule {} failed for {}, not excluding: {}", rule.tag(), candidate.name(), ex.getMessage());
                LOGGER.debug("Rule failure detail", ex);
                continue;
            }
            if (match.isPresent()) {
                return SkipDecision.exclude(rule.tag(), match.get());
            }
        }
        return SkipDecision.proceed();
    }

    public List<String> ruleTags() {
        return rules.stream().map(ExclusionRule::tag).toList();
    }
}
