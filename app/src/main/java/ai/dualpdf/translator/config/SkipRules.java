package ai.dualpdf.translator.config;

import ai.dualpdf.translator.exclusion.ExclusionSettings.OptionalRule;
import java.util.EnumSet;
import java.util.Set;

/**
 * Switches for the exclusion rules that may be turned off.
 */
public record SkipRules(boolean translatedByMetadata,
                        boolean keywords,
                        boolean filenameContainsChinese,
                        boolean filenameFormat,
                        boolean maxPages,
                        boolean maxFileSize,
                        boolean chineseContent) {

    public static SkipRules defaults() {
        return new SkipRules(true, true, true, true, true, true, false);
    }

    public Set<OptionalRule> enabledRules() {
        Set<OptionalRule> enabled = EnumSet.noneOf(OptionalRule.class);
        if (translatedByMetadata) {
            enabled.add(OptionalRule.TRANSLATED_METADATA);
        }
        if (keywords) {
            enabled.add(OptionalRule.KEYWORDS);
        }
        if (filenameContainsChinese) {
            enabled.add(OptionalRule.CHINESE_FILENAME);
        }
        if (filenameFormat) {
            enabled.add(OptionalRule.NAME_PATTERN);
        }
        if (maxPages) {
            enabled.add(OptionalRule.MAX_PAGES);
        }
        if (maxFileSize) {
            enabled.add(OptionalRule.MAX_SIZE);
        }
        if (chineseContent) {
            enabled.add(OptionalRule.CHINESE_CONTENT);
        }
        return enabled;
    }
}
