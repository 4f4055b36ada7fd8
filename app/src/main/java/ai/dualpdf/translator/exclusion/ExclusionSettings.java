package ai.dualpdf.translator.exclusion;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thresholds and switches for the exclusion chain. Rules not listed in {@link OptionalRule} always run.
 */
public record ExclusionSettings(Set<OptionalRule> enabled, List<String> keywords, int maxPages, long maxSizeBytes) {

    public enum OptionalRule {
        TRANSLATED_METADATA,
        KEYWORDS,
        CHINESE_FILENAME,
        NAME_PATTERN,
        MAX_PAGES,
        MAX_SIZE,
        CHINESE_CONTENT
    }

    public ExclusionSettings {
        Objects.requireNonNull(enabled, "enabled");
        enabled = enabled.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(enabled));
        keywords = keywords == null ? List.of() : keywords.stream()
                .filter(Objects::nonNull)
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive");
        }
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive");
        }
    }

    public boolean isEnabled(OptionalRule rule) {
        return enabled.contains(rule);
    }
}
