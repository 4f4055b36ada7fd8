package ai.dualpdf.translator.language;

/**
 * Majority vote over the sampled pages of one document.
 */
public record LanguageVerdict(int chinesePages, int nonChinesePages, int totalPages) {

    public LanguageVerdict {
        if (chinesePages < 0 || nonChinesePages < 0 || totalPages < 0) {
            throw new IllegalArgumentException("page counts must not be negative");
        }
    }

    /**
     * Ties count as Chinese; a document with nothing sampled does not.
     */
    public boolean chinese() {
        int sampled = chinesePages + nonChinesePages;
        return sampled > 0 && chinesePages >= nonChinesePages;
    }

    public String describe() {
        return "vlm_detected: zh=%d, non_zh=%d, total=%d".formatted(chinesePages, nonChinesePages, totalPages);
    }
}
