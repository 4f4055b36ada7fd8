package ai.dualpdf.translator.language;

/**
 * Labels collected separately for the left and right halves of the sampled pages.
 */
public record SideBySideVerdict(int leftChinese, int leftNonChinese, int rightChinese, int rightNonChinese,
                                int totalPages) {

    public SideBySideVerdict {
        if (leftChinese < 0 || leftNonChinese < 0 || rightChinese < 0 || rightNonChinese < 0 || totalPages < 0) {
            throw new IllegalArgumentException("page counts must not be negative");
        }
    }

    /**
     * A translated document has its source on the left and Chinese on the right: the right half is Chinese at
     * least as often as the left, and the left is non-Chinese strictly more often than the right.
     */
    public boolean translated() {
        return rightChinese >= leftChinese && leftNonChinese > rightNonChinese;
    }

    public String describe() {
        return "left_zh=%d, left_non_zh=%d, right_zh=%d, right_non_zh=%d"
                .formatted(leftChinese, leftNonChinese, rightChinese, rightNonChinese);
    }
}
