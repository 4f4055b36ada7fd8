package ai.dualpdf.translator.exclusion;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * File-name checks: CJK detection and the {@code Author-Year-Title} naming convention.
 */
public final class DocumentNameValidator {

    private static final Pattern CJK = Pattern.compile("[\\u3400-\\u4dbf\\u4e00-\\u9fff\\uf900-\\ufaff]");
    private static final Pattern YEAR = Pattern.compile("[0-9]{4}");

    private DocumentNameValidator() {
    }

    public static boolean containsCjk(String text) {
        return text != null && CJK.matcher(text).find();
    }

    /**
     * {@code true} when the stem reads as {@code Author-Year-Title}: at least three dash-separated parts, an
     * author without digits and with a letter, a year in [1900, 2099] and a title with a letter.
     */
    public static boolean isNormalizedName(String stem) {
        if (stem == null || containsCjk(stem)) {
            return false;
        }
        String[] parts = stem.split("-", -1);
        if (parts.length < 3) {
            return false;
        }
        String author = parts[0];
        String year = parts[1];
        String title = String.join("-", Arrays.copyOfRange(parts, 2, parts.length));

        if (!YEAR.matcher(year).matches()) {
            return false;
        }
        int value = Integer.parseInt(year);
        if (value < 1900 || value > 2099) {
            return false;
        }
        if (author.chars().anyMatch(Character::isDigit)) {
            return false;
        }
        return hasLetter(author) && hasLetter(title);
    }

    private static boolean hasLetter(String text) {
        return text.chars().anyMatch(Character::isLetter);
    }
}
