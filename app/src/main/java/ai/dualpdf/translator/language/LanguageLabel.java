package ai.dualpdf.translator.language;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Page-level language classes returned by the labeling service.
 */
public enum LanguageLabel {
    CHINESE,
    NON_CHINESE;

    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff]");

    /**
     * Maps a free-text model answer to a label. Negative answers are checked first because
     * "非中文" also contains "中文".
     */
    public static LanguageLabel normalize(String raw) {
        String text = raw == null ? "" : raw.strip();
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.contains("非中文") || lower.contains("non-chinese") || text.contains("英文") || lower.contains("english")) {
            return NON_CHINESE;
        }
        if (text.contains("中文") || lower.contains("chinese")) {
            return CHINESE;
        }
        return CJK.matcher(text).find() ? CHINESE : NON_CHINESE;
    }
}
