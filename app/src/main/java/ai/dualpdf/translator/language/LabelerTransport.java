package ai.dualpdf.translator.language;

import java.util.Locale;

public enum LabelerTransport {
    AUTO,
    SDK,
    HTTP;

    public static LabelerTransport fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return LabelerTransport.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
