package ai.dualpdf.translator.language;

import java.util.Locale;

/**
 * Resolution hint sent with each page image.
 */
public enum ImageDetail {
    LOW,
    HIGH,
    AUTO;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ImageDetail fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Image detail must be low, high or auto");
        }
        try {
            return ImageDetail.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Image detail must be low, high or auto: " + value, ex);
        }
    }
}
