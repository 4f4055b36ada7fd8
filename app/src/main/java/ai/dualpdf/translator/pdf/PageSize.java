package ai.dualpdf.translator.pdf;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Width and height of a page in points, rounded to two decimals as stored in document metadata.
 */
public record PageSize(double w, double h) {

    public PageSize {
        if (w < 0 || h < 0 || Double.isNaN(w) || Double.isNaN(h)) {
            throw new IllegalArgumentException("page dimensions must be non-negative numbers");
        }
        w = round(w);
        h = round(h);
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
