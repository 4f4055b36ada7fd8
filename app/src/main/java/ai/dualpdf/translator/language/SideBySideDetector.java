package ai.dualpdf.translator.language;

import ai.dualpdf.translator.pdf.PdfDocuments;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells a side-by-side translated document from an ordinary one. Each sampled page is rendered, cut into a left
 * and a right half, and both halves are labeled on their own.
 */
public class SideBySideDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SideBySideDetector.class);

    private final LanguageLabeler labeler;
    private final int pagesToSample;
    private final int dpi;
    private final long seed;

    public SideBySideDetector(LanguageLabeler labeler, int pagesToSample, int dpi, long seed) {
        this.labeler = Objects.requireNonNull(labeler, "labeler");
        if (pagesToSample <= 0) {
            throw new IllegalArgumentException("pagesToSample must be positive");
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive");
        }
        this.pagesToSample = pagesToSample;
        this.dpi = dpi;
        this.seed = seed;
    }

    public SideBySideVerdict judge(Path pdf) throws IOException {
        try (PDDocument document = PdfDocuments.open(pdf)) {
            int total = document.getNumberOfPages();
            if (total == 0) {
                return new SideBySideVerdict(0, 0, 0, 0, 0);
            }
            PDFRenderer renderer = new PDFRenderer(document);
            int leftChinese = 0;
            int leftNonChinese = 0;
            int rightChinese = 0;
            int rightNonChinese = 0;
            for (int index : PdfLanguageDetector.samplePages(total, pagesToSample, seed)) {
                BufferedImage page = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                int half = page.getWidth() / 2;
                LanguageLabel left = labelRegion(page, 0, half);
                LanguageLabel right = labelRegion(page, half, page.getWidth() - half);
                LOGGER.debug("Page {} of {}: left {}, right {}", index + 1, pdf.getFileName(), left, right);
                if (left == LanguageLabel.CHINESE) {
                    leftChinese++;
                } else {
                    leftNonChinese++;
                }
                if (right == LanguageLabel.CHINESE) {
                    rightChinese++;
                } else {
                    rightNonChinese++;
                }
            }
            return new SideBySideVerdict(leftChinese, leftNonChinese, rightChinese, rightNonChinese, total);
        }
    }

    private LanguageLabel labelRegion(BufferedImage page, int x, int width) throws IOException {
        return LanguageLabel.normalize(labeler.label(PdfLanguageDetector.encodeJpegBase64(crop(page, x, width))));
    }

    static BufferedImage crop(BufferedImage page, int x, int width) {
        BufferedImage region = new BufferedImage(Math.max(width, 1), page.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = region.createGraphics();
        try {
            graphics.drawImage(page, -x, 0, null);
        } finally {
            graphics.dispose();
        }
        return region;
    }
}
