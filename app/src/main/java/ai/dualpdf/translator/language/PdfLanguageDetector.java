package ai.dualpdf.translator.language;

import ai.dualpdf.translator.exclusion.ChineseContentDetector;
import ai.dualpdf.translator.pdf.PdfDocuments;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples a handful of pages, renders them to JPEG and asks a {@link LanguageLabeler} for each. The sample is
 * reproducible: the same seed always picks the same pages of a given document.
 */
public class PdfLanguageDetector implements ChineseContentDetector {

    public static final long DEFAULT_SEED = 42L;
    static final float JPEG_QUALITY = 0.85f;

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfLanguageDetector.class);

    private final LanguageLabeler labeler;
    private final int pagesToSample;
    private final int dpi;
    private final long seed;

    public PdfLanguageDetector(LanguageLabeler labeler, int pagesToSample, int dpi, long seed) {
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

    @Override
    public LanguageVerdict judge(Path pdf) throws IOException {
        try (PDDocument document = PdfDocuments.open(pdf)) {
            int total = document.getNumberOfPages();
            if (total == 0) {
                return new LanguageVerdict(0, 0, 0);
            }
            PDFRenderer renderer = new PDFRenderer(document);
            int chinese = 0;
            int nonChinese = 0;
            for (int index : samplePages(total)) {
                String raw = labeler.label(renderJpegBase64(renderer, index));
                LanguageLabel label = LanguageLabel.normalize(raw);
                LOGGER.debug("Page {} of {} labelled {} ({})", index + 1, pdf.getFileName(), label, raw);
                if (label == LanguageLabel.CHINESE) {
                    chinese++;
                } else {
                    nonChinese++;
                }
            }
            return new LanguageVerdict(chinese, nonChinese, total);
        }
    }

    /**
     * Zero-based indices of the pages to label, distinct and at most {@code total}.
     */
    List<Integer> samplePages(int total) {
        return samplePages(total, pagesToSample, seed);
    }

    static List<Integer> samplePages(int total, int count, long seed) {
        List<Integer> indices = IntStream.range(0, total).boxed().collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(indices, new Random(seed));
        return List.copyOf(indices.subList(0, Math.min(count, total)));
    }

    String renderJpegBase64(PDFRenderer renderer, int pageIndex) throws IOException {
        return encodeJpegBase64(renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB));
    }

    static String encodeJpegBase64(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return Base64.getEncoder().encodeToString(buffer.toByteArray());
    }
}
