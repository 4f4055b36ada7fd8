package ai.dualpdf.translator.pdf;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.util.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places two documents side by side and takes merged documents apart again.
 *
 * <p>The left document is kept as the base: its pages are only widened, never rescaled or moved, so every
 * annotation, highlight and link keeps its coordinates. Widths are taken from the crop box, so content hidden
 * by a crop stays hidden. The right page is drawn as a form XObject into the
 * added area.</p>
 */
public class PageMergeEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageMergeEngine.class);

    /**
     * Merges {@code left} and {@code right} page by page into {@code output}.
     *
     * @param gap horizontal space in points between the two halves
     * @throws PageCountMismatchException when the documents have different page counts
     */
    public MergeResult merge(Path left, Path right, double gap, Path output) throws IOException {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        requireDistinctOutput(output, left, right);
        if (gap < 0 || Double.isNaN(gap)) {
            throw new IllegalArgumentException("gap must be zero or greater: " + gap);
        }
        try (PDDocument leftDocument = PdfDocuments.open(left);
             PDDocument rightDocument = PdfDocuments.open(right)) {
            int pages = leftDocument.getNumberOfPages();
            if (pages != rightDocument.getNumberOfPages()) {
                throw new PageCountMismatchException(pages, rightDocument.getNumberOfPages());
            }
            LayerUtility layers = new LayerUtility(leftDocument);
            float gapPt = (float) gap;
            for (int i = 0; i < pages; i++) {
                PDPage page = leftDocument.getPage(i);
                PDRectangle visible = page.getCropBox();
                float width = visible.getWidth();
                float height = visible.getHeight();
                float originX = visible.getLowerLeftX();
                float originY = visible.getLowerLeftY();

                PdfDocuments.setAllBoxes(page, new PDRectangle(originX, originY, 2 * width + gapPt, height));

                PDFormXObject translated = layers.importPageAsForm(rightDocument, i);
                drawInto(leftDocument, page, translated, originX + width + gapPt, originY, width, height);
            }
            PdfDocuments.saveCompacted(leftDocument, output);
            LOGGER.debug("Merged {} page(s) of {} and {} into {}", pages, left.getFileName(), right.getFileName(), output);
            return new MergeResult(output, pages, PageGeometry.of(leftDocument));
        }
    }

    /**
     * Restores the left half of a document merged without a gap.
     */
    public MergeResult split(Path merged, Path output) throws IOException {
        return split(merged, 0.0, output);
    }

    /**
     * Restores the left half of a merged document, given the gap it was merged with.
     */
    public MergeResult split(Path merged, double gap, Path output) throws IOException {
        Objects.requireNonNull(merged, "merged");
        requireDistinctOutput(output, merged, merged);
        if (gap < 0 || Double.isNaN(gap)) {
            throw new IllegalArgumentException("gap must be zero or greater: " + gap);
        }
        try (PDDocument document = PdfDocuments.open(merged)) {
            int index = 0;
            for (PDPage page : document.getPages()) {
                PDRectangle visible = page.getCropBox();
                if (gap >= visible.getWidth()) {
                    throw new IllegalArgumentException("gap " + gap + " is not smaller than the width of page " + (index + 1));
                }
                float halfWidth = (float) ((visible.getWidth() - gap) / 2.0);
                PdfDocuments.setAllBoxes(page,
                        new PDRectangle(visible.getLowerLeftX(), visible.getLowerLeftY(), halfWidth, visible.getHeight()));
                index++;
            }
            PdfDocuments.saveCompacted(document, output);
            return new MergeResult(output, document.getNumberOfPages(), PageGeometry.of(document));
        }
    }

    private void drawInto(PDDocument document, PDPage page, PDFormXObject form,
                          float targetX, float targetY, float targetWidth, float targetHeight) throws IOException {
        Rectangle2D bounds = form.getBBox().transform(form.getMatrix()).getBounds2D();
        if (bounds.getWidth() <= 0 || bounds.getHeight() <= 0) {
            throw new MergeException("translated page has an empty bounding box");
        }
        float scale = (float) Math.min(targetWidth / bounds.getWidth(), targetHeight / bounds.getHeight());
        try (PDPageContentStream content = new PDPageContentStream(document, page, AppendMode.APPEND, true, true)) {
            content.saveGraphicsState();
            content.transform(Matrix.getTranslateInstance(targetX, targetY));
            content.transform(Matrix.getScaleInstance(scale, scale));
            content.transform(Matrix.getTranslateInstance((float) -bounds.getMinX(), (float) -bounds.getMinY()));
            content.drawForm(form);
            content.restoreGraphicsState();
        }
    }

    private static void requireDistinctOutput(Path output, Path first, Path second) {
        Objects.requireNonNull(output, "output");
        Path normalized = output.toAbsolutePath().normalize();
        if (normalized.equals(first.toAbsolutePath().normalize()) || normalized.equals(second.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output must differ from the input documents: " + output);
        }
    }
}
