package ai.dualpdf.translator.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * Reads the visible size of every page, in points.
 */
public final class PageGeometry {

    private PageGeometry() {
    }

    public static List<PageSize> read(Path pdf) throws IOException {
        try (PDDocument document = PdfDocuments.open(pdf)) {
            return of(document);
        }
    }

    public static List<PageSize> of(PDDocument document) {
        List<PageSize> sizes = new ArrayList<>(document.getNumberOfPages());
        for (PDPage page : document.getPages()) {
            PDRectangle box = page.getCropBox();
            sizes.add(new PageSize(box.getWidth(), box.getHeight()));
        }
        return List.copyOf(sizes);
    }
}
