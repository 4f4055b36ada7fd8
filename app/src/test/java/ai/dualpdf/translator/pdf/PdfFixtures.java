package ai.dualpdf.translator.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Builds small PDFs for tests.
 */
public final class PdfFixtures {

    public static final PageSize A4 = new PageSize(595.0, 842.0);

    private PdfFixtures() {
    }

    public static Path create(Path file, int pages) throws IOException {
        return create(file, pages, A4);
    }

    public static Path create(Path file, int pages, PageSize size) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int index = 0; index < pages; index++) {
                addPage(document, size, "Page " + (index + 1));
            }
            document.save(file.toFile());
        }
        return file;
    }

    public static Path create(Path file, List<PageSize> sizes) throws IOException {
        try (PDDocument document = new PDDocument()) {
            int index = 0;
            for (PageSize size : sizes) {
                addPage(document, size, "Page " + (++index));
            }
            document.save(file.toFile());
        }
        return file;
    }

    private static void addPage(PDDocument document, PageSize size, String text) throws IOException {
        PDPage page = new PDPage(new PDRectangle((float) size.w(), (float) size.h()));
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
            content.newLineAtOffset(40, (float) size.h() - 60);
            content.showText(text);
            content.endText();
        }
    }
}
