package ai.dualpdf.translator.pdf;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * Opening and saving conventions for every PDFBox document this tool touches.
 */
public final class PdfDocuments {

    private PdfDocuments() {
    }

    /**
     * Opens a document for modification. Documents protected only by an owner password are opened with the
     * empty user password and saved without encryption.
     */
    public static PDDocument open(Path path) throws IOException {
        PDDocument document = Loader.loadPDF(path.toFile());
        if (document.isEncrypted()) {
            document.setAllSecurityToBeRemoved(true);
        }
        return document;
    }

    /**
     * Saves with object-stream compression; content streams written by this tool are already deflated.
     */
    public static void saveCompacted(PDDocument document, Path target) throws IOException {
        document.save(target.toFile(), CompressParameters.DEFAULT_COMPRESSION);
    }

    static void setAllBoxes(PDPage page, PDRectangle rectangle) {
        // viewers clip to the most restrictive box, so all four must move together
        page.setMediaBox(rectangle);
        page.setCropBox(rectangle);
        page.setTrimBox(rectangle);
        page.setBleedBox(rectangle);
    }
}
