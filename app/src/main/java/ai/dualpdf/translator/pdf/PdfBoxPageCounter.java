package ai.dualpdf.translator.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalInt;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfBoxPageCounter implements PageCounter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxPageCounter.class);

    @Override
    public OptionalInt pageCount(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            return OptionalInt.of(document.getNumberOfPages());
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Unable to read page count of {}: {}", pdf, ex.getMessage());
            return OptionalInt.empty();
        }
    }
}
