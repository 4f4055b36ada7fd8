package ai.dualpdf.translator.pdf;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Reports the page count of a document, or empty when the document cannot be read.
 */
@FunctionalInterface
public interface PageCounter {

    OptionalInt pageCount(Path pdf);
}
