package ai.dualpdf.translator.exclusion;

import ai.dualpdf.translator.pdf.PageCounter;
import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A PDF found during a scan. The page count is read at most once, and only when a rule asks for it.
 */
public final class DocumentCandidate {

    private final Path path;
    private final long sizeBytes;
    private final PageCounter pageCounter;
    private OptionalInt pageCount;

    public DocumentCandidate(Path path, long sizeBytes, PageCounter pageCounter) {
        this.path = Objects.requireNonNull(path, "path");
        this.sizeBytes = sizeBytes;
        this.pageCounter = Objects.requireNonNull(pageCounter, "pageCounter");
    }

    public static DocumentCandidate of(Path path, PageCounter pageCounter) {
        try {
            return new DocumentCandidate(path, Files.size(path), pageCounter);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to stat " + path, ex);
        }
    }

    public Path path() {
        return path;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public String name() {
        return path.getFileName().toString();
    }

    public String stem() {
        return SidecarPaths.stem(path);
    }

    public OptionalInt pageCount() {
        if (pageCount == null) {
            pageCount = pageCounter.pageCount(path);
        }
        return pageCount;
    }

    /**
     * The page count if a rule already read it, without triggering a read.
     */
    public OptionalInt knownPageCount() {
        return pageCount == null ? OptionalInt.empty() : pageCount;
    }

    @Override
    public String toString() {
        return "DocumentCandidate[" + path + ", " + sizeBytes + " bytes]";
    }
}
