package ai.dualpdf.translator.translate;

import ai.dualpdf.translator.writer.SidecarPaths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the monolingual PDF the translator produced for a source document.
 */
public class MonoOutputLocator {

    private static final String MONO_SUFFIX = "mono.pdf";

    private final String langOut;

    public MonoOutputLocator(String langOut) {
        this.langOut = Objects.requireNonNull(langOut, "langOut");
    }

    /**
     * {@code Paper.pdf} becomes {@code Paper.no_watermark.zh-CN.mono.pdf} beside the source.
     */
    public Path expectedPath(Path source) {
        return source.resolveSibling(SidecarPaths.stem(source) + ".no_watermark." + langOut + ".mono.pdf");
    }

    public Optional<Path> locate(Path source) {
        Path expected = expectedPath(source);
        if (Files.isRegularFile(expected)) {
            return Optional.of(expected);
        }
        Path directory = source.toAbsolutePath().getParent();
        return newestMatching(directory, SidecarPaths.stem(source));
    }

    /**
     * Most recently modified {@code <prefix>*mono.pdf} in {@code directory}.
     */
    public static Optional<Path> newestMatching(Path directory, String prefix) {
        if (directory == null || !Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(MONO_SUFFIX);
                    })
                    .max(Comparator.comparing(MonoOutputLocator::modifiedTime));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + directory, ex);
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException ex) {
            return FileTime.fromMillis(0L);
        }
    }
}
