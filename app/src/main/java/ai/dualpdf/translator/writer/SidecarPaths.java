package ai.dualpdf.translator.writer;

import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * File naming conventions shared by every component that writes next to a source document.
 */
public final class SidecarPaths {

    public static final String BACKUP_SUFFIX = "_original.pdf";
    public static final String MERGED_SIDECAR_SUFFIX = ".pdf2zh-merged.pdf";
    public static final String UPDATED_SIDECAR_SUFFIX = ".pdf2zh-updated.pdf";
    public static final String TEMP_INPUT_PREFIX = "__temp_input_";
    public static final String TEMP_MARKER = "_tmp_";

    private SidecarPaths() {
    }

    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static Path backupFor(Path document) {
        return document.resolveSibling(stem(document) + BACKUP_SUFFIX);
    }

    public static boolean isBackup(Path document) {
        return document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(BACKUP_SUFFIX);
    }

    public static Path sidecarFor(Path destination, String suffix) {
        return destination.resolveSibling(stem(destination) + suffix);
    }

    public static Path temporaryFor(Path destination) {
        String token = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return destination.resolveSibling(stem(destination) + TEMP_MARKER + token + ".pdf");
    }
}
