package ai.dualpdf.translator.pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only CSV record of what happened to each document. A new file starts with a UTF-8 byte order mark so
 * spreadsheet tools detect the encoding.
 */
public class OutcomeLog {

    static final List<String> HEADER = List.of("time", "status", "pdf", "reason", "pages", "size_bytes", "duration_sec");
    static final char BOM = '\uFEFF';

    private static final Logger LOGGER = LoggerFactory.getLogger(OutcomeLog.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

    private final Path file;
    private final Clock clock;

    public OutcomeLog(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path file() {
        return file;
    }

    public void ensureHeader() throws IOException {
        if (Files.exists(file)) {
            return;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            writer.write(BOM);
            writer.write(String.join(",", HEADER));
            writer.write("\r\n");
        }
    }

    /**
     * Appends a row; failures are logged and never interrupt the batch.
     */
    public void append(OutcomeRow row) {
        try {
            ensureHeader();
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                writer.write(format(row));
                writer.write("\r\n");
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to write outcome row to {}: {}", file, ex.getMessage());
        }
    }

    String format(OutcomeRow row) {
        StringBuilder builder = new StringBuilder();
        builder.append(escape(LocalDateTime.now(clock).format(TIME_FORMAT))).append(',')
                .append(escape(row.status().value())).append(',')
                .append(escape(row.pdf().toString())).append(',')
                .append(escape(row.reason())).append(',');
        if (row.pages().isPresent()) {
            builder.append(row.pages().getAsInt());
        }
        builder.append(',');
        if (row.sizeBytes().isPresent()) {
            builder.append(row.sizeBytes().getAsLong());
        }
        builder.append(',');
        row.duration().ifPresent(duration -> builder.append(seconds(duration)));
        return builder.toString();
    }

    private static String seconds(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis())
                .divide(BigDecimal.valueOf(1000), 2, RoundingMode.HALF_UP)
                .toPlainString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
