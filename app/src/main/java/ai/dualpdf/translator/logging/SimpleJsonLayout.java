package ai.dualpdf.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * JSON-lines layout. The per-document MDC key is promoted to a top-level {@code document} field.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    public static final String DOCUMENT_KEY = "document";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        node.put("level", event.getLevel().toString());
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        String document = mdc.get(DOCUMENT_KEY);
        if (document != null) {
            node.put(DOCUMENT_KEY, document);
        }
        if (mdc.size() > (document == null ? 0 : 1)) {
            ObjectNode extra = node.putObject("mdc");
            mdc.forEach((key, value) -> {
                if (!DOCUMENT_KEY.equals(key)) {
                    extra.put(key, value);
                }
            });
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            ObjectNode error = node.putObject("error");
            error.put("type", throwable.getClassName());
            error.put("message", throwable.getMessage());
        }

        try {
            return objectMapper.writeValueAsString(node) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException ex) {
            addError("Failed to serialise log event", ex);
            return event.getFormattedMessage() + CoreConstants.LINE_SEPARATOR;
        }
    }

    private Map<String, String> safeMdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }
}
