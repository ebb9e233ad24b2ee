package ai.texdocx.converter.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One JSON object per log event, written without a JSON library. The input file of the running conversion, kept in
 * the MDC under {@value #SOURCE_KEY}, is promoted to a top-level field.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    public static final String SOURCE_KEY = "source";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        appendField(builder, "level", event.getLevel().toString());
        builder.append(',');
        appendField(builder, "logger", event.getLoggerName());
        builder.append(',');
        appendField(builder, "thread", event.getThreadName());
        builder.append(',');
        appendField(builder, "message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        String source = mdc.get(SOURCE_KEY);
        if (source != null) {
            builder.append(',');
            appendField(builder, SOURCE_KEY, source);
        }
        String payload = mdc.entrySet().stream()
                .filter(entry -> !SOURCE_KEY.equals(entry.getKey()))
                .map(entry -> quote(entry.getKey()) + ':' + quote(entry.getValue()))
                .collect(Collectors.joining(","));
        if (!payload.isEmpty()) {
            builder.append(",\"mdc\":{").append(payload).append('}');
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            builder.append(',');
            appendField(builder, "exception", ThrowableProxyUtil.asString(throwable));
        }

        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private static void appendField(StringBuilder builder, String name, String value) {
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private static Map<String, String> safeMdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
