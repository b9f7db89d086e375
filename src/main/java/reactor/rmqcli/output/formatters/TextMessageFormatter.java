/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.rmqcli.output.formatters;

import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.output.OutputFormat;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Formats a message as labelled sections:
 * <pre>
 * == Message #1 ==
 * Queue: orders
 * Routing Key: orders.created
 * Exchange: -
 * Redelivered: No
 * == Properties ==
 * Message ID: msg-1
 * ...
 * == Custom Headers ==
 * source: billing
 * == Body (5 bytes) ==
 * hello
 * </pre>
 * In compact mode only the properties that are set are listed, otherwise unset properties
 * are shown as {@code -}.
 */
public class TextMessageFormatter implements MessageFormatter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    static final Map<String, String> LABELS = new LinkedHashMap<>();

    static {
        LABELS.put("messageId", "Message ID");
        LABELS.put("correlationId", "Correlation ID");
        LABELS.put("timestamp", "Timestamp");
        LABELS.put("contentType", "Content Type");
        LABELS.put("contentEncoding", "Content Encoding");
        LABELS.put("deliveryMode", "Delivery Mode");
        LABELS.put("priority", "Priority");
        LABELS.put("expiration", "Expiration");
        LABELS.put("replyTo", "Reply To");
        LABELS.put("type", "Type");
        LABELS.put("appId", "App ID");
        LABELS.put("userId", "User ID");
        LABELS.put("clusterId", "Cluster ID");
    }

    private final boolean compact;

    public TextMessageFormatter() {
        this(false);
    }

    public TextMessageFormatter(boolean compact) {
        this.compact = compact;
    }

    @Override
    public String format(Delivery delivery) {
        StringBuilder sb = new StringBuilder();
        line(sb, "== Message #" + Long.toUnsignedString(delivery.deliveryTag()) + " ==");
        line(sb, "Queue: " + delivery.queue());
        line(sb, "Routing Key: " + delivery.routingKey());
        line(sb, "Exchange: " + (delivery.exchange().isEmpty() ? "-" : delivery.exchange()));
        line(sb, "Redelivered: " + (delivery.redelivered() ? "Yes" : "No"));

        Map<String, Object> properties = PropertyExtractor.properties(delivery.properties());
        if (delivery.properties() != null && (!properties.isEmpty() || !compact)) {
            line(sb, "== Properties ==");
            for (Map.Entry<String, String> label : LABELS.entrySet()) {
                Object value = properties.get(label.getKey());
                if (value != null)
                    line(sb, label.getValue() + ": " + formatProperty(label.getKey(), value));
                else if (!compact)
                    line(sb, label.getValue() + ": -");
            }
        }

        Map<String, Object> headers = PropertyExtractor.headers(delivery.properties());
        if (!headers.isEmpty()) {
            line(sb, "== Custom Headers ==");
            for (Map.Entry<String, Object> header : headers.entrySet())
                line(sb, header.getKey() + ": " + formatValue(header.getValue()));
        }

        line(sb, "== Body (" + formatSize(delivery.bodySize()) + ") ==");
        sb.append(delivery.bodyAsString());
        return sb.toString();
    }

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.PLAIN;
    }

    static String formatSize(long bytes) {
        if (bytes < 1024)
            return bytes + " bytes";
        if (bytes < 1024 * 1024)
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }

    static String formatProperty(String name, Object value) {
        switch (name) {
            case "timestamp":
                return TIMESTAMP_FORMAT.format(Instant.ofEpochSecond((Long) value)) + " UTC";
            case "deliveryMode":
                int mode = (Integer) value;
                if (mode == 1)
                    return "Non-persistent (1)";
                if (mode == 2)
                    return "Persistent (2)";
                return String.valueOf(mode);
            default:
                return String.valueOf(value);
        }
    }

    static String formatValue(Object value) {
        if (value instanceof String)
            return ((String) value).replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            if (map.isEmpty())
                return "{}";
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : map.entrySet())
                joiner.add(entry.getKey() + ": " + formatValue(entry.getValue()));
            return joiner.toString();
        }
        if (value instanceof List) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : (List<?>) value)
                joiner.add(formatValue(element));
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    private static void line(StringBuilder sb, String line) {
        sb.append(line).append(System.lineSeparator());
    }
}
