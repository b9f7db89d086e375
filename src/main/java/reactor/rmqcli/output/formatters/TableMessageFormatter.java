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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats a message as a framed panel, one row per field with values aligned after a
 * fixed width label column:
 * <pre>
 * ╭─ Message #1 ─────────────╮
 * │ Queue             orders │
 * │ Routing Key       orders │
 * │ Exchange          -      │
 * │ Redelivered       No     │
 * │ ── Body (5 bytes) ────── │
 * │ hello                    │
 * ╰──────────────────────────╯
 * </pre>
 * Sections and the compact mode are the same as for {@link TextMessageFormatter}.
 */
public class TableMessageFormatter implements MessageFormatter {

    static final int LABEL_WIDTH = 17;

    private static final char HORIZONTAL = '─';

    private final boolean compact;

    public TableMessageFormatter() {
        this(false);
    }

    public TableMessageFormatter(boolean compact) {
        this.compact = compact;
    }

    @Override
    public String format(Delivery delivery) {
        List<Row> rows = new ArrayList<>();
        rows.add(Row.field("Queue", delivery.queue()));
        rows.add(Row.field("Routing Key", delivery.routingKey()));
        rows.add(Row.field("Exchange", delivery.exchange().isEmpty() ? "-" : delivery.exchange()));
        rows.add(Row.field("Redelivered", delivery.redelivered() ? "Yes" : "No"));

        Map<String, Object> properties = PropertyExtractor.properties(delivery.properties());
        if (delivery.properties() != null && (!properties.isEmpty() || !compact)) {
            rows.add(Row.rule("Properties"));
            for (Map.Entry<String, String> label : TextMessageFormatter.LABELS.entrySet()) {
                Object value = properties.get(label.getKey());
                if (value != null)
                    rows.add(Row.field(label.getValue(), TextMessageFormatter.formatProperty(label.getKey(), value)));
                else if (!compact)
                    rows.add(Row.field(label.getValue(), "-"));
            }
        }

        Map<String, Object> headers = PropertyExtractor.headers(delivery.properties());
        if (!headers.isEmpty()) {
            rows.add(Row.rule("Custom Headers"));
            for (Map.Entry<String, Object> header : headers.entrySet())
                rows.add(Row.field(header.getKey(), TextMessageFormatter.formatValue(header.getValue())));
        }

        rows.add(Row.rule("Body (" + TextMessageFormatter.formatSize(delivery.bodySize()) + ")"));
        for (String line : delivery.bodyAsString().replace("\t", "    ").split("\r?\n", -1))
            rows.add(Row.text(line));

        return render(" Message #" + Long.toUnsignedString(delivery.deliveryTag()) + " ", rows);
    }

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.TABLE;
    }

    private static String render(String title, List<Row> rows) {
        int width = title.length();
        for (Row row : rows)
            width = Math.max(width, row.minimumWidth());

        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append('╭').append(HORIZONTAL).append(title);
        repeat(sb, HORIZONTAL, width + 1 - title.length());
        sb.append('╮').append(nl);
        for (Row row : rows)
            sb.append("│ ").append(row.render(width)).append(" │").append(nl);
        sb.append('╰');
        repeat(sb, HORIZONTAL, width + 2);
        sb.append('╯');
        return sb.toString();
    }

    private static void repeat(StringBuilder sb, char c, int count) {
        for (int i = 0; i < count; i++)
            sb.append(c);
    }

    private static String pad(String text, int width) {
        StringBuilder sb = new StringBuilder(text);
        repeat(sb, ' ', width - text.length());
        return sb.toString();
    }

    /**
     * A line of the panel: a labelled field, a section rule or free text.
     */
    private static final class Row {

        private final String content;

        private final boolean rule;

        private Row(String content, boolean rule) {
            this.content = content;
            this.rule = rule;
        }

        static Row field(String label, String value) {
            return new Row(pad(label, LABEL_WIDTH) + " " + value, false);
        }

        static Row rule(String name) {
            return new Row(HORIZONTAL + "" + HORIZONTAL + " " + name + " ", true);
        }

        static Row text(String text) {
            return new Row(text, false);
        }

        int minimumWidth() {
            // a rule keeps at least one trailing line segment
            return rule ? content.length() + 1 : content.length();
        }

        String render(int width) {
            if (!rule)
                return pad(content, width);
            StringBuilder sb = new StringBuilder(content);
            repeat(sb, HORIZONTAL, width - content.length());
            return sb.toString();
        }
    }
}
