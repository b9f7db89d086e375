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

package reactor.rmqcli.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.util.annotation.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses messages given as JSON objects:
 * <pre>
 * {"body": "...", "properties": {"contentType": "text/plain", "deliveryMode": 2}, "headers": {"source": "billing"}}
 * </pre>
 * Header values keep their JSON type where AMQP has one: strings, longs (doubles when the
 * number is not integral or too large), booleans. {@code null} becomes an empty string, nested
 * objects and arrays their JSON text.
 */
public final class JsonMessageParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonMessageParser() {
    }

    /**
     * @throws IllegalArgumentException if {@code json} is not a JSON message object
     */
    public static JsonMessage parseSingle(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON message format: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject())
            throw new IllegalArgumentException("Invalid JSON message format: expected an object");
        return new JsonMessage(body(root.get("body")), properties(root.get("properties")), headers(root.get("headers")));
    }

    /**
     * Parses one message per line, skipping blank lines.
     * @throws IllegalArgumentException naming the 1-based line that could not be parsed
     */
    public static List<JsonMessage> parseNdjson(String ndjson) {
        List<JsonMessage> messages = new ArrayList<>();
        String[] lines = ndjson.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty())
                continue;
            try {
                messages.add(parseSingle(line));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Failed to parse line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return messages;
    }

    /**
     * Returns true if the first non-blank line of {@code blob} is a JSON object with a
     * {@code body} field.
     */
    public static boolean isNdjson(String blob) {
        for (String line : blob.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty())
                continue;
            if (!trimmed.startsWith("{"))
                return false;
            try {
                JsonNode node = MAPPER.readTree(trimmed);
                return node != null && node.isObject() && node.has("body");
            } catch (JsonProcessingException e) {
                return false;
            }
        }
        return false;
    }

    private static String body(@Nullable JsonNode node) {
        if (node == null || node.isNull())
            return "";
        if (node.isTextual())
            return node.asText();
        return node.toString();
    }

    private static MessageProperties properties(@Nullable JsonNode node) {
        MessageProperties properties = new MessageProperties();
        if (node == null || node.isNull())
            return properties;
        if (!node.isObject())
            throw new IllegalArgumentException("Invalid JSON message format: 'properties' must be an object");
        return properties
            .appId(text(node, "appId"))
            .clusterId(text(node, "clusterId"))
            .contentType(text(node, "contentType"))
            .contentEncoding(text(node, "contentEncoding"))
            .correlationId(text(node, "correlationId"))
            .deliveryMode(deliveryMode(node.get("deliveryMode")))
            .expiration(text(node, "expiration"))
            .messageId(text(node, "messageId"))
            .priority(priority(node.get("priority")))
            .replyTo(text(node, "replyTo"))
            .timestamp(timestamp(node.get("timestamp")))
            .type(text(node, "type"))
            .userId(text(node, "userId"));
    }

    @Nullable
    private static String text(JsonNode properties, String name) {
        JsonNode node = properties.get(name);
        if (node == null || node.isNull())
            return null;
        return node.asText();
    }

    @Nullable
    static Integer deliveryMode(@Nullable JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (node.isIntegralNumber() && (node.asInt() == 1 || node.asInt() == 2))
            return node.asInt();
        if (node.isTextual()) {
            Integer mode = deliveryMode(node.asText());
            if (mode != null)
                return mode;
        }
        throw new IllegalArgumentException("Invalid JSON message format: deliveryMode must be 1, 2, "
            + "'transient' or 'persistent', was " + node);
    }

    /**
     * Maps {@code 1}, {@code 2}, {@code transient} and {@code persistent} to a delivery mode,
     * anything else to null.
     */
    @Nullable
    public static Integer deliveryMode(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "transient":
            case "nonpersistent":
                return 1;
            case "2":
            case "persistent":
                return 2;
            default:
                return null;
        }
    }

    @Nullable
    private static Integer priority(@Nullable JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (!node.isIntegralNumber() || node.asInt() < 0 || node.asInt() > 255)
            throw new IllegalArgumentException("Invalid JSON message format: priority must be between 0 and 255, was " + node);
        return node.asInt();
    }

    @Nullable
    private static Long timestamp(@Nullable JsonNode node) {
        if (node == null || node.isNull())
            return null;
        if (!node.isIntegralNumber() || !node.canConvertToLong())
            throw new IllegalArgumentException("Invalid JSON message format: timestamp must be Unix seconds, was " + node);
        return node.asLong();
    }

    private static Map<String, Object> headers(@Nullable JsonNode node) {
        Map<String, Object> headers = new LinkedHashMap<>();
        if (node == null || node.isNull())
            return headers;
        if (!node.isObject())
            throw new IllegalArgumentException("Invalid JSON message format: 'headers' must be an object");
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            headers.put(field.getKey(), headerValue(field.getValue()));
        }
        return headers;
    }

    static Object headerValue(JsonNode value) {
        if (value.isTextual())
            return value.asText();
        if (value.isIntegralNumber())
            return value.canConvertToLong() ? (Object) value.asLong() : (Object) value.asDouble();
        if (value.isNumber())
            return value.asDouble();
        if (value.isBoolean())
            return value.asBoolean();
        if (value.isNull())
            return "";
        return value.toString();
    }
}
