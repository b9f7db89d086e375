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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;
import reactor.util.annotation.Nullable;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts AMQP basic properties and header tables into plain Java values shared by
 * the text and JSON formatters.
 */
public final class PropertyExtractor {

    private PropertyExtractor() {
    }

    /**
     * Returns the properties that are set, keyed by their camel case name, in display order.
     * The timestamp is converted to Unix seconds. Headers are not included.
     */
    public static Map<String, Object> properties(@Nullable AMQP.BasicProperties props) {
        if (props == null)
            return Collections.emptyMap();
        Map<String, Object> properties = new LinkedHashMap<>();
        putIfSet(properties, "messageId", props.getMessageId());
        putIfSet(properties, "correlationId", props.getCorrelationId());
        Date timestamp = props.getTimestamp();
        if (timestamp != null)
            properties.put("timestamp", timestamp.getTime() / 1000);
        putIfSet(properties, "contentType", props.getContentType());
        putIfSet(properties, "contentEncoding", props.getContentEncoding());
        putIfSet(properties, "deliveryMode", props.getDeliveryMode());
        putIfSet(properties, "priority", props.getPriority());
        putIfSet(properties, "expiration", props.getExpiration());
        putIfSet(properties, "replyTo", props.getReplyTo());
        putIfSet(properties, "type", props.getType());
        putIfSet(properties, "appId", props.getAppId());
        putIfSet(properties, "userId", props.getUserId());
        putIfSet(properties, "clusterId", props.getClusterId());
        return properties;
    }

    /**
     * Returns the message headers with their values converted by {@link #convert(Object)}.
     * Headers with a {@code null} value are left out. Names are sorted, the broker client
     * does not keep the order the publisher used.
     */
    public static Map<String, Object> headers(@Nullable AMQP.BasicProperties props) {
        if (props == null || props.getHeaders() == null)
            return Collections.emptyMap();
        Map<String, Object> headers = new TreeMap<>();
        for (Map.Entry<String, Object> header : props.getHeaders().entrySet()) {
            if (header.getValue() != null)
                headers.put(header.getKey(), convert(header.getValue()));
        }
        return headers;
    }

    /**
     * Converts a header table value. Strings arrive as {@link LongString} and are decoded
     * as UTF-8, binary content is replaced by a size marker, timestamps become Unix seconds.
     * Lists and nested tables are converted recursively.
     */
    public static Object convert(@Nullable Object value) {
        if (value == null)
            return "null";
        if (value instanceof LongString)
            return decode(((LongString) value).getBytes());
        if (value instanceof byte[])
            return decode((byte[]) value);
        if (value instanceof Date)
            return ((Date) value).getTime() / 1000;
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value)
                converted.add(convert(element));
            return converted;
        }
        if (value instanceof Map) {
            Map<String, Object> converted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
                converted.put(String.valueOf(entry.getKey()), convert(entry.getValue()));
            return converted;
        }
        return value;
    }

    static String decode(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        String decoded;
        try {
            decoded = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return binaryMarker(bytes.length);
        }
        for (int i = 0; i < decoded.length(); i++) {
            char c = decoded.charAt(i);
            if (Character.isISOControl(c) && c != '\r' && c != '\n' && c != '\t')
                return binaryMarker(bytes.length);
        }
        return decoded;
    }

    static String binaryMarker(int length) {
        return "<binary data: " + length + " bytes>";
    }

    private static void putIfSet(Map<String, Object> properties, String name, @Nullable Object value) {
        if (value != null)
            properties.put(name, value);
    }
}
