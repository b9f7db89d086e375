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
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PropertyExtractorTest {

    @Test
    public void onlySetPropertiesAreExtractedInDisplayOrder() {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .appId("billing")
            .timestamp(new Date(1_700_000_000_999L))
            .messageId("msg-1")
            .deliveryMode(2)
            .build();

        Map<String, Object> extracted = PropertyExtractor.properties(properties);

        assertThat(extracted.keySet()).containsExactly("messageId", "timestamp", "deliveryMode", "appId");
        assertEquals(1_700_000_000L, extracted.get("timestamp"));
        assertTrue(PropertyExtractor.properties(null).isEmpty());
    }

    @Test
    public void headerValuesAreConverted() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("text", LongStringHelper.asLongString("héllo"));
        headers.put("binary", new byte[] {0, 1, 2});
        headers.put("invalid", LongStringHelper.asLongString(new byte[] {(byte) 0xC3, (byte) 0x28}));
        headers.put("count", 3);
        headers.put("when", new Date(5_000));
        headers.put("missing", null);
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder().headers(headers).build();

        Map<String, Object> converted = PropertyExtractor.headers(properties);

        assertEquals("héllo", converted.get("text"));
        assertEquals("<binary data: 3 bytes>", converted.get("binary"));
        assertEquals("<binary data: 2 bytes>", converted.get("invalid"));
        assertEquals(3, converted.get("count"));
        assertEquals(5L, converted.get("when"));
        assertThat(converted).doesNotContainKey("missing");
        assertThat(converted.keySet()).containsExactly("binary", "count", "invalid", "text", "when");
    }

    @Test
    public void nestedValuesAreConverted() {
        Map<String, Object> table = new LinkedHashMap<>();
        table.put("name", LongStringHelper.asLongString("x"));
        List<Object> list = Arrays.asList(LongStringHelper.asLongString("a"), table);

        Object converted = PropertyExtractor.convert(list);

        assertEquals(Arrays.asList("a", Collections.singletonMap("name", "x")), converted);
    }

    @Test
    public void textWithLineBreaksIsNotBinary() {
        assertEquals("a\nb\tc", PropertyExtractor.decode("a\nb\tc".getBytes(StandardCharsets.UTF_8)));
    }
}
