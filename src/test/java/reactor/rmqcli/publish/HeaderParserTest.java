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

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;

public class HeaderParserTest {

    @Test
    public void valuesAreTyped() {
        Map<String, Object> headers = HeaderParser.parse(Arrays.asList(
            "source:billing", "retry: true", "enabled:FALSE", "count:42", "negative:-7",
            "ratio:0.25", "exp:1e3", "huge:123456789012345678901234567890", "version:1.2.3"));

        assertThat(headers.keySet()).containsExactly("source", "retry", "enabled", "count", "negative",
            "ratio", "exp", "huge", "version");
        assertEquals("billing", headers.get("source"));
        assertEquals(Boolean.TRUE, headers.get("retry"));
        assertEquals(Boolean.FALSE, headers.get("enabled"));
        assertEquals(42L, headers.get("count"));
        assertEquals(-7L, headers.get("negative"));
        assertEquals(0.25, headers.get("ratio"));
        assertEquals(1000.0, headers.get("exp"));
        assertThat(headers.get("huge")).isInstanceOf(Double.class);
        assertEquals("1.2.3", headers.get("version"));
    }

    @Test
    public void valueMayContainColons() {
        Map<String, Object> headers = HeaderParser.parse(Collections.singletonList("url:http://host:8080/x"));

        assertEquals("http://host:8080/x", headers.get("url"));
    }

    @Test
    public void emptyValueIsEmptyString() {
        assertEquals("", HeaderParser.parse(Collections.singletonList("key:")).get("key"));
    }

    @Test
    public void invalidHeadersAreRejected() {
        assertThatThrownBy(() -> HeaderParser.parse(Collections.singletonList("novalue")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid header format: 'novalue'. Expected 'key:value'.");
        assertThatThrownBy(() -> HeaderParser.parse(Collections.singletonList(" :value")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Key cannot be empty");
    }
}
