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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code key:value} header arguments. Values are typed: {@code true}/{@code false}
 * become booleans, integral numbers longs, other numbers doubles, anything else strings.
 */
public final class HeaderParser {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private HeaderParser() {
    }

    /**
     * @throws IllegalArgumentException if a header has no colon or an empty key
     */
    public static Map<String, Object> parse(List<String> headers) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String header : headers) {
            int colon = header.indexOf(':');
            if (colon < 0)
                throw new IllegalArgumentException("Invalid header format: '" + header + "'. Expected 'key:value'.");
            String key = header.substring(0, colon).trim();
            if (key.isEmpty())
                throw new IllegalArgumentException("Invalid header format: '" + header + "'. Key cannot be empty.");
            result.put(key, detectType(header.substring(colon + 1).trim()));
        }
        return result;
    }

    static Object detectType(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value))
            return Boolean.parseBoolean(value);
        if (INTEGER.matcher(value).matches()) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return Double.parseDouble(value);
            }
        }
        if (DECIMAL.matcher(value).matches())
            return Double.parseDouble(value);
        return value;
    }
}
