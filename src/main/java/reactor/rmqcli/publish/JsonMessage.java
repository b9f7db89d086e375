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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message to publish: body, AMQP properties and headers.
 */
public class JsonMessage {

    private final String body;

    private final MessageProperties properties;

    private final Map<String, Object> headers;

    public JsonMessage(String body, MessageProperties properties, Map<String, Object> headers) {
        this.body = body;
        this.properties = properties;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * A message without properties or headers.
     */
    public static JsonMessage ofBody(String body) {
        return new JsonMessage(body, new MessageProperties(), Collections.<String, Object>emptyMap());
    }

    public static List<JsonMessage> ofBodies(List<String> bodies) {
        List<JsonMessage> messages = new ArrayList<>(bodies.size());
        for (String body : bodies)
            messages.add(ofBody(body));
        return messages;
    }

    public String body() {
        return body;
    }

    public MessageProperties properties() {
        return properties;
    }

    public Map<String, Object> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "JsonMessage(" + body.length() + " chars, headers=" + headers.keySet() + ")";
    }
}
