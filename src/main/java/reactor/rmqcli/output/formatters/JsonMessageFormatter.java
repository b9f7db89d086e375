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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.output.OutputFormat;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Formats a message as a single line JSON document, whatever the compact setting. A body that is itself a JSON object
 * or array is embedded as such, any other body is written as a string.
 */
public class JsonMessageFormatter implements MessageFormatter {

    private static final Logger log = LoggerFactory.getLogger(JsonMessageFormatter.class);

    private final ObjectMapper mapper;

    public JsonMessageFormatter() {
        this(new ObjectMapper());
    }

    public JsonMessageFormatter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String format(Delivery delivery) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        long deliveryTag = delivery.deliveryTag();
        if (deliveryTag >= 0)
            node.put("deliveryTag", deliveryTag);
        else
            node.put("deliveryTag", new BigInteger(Long.toUnsignedString(deliveryTag)));
        node.put("exchange", delivery.exchange());
        node.put("routingKey", delivery.routingKey());
        node.put("queue", delivery.queue());
        node.put("redelivered", delivery.redelivered());
        node.set("body", body(delivery.bodyAsString()));

        Map<String, Object> properties = new LinkedHashMap<>(PropertyExtractor.properties(delivery.properties()));
        Map<String, Object> headers = PropertyExtractor.headers(delivery.properties());
        if (!headers.isEmpty())
            properties.put("headers", headers);
        if (!properties.isEmpty())
            node.set("properties", mapper.valueToTree(properties));
        return mapper.writeValueAsString(node);
    }

    @Override
    public OutputFormat outputFormat() {
        return OutputFormat.JSON;
    }

    private JsonNode body(String body) {
        String trimmed = body.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return mapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.trace("Body is not valid JSON, writing it as a string: {}", e.getOriginalMessage());
            }
        }
        return mapper.getNodeFactory().textNode(body);
    }
}
