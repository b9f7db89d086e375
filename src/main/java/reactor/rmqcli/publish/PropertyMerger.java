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
import java.util.Map;

/**
 * Applies command line options on top of the properties and headers of a message. An option
 * given on the command line replaces the message's value, headers are merged by name.
 */
public final class PropertyMerger {

    private PropertyMerger() {
    }

    public static JsonMessage merge(JsonMessage message, PublishOptions options) {
        MessageProperties json = message.properties();
        MessageProperties merged = json.copy()
            .appId(prefer(options.appId(), json.appId()))
            .contentType(prefer(options.contentType(), json.contentType()))
            .contentEncoding(prefer(options.contentEncoding(), json.contentEncoding()))
            .correlationId(prefer(options.correlationId(), json.correlationId()))
            .deliveryMode(prefer(options.deliveryMode(), json.deliveryMode()))
            .expiration(prefer(options.expiration(), json.expiration()))
            .messageId(prefer(options.messageId(), json.messageId()))
            .priority(prefer(options.priority(), json.priority()))
            .replyTo(prefer(options.replyTo(), json.replyTo()))
            .type(prefer(options.type(), json.type()))
            .userId(prefer(options.userId(), json.userId()));

        Map<String, Object> headers = new LinkedHashMap<>(message.headers());
        headers.putAll(options.headers());
        return new JsonMessage(message.body(), merged, headers);
    }

    private static <T> T prefer(T option, T json) {
        return option != null ? option : json;
    }
}
