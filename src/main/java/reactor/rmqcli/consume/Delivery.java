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

package reactor.rmqcli.consume;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import reactor.util.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A message received from a queue, together with the routing metadata and the
 * delivery tag needed to acknowledge it.
 */
public final class Delivery {

    private final String exchange;

    private final String routingKey;

    private final String queue;

    private final long deliveryTag;

    private final boolean redelivered;

    @Nullable
    private final AMQP.BasicProperties properties;

    private final byte[] body;

    public Delivery(String exchange, String routingKey, String queue, long deliveryTag, boolean redelivered,
                    @Nullable AMQP.BasicProperties properties, byte[] body) {
        this.exchange = exchange == null ? "" : exchange;
        this.routingKey = routingKey == null ? "" : routingKey;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.properties = properties;
        this.body = body == null ? new byte[0] : body.clone();
    }

    public static Delivery of(String queue, Envelope envelope, @Nullable AMQP.BasicProperties properties, byte[] body) {
        return new Delivery(envelope.getExchange(), envelope.getRoutingKey(), queue, envelope.getDeliveryTag(),
            envelope.isRedeliver(), properties, body);
    }

    public static Delivery of(String queue, GetResponse response) {
        return of(queue, response.getEnvelope(), response.getProps(), response.getBody());
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    public String queue() {
        return queue;
    }

    /**
     * Broker assigned tag, unique and increasing within one channel. AMQP defines it as an
     * unsigned 64-bit value.
     */
    public long deliveryTag() {
        return deliveryTag;
    }

    public boolean redelivered() {
        return redelivered;
    }

    @Nullable
    public AMQP.BasicProperties properties() {
        return properties;
    }

    public byte[] body() {
        return body.clone();
    }

    public int bodySize() {
        return body.length;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Delivery(#" + Long.toUnsignedString(deliveryTag) + ", exchange=" + exchange
            + ", routingKey=" + routingKey + ", queue=" + queue + ", redelivered=" + redelivered
            + ", bodySize=" + body.length + ")";
    }
}
