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

import reactor.util.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Destination and message properties of a publish invocation. Either a queue or an
 * exchange is set: a queue is addressed through the default exchange with the queue name
 * as routing key.
 */
public class PublishOptions {

    @Nullable
    private String queue;

    @Nullable
    private String exchange;

    private String routingKey = "";

    private int burst = 1;

    private final Map<String, Object> headers = new LinkedHashMap<>();

    @Nullable
    private String contentType;

    @Nullable
    private String contentEncoding;

    @Nullable
    private String correlationId;

    @Nullable
    private String messageId;

    private boolean persistent;

    @Nullable
    private Integer deliveryMode;

    @Nullable
    private Integer priority;

    @Nullable
    private String expiration;

    @Nullable
    private String type;

    @Nullable
    private String appId;

    @Nullable
    private String replyTo;

    @Nullable
    private String userId;

    public static PublishOptions toQueue(String queue) {
        return new PublishOptions().queue(queue);
    }

    public static PublishOptions toExchange(String exchange, String routingKey) {
        return new PublishOptions().exchange(exchange).routingKey(routingKey);
    }

    @Nullable
    public String queue() {
        return queue;
    }

    public PublishOptions queue(@Nullable String queue) {
        this.queue = queue;
        return this;
    }

    @Nullable
    public String exchange() {
        return exchange;
    }

    public PublishOptions exchange(@Nullable String exchange) {
        this.exchange = exchange;
        return this;
    }

    public String routingKey() {
        return routingKey;
    }

    public PublishOptions routingKey(@Nullable String routingKey) {
        this.routingKey = routingKey == null ? "" : routingKey;
        return this;
    }

    /**
     * Number of times each message is published.
     */
    public int burst() {
        return burst;
    }

    public PublishOptions burst(int burst) {
        if (burst < 1)
            throw new IllegalArgumentException("Burst count must be >= 1");
        this.burst = burst;
        return this;
    }

    public Map<String, Object> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public PublishOptions headers(Map<String, Object> headers) {
        this.headers.putAll(headers);
        return this;
    }

    @Nullable
    public String contentType() {
        return contentType;
    }

    public PublishOptions contentType(@Nullable String contentType) {
        this.contentType = contentType;
        return this;
    }

    @Nullable
    public String contentEncoding() {
        return contentEncoding;
    }

    public PublishOptions contentEncoding(@Nullable String contentEncoding) {
        this.contentEncoding = contentEncoding;
        return this;
    }

    @Nullable
    public String correlationId() {
        return correlationId;
    }

    public PublishOptions correlationId(@Nullable String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    /**
     * Message id applied to every message. Generated per message when not set.
     */
    @Nullable
    public String messageId() {
        return messageId;
    }

    public PublishOptions messageId(@Nullable String messageId) {
        this.messageId = messageId;
        return this;
    }

    public boolean persistent() {
        return persistent;
    }

    public PublishOptions persistent(boolean persistent) {
        this.persistent = persistent;
        return this;
    }

    /**
     * Explicit delivery mode, or {@code 2} when only {@link #persistent(boolean)} was set.
     */
    @Nullable
    public Integer deliveryMode() {
        if (deliveryMode != null)
            return deliveryMode;
        return persistent ? 2 : null;
    }

    public PublishOptions deliveryMode(@Nullable Integer deliveryMode) {
        if (deliveryMode != null && deliveryMode != 1 && deliveryMode != 2)
            throw new IllegalArgumentException("Delivery mode must be 1 (transient) or 2 (persistent)");
        this.deliveryMode = deliveryMode;
        return this;
    }

    @Nullable
    public Integer priority() {
        return priority;
    }

    public PublishOptions priority(@Nullable Integer priority) {
        if (priority != null && (priority < 0 || priority > 255))
            throw new IllegalArgumentException("Priority must be between 0 and 255");
        this.priority = priority;
        return this;
    }

    @Nullable
    public String expiration() {
        return expiration;
    }

    public PublishOptions expiration(@Nullable String expiration) {
        this.expiration = expiration;
        return this;
    }

    @Nullable
    public String type() {
        return type;
    }

    public PublishOptions type(@Nullable String type) {
        this.type = type;
        return this;
    }

    @Nullable
    public String appId() {
        return appId;
    }

    public PublishOptions appId(@Nullable String appId) {
        this.appId = appId;
        return this;
    }

    @Nullable
    public String replyTo() {
        return replyTo;
    }

    public PublishOptions replyTo(@Nullable String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    @Nullable
    public String userId() {
        return userId;
    }

    public PublishOptions userId(@Nullable String userId) {
        this.userId = userId;
        return this;
    }

    /**
     * Human readable destination, e.g. {@code queue 'orders'}.
     */
    public String destination() {
        if (queue != null)
            return "queue '" + queue + "'";
        return "exchange '" + exchange + "' with routing key '" + routingKey + "'";
    }

    @Override
    public String toString() {
        return "PublishOptions(" + destination() + ", burst=" + burst + ", headers=" + headers.keySet() + ")";
    }
}
