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

/**
 * AMQP properties given with a JSON message. Every property is optional.
 */
public class MessageProperties {

    @Nullable
    private String appId;

    @Nullable
    private String clusterId;

    @Nullable
    private String contentType;

    @Nullable
    private String contentEncoding;

    @Nullable
    private String correlationId;

    @Nullable
    private Integer deliveryMode;

    @Nullable
    private String expiration;

    @Nullable
    private String messageId;

    @Nullable
    private Integer priority;

    @Nullable
    private String replyTo;

    @Nullable
    private Long timestamp;

    @Nullable
    private String type;

    @Nullable
    private String userId;

    public MessageProperties copy() {
        return new MessageProperties()
            .appId(appId)
            .clusterId(clusterId)
            .contentType(contentType)
            .contentEncoding(contentEncoding)
            .correlationId(correlationId)
            .deliveryMode(deliveryMode)
            .expiration(expiration)
            .messageId(messageId)
            .priority(priority)
            .replyTo(replyTo)
            .timestamp(timestamp)
            .type(type)
            .userId(userId);
    }

    @Nullable
    public String appId() {
        return appId;
    }

    public MessageProperties appId(@Nullable String appId) {
        this.appId = appId;
        return this;
    }

    @Nullable
    public String clusterId() {
        return clusterId;
    }

    public MessageProperties clusterId(@Nullable String clusterId) {
        this.clusterId = clusterId;
        return this;
    }

    @Nullable
    public String contentType() {
        return contentType;
    }

    public MessageProperties contentType(@Nullable String contentType) {
        this.contentType = contentType;
        return this;
    }

    @Nullable
    public String contentEncoding() {
        return contentEncoding;
    }

    public MessageProperties contentEncoding(@Nullable String contentEncoding) {
        this.contentEncoding = contentEncoding;
        return this;
    }

    @Nullable
    public String correlationId() {
        return correlationId;
    }

    public MessageProperties correlationId(@Nullable String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    /**
     * {@code 1} for transient, {@code 2} for persistent messages.
     */
    @Nullable
    public Integer deliveryMode() {
        return deliveryMode;
    }

    public MessageProperties deliveryMode(@Nullable Integer deliveryMode) {
        this.deliveryMode = deliveryMode;
        return this;
    }

    @Nullable
    public String expiration() {
        return expiration;
    }

    public MessageProperties expiration(@Nullable String expiration) {
        this.expiration = expiration;
        return this;
    }

    @Nullable
    public String messageId() {
        return messageId;
    }

    public MessageProperties messageId(@Nullable String messageId) {
        this.messageId = messageId;
        return this;
    }

    @Nullable
    public Integer priority() {
        return priority;
    }

    public MessageProperties priority(@Nullable Integer priority) {
        this.priority = priority;
        return this;
    }

    @Nullable
    public String replyTo() {
        return replyTo;
    }

    public MessageProperties replyTo(@Nullable String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    /**
     * Unix time in seconds.
     */
    @Nullable
    public Long timestamp() {
        return timestamp;
    }

    public MessageProperties timestamp(@Nullable Long timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    @Nullable
    public String type() {
        return type;
    }

    public MessageProperties type(@Nullable String type) {
        this.type = type;
        return this;
    }

    @Nullable
    public String userId() {
        return userId;
    }

    public MessageProperties userId(@Nullable String userId) {
        this.userId = userId;
        return this;
    }
}
