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

import java.time.Duration;
import java.util.Objects;

class ImmutableConsumeOptions implements ConsumeOptions {

    private static final int DEFAULT_PREFETCH_COUNT = 100;
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String queue;
    private final AckMode ackMode;
    private final int prefetchCount;
    private final int messageCount;
    private final int bufferSize;
    private final FailurePolicy failurePolicy;
    private final Duration shutdownTimeout;
    private final ConsumeListener consumeListener;

    ImmutableConsumeOptions(String queue) {
        this(
            queue,
            AckMode.ACK,
            DEFAULT_PREFETCH_COUNT,
            -1,
            DEFAULT_BUFFER_SIZE,
            FailurePolicy.CONTINUE,
            DEFAULT_SHUTDOWN_TIMEOUT,
            ConsumeListener.NOOP
        );
    }

    ImmutableConsumeOptions(
        String queue,
        AckMode ackMode,
        int prefetchCount,
        int messageCount,
        int bufferSize,
        FailurePolicy failurePolicy,
        Duration shutdownTimeout,
        ConsumeListener consumeListener
    ) {
        if (queue == null || queue.trim().isEmpty())
            throw new IllegalArgumentException("Queue name must not be empty");
        this.queue = queue;
        this.ackMode = ackMode;
        this.prefetchCount = prefetchCount;
        this.messageCount = messageCount;
        this.bufferSize = bufferSize;
        this.failurePolicy = failurePolicy;
        this.shutdownTimeout = shutdownTimeout;
        this.consumeListener = consumeListener;
    }

    @Override
    public String queue() {
        return queue;
    }

    @Override
    public AckMode ackMode() {
        return ackMode;
    }

    @Override
    public ConsumeOptions ackMode(AckMode ackMode) {
        return new ImmutableConsumeOptions(
            queue,
            Objects.requireNonNull(ackMode),
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public int prefetchCount() {
        return prefetchCount;
    }

    @Override
    public ConsumeOptions prefetchCount(int prefetchCount) {
        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public int messageCount() {
        return messageCount;
    }

    @Override
    public ConsumeOptions messageCount(int messageCount) {
        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public int bufferSize() {
        return bufferSize;
    }

    @Override
    public ConsumeOptions bufferSize(int bufferSize) {
        if (bufferSize <= 0)
            throw new IllegalArgumentException("Buffer size must be > 0");

        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    @Override
    public ConsumeOptions failurePolicy(FailurePolicy failurePolicy) {
        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            Objects.requireNonNull(failurePolicy),
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public ConsumeOptions shutdownTimeout(Duration shutdownTimeout) {
        if (shutdownTimeout.isNegative())
            throw new IllegalArgumentException("Shutdown timeout must be >= 0");

        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            consumeListener
        );
    }

    @Override
    public ConsumeListener consumeListener() {
        return consumeListener;
    }

    @Override
    public ConsumeOptions consumeListener(ConsumeListener consumeListener) {
        return new ImmutableConsumeOptions(
            queue,
            ackMode,
            prefetchCount,
            messageCount,
            bufferSize,
            failurePolicy,
            shutdownTimeout,
            Objects.requireNonNull(consumeListener)
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ImmutableConsumeOptions that = (ImmutableConsumeOptions) o;
        return prefetchCount == that.prefetchCount
            && messageCount == that.messageCount
            && bufferSize == that.bufferSize
            && Objects.equals(queue, that.queue)
            && ackMode == that.ackMode
            && failurePolicy == that.failurePolicy
            && Objects.equals(shutdownTimeout, that.shutdownTimeout)
            && Objects.equals(consumeListener, that.consumeListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queue, ackMode, prefetchCount, messageCount, bufferSize, failurePolicy,
            shutdownTimeout, consumeListener);
    }

    @Override
    public String toString() {
        return "ConsumeOptions(queue=" + queue
            + ", ackMode=" + ackMode
            + ", prefetchCount=" + prefetchCount
            + ", messageCount=" + messageCount
            + ", bufferSize=" + bufferSize
            + ", failurePolicy=" + failurePolicy
            + ", shutdownTimeout=" + shutdownTimeout
            + ")";
    }
}
