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

import reactor.util.annotation.NonNull;

import java.time.Duration;

/**
 * Options of one consume or peek invocation. Instances are immutable, every setter
 * returns a new instance.
 */
public interface ConsumeOptions {

    /**
     * Batch size used by the acknowledgment dispatcher when no positive prefetch count is set.
     */
    int DEFAULT_BATCH_SIZE = 100;

    /**
     * Default capacity of the message and acknowledgment channels.
     */
    int DEFAULT_BUFFER_SIZE = 100;

    /**
     * Creates an options instance with default settings for the given queue.
     * @param queue queue to consume from
     * @return new instance of consume options
     */
    @NonNull
    static ConsumeOptions create(@NonNull String queue) {
        return new ImmutableConsumeOptions(queue);
    }

    /**
     * Returns the number of consecutive successes coalesced into one multi-ack for the
     * given prefetch count: the prefetch count itself when positive, {@link #DEFAULT_BATCH_SIZE}
     * otherwise.
     * @param prefetchCount consumer prefetch count
     * @return acknowledgment batch size
     */
    static int batchSize(int prefetchCount) {
        return prefetchCount > 0 ? prefetchCount : DEFAULT_BATCH_SIZE;
    }

    /**
     * Sets the acknowledgment mode applied to successfully written messages.
     * @return options instance with new acknowledgment mode
     */
    @NonNull
    ConsumeOptions ackMode(@NonNull AckMode ackMode);

    /**
     * Sets the consumer prefetch count ({@code basic.qos}). The prefetch count also sets the
     * acknowledgment batch size. Zero or negative means unlimited prefetch and the default batch size.
     * @return options instance with new prefetch count
     */
    @NonNull
    ConsumeOptions prefetchCount(int prefetchCount);

    /**
     * Sets the number of messages after which consumption stops. Zero or negative consumes
     * until cancelled.
     * @return options instance with new message count
     */
    @NonNull
    ConsumeOptions messageCount(int messageCount);

    /**
     * Sets the capacity of the message channel and of the acknowledgment channel. A small
     * capacity limits how far broker intake can run ahead of a slow output.
     * @return options instance with new buffer size
     */
    @NonNull
    ConsumeOptions bufferSize(int bufferSize);

    /**
     * Sets the reaction to messages that could not be written.
     * @return options instance with new failure policy
     */
    @NonNull
    ConsumeOptions failurePolicy(@NonNull FailurePolicy failurePolicy);

    /**
     * Sets how long a cancelled consume waits for in-flight messages to be written and
     * acknowledged before giving up on them.
     * @return options instance with new shutdown timeout
     */
    @NonNull
    ConsumeOptions shutdownTimeout(@NonNull Duration shutdownTimeout);

    /**
     * Sets the listener notified of acknowledgment calls.
     * @return options instance with new listener
     */
    @NonNull
    ConsumeOptions consumeListener(@NonNull ConsumeListener consumeListener);

    @NonNull
    String queue();

    @NonNull
    AckMode ackMode();

    int prefetchCount();

    int messageCount();

    int bufferSize();

    @NonNull
    FailurePolicy failurePolicy();

    @NonNull
    Duration shutdownTimeout();

    @NonNull
    ConsumeListener consumeListener();

    /**
     * Returns the acknowledgment batch size derived from the prefetch count.
     * @return acknowledgment batch size
     */
    default int batchSize() {
        return batchSize(prefetchCount());
    }
}
