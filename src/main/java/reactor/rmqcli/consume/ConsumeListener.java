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

/**
 * Called by the acknowledgment dispatcher after each successful broker call. Invoked on
 * the dispatcher thread, implementations must not block.
 */
public interface ConsumeListener {

    ConsumeListener NOOP = new ConsumeListener() { };

    /**
     * A multi-ack covering {@code messages} deliveries up to {@code deliveryTag} was sent.
     */
    default void onAcknowledged(String queue, long deliveryTag, int messages) {
    }

    /**
     * A multi-reject without requeue covering {@code messages} deliveries was sent.
     */
    default void onRejected(String queue, long deliveryTag, int messages) {
    }

    /**
     * A single failed delivery was returned to the queue.
     */
    default void onRequeued(String queue, long deliveryTag) {
    }

    /**
     * Returns a listener notifying this listener, then {@code other}.
     */
    default ConsumeListener andThen(ConsumeListener other) {
        ConsumeListener first = this;
        return new ConsumeListener() {
            @Override
            public void onAcknowledged(String queue, long deliveryTag, int messages) {
                first.onAcknowledged(queue, deliveryTag, messages);
                other.onAcknowledged(queue, deliveryTag, messages);
            }

            @Override
            public void onRejected(String queue, long deliveryTag, int messages) {
                first.onRejected(queue, deliveryTag, messages);
                other.onRejected(queue, deliveryTag, messages);
            }

            @Override
            public void onRequeued(String queue, long deliveryTag) {
                first.onRequeued(queue, deliveryTag);
                other.onRequeued(queue, deliveryTag);
            }
        };
    }
}
