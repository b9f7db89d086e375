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

import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Produces broker deliveries into the message channel of a consume pipeline.
 * <p>
 * The source closes the message channel when it stops producing, whatever the reason:
 * the message count limit was reached, the queue was drained, the broker cancelled the
 * consumer or {@link #cancel()} was invoked. Deliveries are sent in the order the broker
 * delivered them.
 */
public interface DeliverySource {

    /**
     * Starts producing deliveries into {@code messages}. The returned {@code Mono} completes
     * once the source has stopped and closed the channel, and fails if the broker rejected
     * the subscription.
     * @param messages channel receiving the deliveries
     * @return completion signal of the intake
     */
    Mono<Void> deliver(BoundedChannel<Delivery> messages);

    /**
     * Stops producing deliveries. Deliveries already in the channel are still processed.
     * Idempotent.
     */
    void cancel();

    /**
     * Returns true once {@link #cancel()} was invoked.
     */
    boolean isCancelled();

    /**
     * Why the source stopped, {@code null} while it is still producing.
     */
    @Nullable
    StopReason stopReason();

    /**
     * Number of deliveries received from the broker so far.
     */
    long receivedCount();

    /**
     * Prefetch count applied to the channel, zero if unlimited.
     */
    int prefetchCount();

    /**
     * Queue the deliveries come from.
     */
    String queue();
}
