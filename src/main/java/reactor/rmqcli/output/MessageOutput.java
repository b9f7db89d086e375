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

package reactor.rmqcli.output;

import reactor.rmqcli.consume.AckDecision;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.Delivery;

/**
 * Output stage of the consume pipeline. Renders and writes every delivery taken from the
 * message channel and reports the outcome of each one to the acknowledgment channel.
 * Implementations never talk to the broker.
 */
public interface MessageOutput {

    /**
     * Processes deliveries until {@code messages} is closed and drained, then closes {@code acks}.
     * <p>
     * Exactly one decision is sent per delivery: success once the message was written,
     * failure if formatting or writing it failed. No decision is sent in {@link AckMode#REQUEUE}
     * since nothing is settled with the broker in that mode.
     * <p>
     * Processing stops early if {@code acks} is closed by the acknowledgment dispatcher after a
     * broker failure.
     *
     * @param messages channel of deliveries to write
     * @param acks channel receiving one decision per delivery
     * @param ackMode acknowledgment mode of the session
     * @return counters of the processed deliveries
     * @throws InterruptedException if interrupted while waiting on one of the channels
     */
    OutputResult process(BoundedChannel<Delivery> messages, BoundedChannel<AckDecision> acks, AckMode ackMode)
        throws InterruptedException;
}
