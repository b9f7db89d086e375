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

package reactor.rmqcli.consume.internals;

import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.consume.AckDecision;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.Acknowledger;
import reactor.rmqcli.consume.AcknowledgmentException;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.ConsumeListener;
import reactor.rmqcli.consume.FailurePolicy;

import java.io.IOException;

/**
 * Drains the acknowledgment channel and settles deliveries with the broker.
 * <p>
 * Consecutive successes are coalesced into one multiple ack (or multiple reject without
 * requeue in {@link AckMode#REJECT}) every {@code batchSize} deliveries and once more when
 * the channel ends. A failed delivery is requeued on its own. Not thread-safe, a dispatcher
 * instance is driven by one thread for one session.
 */
public class AckDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AckDispatcher.class);

    private final String queue;

    private final Acknowledger acknowledger;

    private final AckMode ackMode;

    private final int batchSize;

    private final FailurePolicy failurePolicy;

    private final ConsumeListener listener;

    private long lastSeenTag;

    private long lastFlushedTag;

    private int pending;

    private boolean halted;

    private long settled;

    private long requeued;

    private long discarded;

    public AckDispatcher(String queue, Acknowledger acknowledger, AckMode ackMode, int batchSize,
                         FailurePolicy failurePolicy, ConsumeListener listener) {
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be > 0");
        this.queue = queue;
        this.acknowledger = acknowledger;
        this.ackMode = ackMode;
        this.batchSize = batchSize;
        this.failurePolicy = failurePolicy;
        this.listener = listener;
    }

    /**
     * Processes decisions until {@code acks} is closed and drained, then flushes the pending
     * successes. Returns immediately in {@link AckMode#REQUEUE}, where nothing is settled.
     * @param acks channel of decisions emitted by the message output
     * @throws AcknowledgmentException if the broker call fails. {@code acks} is closed first
     *         so that a writer blocked on it is released.
     * @throws InterruptedException if interrupted while waiting for a decision
     */
    public void dispatch(BoundedChannel<AckDecision> acks) throws InterruptedException {
        if (ackMode == AckMode.REQUEUE) {
            log.debug("Ack mode REQUEUE, leaving deliveries from {} unacknowledged", queue);
            return;
        }
        long deliveryTag = 0;
        try {
            AckDecision decision;
            while ((decision = acks.receive()) != null) {
                deliveryTag = decision.deliveryTag();
                if (halted) {
                    discarded++;
                    log.trace("Discarding {} after halt", decision);
                } else if (decision.success()) {
                    onSuccess(deliveryTag);
                } else {
                    onFailure(deliveryTag);
                }
            }
            if (!halted) {
                deliveryTag = lastSeenTag;
                flush();
            }
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Acknowledgment of #{} on {} failed", Long.toUnsignedString(deliveryTag), queue, e);
            acks.close();
            throw new AcknowledgmentException(deliveryTag, e);
        }
        log.debug("Acknowledgment channel of {} drained, settled={} requeued={} discarded={}",
            queue, settled, requeued, discarded);
    }

    private void onSuccess(long deliveryTag) throws IOException {
        if (Long.compareUnsigned(deliveryTag, lastFlushedTag) <= 0) {
            log.trace("#{} already covered by multiple ack up to #{}", Long.toUnsignedString(deliveryTag),
                Long.toUnsignedString(lastFlushedTag));
            return;
        }
        if (Long.compareUnsigned(lastSeenTag - lastFlushedTag, batchSize) >= 0)
            flush();
        if (Long.compareUnsigned(deliveryTag, lastSeenTag) > 0)
            lastSeenTag = deliveryTag;
        pending++;
    }

    private void onFailure(long deliveryTag) throws IOException {
        acknowledger.nack(deliveryTag, false, true);
        requeued++;
        listener.onRequeued(queue, deliveryTag);
        log.debug("Requeued #{} after output failure", Long.toUnsignedString(deliveryTag));
        if (failurePolicy == FailurePolicy.HALT) {
            halted = true;
            log.warn("Stopped acknowledging messages from {} after the failure of #{}", queue,
                Long.toUnsignedString(deliveryTag));
        }
    }

    private void flush() throws IOException {
        if (Long.compareUnsigned(lastFlushedTag, lastSeenTag) >= 0)
            return;
        if (ackMode == AckMode.ACK) {
            acknowledger.ack(lastSeenTag, true);
            listener.onAcknowledged(queue, lastSeenTag, pending);
        } else {
            acknowledger.nack(lastSeenTag, true, false);
            listener.onRejected(queue, lastSeenTag, pending);
        }
        log.trace("Settled {} deliveries up to #{} ({})", pending, Long.toUnsignedString(lastSeenTag), ackMode);
        settled += pending;
        lastFlushedTag = lastSeenTag;
        pending = 0;
    }

    public boolean isHalted() {
        return halted;
    }

    /**
     * Number of deliveries acknowledged or rejected through multiple acks.
     */
    public long settledCount() {
        return settled;
    }

    public long requeuedCount() {
        return requeued;
    }
}
