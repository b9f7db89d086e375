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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.consume.AckDecision;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.ChannelClosedException;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.output.formatters.MessageFormatter;

import java.io.IOException;

/**
 * Base class of the outputs writing one formatted message at a time.
 */
abstract class AbstractMessageOutput implements MessageOutput {

    private static final Logger log = LoggerFactory.getLogger(AbstractMessageOutput.class);

    final MessageFormatter formatter;

    AbstractMessageOutput(MessageFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public final OutputResult process(BoundedChannel<Delivery> messages, BoundedChannel<AckDecision> acks,
                                      AckMode ackMode) throws InterruptedException {
        log.debug("Starting {} (ack mode {})", this, ackMode);
        long processed = 0;
        long failed = 0;
        long totalBytes = 0;
        try {
            Delivery delivery;
            while ((delivery = messages.receive()) != null) {
                long deliveryTag = delivery.deliveryTag();
                boolean success;
                try {
                    write(formatter.format(delivery), delivery);
                    success = true;
                    processed++;
                    totalBytes += delivery.bodySize();
                    log.trace("Message #{} written to {}", Long.toUnsignedString(deliveryTag), this);
                } catch (IOException | RuntimeException e) {
                    success = false;
                    failed++;
                    log.error("Failed to write message #{}: {}", Long.toUnsignedString(deliveryTag), e.getMessage());
                    log.debug("Write failure of #{}", Long.toUnsignedString(deliveryTag), e);
                }
                if (ackMode != AckMode.REQUEUE && !decide(acks, success, deliveryTag))
                    break;
            }
        } finally {
            acks.close();
            try {
                complete();
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", this, e.getMessage());
            }
        }
        log.debug("{} completed (processed: {}, failed: {})", this, processed, failed);
        return new OutputResult(processed, failed, totalBytes);
    }

    private boolean decide(BoundedChannel<AckDecision> acks, boolean success, long deliveryTag)
        throws InterruptedException {
        try {
            acks.send(success ? AckDecision.success(deliveryTag) : AckDecision.failure(deliveryTag));
            return true;
        } catch (ChannelClosedException e) {
            // closed by the dispatcher after a broker failure, which fails the session
            log.debug("Acknowledgment channel closed, {} stops after #{}", this, Long.toUnsignedString(deliveryTag));
            return false;
        }
    }

    /**
     * Writes one formatted message. Returning normally means the message reached its destination.
     */
    abstract void write(String formatted, Delivery delivery) throws IOException;

    /**
     * Releases the resources of this output, called once after the last message.
     */
    abstract void complete() throws IOException;

    boolean separatesMessages() {
        return formatter.outputFormat() != OutputFormat.JSON;
    }
}
