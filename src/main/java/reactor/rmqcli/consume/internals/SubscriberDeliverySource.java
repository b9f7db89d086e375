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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.ChannelClosedException;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.consume.DeliverySource;
import reactor.rmqcli.consume.StopReason;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push subscription ({@code basic.consume}) with manual acknowledgment.
 * <p>
 * Deliveries are sent to the message channel from the client's consumer dispatch thread.
 * A full channel blocks that thread, which together with the prefetch count bounds the
 * number of messages held in memory.
 */
public class SubscriberDeliverySource implements DeliverySource {

    private static final Logger log = LoggerFactory.getLogger(SubscriberDeliverySource.class);

    private final Channel channel;

    private final String queue;

    private final int prefetchCount;

    private final int messageCount;

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final AtomicLong received = new AtomicLong();

    private final AtomicReference<StopReason> stopReason = new AtomicReference<>();

    private final Sinks.Empty<Void> done = Sinks.empty();

    private volatile BoundedChannel<Delivery> messages;

    private volatile String consumerTag;

    public SubscriberDeliverySource(Channel channel, String queue, int prefetchCount, int messageCount) {
        this.channel = channel;
        this.queue = queue;
        this.prefetchCount = prefetchCount;
        this.messageCount = messageCount;
    }

    @Override
    public Mono<Void> deliver(BoundedChannel<Delivery> messages) {
        return Mono.defer(() -> {
            this.messages = messages;
            if (cancelled.get()) {
                closeIntake();
                return done.asMono();
            }
            try {
                if (prefetchCount > 0)
                    channel.basicQos(prefetchCount);
                consumerTag = channel.basicConsume(queue, false, new Subscriber(channel));
                log.debug("Consuming from {} with consumer tag {} (prefetch {})", queue, consumerTag, prefetchCount);
            } catch (IOException | AlreadyClosedException e) {
                messages.close();
                return Mono.error(e);
            }
            return done.asMono();
        });
    }

    @Override
    public void cancel() {
        stop(StopReason.CANCELLED);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public StopReason stopReason() {
        return stopReason.get();
    }

    @Override
    public long receivedCount() {
        return received.get();
    }

    @Override
    public int prefetchCount() {
        return prefetchCount;
    }

    @Override
    public String queue() {
        return queue;
    }

    private void stop(StopReason reason) {
        if (!cancelled.compareAndSet(false, true))
            return;
        stopReason.compareAndSet(null, reason);
        log.debug("Stopping consumer on {}: {}", queue, reason.description());
        closeIntake();
        String tag = consumerTag;
        if (tag != null) {
            // basic.cancel waits for the broker, which must not happen on the consumer dispatch thread
            Schedulers.boundedElastic().schedule(() -> cancelConsumer(tag));
        }
    }

    private void cancelConsumer(String tag) {
        try {
            channel.basicCancel(tag);
        } catch (IOException | AlreadyClosedException e) {
            if (channel.isOpen())
                log.warn("Failed to cancel consumer {} on {}: {}", tag, queue, e.getMessage());
            else
                log.debug("Channel already closed while cancelling consumer {}", tag);
        }
    }

    private void closeIntake() {
        BoundedChannel<Delivery> current = messages;
        if (current != null && current.close())
            log.debug("Message channel of {} closed after {} deliveries", queue, received.get());
        done.tryEmitEmpty();
    }

    private final class Subscriber extends DefaultConsumer {

        Subscriber(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            if (cancelled.get()) {
                log.trace("Ignoring delivery #{} after stop, the broker will redeliver it",
                    Long.toUnsignedString(envelope.getDeliveryTag()));
                return;
            }
            try {
                messages.send(Delivery.of(queue, envelope, properties, body));
            } catch (ChannelClosedException e) {
                log.trace("Message channel closed, dropping delivery #{}", Long.toUnsignedString(envelope.getDeliveryTag()));
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop(StopReason.CANCELLED);
                return;
            }
            long count = received.incrementAndGet();
            if (messageCount > 0 && count >= messageCount)
                stop(StopReason.MESSAGE_COUNT_REACHED);
        }

        @Override
        public void handleCancelOk(String tag) {
            log.debug("Consumer {} on {} cancelled", tag, queue);
            closeIntake();
        }

        @Override
        public void handleCancel(String tag) {
            log.warn("Consumer {} was cancelled by the broker, was queue {} deleted?", tag, queue);
            cancelled.set(true);
            stopReason.compareAndSet(null, StopReason.BROKER_CANCELLED);
            closeIntake();
        }

        @Override
        public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
            cancelled.set(true);
            if (sig.isInitiatedByApplication() || !stopReason.compareAndSet(null, StopReason.CHANNEL_SHUTDOWN)) {
                closeIntake();
                return;
            }
            log.warn("Channel of consumer {} shut down: {}", tag, sig.getMessage());
            BoundedChannel<Delivery> current = messages;
            if (current != null)
                current.close();
            done.tryEmitError(sig);
        }
    }
}
