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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
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
 * Pulls messages one at a time with {@code basic.get} until the queue is empty or the
 * message count is reached. Messages are fetched without auto-ack, so they stay with this
 * channel and are not fetched twice.
 */
public class PollingDeliverySource implements DeliverySource {

    private static final Logger log = LoggerFactory.getLogger(PollingDeliverySource.class);

    private final Channel channel;

    private final String queue;

    private final int messageCount;

    private final Scheduler scheduler;

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final AtomicLong received = new AtomicLong();

    private final AtomicReference<StopReason> stopReason = new AtomicReference<>();

    private volatile BoundedChannel<Delivery> messages;

    public PollingDeliverySource(Channel channel, String queue, int messageCount) {
        this(channel, queue, messageCount, Schedulers.boundedElastic());
    }

    PollingDeliverySource(Channel channel, String queue, int messageCount, Scheduler scheduler) {
        this.channel = channel;
        this.queue = queue;
        this.messageCount = messageCount;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> deliver(BoundedChannel<Delivery> messages) {
        return Mono.fromCallable(() -> {
            this.messages = messages;
            try {
                poll(messages);
            } finally {
                messages.close();
            }
            return null;
        })
        .subscribeOn(scheduler)
        .then();
    }

    private void poll(BoundedChannel<Delivery> messages) throws IOException, InterruptedException {
        try {
            while (!cancelled.get()) {
                if (messageCount > 0 && received.get() >= messageCount) {
                    stopReason.compareAndSet(null, StopReason.MESSAGE_COUNT_REACHED);
                    break;
                }
                GetResponse response = channel.basicGet(queue, false);
                if (response == null) {
                    stopReason.compareAndSet(null, StopReason.QUEUE_EMPTY);
                    break;
                }
                messages.send(Delivery.of(queue, response));
                received.incrementAndGet();
            }
        } catch (ChannelClosedException e) {
            log.trace("Message channel of {} closed, stop polling", queue);
        }
        log.debug("Fetched {} messages from {}: {}", received.get(), queue, stopReason.get());
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            stopReason.compareAndSet(null, StopReason.CANCELLED);
            BoundedChannel<Delivery> current = messages;
            if (current != null)
                current.close();
        }
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
        return 0;
    }

    @Override
    public String queue() {
        return queue;
    }
}
