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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.rmqcli.RmqCliException;
import reactor.rmqcli.connection.BrokerErrors;
import reactor.rmqcli.connection.RabbitConnectionFactory;
import reactor.rmqcli.consume.internals.AckDispatcher;
import reactor.rmqcli.consume.internals.ConsumePipeline;
import reactor.rmqcli.consume.internals.PollingDeliverySource;
import reactor.rmqcli.consume.internals.SubscriberDeliverySource;
import reactor.rmqcli.output.MessageOutput;
import reactor.rmqcli.output.OutputResult;
import reactor.rmqcli.output.StatusOutput;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Runs {@code consume} and {@code peek}: connects, checks that the queue exists, runs the
 * consume pipeline until the source stops and reports the result.
 */
public class ConsumeService {

    private static final Logger log = LoggerFactory.getLogger(ConsumeService.class);

    private final RabbitConnectionFactory connections;

    private final StatusOutput status;

    private final Consumer<ConsumeResult> reporter;

    /**
     * @param reporter called with the result before the connection is closed, and before a
     *        Ctrl+C triggered JVM exit is released
     */
    public ConsumeService(RabbitConnectionFactory connections, StatusOutput status, Consumer<ConsumeResult> reporter) {
        this.connections = connections;
        this.status = status;
        this.reporter = reporter;
    }

    /**
     * Consumes with a push subscription, settling messages according to the ack mode.
     */
    public ConsumeResult consume(ConsumeOptions options, MessageOutput output) {
        if (options.ackMode() == AckMode.REQUEUE && options.messageCount() <= 0) {
            status.warning("Ack mode requeue without a message count: requeued messages are delivered "
                + "again until the consumer is stopped");
        }
        return run(options, output, false);
    }

    /**
     * Fetches messages with {@code basic.get} and leaves them in the queue.
     */
    public ConsumeResult peek(ConsumeOptions options, MessageOutput output) {
        return run(options.ackMode(AckMode.REQUEUE), output, true);
    }

    private ConsumeResult run(ConsumeOptions options, MessageOutput output, boolean polling) {
        String queue = options.queue();
        Connection connection = connections.connect();
        try {
            Channel channel = connection.createChannel();
            long messagesInQueue = declarePassive(channel, queue);
            status.status((polling ? "Peeking at" : "Consuming") + " messages from queue '" + queue + "' ("
                + messagesInQueue + " ready, ack mode " + options.ackMode().name().toLowerCase(Locale.ROOT) + ")");

            DeliverySource source = polling
                ? new PollingDeliverySource(channel, queue, options.messageCount())
                : new SubscriberDeliverySource(channel, queue, options.prefetchCount(), options.messageCount());
            SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
            AckDispatcher dispatcher = new AckDispatcher(queue, Acknowledger.of(channel), options.ackMode(),
                options.batchSize(), options.failurePolicy(),
                options.consumeListener().andThen(new MicrometerConsumeListener(meterRegistry)));
            ConsumePipeline pipeline = new ConsumePipeline(source, output, dispatcher, options.ackMode(),
                options.bufferSize());

            long start = System.nanoTime();
            try (CancellationHandler cancellation = CancellationHandler.install(pipeline::cancel, options.shutdownTimeout())) {
                OutputResult outputResult = runPipeline(pipeline);
                ConsumeResult result = new ConsumeResult(queue, options.ackMode(), source.receivedCount(), outputResult,
                    Duration.ofNanos(System.nanoTime() - start), source.stopReason(), dispatcher.isHalted());
                logMeters(meterRegistry);
                reporter.accept(result);
                return result;
            }
        } catch (IOException e) {
            throw new RmqCliException("Failed to consume from '" + queue + "': " + BrokerErrors.describe(e), e);
        } finally {
            close(connection);
        }
    }

    private OutputResult runPipeline(ConsumePipeline pipeline) {
        try {
            OutputResult result = pipeline.run().block();
            return result == null ? OutputResult.EMPTY : result;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof AcknowledgmentException)
                throw new RmqCliException(cause.getMessage() + ", unacknowledged messages will be redelivered", cause);
            throw new RmqCliException("Consume failed: " + BrokerErrors.describe(cause), cause);
        }
    }

    static long declarePassive(Channel channel, String queue) throws IOException {
        try {
            return channel.queueDeclarePassive(queue).getMessageCount();
        } catch (IOException e) {
            if (BrokerErrors.replyCode(e) == BrokerErrors.NOT_FOUND)
                throw new RmqCliException("Queue '" + queue + "' not found", e);
            throw e;
        }
    }

    private static void logMeters(SimpleMeterRegistry meterRegistry) {
        if (!log.isDebugEnabled())
            return;
        for (Meter meter : meterRegistry.getMeters()) {
            if (meter instanceof Counter)
                log.debug("{} {} = {}", meter.getId().getName(), meter.getId().getTags(), ((Counter) meter).count());
        }
    }

    private static void close(Connection connection) {
        try {
            connection.close();
        } catch (IOException | AlreadyClosedException e) {
            log.debug("Connection already closed: {}", e.getMessage());
        }
    }
}
