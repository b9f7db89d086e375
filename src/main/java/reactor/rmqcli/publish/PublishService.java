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

package reactor.rmqcli.publish;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.RmqCliException;
import reactor.rmqcli.connection.BrokerErrors;
import reactor.rmqcli.connection.RabbitConnectionFactory;
import reactor.rmqcli.output.StatusOutput;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Publishes messages with publisher confirms and the mandatory flag, so that both messages
 * the broker could not take and messages it could not route are reported.
 */
public class PublishService {

    private static final Logger log = LoggerFactory.getLogger(PublishService.class);

    static final Duration CONFIRM_TIMEOUT = Duration.ofSeconds(30);

    private final RabbitConnectionFactory connections;

    private final StatusOutput status;

    public PublishService(RabbitConnectionFactory connections, StatusOutput status) {
        this.connections = connections;
        this.status = status;
    }

    /**
     * Publishes every body {@code options.burst()} times.
     * @throws RmqCliException if there is nothing to publish, the destination does not exist or
     *         the broker does not confirm the messages
     */
    public PublishResult publish(PublishOptions options, List<String> bodies) {
        return publishMessages(options, JsonMessage.ofBodies(bodies));
    }

    /**
     * Publishes every message {@code options.burst()} times, with its own properties and headers
     * merged under the command line options.
     * @see PropertyMerger
     */
    public PublishResult publishMessages(PublishOptions options, List<JsonMessage> messages) {
        if (messages.isEmpty())
            throw new RmqCliException("No messages to publish");
        String exchange = options.queue() != null ? "" : options.exchange();
        String routingKey = options.queue() != null ? options.queue() : options.routingKey();
        if (exchange == null)
            throw new RmqCliException("Either a queue or an exchange is required");

        int total = messages.size() * options.burst();
        log.debug("Publishing {} messages to {} (burst {})", total, options.destination(), options.burst());
        long start = System.nanoTime();
        Connection connection = connections.connect();
        try {
            Channel channel = connection.createChannel();
            checkDestination(channel, options);
            List<String> returned = new ArrayList<>();
            channel.addReturnListener(unroutable -> {
                String messageId = unroutable.getProperties() != null ? unroutable.getProperties().getMessageId() : null;
                log.debug("Message {} returned: {} {}", messageId, unroutable.getReplyCode(), unroutable.getReplyText());
                synchronized (returned) {
                    returned.add(messageId != null ? messageId : "<no id>");
                }
            });
            channel.confirmSelect();

            status.status("Publishing " + messages(total) + " to " + options.destination());
            Map<String, Integer> sizes = new HashMap<>();
            long bytes = 0;
            String baseId = baseMessageId();
            for (int m = 0; m < messages.size(); m++) {
                JsonMessage message = PropertyMerger.merge(messages.get(m), options);
                byte[] body = message.body().getBytes(StandardCharsets.UTF_8);
                String messageSuffix = suffix(m, messages.size());
                for (int b = 0; b < options.burst(); b++) {
                    AMQP.BasicProperties properties = properties(message,
                        baseId + messageSuffix + (options.burst() > 1 ? suffix(b, options.burst()) : ""));
                    String messageId = properties.getMessageId();
                    channel.basicPublish(exchange, routingKey, true, properties, body);
                    sizes.put(messageId, body.length);
                    bytes += body.length;
                    log.trace("Published {} ({} bytes)", messageId, body.length);
                }
            }
            channel.waitForConfirmsOrDie(CONFIRM_TIMEOUT.toMillis());

            List<String> failed;
            synchronized (returned) {
                failed = new ArrayList<>(returned);
            }
            for (String messageId : failed)
                bytes -= sizes.getOrDefault(messageId, 0);
            return new PublishResult(options.destination(), total - failed.size(), failed, bytes,
                Duration.ofNanos(System.nanoTime() - start));
        } catch (IOException | AlreadyClosedException e) {
            throw new RmqCliException("Failed to publish to " + options.destination() + ": "
                + BrokerErrors.describe(e), e);
        } catch (TimeoutException e) {
            throw new RmqCliException("Broker did not confirm the messages within " + CONFIRM_TIMEOUT.getSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RmqCliException("Interrupted while waiting for publisher confirms", e);
        } finally {
            close(connection);
        }
    }

    private static void checkDestination(Channel channel, PublishOptions options) throws IOException {
        try {
            if (options.queue() != null)
                channel.queueDeclarePassive(options.queue());
            else if (!options.exchange().isEmpty())
                channel.exchangeDeclarePassive(options.exchange());
        } catch (IOException e) {
            if (BrokerErrors.replyCode(e) == BrokerErrors.NOT_FOUND) {
                String what = options.queue() != null ? "Queue '" + options.queue() + "'" : "Exchange '" + options.exchange() + "'";
                throw new RmqCliException(what + " not found", e);
            }
            throw e;
        }
    }

    static AMQP.BasicProperties properties(PublishOptions options, String messageId) {
        return properties(PropertyMerger.merge(JsonMessage.ofBody(""), options), messageId);
    }

    /**
     * Builds the AMQP properties of a merged message. The message id and timestamp of the
     * message win over the generated id and the current time.
     */
    static AMQP.BasicProperties properties(JsonMessage message, String generatedId) {
        MessageProperties props = message.properties();
        long timestamp = props.timestamp() != null ? props.timestamp() : System.currentTimeMillis() / 1000;
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
            .messageId(props.messageId() != null ? props.messageId() : generatedId)
            .timestamp(new Date(timestamp * 1000))
            .contentType(props.contentType())
            .contentEncoding(props.contentEncoding())
            .correlationId(props.correlationId())
            .deliveryMode(props.deliveryMode())
            .priority(props.priority())
            .expiration(props.expiration())
            .type(props.type())
            .appId(props.appId())
            .replyTo(props.replyTo())
            .userId(props.userId())
            .clusterId(props.clusterId());
        if (!message.headers().isEmpty())
            builder.headers(new HashMap<>(message.headers()));
        return builder.build();
    }

    /**
     * Returns {@code msg-} followed by the first 13 characters of a random UUID.
     */
    static String baseMessageId() {
        return "msg-" + UUID.randomUUID().toString().substring(0, 13);
    }

    /**
     * Returns the 1-based index, zero padded to the digit count of {@code total}, e.g. {@code -007}
     * for index 6 of 100.
     */
    static String suffix(int index, int total) {
        int digits = String.valueOf(total).length();
        StringBuilder number = new StringBuilder(String.valueOf(index + 1));
        while (number.length() < digits)
            number.insert(0, '0');
        return "-" + number;
    }

    static String messages(long count) {
        return count == 1 ? "1 message" : count + " messages";
    }

    private static void close(Connection connection) {
        try {
            connection.close();
        } catch (IOException | AlreadyClosedException e) {
            log.debug("Connection already closed: {}", e.getMessage());
        }
    }
}
