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

package reactor.rmqcli.purge;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.RmqCliException;
import reactor.rmqcli.connection.BrokerErrors;
import reactor.rmqcli.connection.RabbitConnectionFactory;
import reactor.rmqcli.output.StatusOutput;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Locale;

/**
 * Removes all ready messages from a queue. Unacknowledged messages held by consumers are
 * not affected.
 */
public class PurgeService {

    private static final Logger log = LoggerFactory.getLogger(PurgeService.class);

    private final RabbitConnectionFactory connections;

    private final StatusOutput status;

    private final BufferedReader console;

    /**
     * @param console source of the confirmation answer
     */
    public PurgeService(RabbitConnectionFactory connections, StatusOutput status, BufferedReader console) {
        this.connections = connections;
        this.status = status;
        this.console = console;
    }

    /**
     * Purges {@code queue}, asking for confirmation first unless {@code force} is set.
     * @throws RmqCliException if the queue does not exist or the broker refuses the purge
     */
    public PurgeResult purge(String queue, boolean force) {
        Connection connection = connections.connect();
        try {
            Channel channel = connection.createChannel();
            long ready = declarePassive(channel, queue);
            if (!force && !confirm("Purge " + ready + " ready message(s) from queue '" + queue + "'? [y/N] ")) {
                log.debug("Purge of {} declined", queue);
                return PurgeResult.declined(queue);
            }
            long purged = channel.queuePurge(queue).getMessageCount();
            log.debug("Purged {} messages from {}", purged, queue);
            return new PurgeResult(queue, true, purged);
        } catch (IOException | AlreadyClosedException e) {
            throw new RmqCliException("Failed to purge queue '" + queue + "': " + BrokerErrors.describe(e), e);
        } finally {
            try {
                connection.close();
            } catch (IOException | AlreadyClosedException e) {
                log.debug("Connection already closed: {}", e.getMessage());
            }
        }
    }

    private static long declarePassive(Channel channel, String queue) throws IOException {
        try {
            return channel.queueDeclarePassive(queue).getMessageCount();
        } catch (IOException e) {
            if (BrokerErrors.replyCode(e) == BrokerErrors.NOT_FOUND)
                throw new RmqCliException("Queue '" + queue + "' not found", e);
            throw e;
        }
    }

    private boolean confirm(String question) throws IOException {
        status.prompt(question);
        String answer = console.readLine();
        if (answer == null)
            return false;
        answer = answer.trim().toLowerCase(Locale.ROOT);
        return answer.equals("y") || answer.equals("yes");
    }
}
