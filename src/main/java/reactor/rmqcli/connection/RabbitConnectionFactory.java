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

package reactor.rmqcli.connection;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.RmqCliException;
import reactor.rmqcli.config.RabbitMqConfig;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.TimeoutException;

/**
 * Opens broker connections from the {@code [RabbitMq]} configuration.
 */
public class RabbitConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(RabbitConnectionFactory.class);

    private final RabbitMqConfig config;

    public RabbitConnectionFactory(RabbitMqConfig config) {
        this.config = config;
    }

    /**
     * Opens a connection named after the configured client name.
     * @throws RmqCliException if the broker cannot be reached or refuses the connection
     */
    public Connection connect() {
        ConnectionFactory factory = createConnectionFactory();
        log.debug("Connecting to {}", config);
        try {
            return factory.newConnection(config.getClientName());
        } catch (IOException | TimeoutException e) {
            throw new RmqCliException("Could not connect to " + address() + ": " + BrokerErrors.describe(e), e);
        }
    }

    ConnectionFactory createConnectionFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setVirtualHost(config.getVirtualHost());
        factory.setUsername(config.getUser());
        factory.setPassword(config.getPassword());
        // recovery would hide broker failures from the acknowledgment dispatcher
        factory.setAutomaticRecoveryEnabled(false);
        if (config.isUseTls()) {
            try {
                if (config.isTlsAcceptAllCertificates()) {
                    log.warn("TLS certificate validation is disabled");
                    factory.useSslProtocol();
                } else {
                    factory.useSslProtocol(SSLContext.getDefault());
                    factory.enableHostnameVerification();
                }
            } catch (GeneralSecurityException e) {
                throw new RmqCliException("Could not set up TLS: " + e.getMessage(), e);
            }
        }
        return factory;
    }

    public String address() {
        return config.getHost() + ":" + config.getPort() + config.getVirtualHost();
    }
}
