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

package reactor.rmqcli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The {@code [RabbitMq]} section: broker address, credentials and TLS settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"Host", "Port", "VirtualHost", "User", "Password", "Exchange", "ClientName", "UseTls",
    "TlsAcceptAllCertificates"})
public class RabbitMqConfig {

    @JsonProperty("Host")
    private String host = "localhost";

    @JsonProperty("Port")
    private int port = 5672;

    @JsonProperty("VirtualHost")
    private String virtualHost = "/";

    @JsonProperty("User")
    private String user = "guest";

    @JsonProperty("Password")
    private String password = "guest";

    @JsonProperty("Exchange")
    private String exchange = "amq.direct";

    @JsonProperty("ClientName")
    private String clientName = "rmq-cli";

    @JsonProperty("UseTls")
    private boolean useTls;

    @JsonProperty("TlsAcceptAllCertificates")
    private boolean tlsAcceptAllCertificates;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    /**
     * Exchange used by publish when neither a queue nor an exchange is given.
     */
    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    /**
     * Trust any server certificate and skip hostname verification. Only meant for test brokers
     * with self-signed certificates.
     */
    public boolean isTlsAcceptAllCertificates() {
        return tlsAcceptAllCertificates;
    }

    public void setTlsAcceptAllCertificates(boolean tlsAcceptAllCertificates) {
        this.tlsAcceptAllCertificates = tlsAcceptAllCertificates;
    }

    @Override
    public String toString() {
        return "RabbitMqConfig(" + user + "@" + host + ":" + port + virtualHost + ", tls=" + useTls + ")";
    }
}
