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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.RmqCliException;
import reactor.util.annotation.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads the TOML configuration. Layers, lowest priority first:
 * <ol>
 *     <li>built-in defaults</li>
 *     <li>system file, {@code /etc/rmq/config.toml} or {@value #SYSTEM_CONFIG_ENV}</li>
 *     <li>user file, {@code ~/.config/rmq/config.toml} or {@value #USER_CONFIG_ENV}</li>
 *     <li>file passed with {@code --config}</li>
 *     <li>environment variables {@code RMQCLI_<SECTION>__<KEY>}, e.g. {@code RMQCLI_RABBITMQ__HOST}</li>
 * </ol>
 * Command line flags are applied on top by the caller.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String USER_CONFIG_ENV = "RMQCLI_USER_CONFIG_PATH";

    public static final String SYSTEM_CONFIG_ENV = "RMQCLI_SYSTEM_CONFIG_PATH";

    static final String ENV_PREFIX = "RMQCLI_";

    static final String ENV_SEPARATOR = "__";

    static final String DEFAULT_CONFIG =
        "# rmq configuration file\n"
        + "[RabbitMq]\n"
        + "Host = \"localhost\"\n"
        + "Port = 5672\n"
        + "VirtualHost = \"/\"\n"
        + "User = \"guest\"\n"
        + "Password = \"guest\"\n"
        + "Exchange = \"amq.direct\"\n"
        + "ClientName = \"rmq-cli\"\n"
        + "UseTls = false\n"
        + "## Accept self-signed certificates, never use against production brokers\n"
        + "# TlsAcceptAllCertificates = false\n"
        + "\n"
        + "[FileConfig]\n"
        + "## Number of messages written to one file before rotating\n"
        + "MessagesPerFile = 10000\n"
        + "## Separator between plain text messages, defaults to the platform line separator\n"
        + "# MessageDelimiter = \"\\n\"\n";

    private final Map<String, String> env;

    private final Path home;

    private final TomlMapper mapper;

    private final List<String> warnings = new ArrayList<>();

    public ConfigLoader() {
        this(System.getenv(), Paths.get(System.getProperty("user.home")));
    }

    public ConfigLoader(Map<String, String> env, Path home) {
        this.env = env;
        this.home = home;
        this.mapper = TomlMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public Path userConfigPath() {
        String override = env.get(USER_CONFIG_ENV);
        if (override != null && !override.isEmpty())
            return Paths.get(override);
        return home.resolve(".config").resolve("rmq").resolve("config.toml");
    }

    public Path systemConfigPath() {
        String override = env.get(SYSTEM_CONFIG_ENV);
        if (override != null && !override.isEmpty())
            return Paths.get(override);
        return Paths.get("/etc", "rmq", "config.toml");
    }

    /**
     * Writes the default user configuration file unless it exists.
     * @return true if the file was created
     */
    public boolean createDefaultUserConfig() throws IOException {
        Path path = userConfigPath();
        if (Files.exists(path))
            return false;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.write(path, DEFAULT_CONFIG.getBytes(StandardCharsets.UTF_8));
        log.debug("Created default configuration {}", path);
        return true;
    }

    /**
     * Builds the effective configuration from all layers. A missing user file is created with
     * defaults first, a missing custom file is reported through {@link #warnings()}.
     * @param customConfig file given with {@code --config}, may be {@code null}
     * @throws RmqCliException if a configuration file cannot be parsed
     */
    public RmqConfig load(@Nullable Path customConfig) {
        RmqConfig config = new RmqConfig();
        try {
            createDefaultUserConfig();
        } catch (IOException e) {
            log.debug("Could not create default configuration {}", userConfigPath(), e);
        }
        merge(config, systemConfigPath());
        merge(config, userConfigPath());
        if (customConfig != null) {
            if (Files.isRegularFile(customConfig))
                merge(config, customConfig);
            else
                warnings.add("Configuration file '" + customConfig + "' not found, ignoring it");
        }
        applyEnvironment(config);
        return config;
    }

    private void merge(RmqConfig config, Path path) {
        if (!Files.isRegularFile(path))
            return;
        log.debug("Reading configuration {}", path);
        try {
            mapper.readerForUpdating(config).readValue(path.toFile());
        } catch (IOException e) {
            throw new RmqCliException("Invalid configuration file '" + path + "': " + e.getMessage(), e);
        }
    }

    void applyEnvironment(RmqConfig config) {
        ObjectNode overrides = mapper.createObjectNode();
        for (Map.Entry<String, String> variable : new TreeMap<>(env).entrySet()) {
            String name = variable.getKey();
            if (!name.startsWith(ENV_PREFIX))
                continue;
            String path = name.substring(ENV_PREFIX.length());
            int separator = path.indexOf(ENV_SEPARATOR);
            if (separator <= 0)
                continue;
            String section = path.substring(0, separator);
            String key = path.substring(separator + ENV_SEPARATOR.length()).replace("_", "");
            ObjectNode sectionNode = overrides.has(section) ? (ObjectNode) overrides.get(section) : overrides.putObject(section);
            sectionNode.put(key, variable.getValue());
            log.debug("Configuration {}.{} set from environment", section, key.toLowerCase(Locale.ROOT));
        }
        if (overrides.isEmpty())
            return;
        try {
            mapper.readerForUpdating(config).readValue(mapper.treeAsTokens(overrides));
        } catch (IOException e) {
            throw new RmqCliException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    /**
     * Renders the configuration as TOML, with the password masked.
     */
    public String render(RmqConfig config) {
        ObjectNode tree = mapper.valueToTree(config);
        ObjectNode rabbitMq = (ObjectNode) tree.get("RabbitMq");
        if (rabbitMq != null && rabbitMq.has("Password"))
            rabbitMq.put("Password", "********");
        try {
            return mapper.writeValueAsString(tree);
        } catch (IOException e) {
            throw new RmqCliException("Failed to render configuration: " + e.getMessage(), e);
        }
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
