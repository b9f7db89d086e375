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

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import reactor.rmqcli.RmqCliException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ConfigLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path home;

    private Map<String, String> env;

    @Before
    public void setUp() throws Exception {
        home = folder.newFolder("home").toPath();
        env = new HashMap<>();
        env.put(ConfigLoader.SYSTEM_CONFIG_ENV, home.resolve("system.toml").toString());
    }

    private Path write(String name, String content) throws Exception {
        Path path = home.resolve(name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void defaultsCreateUserConfig() {
        ConfigLoader loader = new ConfigLoader(env, home);

        RmqConfig config = loader.load(null);

        Path userConfig = home.resolve(".config").resolve("rmq").resolve("config.toml");
        assertEquals(userConfig, loader.userConfigPath());
        assertTrue(Files.isRegularFile(userConfig));
        RabbitMqConfig rabbitMq = config.getRabbitMq();
        assertEquals("localhost", rabbitMq.getHost());
        assertEquals(5672, rabbitMq.getPort());
        assertEquals("/", rabbitMq.getVirtualHost());
        assertEquals("guest", rabbitMq.getUser());
        assertEquals("amq.direct", rabbitMq.getExchange());
        assertEquals("rmq-cli", rabbitMq.getClientName());
        assertFalse(rabbitMq.isUseTls());
        assertEquals(10000, config.getFileConfig().getMessagesPerFile());
        assertThat(loader.warnings()).isEmpty();
    }

    @Test
    public void existingUserConfigIsNotOverwritten() throws Exception {
        env.put(ConfigLoader.USER_CONFIG_ENV, write("user.toml", "[RabbitMq]\nHost = \"user-host\"\n").toString());
        ConfigLoader loader = new ConfigLoader(env, home);

        assertFalse(loader.createDefaultUserConfig());
        assertEquals("user-host", loader.load(null).getRabbitMq().getHost());
    }

    @Test
    public void laterLayersOverrideEarlierOnes() throws Exception {
        write("system.toml", "[RabbitMq]\nHost = \"system-host\"\nPort = 5673\nUser = \"system-user\"\n"
            + "[FileConfig]\nMessagesPerFile = 50\n");
        env.put(ConfigLoader.USER_CONFIG_ENV, write("user.toml", "[RabbitMq]\nHost = \"user-host\"\n").toString());
        Path custom = write("custom.toml", "[RabbitMq]\nPort = 5674\n[FileConfig]\nMessageDelimiter = \"---\"\n");
        env.put("RMQCLI_RABBITMQ__VIRTUAL_HOST", "/staging");
        env.put("RMQCLI_RABBITMQ__USE_TLS", "true");

        RmqConfig config = new ConfigLoader(env, home).load(custom);

        RabbitMqConfig rabbitMq = config.getRabbitMq();
        assertEquals("user-host", rabbitMq.getHost());
        assertEquals(5674, rabbitMq.getPort());
        assertEquals("system-user", rabbitMq.getUser());
        assertEquals("/staging", rabbitMq.getVirtualHost());
        assertTrue(rabbitMq.isUseTls());
        assertEquals(50, config.getFileConfig().getMessagesPerFile());
        assertEquals("---", config.getFileConfig().getMessageDelimiter());
    }

    @Test
    public void environmentOverridesFiles() throws Exception {
        Path custom = write("custom.toml", "[RabbitMq]\nHost = \"file-host\"\nPort = 5674\n");
        env.put("RMQCLI_RABBITMQ__HOST", "env-host");
        env.put("RMQCLI_RABBITMQ__PORT", "6000");
        env.put("RMQCLI_FILECONFIG__MESSAGES_PER_FILE", "7");
        env.put("RMQCLI_UNRELATED", "ignored");

        RmqConfig config = new ConfigLoader(env, home).load(custom);

        assertEquals("env-host", config.getRabbitMq().getHost());
        assertEquals(6000, config.getRabbitMq().getPort());
        assertEquals(7, config.getFileConfig().getMessagesPerFile());
    }

    @Test
    public void missingCustomFileIsAWarning() {
        ConfigLoader loader = new ConfigLoader(env, home);
        Path missing = home.resolve("missing.toml");

        RmqConfig config = loader.load(missing);

        assertEquals("localhost", config.getRabbitMq().getHost());
        assertThat(loader.warnings()).containsExactly("Configuration file '" + missing + "' not found, ignoring it");
    }

    @Test
    public void invalidFileFails() throws Exception {
        Path broken = write("broken.toml", "[RabbitMq\nHost = \n");

        assertThatThrownBy(() -> new ConfigLoader(env, home).load(broken))
            .isInstanceOf(RmqCliException.class)
            .hasMessageStartingWith("Invalid configuration file '" + broken + "'");
    }

    @Test
    public void renderMasksPassword() throws Exception {
        Path custom = write("custom.toml", "[RabbitMq]\nPassword = \"s3cr3t\"\nHost = \"render-host\"\n");
        ConfigLoader loader = new ConfigLoader(env, home);

        String rendered = loader.render(loader.load(custom));

        assertThat(rendered).contains("render-host").contains("********").doesNotContain("s3cr3t");
    }
}
