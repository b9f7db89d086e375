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

package reactor.rmqcli;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import reactor.rmqcli.config.ConfigLoader;
import reactor.rmqcli.config.RabbitMqConfig;
import reactor.rmqcli.config.RmqConfig;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RmqCliTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream out;

    private ByteArrayOutputStream err;

    private Path userConfig;

    private RmqCli cli;

    @Before
    public void setUp() throws Exception {
        Path home = folder.newFolder("home").toPath();
        userConfig = home.resolve("rmq.toml");
        Map<String, String> env = new HashMap<>();
        env.put(ConfigLoader.USER_CONFIG_ENV, userConfig.toString());
        env.put(ConfigLoader.SYSTEM_CONFIG_ENV, home.resolve("system.toml").toString());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new RmqCli(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"),
            new ByteArrayInputStream(new byte[0]), new ConfigLoader(env, home));
    }

    private String out() throws Exception {
        return out.toString(StandardCharsets.UTF_8.name());
    }

    private String err() throws Exception {
        return err.toString(StandardCharsets.UTF_8.name());
    }

    @Test
    public void noArgumentsPrintsHelp() throws Exception {
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[0]));
        assertThat(err()).contains("consume").contains("publish").contains("purge");
    }

    @Test
    public void invalidArgumentsAreUsageErrors() throws Exception {
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"consume"}));
        assertThat(err()).contains("usage:");
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"consume", "orders", "--ack-mode", "maybe"}));
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"frobnicate"}));
    }

    @Test
    public void helpExitsSuccessfully() {
        assertEquals(RmqCli.EXIT_OK, cli.run(new String[] {"consume", "--help"}));
    }

    @Test
    public void configPathAndInit() throws Exception {
        assertEquals(RmqCli.EXIT_OK, cli.run(new String[] {"config", "path"}));
        assertEquals(userConfig.toString(), out().trim());

        assertEquals(RmqCli.EXIT_OK, cli.run(new String[] {"config", "init"}));
        assertTrue(Files.isRegularFile(userConfig));
        assertThat(err()).contains("Created " + userConfig);

        assertEquals(RmqCli.EXIT_OK, cli.run(new String[] {"config", "init"}));
        assertThat(err()).contains("already exists");
    }

    @Test
    public void configShowMasksPassword() throws Exception {
        Files.write(userConfig, "[RabbitMq]\nHost = \"cli-host\"\nPassword = \"hidden\"\n"
            .getBytes(StandardCharsets.UTF_8));

        assertEquals(RmqCli.EXIT_OK, cli.run(new String[] {"config"}));

        assertThat(out()).contains("cli-host").contains("********").doesNotContain("hidden");
    }

    @Test
    public void publishRejectsConflictingDestinations() throws Exception {
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"publish", "-q", "orders", "-e", "events", "hi"}));
        assertThat(err()).contains("Use either --queue or --exchange, not both");
    }

    @Test
    public void publishRejectsInvalidHeaders() throws Exception {
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"publish", "-q", "orders", "-H", "broken", "hi"}));
        assertThat(err()).contains("Invalid header format: 'broken'");
    }

    @Test
    public void publishRejectsJsonMessageWithOtherInput() throws Exception {
        String json = "{\"body\":\"hi\"}";
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"publish", "-q", "orders", "--message", json, "hi"}));
        assertThat(err()).contains("Use either --message or message arguments, not both");

        Path file = folder.newFile("messages.ndjson").toPath();
        assertEquals(RmqCli.EXIT_USAGE,
            cli.run(new String[] {"publish", "-q", "orders", "--message", json, "--message-file", file.toString()}));
        assertThat(err()).contains("Use either --message or --message-file, not both");
    }

    @Test
    public void publishReportsInvalidJsonMessage() throws Exception {
        assertEquals(RmqCli.EXIT_ERROR,
            cli.run(new String[] {"publish", "-q", "orders", "--message", "{\"body\": \"hi\", \"properties\": {\"priority\": 300}}"}));
        assertThat(err()).contains("Failed to parse JSON messages").contains("priority must be between 0 and 255");
    }

    @Test
    public void publishRejectsUnknownDeliveryMode() {
        assertEquals(RmqCli.EXIT_USAGE,
            cli.run(new String[] {"publish", "-q", "orders", "--delivery-mode", "durable", "hi"}));
    }

    @Test
    public void publishRejectsInvalidBurst() {
        assertEquals(RmqCli.EXIT_USAGE, cli.run(new String[] {"publish", "-q", "orders", "--burst", "0", "hi"}));
    }

    @Test
    public void connectionFlagsOverrideConfig() {
        RmqConfig config = new RmqConfig();
        Map<String, Object> flags = new HashMap<>();
        flags.put("host", "flag-host");
        flags.put("port", 5999);
        flags.put("user", null);

        RabbitMqConfig rabbitMq = RmqCli.rabbitMq(config, flags);

        assertEquals("flag-host", rabbitMq.getHost());
        assertEquals(5999, rabbitMq.getPort());
        assertEquals("guest", rabbitMq.getUser());
        assertEquals("/", rabbitMq.getVirtualHost());
    }
}
