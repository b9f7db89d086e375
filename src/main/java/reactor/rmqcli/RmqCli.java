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

import static net.sourceforge.argparse4j.impl.Arguments.append;
import static net.sourceforge.argparse4j.impl.Arguments.storeTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import reactor.rmqcli.config.ConfigLoader;
import reactor.rmqcli.config.RabbitMqConfig;
import reactor.rmqcli.config.RmqConfig;
import reactor.rmqcli.connection.RabbitConnectionFactory;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.ConsumeOptions;
import reactor.rmqcli.consume.ConsumeResult;
import reactor.rmqcli.consume.ConsumeService;
import reactor.rmqcli.consume.FailurePolicy;
import reactor.rmqcli.output.MessageOutput;
import reactor.rmqcli.output.MessageOutputFactory;
import reactor.rmqcli.output.OutputFormat;
import reactor.rmqcli.output.OutputOptions;
import reactor.rmqcli.output.StatusOutput;
import reactor.rmqcli.publish.HeaderParser;
import reactor.rmqcli.publish.JsonMessage;
import reactor.rmqcli.publish.JsonMessageParser;
import reactor.rmqcli.publish.MessageSplitter;
import reactor.rmqcli.publish.PublishOptions;
import reactor.rmqcli.publish.PublishResult;
import reactor.rmqcli.publish.PublishService;
import reactor.rmqcli.purge.PurgeResult;
import reactor.rmqcli.purge.PurgeService;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point: {@code rmq consume|peek|publish|purge|config}.
 * <p>
 * Exit codes: 0 on success, 1 on errors, 2 on invalid arguments. Messages go to standard
 * output, status lines and diagnostics to standard error.
 */
public class RmqCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String LOG_LEVEL_PROPERTY = "rmqcli.log.level";

    private final PrintStream out;

    private final PrintStream err;

    private final InputStream in;

    private final ConfigLoader configLoader;

    private final ObjectMapper mapper = new ObjectMapper();

    public RmqCli(PrintStream out, PrintStream err, InputStream in, ConfigLoader configLoader) {
        this.out = out;
        this.err = err;
        this.in = in;
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        RmqCli cli = new RmqCli(System.out, System.err, System.in, new ConfigLoader());
        System.exit(cli.run(args));
    }

    int run(String[] args) {
        ArgumentParser parser = argParser();
        Namespace res;
        try {
            res = parser.parseArgs(args);
        } catch (HelpScreenException e) {
            return EXIT_OK;
        } catch (ArgumentParserException e) {
            PrintWriter writer = new PrintWriter(err, true);
            if (args.length == 0) {
                parser.printHelp(writer);
            } else {
                parser.printUsage(writer);
                writer.println(e.getMessage());
            }
            return EXIT_USAGE;
        }

        // must happen before the first logger is created
        System.setProperty(LOG_LEVEL_PROPERTY, res.getBoolean("verbose") ? "DEBUG" : "WARN");
        StatusOutput status = new StatusOutput(err, res.getBoolean("quiet"),
            !res.getBoolean("noColor") && System.console() != null);
        try {
            String command = res.getString("command");
            switch (command) {
                case "consume":
                    return consume(res, status, false);
                case "peek":
                    return consume(res, status, true);
                case "publish":
                    return publish(res, status);
                case "purge":
                    return purge(res, status);
                case "config":
                    return config(res, status);
                default:
                    status.error("Unknown command " + command);
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            status.error(e.getMessage());
            return EXIT_USAGE;
        } catch (RmqCliException e) {
            status.error(e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int consume(Namespace res, StatusOutput status, boolean peek) {
        RmqConfig config = loadConfig(res, status);
        OutputFormat format = OutputFormat.valueOf(res.getString("format").toUpperCase(Locale.ROOT));
        int count = res.getInt("count");
        String outputFile = res.getString("output");
        OutputOptions outputOptions = new OutputOptions(format, res.getBoolean("compact"),
            outputFile == null ? null : Paths.get(outputFile),
            config.getFileConfig().getMessageDelimiter(), config.getFileConfig().getMessagesPerFile(), count);
        MessageOutput output = MessageOutputFactory.create(outputOptions, out);

        ConsumeOptions options = ConsumeOptions.create(res.getString("queue"))
            .messageCount(count)
            .bufferSize(res.getInt("bufferSize"));
        if (!peek) {
            options = options
                .ackMode(AckMode.valueOf(res.getString("ackMode").toUpperCase(Locale.ROOT)))
                .prefetchCount(res.getInt("prefetch"))
                .failurePolicy(FailurePolicy.valueOf(res.getString("onFailure").toUpperCase(Locale.ROOT)))
                .shutdownTimeout(Duration.ofSeconds(res.getInt("shutdownTimeout")));
        }

        ConsumeService service = new ConsumeService(new RabbitConnectionFactory(rabbitMq(config, res)), status,
            result -> report(result, status));
        ConsumeResult result = peek ? service.peek(options, output) : service.consume(options, output);
        // standard output carries the messages unless they went to a file
        if (outputFile != null)
            printJson(res, result);
        return result.failed() > 0 ? EXIT_ERROR : EXIT_OK;
    }

    private void report(ConsumeResult result, StatusOutput status) {
        String summary = result.processed() + " message(s) from '" + result.queue() + "' in "
            + String.format(Locale.ROOT, "%.2fs", result.durationMs() / 1000.0)
            + " (" + result.messagesPerSecond() + " msg/s, " + result.bytes() + " bytes, ack mode "
            + result.ackMode().name().toLowerCase(Locale.ROOT) + ")";
        if (result.failed() > 0)
            status.warning("Received " + summary + ", " + result.failed() + " failed and were requeued");
        else
            status.success("Received " + summary);
        if (result.stopReason() != null)
            status.status("Stopped: " + result.stopReason().description());
        if (result.halted())
            status.warning("Acknowledgments stopped after a failed message, unacknowledged messages will be redelivered");
    }

    private int publish(Namespace res, StatusOutput status) {
        RmqConfig config = loadConfig(res, status);
        String queue = res.getString("queue");
        String exchange = res.getString("exchange");
        if (queue != null && exchange != null)
            throw new IllegalArgumentException("Use either --queue or --exchange, not both");
        PublishOptions options = queue != null
            ? PublishOptions.toQueue(queue)
            : PublishOptions.toExchange(exchange != null ? exchange : config.getRabbitMq().getExchange(),
                res.getString("routingKey"));
        List<String> headers = res.getList("header");
        options.burst(res.getInt("burst"))
            .headers(HeaderParser.parse(headers == null ? Collections.<String>emptyList() : headers))
            .contentType(res.getString("contentType"))
            .contentEncoding(res.getString("contentEncoding"))
            .correlationId(res.getString("correlationId"))
            .messageId(res.getString("messageId"))
            .persistent(res.getBoolean("persistent"))
            .priority(res.getInt("priority"))
            .expiration(res.getString("expiration"))
            .type(res.getString("type"))
            .appId(res.getString("appId"))
            .replyTo(res.getString("replyTo"))
            .userId(res.getString("userId"));
        String deliveryMode = res.getString("deliveryMode");
        if (deliveryMode != null)
            options.deliveryMode(JsonMessageParser.deliveryMode(deliveryMode));

        List<JsonMessage> messages = readMessages(res, config.getFileConfig().getMessageDelimiter());
        PublishResult result = new PublishService(new RabbitConnectionFactory(rabbitMq(config, res)), status)
            .publishMessages(options, messages);
        if (result.hasFailures()) {
            status.error(result.failed() + " message(s) could not be routed from " + result.destination()
                + ", no queue is bound for routing key '" + options.routingKey() + "'");
        } else {
            status.success("Published " + result.published() + " message(s) to " + result.destination() + " in "
                + String.format(Locale.ROOT, "%.2fs", result.durationMs() / 1000.0));
        }
        printJson(res, result);
        return result.hasFailures() ? EXIT_ERROR : EXIT_OK;
    }

    private List<JsonMessage> readMessages(Namespace res, String delimiter) {
        String json = res.getString("message");
        List<String> bodies = res.getList("messages");
        boolean hasBodies = bodies != null && !bodies.isEmpty();
        String messageFile = res.getString("messageFile");
        if (json != null && messageFile != null)
            throw new IllegalArgumentException("Use either --message or --message-file, not both");
        if (json != null && hasBodies)
            throw new IllegalArgumentException("Use either --message or message arguments, not both");
        Path file = messageFile != null ? Paths.get(messageFile) : null;
        try {
            if (json != null)
                return Collections.singletonList(JsonMessageParser.parseSingle(json));
            if (file == null && hasBodies)
                return JsonMessage.ofBodies(bodies);
            String blob = file != null ? MessageSplitter.read(file) : MessageSplitter.read(in);
            if (JsonMessageParser.isNdjson(blob))
                return JsonMessageParser.parseNdjson(blob);
            return JsonMessage.ofBodies(MessageSplitter.split(blob, delimiter));
        } catch (IOException e) {
            throw new RmqCliException("Failed to read messages: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new RmqCliException("Failed to parse JSON messages: " + e.getMessage(), e);
        }
    }

    private int purge(Namespace res, StatusOutput status) {
        RmqConfig config = loadConfig(res, status);
        BufferedReader console = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        PurgeResult result = new PurgeService(new RabbitConnectionFactory(rabbitMq(config, res)), status, console)
            .purge(res.getString("queue"), res.getBoolean("force"));
        if (result.purged())
            status.success("Purged " + result.messagesPurged() + " message(s) from queue '" + result.queue() + "'");
        else
            status.warning("Purge cancelled");
        printJson(res, result);
        return EXIT_OK;
    }

    private int config(Namespace res, StatusOutput status) {
        String action = res.getString("action");
        switch (action) {
            case "path":
                out.println(configLoader.userConfigPath());
                return EXIT_OK;
            case "init":
                try {
                    if (configLoader.createDefaultUserConfig())
                        status.success("Created " + configLoader.userConfigPath());
                    else
                        status.status("Configuration " + configLoader.userConfigPath() + " already exists");
                } catch (IOException e) {
                    throw new RmqCliException("Failed to create " + configLoader.userConfigPath() + ": " + e.getMessage(), e);
                }
                return EXIT_OK;
            case "show":
            default:
                out.print(configLoader.render(loadConfig(res, status)));
                out.flush();
                return EXIT_OK;
        }
    }

    private RmqConfig loadConfig(Namespace res, StatusOutput status) {
        String custom = res.getString("config");
        Path customPath = custom == null ? null : Paths.get(custom);
        RmqConfig config = configLoader.load(customPath);
        for (String warning : configLoader.warnings())
            status.warning(warning);
        return config;
    }

    /**
     * Applies the connection flags on top of the loaded configuration.
     */
    static RabbitMqConfig rabbitMq(RmqConfig config, Map<String, Object> flags) {
        RabbitMqConfig rabbitMq = config.getRabbitMq();
        if (flags.get("host") != null)
            rabbitMq.setHost((String) flags.get("host"));
        if (flags.get("port") != null)
            rabbitMq.setPort((Integer) flags.get("port"));
        if (flags.get("vhost") != null)
            rabbitMq.setVirtualHost((String) flags.get("vhost"));
        if (flags.get("user") != null)
            rabbitMq.setUser((String) flags.get("user"));
        if (flags.get("password") != null)
            rabbitMq.setPassword((String) flags.get("password"));
        return rabbitMq;
    }

    private static RabbitMqConfig rabbitMq(RmqConfig config, Namespace res) {
        return rabbitMq(config, res.getAttrs());
    }

    private void printJson(Namespace res, Object result) {
        if (!"json".equals(res.getString("format")))
            return;
        try {
            out.println(mapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new RmqCliException("Failed to render result: " + e.getMessage(), e);
        }
    }

    /** Get the command-line argument parser. */
    static ArgumentParser argParser() {
        ArgumentParser parser = ArgumentParsers
                .newFor("rmq")
                .build()
                .defaultHelp(true)
                .description("Command line client for RabbitMQ.");
        Subparsers commands = parser.addSubparsers()
                .dest("command")
                .metavar("COMMAND");

        Subparser consume = commands.addParser("consume")
                .defaultHelp(true)
                .help("consume messages from a queue");
        consume.addArgument("queue")
                .metavar("QUEUE")
                .help("queue to consume from");
        consume.addArgument("--ack-mode")
                .choices("ack", "reject", "requeue")
                .setDefault("ack")
                .dest("ackMode")
                .help("what to do with successfully written messages");
        consume.addArgument("-c", "--count")
                .type(Integer.class)
                .setDefault(-1)
                .help("stop after this many messages, -1 to consume until interrupted");
        consume.addArgument("--prefetch")
                .type(Integer.class)
                .setDefault(100)
                .help("consumer prefetch count, also the acknowledgment batch size");
        consume.addArgument("--on-failure")
                .choices("continue", "halt")
                .setDefault("continue")
                .dest("onFailure")
                .help("keep acknowledging after a message failed to be written, or stop");
        consume.addArgument("--shutdown-timeout")
                .type(Integer.class)
                .setDefault(5)
                .metavar("SECONDS")
                .dest("shutdownTimeout")
                .help("how long Ctrl+C waits for in-flight messages");
        addOutputArguments(consume);
        addConnectionArguments(consume);

        Subparser peek = commands.addParser("peek")
                .defaultHelp(true)
                .help("show messages without removing them from the queue");
        peek.addArgument("queue")
                .metavar("QUEUE")
                .help("queue to peek at");
        peek.addArgument("-c", "--count")
                .type(Integer.class)
                .setDefault(1)
                .help("number of messages, -1 for all");
        addOutputArguments(peek);
        addConnectionArguments(peek);

        Subparser publish = commands.addParser("publish")
                .defaultHelp(true)
                .help("publish messages to a queue or an exchange");
        publish.addArgument("messages")
                .nargs("*")
                .metavar("MESSAGE")
                .help("message bodies, read from --message-file or standard input if none are given");
        publish.addArgument("-q", "--queue")
                .help("publish to this queue through the default exchange");
        publish.addArgument("-e", "--exchange")
                .help("publish to this exchange, defaults to the configured exchange");
        publish.addArgument("-r", "--routing-key")
                .dest("routingKey")
                .setDefault("")
                .help("routing key used with --exchange");
        publish.addArgument("-m", "--message")
                .help("a JSON message: {\"body\": ..., \"properties\": {...}, \"headers\": {...}}");
        publish.addArgument("-f", "--message-file")
                .dest("messageFile")
                .help("read messages from this file, one JSON message per line or split by the configured delimiter");
        publish.addArgument("--burst")
                .type(Integer.class)
                .setDefault(1)
                .help("publish each message this many times");
        publish.addArgument("-H", "--header")
                .action(append())
                .metavar("KEY:VALUE")
                .help("message header, repeatable");
        publish.addArgument("--content-type").dest("contentType");
        publish.addArgument("--content-encoding").dest("contentEncoding");
        publish.addArgument("--correlation-id").dest("correlationId");
        publish.addArgument("--message-id").dest("messageId")
                .help("message id of every message, generated if not set");
        publish.addArgument("--persistent")
                .action(storeTrue())
                .help("delivery mode 2");
        publish.addArgument("--delivery-mode")
                .dest("deliveryMode")
                .choices("transient", "persistent", "1", "2")
                .help("delivery mode, overrides --persistent");
        publish.addArgument("--priority").type(Integer.class);
        publish.addArgument("--expiration")
                .help("per-message TTL in milliseconds");
        publish.addArgument("--type");
        publish.addArgument("--app-id").dest("appId");
        publish.addArgument("--reply-to").dest("replyTo");
        publish.addArgument("--user-id").dest("userId")
                .help("must match the connection user");
        addFormatArgument(publish);
        addConnectionArguments(publish);

        Subparser purge = commands.addParser("purge")
                .defaultHelp(true)
                .help("remove all ready messages from a queue");
        purge.addArgument("queue")
                .metavar("QUEUE");
        purge.addArgument("--force")
                .action(storeTrue())
                .help("do not ask for confirmation");
        addFormatArgument(purge);
        addConnectionArguments(purge);

        Subparser config = commands.addParser("config")
                .defaultHelp(true)
                .help("show or create the configuration");
        config.addArgument("action")
                .choices("path", "show", "init")
                .nargs("?")
                .setDefault("show");
        addConnectionArguments(config);
        return parser;
    }

    private static void addOutputArguments(Subparser subparser) {
        subparser.addArgument("-o", "--output")
                .metavar("FILE")
                .help("write messages to this file instead of standard output");
        subparser.addArgument("--compact")
                .action(storeTrue())
                .help("plain and table formats: only list properties that are set");
        subparser.addArgument("--buffer-size")
                .type(Integer.class)
                .setDefault(ConsumeOptions.DEFAULT_BUFFER_SIZE)
                .dest("bufferSize")
                .help("capacity of the internal message and acknowledgment buffers");
        subparser.addArgument("--format")
                .choices("plain", "table", "json")
                .setDefault("plain")
                .help("message format");
    }

    private static void addFormatArgument(Subparser subparser) {
        subparser.addArgument("--format")
                .choices("plain", "json")
                .setDefault("plain")
                .help("output format");
    }

    private static void addConnectionArguments(Subparser subparser) {
        subparser.addArgument("--config")
                .metavar("FILE")
                .help("additional configuration file");
        subparser.addArgument("--host");
        subparser.addArgument("--port").type(Integer.class);
        subparser.addArgument("--vhost");
        subparser.addArgument("--user");
        subparser.addArgument("--password");
        subparser.addArgument("-v", "--verbose")
                .action(storeTrue())
                .help("debug logging on standard error");
        subparser.addArgument("--quiet")
                .action(storeTrue())
                .help("only print errors on standard error");
        subparser.addArgument("--no-color")
                .action(storeTrue())
                .dest("noColor");
    }
}
