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

package reactor.rmqcli.output;

import reactor.rmqcli.output.formatters.JsonMessageFormatter;
import reactor.rmqcli.output.formatters.MessageFormatter;
import reactor.rmqcli.output.formatters.TableMessageFormatter;
import reactor.rmqcli.output.formatters.TextMessageFormatter;

import java.io.PrintStream;

public final class MessageOutputFactory {

    private MessageOutputFactory() {
    }

    public static MessageFormatter formatter(OutputOptions options) {
        switch (options.format()) {
            case JSON:
                return new JsonMessageFormatter();
            case TABLE:
                return new TableMessageFormatter(options.compact());
            case PLAIN:
            default:
                return new TextMessageFormatter(options.compact());
        }
    }

    /**
     * Creates a file output if the options name a file, a console output writing to {@code stdout} otherwise.
     */
    public static MessageOutput create(OutputOptions options, PrintStream stdout) {
        MessageFormatter formatter = formatter(options);
        if (options.outputFile() == null)
            return new ConsoleOutput(stdout, formatter);
        return new FileOutput(options.outputFile(), formatter, options.messageDelimiter(),
            options.messagesPerFile(), options.messageCount());
    }
}
