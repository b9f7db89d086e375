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

import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.output.formatters.MessageFormatter;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Writes consumed messages to a console stream, usually standard output. Plain text
 * and table messages are separated by a blank line.
 */
public class ConsoleOutput extends AbstractMessageOutput {

    private final PrintStream out;

    private boolean first = true;

    public ConsoleOutput(PrintStream out, MessageFormatter formatter) {
        super(formatter);
        this.out = out;
    }

    @Override
    void write(String formatted, Delivery delivery) throws IOException {
        if (!first && separatesMessages())
            out.println();
        first = false;
        out.println(formatted);
        // PrintStream never throws, errors are only visible through checkError()
        if (out.checkError())
            throw new IOException("Console output stream failed");
    }

    @Override
    void complete() {
        out.flush();
    }

    @Override
    public String toString() {
        return "ConsoleOutput(" + formatter.outputFormat() + ")";
    }
}
