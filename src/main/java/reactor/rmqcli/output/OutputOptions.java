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

import reactor.util.annotation.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how consumed messages are written.
 */
public final class OutputOptions {

    public static final String DEFAULT_DELIMITER = System.lineSeparator();

    public static final int DEFAULT_MESSAGES_PER_FILE = 10_000;

    private final OutputFormat format;

    private final boolean compact;

    @Nullable
    private final Path outputFile;

    private final String messageDelimiter;

    private final int messagesPerFile;

    private final int messageCount;

    public OutputOptions(OutputFormat format, boolean compact, @Nullable Path outputFile,
                         String messageDelimiter, int messagesPerFile, int messageCount) {
        this.format = Objects.requireNonNull(format, "format");
        this.compact = compact;
        this.outputFile = outputFile;
        this.messageDelimiter = messageDelimiter == null ? DEFAULT_DELIMITER : messageDelimiter;
        this.messagesPerFile = messagesPerFile;
        this.messageCount = messageCount;
    }

    /**
     * Console output with default file settings.
     */
    public static OutputOptions console(OutputFormat format, boolean compact) {
        return new OutputOptions(format, compact, null, DEFAULT_DELIMITER, DEFAULT_MESSAGES_PER_FILE, -1);
    }

    public OutputFormat format() {
        return format;
    }

    /**
     * Plain format only: leave out properties that are not set.
     */
    public boolean compact() {
        return compact;
    }

    /**
     * File to write to, {@code null} for standard output.
     */
    @Nullable
    public Path outputFile() {
        return outputFile;
    }

    public String messageDelimiter() {
        return messageDelimiter;
    }

    public int messagesPerFile() {
        return messagesPerFile;
    }

    /**
     * Number of messages that will be consumed, zero or negative if unbounded.
     */
    public int messageCount() {
        return messageCount;
    }

    @Override
    public String toString() {
        return "OutputOptions(format=" + format + ", compact=" + compact + ", outputFile=" + outputFile
            + ", messagesPerFile=" + messagesPerFile + ", messageCount=" + messageCount + ")";
    }
}
