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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.output.formatters.MessageFormatter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes consumed messages to a file.
 * <p>
 * When the number of messages to consume is known and fits into one file, everything is
 * written to the given path. Otherwise the output rotates through {@code base.0.ext},
 * {@code base.1.ext}, ... holding at most {@code messagesPerFile} messages each. Plain text
 * and table messages within one file are separated by the configured delimiter.
 */
public class FileOutput extends AbstractMessageOutput {

    private static final Logger log = LoggerFactory.getLogger(FileOutput.class);

    private final Path path;

    private final String delimiter;

    private final int messagesPerFile;

    private final boolean rotating;

    private BufferedWriter writer;

    private int fileIndex;

    private int messagesInCurrentFile;

    public FileOutput(Path path, MessageFormatter formatter, String delimiter, int messagesPerFile, int messageCount) {
        super(formatter);
        if (messagesPerFile <= 0)
            throw new IllegalArgumentException("Messages per file must be > 0");
        this.path = path;
        this.delimiter = delimiter;
        this.messagesPerFile = messagesPerFile;
        this.rotating = isRotating(messageCount, messagesPerFile);
    }

    static boolean isRotating(int messageCount, int messagesPerFile) {
        return messageCount <= 0 || messageCount > messagesPerFile;
    }

    /**
     * Returns the path of the file with the given index in rotating mode.
     */
    static Path rotatedPath(Path path, int index) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String rotated = dot > 0
            ? fileName.substring(0, dot) + "." + index + fileName.substring(dot)
            : fileName + "." + index;
        return path.resolveSibling(rotated);
    }

    public boolean isRotating() {
        return rotating;
    }

    @Override
    void write(String formatted, Delivery delivery) throws IOException {
        if (writer == null || (rotating && messagesInCurrentFile >= messagesPerFile))
            openNextFile();
        if (messagesInCurrentFile > 0 && separatesMessages()) {
            writer.write(delimiter);
            if (!delimiter.contains("\n"))
                writer.newLine();
        }
        writer.write(formatted);
        writer.newLine();
        writer.flush();
        messagesInCurrentFile++;
    }

    private void openNextFile() throws IOException {
        complete();
        Path target = rotating ? rotatedPath(path, fileIndex++) : path;
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        log.debug("Writing messages to {}", target);
        writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        messagesInCurrentFile = 0;
    }

    @Override
    void complete() throws IOException {
        if (writer != null) {
            BufferedWriter current = writer;
            writer = null;
            current.close();
        }
    }

    @Override
    public String toString() {
        return "FileOutput(" + path + (rotating ? ", rotating every " + messagesPerFile : "") + ")";
    }
}
