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

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import reactor.rmqcli.consume.AckDecision;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.BoundedChannel;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FileOutputTest {

    private static final String NL = System.lineSeparator();

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private BoundedChannel<AckDecision> acks;

    @Before
    public void setUp() {
        acks = new BoundedChannel<>("acks", 100);
    }

    @Test
    public void knownCountFittingOneFileWritesSingleFile() throws Exception {
        Path path = folder.getRoot().toPath().resolve("out.txt");
        FileOutput output = new FileOutput(path, new BodyFormatter(OutputFormat.PLAIN), "---", 10, 3);

        OutputResult result = output.process(ConsoleOutputTest.messages("a", "b", "c"), acks, AckMode.ACK);

        assertFalse(output.isRotating());
        assertEquals(3, result.processedCount());
        assertEquals("a" + NL + "---" + NL + "b" + NL + "---" + NL + "c" + NL, read(path));
        assertThat(ConsoleOutputTest.drain(acks)).hasSize(3);
    }

    @Test
    public void delimiterWithLineBreakIsWrittenAsIs() throws Exception {
        Path path = folder.getRoot().toPath().resolve("out.txt");
        FileOutput output = new FileOutput(path, new BodyFormatter(OutputFormat.PLAIN), "\n", 10, 2);

        output.process(ConsoleOutputTest.messages("a", "b"), acks, AckMode.ACK);

        assertEquals("a" + NL + "\n" + "b" + NL, read(path));
    }

    @Test
    public void unboundedCountRotatesFiles() throws Exception {
        Path path = folder.getRoot().toPath().resolve("out.json");
        FileOutput output = new FileOutput(path, new BodyFormatter(OutputFormat.JSON), "---", 2, -1);

        output.process(ConsoleOutputTest.messages("1", "2", "3", "4", "5"), acks, AckMode.ACK);

        assertTrue(output.isRotating());
        assertFalse(Files.exists(path));
        assertEquals("1" + NL + "2" + NL, read(folder.getRoot().toPath().resolve("out.0.json")));
        assertEquals("3" + NL + "4" + NL, read(folder.getRoot().toPath().resolve("out.1.json")));
        assertEquals("5" + NL, read(folder.getRoot().toPath().resolve("out.2.json")));
    }

    @Test
    public void parentDirectoriesAreCreated() throws Exception {
        Path path = folder.getRoot().toPath().resolve("a").resolve("b").resolve("out.txt");
        FileOutput output = new FileOutput(path, new BodyFormatter(OutputFormat.JSON), "", 10, 1);

        output.process(ConsoleOutputTest.messages("x"), acks, AckMode.ACK);

        assertEquals("x" + NL, read(path));
    }

    @Test
    public void unwritableTargetFailsMessages() throws Exception {
        FileOutput output = new FileOutput(folder.getRoot().toPath(), new BodyFormatter(OutputFormat.JSON), "", 10, 2);

        OutputResult result = output.process(ConsoleOutputTest.messages("x", "y"), acks, AckMode.ACK);

        assertEquals(2, result.failedCount());
        assertThat(ConsoleOutputTest.drain(acks)).containsExactly(AckDecision.failure(1), AckDecision.failure(2));
    }

    @Test
    public void rotation() {
        assertTrue(FileOutput.isRotating(0, 10));
        assertTrue(FileOutput.isRotating(11, 10));
        assertFalse(FileOutput.isRotating(10, 10));
        assertEquals(Paths.get("dir", "out.3.txt"), FileOutput.rotatedPath(Paths.get("dir", "out.txt"), 3));
        assertEquals(Paths.get("out.1"), FileOutput.rotatedPath(Paths.get("out"), 1));
        assertEquals(Paths.get(".messages.0"), FileOutput.rotatedPath(Paths.get(".messages"), 0));
    }

    private static String read(Path path) throws Exception {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
