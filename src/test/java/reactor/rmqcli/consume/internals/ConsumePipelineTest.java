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

package reactor.rmqcli.consume.internals;

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.Acknowledger;
import reactor.rmqcli.consume.AcknowledgmentException;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.ConsumeListener;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.consume.FailurePolicy;
import reactor.rmqcli.output.ConsoleOutput;
import reactor.rmqcli.output.MessageOutput;
import reactor.rmqcli.output.OutputFormat;
import reactor.rmqcli.output.OutputResult;
import reactor.rmqcli.output.formatters.MessageFormatter;
import reactor.rmqcli.output.formatters.TextMessageFormatter;
import reactor.rmqcli.util.TestUtils;
import reactor.test.StepVerifier;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

public class ConsumePipelineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private Acknowledger acknowledger;

    private ByteArrayOutputStream stdout;

    @Before
    public void setUp() {
        acknowledger = mock(Acknowledger.class);
        stdout = new ByteArrayOutputStream();
    }

    @Test
    public void deliveriesAreWrittenThenAcknowledged() throws Exception {
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 25));
        ConsumePipeline pipeline = pipeline(source, consoleOutput(), AckMode.ACK, 10, FailurePolicy.CONTINUE, 5);

        StepVerifier.create(pipeline.run())
            .assertNext(result -> {
                assertEquals(25, result.processedCount());
                assertEquals(0, result.failedCount());
                assertEquals(9 * 9 + 16 * 10, result.totalBytes());
            })
            .expectComplete()
            .verify(TIMEOUT);

        InOrder inOrder = inOrder(acknowledger);
        inOrder.verify(acknowledger).ack(10, true);
        inOrder.verify(acknowledger).ack(20, true);
        inOrder.verify(acknowledger).ack(25, true);
        verifyNoMoreInteractions(acknowledger);
        String written = new String(stdout.toByteArray(), StandardCharsets.UTF_8);
        assertThat(written).contains("== Message #1 ==", "message-25");
        assertTrue(pipeline.messages().isClosed());
        assertTrue(pipeline.acks().isClosed());
    }

    @Test
    public void failedWritesAreRequeued() throws Exception {
        MessageFormatter formatter = mock(MessageFormatter.class);
        given(formatter.outputFormat()).willReturn(OutputFormat.JSON);
        given(formatter.format(any())).willAnswer(invocation -> {
            Delivery delivery = invocation.getArgument(0);
            if (delivery.deliveryTag() == 3)
                throw new IOException("disk full");
            return delivery.bodyAsString();
        });
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 5));
        ConsumePipeline pipeline = pipeline(source, new ConsoleOutput(new PrintStream(stdout, true), formatter),
            AckMode.ACK, 10, FailurePolicy.CONTINUE, 2);

        OutputResult result = pipeline.run().block(TIMEOUT);

        assertEquals(4, result.processedCount());
        assertEquals(1, result.failedCount());
        InOrder inOrder = inOrder(acknowledger);
        inOrder.verify(acknowledger).nack(3, false, true);
        inOrder.verify(acknowledger).ack(5, true);
        verifyNoMoreInteractions(acknowledger);
    }

    @Test
    public void requeueModeCompletesWithSmallBuffers() {
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 20));
        ConsumePipeline pipeline = pipeline(source, consoleOutput(), AckMode.REQUEUE, 10, FailurePolicy.CONTINUE, 1);

        StepVerifier.create(pipeline.run())
            .assertNext(result -> assertEquals(20, result.processedCount()))
            .expectComplete()
            .verify(TIMEOUT);

        verifyNoInteractions(acknowledger);
    }

    @Test
    public void intakeRunsAtMostOneBufferAheadOfOutput() throws Exception {
        int bufferSize = 3;
        CountDownLatch release = new CountDownLatch(1);
        MessageOutput console = consoleOutput();
        MessageOutput slowOutput = (messages, acks, ackMode) -> {
            release.await();
            return console.process(messages, acks, ackMode);
        };
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 20));
        ConsumePipeline pipeline = pipeline(source, slowOutput, AckMode.ACK, 100, FailurePolicy.CONTINUE, bufferSize);

        CompletableFuture<OutputResult> future = pipeline.run().toFuture();
        TestUtils.waitUntil("Message channel not filled", () -> source.sent.get() == bufferSize, TIMEOUT);
        TestUtils.sleep(100);
        assertEquals(bufferSize, source.sent.get());
        assertEquals(bufferSize, pipeline.messages().size());

        release.countDown();
        OutputResult result = future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        assertEquals(20, result.processedCount());
        verify(acknowledger).ack(20, true);
    }

    @Test
    public void cancelDrainsDeliveriesAlreadyReceived() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        MessageOutput console = consoleOutput();
        MessageOutput slowOutput = (messages, acks, ackMode) -> {
            release.await();
            return console.process(messages, acks, ackMode);
        };
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 1000));
        ConsumePipeline pipeline = pipeline(source, slowOutput, AckMode.ACK, 100, FailurePolicy.CONTINUE, 5);

        CompletableFuture<OutputResult> future = pipeline.run().toFuture();
        TestUtils.waitUntil("Message channel not filled", () -> source.sent.get() == 5, TIMEOUT);
        pipeline.cancel();
        release.countDown();

        OutputResult result = future.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        long sent = source.sent.get();
        assertThat(sent).isLessThan(1000);
        assertEquals(sent, result.processedCount());
        verify(acknowledger).ack(sent, true);
        verifyNoMoreInteractions(acknowledger);
    }

    @Test
    public void acknowledgmentFailureFailsPipelineAndReleasesStages() throws Exception {
        willThrow(new IOException("connection reset")).given(acknowledger).ack(anyLong(), eq(true));
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 200));
        ConsumePipeline pipeline = pipeline(source, consoleOutput(), AckMode.ACK, 5, FailurePolicy.CONTINUE, 2);

        StepVerifier.create(pipeline.run())
            .expectError(AcknowledgmentException.class)
            .verify(TIMEOUT);

        assertTrue(source.isCancelled());
        assertTrue(pipeline.messages().isClosed());
        assertTrue(pipeline.acks().isClosed());
        verify(acknowledger).ack(5, true);
    }

    @Test
    public void sourceFailureFailsPipeline() {
        ListDeliverySource source = new ListDeliverySource(TestUtils.deliveries("orders", 3)) {
            @Override
            public Mono<Void> deliver(BoundedChannel<Delivery> messages) {
                messages.close();
                return Mono.error(new IOException("NOT_FOUND"));
            }
        };
        ConsumePipeline pipeline = pipeline(source, consoleOutput(), AckMode.ACK, 5, FailurePolicy.CONTINUE, 2);

        StepVerifier.create(pipeline.run())
            .expectErrorMessage("NOT_FOUND")
            .verify(TIMEOUT);
        assertTrue(pipeline.acks().isClosed());
        verifyNoInteractions(acknowledger);
    }

    private MessageOutput consoleOutput() {
        return new ConsoleOutput(new PrintStream(stdout, true), new TextMessageFormatter(true));
    }

    private ConsumePipeline pipeline(ListDeliverySource source, MessageOutput output, AckMode ackMode, int batchSize,
                                     FailurePolicy failurePolicy, int bufferSize) {
        AckDispatcher dispatcher = new AckDispatcher(source.queue(), acknowledger, ackMode, batchSize, failurePolicy,
            ConsumeListener.NOOP);
        return new ConsumePipeline(source, output, dispatcher, ackMode, bufferSize);
    }
}
