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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import org.junit.Before;
import org.junit.Test;
import reactor.core.scheduler.Schedulers;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.consume.StopReason;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class PollingDeliverySourceTest {

    private Channel channel;

    private BoundedChannel<Delivery> messages;

    @Before
    public void setUp() {
        channel = mock(Channel.class);
        messages = new BoundedChannel<>("messages", 100);
    }

    @Test
    public void pollsUntilQueueIsEmpty() throws Exception {
        given(channel.basicGet("orders", false)).willReturn(response(1), response(2), null);
        PollingDeliverySource source = new PollingDeliverySource(channel, "orders", 10, Schedulers.immediate());

        StepVerifier.create(source.deliver(messages)).verifyComplete();

        assertEquals(StopReason.QUEUE_EMPTY, source.stopReason());
        assertEquals(2, source.receivedCount());
        assertEquals(0, source.prefetchCount());
        assertEquals("message-1", messages.receive().bodyAsString());
        assertEquals("message-2", messages.receive().bodyAsString());
        assertNull(messages.receive());
    }

    @Test
    public void stopsAtMessageCountWithoutFetchingMore() throws Exception {
        given(channel.basicGet("orders", false)).willReturn(response(1), response(2), response(3));
        PollingDeliverySource source = new PollingDeliverySource(channel, "orders", 2, Schedulers.immediate());

        StepVerifier.create(source.deliver(messages)).verifyComplete();

        verify(channel, times(2)).basicGet("orders", false);
        assertEquals(StopReason.MESSAGE_COUNT_REACHED, source.stopReason());
        assertTrue(messages.isClosed());
        assertEquals(2, messages.size());
    }

    @Test
    public void cancelStopsPolling() throws Exception {
        given(channel.basicGet("orders", false)).willReturn(response(1));
        BoundedChannel<Delivery> small = new BoundedChannel<>("messages", 1);
        PollingDeliverySource source = new PollingDeliverySource(channel, "orders", 0);

        StepVerifier.create(source.deliver(small))
            .then(() -> {
                while (small.size() == 0)
                    Thread.yield();
                source.cancel();
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertTrue(source.isCancelled());
        assertEquals(StopReason.CANCELLED, source.stopReason());
        assertTrue(small.isClosed());
    }

    @Test
    public void brokerFailureFailsIntake() throws Exception {
        given(channel.basicGet("orders", false)).willThrow(new IOException("channel closed"));
        PollingDeliverySource source = new PollingDeliverySource(channel, "orders", 5, Schedulers.immediate());

        StepVerifier.create(source.deliver(messages))
            .expectErrorMessage("channel closed")
            .verify(Duration.ofSeconds(5));
        assertTrue(messages.isClosed());
    }

    private static GetResponse response(long tag) {
        return new GetResponse(new Envelope(tag, false, "", "orders"), null,
            ("message-" + tag).getBytes(StandardCharsets.UTF_8), 0);
    }
}
