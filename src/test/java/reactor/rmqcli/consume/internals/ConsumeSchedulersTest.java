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

import org.junit.Test;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ConsumeSchedulersTest {

    private static Thread threadOf(Scheduler scheduler) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Thread> thread = new AtomicReference<>();
        scheduler.schedule(() -> {
            thread.set(Thread.currentThread());
            latch.countDown();
        });
        assertTrue("Task not run", latch.await(5, TimeUnit.SECONDS));
        return thread.get();
    }

    @Test
    public void stageThreadsAreNamedDaemons() throws InterruptedException {
        Scheduler acks = ConsumeSchedulers.newStage("orders", "acks");
        Scheduler output = ConsumeSchedulers.newStage("orders", "output");
        try {
            Thread acksThread = threadOf(acks);
            Thread outputThread = threadOf(output);

            assertThat(acksThread.getName()).startsWith("rmq-cli-acks-orders-");
            assertThat(outputThread.getName()).startsWith("rmq-cli-output-orders-");
            assertTrue(acksThread.isDaemon());
            assertNotEquals(acksThread, outputThread);
        } finally {
            acks.dispose();
            output.dispose();
        }
    }
}
