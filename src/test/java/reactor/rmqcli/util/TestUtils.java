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

package reactor.rmqcli.util;

import com.rabbitmq.client.AMQP;
import reactor.rmqcli.consume.Delivery;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.fail;

public class TestUtils {

    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    public static void waitUntil(String errorMessage, BooleanSupplier condition, Duration duration) {
        long endTimeMillis = System.currentTimeMillis() + duration.toMillis();
        while (System.currentTimeMillis() < endTimeMillis) {
            if (condition.getAsBoolean())
                return;
            TestUtils.sleep(10);
        }
        fail(errorMessage);
    }

    public static void waitForLatch(String errorPrefix, CountDownLatch latch, Duration duration) throws InterruptedException {
        if (!latch.await(duration.toMillis(), TimeUnit.MILLISECONDS))
            fail(errorPrefix + ", remaining=" + latch.getCount());
    }

    public static <T> T execute(Callable<T> callable, long maxTimeMs) throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            return executor.submit(callable).get(maxTimeMs, TimeUnit.MILLISECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    public static Delivery delivery(String queue, long deliveryTag, String body) {
        return delivery(queue, deliveryTag, null, body);
    }

    public static Delivery delivery(String queue, long deliveryTag, AMQP.BasicProperties properties, String body) {
        return new Delivery("", queue, queue, deliveryTag, false, properties, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Deliveries with tags 1 to count and bodies "message-1" to "message-count".
     */
    public static List<Delivery> deliveries(String queue, int count) {
        List<Delivery> deliveries = new ArrayList<>(count);
        for (int i = 1; i <= count; i++)
            deliveries.add(delivery(queue, i, "message-" + i));
        return deliveries;
    }
}
