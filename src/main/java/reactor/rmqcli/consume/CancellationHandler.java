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

package reactor.rmqcli.consume;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns Ctrl+C into a graceful stop. The shutdown hook runs the cancel action and then holds
 * JVM exit until {@link #complete()} is called or the shutdown timeout expires, whichever
 * comes first. Messages not acknowledged by then are redelivered by the broker.
 */
public class CancellationHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationHandler.class);

    private final Runnable onCancel;

    private final Duration shutdownTimeout;

    private final CountDownLatch done = new CountDownLatch(1);

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private Thread hook;

    CancellationHandler(Runnable onCancel, Duration shutdownTimeout) {
        this.onCancel = onCancel;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Creates a handler and registers its JVM shutdown hook.
     */
    public static CancellationHandler install(Runnable onCancel, Duration shutdownTimeout) {
        CancellationHandler handler = new CancellationHandler(onCancel, shutdownTimeout);
        handler.hook = new Thread(handler::cancel, "rmq-cli-shutdown");
        Runtime.getRuntime().addShutdownHook(handler.hook);
        return handler;
    }

    /**
     * Runs the cancel action once and waits for completion.
     * @return true if {@link #complete()} was called within the shutdown timeout
     */
    boolean cancel() {
        if (!cancelled.compareAndSet(false, true))
            return done.getCount() == 0;
        log.debug("Cancellation requested, waiting up to {} for in-flight messages", shutdownTimeout);
        onCancel.run();
        try {
            if (done.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS))
                return true;
            log.warn("In-flight messages not settled within {}, the broker will redeliver them", shutdownTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void complete() {
        done.countDown();
    }

    @Override
    public void close() {
        complete();
        if (hook == null || cancelled.get())
            return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.trace("JVM shutdown in progress, shutdown hook kept");
        }
    }
}
