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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-thread schedulers running the output and acknowledgment stages of a consume
 * pipeline. Threads are daemons named {@code rmq-cli-<stage>-<queue>-<n>} so that a stuck
 * stage can be spotted in a thread dump.
 */
final class ConsumeSchedulers {

    private static final Logger log = LoggerFactory.getLogger(ConsumeSchedulers.class);

    static final String THREAD_PREFIX = "rmq-cli-";

    private static final AtomicLong THREAD_COUNTER = new AtomicLong();

    private ConsumeSchedulers() {
    }

    static Scheduler newStage(String queue, String stage) {
        return Schedulers.newSingle(runnable -> {
            Thread thread = new Thread(runnable, THREAD_PREFIX + stage + "-" + queue + "-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                log.error("Stage {} of queue {} failed on {}", stage, queue, t.getName(), e));
            return thread;
        });
    }
}
