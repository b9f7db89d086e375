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
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.rmqcli.consume.AckDecision;
import reactor.rmqcli.consume.AckMode;
import reactor.rmqcli.consume.BoundedChannel;
import reactor.rmqcli.consume.Delivery;
import reactor.rmqcli.consume.DeliverySource;
import reactor.rmqcli.output.MessageOutput;
import reactor.rmqcli.output.OutputResult;
import reactor.util.function.Tuple3;

/**
 * Wires a delivery source, a message output and an acknowledgment dispatcher together
 * through two bounded channels:
 * <pre>
 * source -&gt; messages -&gt; output -&gt; acks -&gt; dispatcher -&gt; broker
 * </pre>
 * The output and the dispatcher run on their own threads, concurrently with intake. The
 * pipeline completes once the source has stopped and both channels are drained. If any
 * stage fails the source is cancelled and both channels are closed so that no stage stays
 * blocked on a channel.
 */
public class ConsumePipeline {

    private static final Logger log = LoggerFactory.getLogger(ConsumePipeline.class);

    private final DeliverySource source;

    private final MessageOutput output;

    private final AckDispatcher dispatcher;

    private final AckMode ackMode;

    private final BoundedChannel<Delivery> messages;

    private final BoundedChannel<AckDecision> acks;

    public ConsumePipeline(DeliverySource source, MessageOutput output, AckDispatcher dispatcher,
                           AckMode ackMode, int bufferSize) {
        this.source = source;
        this.output = output;
        this.dispatcher = dispatcher;
        this.ackMode = ackMode;
        this.messages = new BoundedChannel<>("messages-" + source.queue(), bufferSize);
        this.acks = new BoundedChannel<>("acks-" + source.queue(), bufferSize);
    }

    /**
     * Returns a {@code Mono} that runs the pipeline on subscription and emits the output
     * counters once every stage has completed.
     */
    public Mono<OutputResult> run() {
        return Mono.using(
            () -> new Stages(source.queue()),
            stages -> {
                Mono<Boolean> intake = source.deliver(messages)
                    .doFinally(signal -> messages.close())
                    .thenReturn(Boolean.TRUE);
                Mono<OutputResult> writer = Mono
                    .fromCallable(() -> output.process(messages, acks, ackMode))
                    .subscribeOn(stages.output)
                    .doFinally(signal -> acks.close());
                Mono<Boolean> acknowledgments = Mono
                    .fromCallable(() -> {
                        dispatcher.dispatch(acks);
                        return Boolean.TRUE;
                    })
                    .subscribeOn(stages.acks);
                return Mono.zip(writer, intake, acknowledgments)
                    .map(Tuple3::getT1)
                    .doOnSuccess(result -> log.debug("Consume pipeline of {} completed: {}", source.queue(), result))
                    .doOnError(e -> {
                        log.debug("Consume pipeline of {} failed", source.queue(), e);
                        abort();
                    });
            },
            Stages::dispose
        );
    }

    /**
     * Stops intake. Deliveries already taken from the broker are still written and
     * acknowledged before {@link #run()} completes.
     */
    public void cancel() {
        source.cancel();
    }

    private void abort() {
        source.cancel();
        messages.close();
        acks.close();
    }

    BoundedChannel<Delivery> messages() {
        return messages;
    }

    BoundedChannel<AckDecision> acks() {
        return acks;
    }

    private static final class Stages {

        final Scheduler output;

        final Scheduler acks;

        Stages(String queue) {
            this.output = ConsumeSchedulers.newStage(queue, "output");
            this.acks = ConsumeSchedulers.newStage(queue, "acks");
        }

        void dispose() {
            output.dispose();
            acks.dispose();
        }
    }
}
