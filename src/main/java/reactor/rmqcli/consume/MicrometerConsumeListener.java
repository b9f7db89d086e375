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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.ImmutableTag;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A consume listener that counts acknowledged, rejected and requeued messages and the
 * broker calls issued for them in a {@link MeterRegistry}.
 * <p>
 * Meters: {@value #MESSAGES} (messages settled, tagged by {@code outcome}) and
 * {@value #CALLS} (ack/nack calls sent to the broker, tagged by {@code outcome}).
 */
public class MicrometerConsumeListener implements ConsumeListener {

    public static final String MESSAGES = "rmq.consume.messages";

    public static final String CALLS = "rmq.consume.broker.calls";

    private final MeterRegistry meterRegistry;

    private final List<Tag> tags = new ArrayList<>();

    /**
     * Construct an instance with the provided registry.
     * @param meterRegistry the registry.
     */
    public MicrometerConsumeListener(MeterRegistry meterRegistry) {
        this(meterRegistry, Collections.emptyList());
    }

    /**
     * Construct an instance with the provided registry and tags.
     * @param meterRegistry the registry.
     * @param tags the tags.
     */
    public MicrometerConsumeListener(MeterRegistry meterRegistry, List<Tag> tags) {
        this.meterRegistry = meterRegistry;
        this.tags.addAll(tags);
    }

    @Override
    public void onAcknowledged(String queue, long deliveryTag, int messages) {
        record(queue, "ack", messages);
    }

    @Override
    public void onRejected(String queue, long deliveryTag, int messages) {
        record(queue, "reject", messages);
    }

    @Override
    public void onRequeued(String queue, long deliveryTag) {
        record(queue, "requeue", 1);
    }

    private void record(String queue, String outcome, int messages) {
        List<Tag> meterTags = new ArrayList<>(this.tags);
        meterTags.add(new ImmutableTag("rmq.queue", queue));
        meterTags.add(new ImmutableTag("outcome", outcome));
        Counter.builder(MESSAGES)
            .description("Messages settled with the broker")
            .tags(meterTags)
            .register(meterRegistry)
            .increment(messages);
        Counter.builder(CALLS)
            .description("Acknowledgment calls sent to the broker")
            .tags(meterTags)
            .register(meterRegistry)
            .increment();
    }
}
