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

package reactor.rmqcli.publish;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a publish invocation. Messages returned by the broker as unroutable count as failed.
 */
@JsonPropertyOrder({"destination", "published", "failed", "bytes", "durationMs", "returnedMessageIds"})
public final class PublishResult {

    private final String destination;

    private final long published;

    private final List<String> returnedMessageIds;

    private final long bytes;

    private final Duration duration;

    public PublishResult(String destination, long published, List<String> returnedMessageIds, long bytes,
                         Duration duration) {
        this.destination = destination;
        this.published = published;
        this.returnedMessageIds = Collections.unmodifiableList(returnedMessageIds);
        this.bytes = bytes;
        this.duration = duration;
    }

    @JsonProperty("destination")
    public String destination() {
        return destination;
    }

    /**
     * Messages confirmed and routed by the broker.
     */
    @JsonProperty("published")
    public long published() {
        return published;
    }

    @JsonProperty("failed")
    public long failed() {
        return returnedMessageIds.size();
    }

    @JsonProperty("bytes")
    public long bytes() {
        return bytes;
    }

    @JsonProperty("durationMs")
    public long durationMs() {
        return duration.toMillis();
    }

    @JsonProperty("returnedMessageIds")
    public List<String> returnedMessageIds() {
        return returnedMessageIds;
    }

    public boolean hasFailures() {
        return !returnedMessageIds.isEmpty();
    }

    @Override
    public String toString() {
        return "PublishResult(" + destination + ", published=" + published + ", failed=" + failed()
            + ", bytes=" + bytes + ")";
    }
}
