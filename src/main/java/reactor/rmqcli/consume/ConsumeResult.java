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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import reactor.rmqcli.output.OutputResult;
import reactor.util.annotation.Nullable;

import java.time.Duration;

/**
 * Summary of one consume or peek invocation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"queue", "ackMode", "received", "processed", "failed", "bytes", "durationMs",
    "messagesPerSecond", "stopReason", "halted"})
public final class ConsumeResult {

    private final String queue;

    private final AckMode ackMode;

    private final long received;

    private final OutputResult output;

    private final Duration duration;

    @Nullable
    private final StopReason stopReason;

    private final boolean halted;

    public ConsumeResult(String queue, AckMode ackMode, long received, OutputResult output, Duration duration,
                         @Nullable StopReason stopReason, boolean halted) {
        this.queue = queue;
        this.ackMode = ackMode;
        this.received = received;
        this.output = output;
        this.duration = duration;
        this.stopReason = stopReason;
        this.halted = halted;
    }

    @JsonProperty("queue")
    public String queue() {
        return queue;
    }

    @JsonProperty("ackMode")
    public AckMode ackMode() {
        return ackMode;
    }

    @JsonProperty("received")
    public long received() {
        return received;
    }

    @JsonProperty("processed")
    public long processed() {
        return output.processedCount();
    }

    @JsonProperty("failed")
    public long failed() {
        return output.failedCount();
    }

    @JsonProperty("bytes")
    public long bytes() {
        return output.totalBytes();
    }

    public Duration duration() {
        return duration;
    }

    @JsonProperty("durationMs")
    public long durationMs() {
        return duration.toMillis();
    }

    @JsonProperty("messagesPerSecond")
    public double messagesPerSecond() {
        long millis = duration.toMillis();
        if (millis <= 0)
            return 0;
        return Math.round(output.processedCount() * 100_000.0 / millis) / 100.0;
    }

    @Nullable
    public StopReason stopReason() {
        return stopReason;
    }

    @Nullable
    @JsonProperty("stopReason")
    String stopReasonDescription() {
        return stopReason == null ? null : stopReason.description();
    }

    /**
     * True if acknowledging stopped after a failed message, see {@link FailurePolicy#HALT}.
     */
    @JsonProperty("halted")
    public boolean halted() {
        return halted;
    }

    @Override
    public String toString() {
        return "ConsumeResult(queue=" + queue + ", ackMode=" + ackMode + ", received=" + received + ", " + output
            + ", duration=" + duration + ", stopReason=" + stopReason + ")";
    }
}
