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

package reactor.rmqcli.output;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Counters reported by a {@link MessageOutput} once its message channel is drained.
 */
public final class OutputResult {

    public static final OutputResult EMPTY = new OutputResult(0, 0, 0);

    private final long processedCount;

    private final long failedCount;

    private final long totalBytes;

    public OutputResult(long processedCount, long failedCount, long totalBytes) {
        this.processedCount = processedCount;
        this.failedCount = failedCount;
        this.totalBytes = totalBytes;
    }

    /**
     * Messages written successfully.
     */
    @JsonProperty("processed")
    public long processedCount() {
        return processedCount;
    }

    /**
     * Messages that could not be formatted or written.
     */
    @JsonProperty("failed")
    public long failedCount() {
        return failedCount;
    }

    /**
     * Sum of the body sizes of the messages written successfully.
     */
    @JsonProperty("bytes")
    public long totalBytes() {
        return totalBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        OutputResult that = (OutputResult) o;
        return processedCount == that.processedCount && failedCount == that.failedCount && totalBytes == that.totalBytes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(processedCount, failedCount, totalBytes);
    }

    @Override
    public String toString() {
        return "OutputResult(processed=" + processedCount + ", failed=" + failedCount + ", bytes=" + totalBytes + ")";
    }
}
