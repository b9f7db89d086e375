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

package reactor.rmqcli.purge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"queue", "purged", "messagesPurged"})
public final class PurgeResult {

    private final String queue;

    private final boolean purged;

    private final long messagesPurged;

    PurgeResult(String queue, boolean purged, long messagesPurged) {
        this.queue = queue;
        this.purged = purged;
        this.messagesPurged = messagesPurged;
    }

    static PurgeResult declined(String queue) {
        return new PurgeResult(queue, false, 0);
    }

    @JsonProperty("queue")
    public String queue() {
        return queue;
    }

    /**
     * False if the user did not confirm the purge.
     */
    @JsonProperty("purged")
    public boolean purged() {
        return purged;
    }

    @JsonProperty("messagesPurged")
    public long messagesPurged() {
        return messagesPurged;
    }

    @Override
    public String toString() {
        return "PurgeResult(" + queue + ", purged=" + purged + ", messages=" + messagesPurged + ")";
    }
}
