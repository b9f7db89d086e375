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

/**
 * Outcome of processing one delivery, sent by the message output to the
 * acknowledgment dispatcher.
 */
public final class AckDecision {

    private final long deliveryTag;

    private final boolean success;

    private AckDecision(long deliveryTag, boolean success) {
        this.deliveryTag = deliveryTag;
        this.success = success;
    }

    public static AckDecision success(long deliveryTag) {
        return new AckDecision(deliveryTag, true);
    }

    public static AckDecision failure(long deliveryTag) {
        return new AckDecision(deliveryTag, false);
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public boolean success() {
        return success;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AckDecision that = (AckDecision) o;
        return deliveryTag == that.deliveryTag && success == that.success;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(deliveryTag) + (success ? 1 : 0);
    }

    @Override
    public String toString() {
        return "AckDecision(#" + Long.toUnsignedString(deliveryTag) + ", " + (success ? "success" : "failure") + ")";
    }
}
