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
 * Thrown when the broker rejects or cannot receive an ack/nack call. Not retried: the
 * consume pipeline terminates and the outstanding deliveries are redelivered by the broker.
 */
public class AcknowledgmentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long deliveryTag;

    public AcknowledgmentException(long deliveryTag, Throwable cause) {
        super("Failed to acknowledge message #" + Long.toUnsignedString(deliveryTag) + ": " + cause.getMessage(), cause);
        this.deliveryTag = deliveryTag;
    }

    public long deliveryTag() {
        return deliveryTag;
    }
}
