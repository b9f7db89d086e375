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

import com.rabbitmq.client.Channel;

import java.io.IOException;

/**
 * Broker side acknowledgment primitives used by the acknowledgment dispatcher.
 * Calls are issued sequentially from a single thread.
 */
public interface Acknowledger {

    /**
     * Acknowledges one or several received messages.
     * @param deliveryTag tag of the delivery to acknowledge
     * @param multiple true to acknowledge all outstanding deliveries up to and including the tag
     */
    void ack(long deliveryTag, boolean multiple) throws IOException;

    /**
     * Rejects one or several received messages.
     * @param deliveryTag tag of the delivery to reject
     * @param multiple true to reject all outstanding deliveries up to and including the tag
     * @param requeue true to return the messages to the queue, false to discard or dead-letter them
     */
    void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

    /**
     * Creates an acknowledger issuing {@code basic.ack} and {@code basic.nack} on the given channel.
     * @param channel channel the deliveries were received on
     * @return new acknowledger
     */
    static Acknowledger of(Channel channel) {
        return new Acknowledger() {
            @Override
            public void ack(long deliveryTag, boolean multiple) throws IOException {
                channel.basicAck(deliveryTag, multiple);
            }

            @Override
            public void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
                channel.basicNack(deliveryTag, multiple, requeue);
            }

            @Override
            public String toString() {
                return "Acknowledger(channel=" + channel.getChannelNumber() + ")";
            }
        };
    }
}
