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
 * What a successfully written message means to the broker.
 */
public enum AckMode {

    /**
     * Acknowledge the message, removing it from the queue.
     */
    ACK,

    /**
     * Reject the message without requeueing it. The broker discards or dead-letters it.
     */
    REJECT,

    /**
     * Leave messages unacknowledged. The broker returns them to the queue when the
     * consumer or channel goes away.
     */
    REQUEUE
}
