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
 * How the acknowledgment dispatcher reacts to a message that could not be written.
 * The failed message itself is always requeued individually.
 */
public enum FailurePolicy {

    /**
     * Keep acknowledging subsequent messages.
     */
    CONTINUE,

    /**
     * Stop acknowledging for the rest of the session. Successfully written messages
     * that were not yet acknowledged are redelivered by the broker later.
     */
    HALT
}
