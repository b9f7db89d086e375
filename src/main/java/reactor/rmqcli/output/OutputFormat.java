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

/**
 * Rendering of consumed messages.
 */
public enum OutputFormat {

    /**
     * Human readable sections with routing information, properties, headers and body.
     */
    PLAIN,

    /**
     * The sections of {@link #PLAIN} drawn as a framed panel with aligned values.
     */
    TABLE,

    /**
     * One JSON document per message, always on a single line so that the output can be read
     * as NDJSON. {@code --compact} does not apply.
     */
    JSON
}
