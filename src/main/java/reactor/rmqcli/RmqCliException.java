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

package reactor.rmqcli;

/**
 * An error reported to the user as a single line on standard error, ending the command
 * with exit code 1. The message must make sense without the stack trace.
 */
public class RmqCliException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RmqCliException(String message) {
        super(message);
    }

    public RmqCliException(String message, Throwable cause) {
        super(message, cause);
    }
}
