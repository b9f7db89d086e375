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

package reactor.rmqcli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.rmqcli.output.OutputOptions;

/**
 * The {@code [FileConfig]} section: file output rotation and message separation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileConfig {

    @JsonProperty("MessagesPerFile")
    private int messagesPerFile = OutputOptions.DEFAULT_MESSAGES_PER_FILE;

    @JsonProperty("MessageDelimiter")
    private String messageDelimiter = OutputOptions.DEFAULT_DELIMITER;

    public int getMessagesPerFile() {
        return messagesPerFile;
    }

    public void setMessagesPerFile(int messagesPerFile) {
        this.messagesPerFile = messagesPerFile;
    }

    public String getMessageDelimiter() {
        return messageDelimiter;
    }

    public void setMessageDelimiter(String messageDelimiter) {
        this.messageDelimiter = messageDelimiter;
    }
}
