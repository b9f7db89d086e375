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
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Effective configuration, assembled by {@link ConfigLoader} from the configuration layers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RmqConfig {

    @JsonMerge
    @JsonProperty("RabbitMq")
    private RabbitMqConfig rabbitMq = new RabbitMqConfig();

    @JsonMerge
    @JsonProperty("FileConfig")
    private FileConfig fileConfig = new FileConfig();

    public RabbitMqConfig getRabbitMq() {
        return rabbitMq;
    }

    public FileConfig getFileConfig() {
        return fileConfig;
    }
}
