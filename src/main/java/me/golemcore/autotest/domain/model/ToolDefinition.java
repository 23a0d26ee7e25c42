package me.golemcore.autotest.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A tool advertised by the backend through {@code tools/list}: its name, a
 * human description and the JSON Schema of its arguments. Listed once per
 * connection and never mutated afterwards.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    /**
     * Tools without a name cannot be called and are not offered to the model.
     */
    public boolean isCallable() {
        return name != null && !name.isBlank();
    }

    public static List<String> names(List<ToolDefinition> tools) {
        return tools.stream().filter(ToolDefinition::isCallable).map(ToolDefinition::getName).toList();
    }
}
