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
import lombok.Data;

import java.util.List;

/**
 * Reachability of the completion service and the tool backend.
 */
@Data
@Builder
public class BackendHealth {

    private boolean llmReachable;
    private String llmProvider;
    private String llmModel;
    private String llmUrl;

    private List<String> toolBackendPool;
    private boolean toolBackendReachable;
    private String toolBackendEndpoint;
    private List<String> toolNames;
    private String error;

    public boolean hasTool(String name) {
        return toolNames != null && toolNames.contains(name);
    }
}
