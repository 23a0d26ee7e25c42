package me.golemcore.autotest.port.outbound;

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

import java.util.List;

/**
 * Port for the external tool-execution backend. Each run acquires its own
 * connection and closes it when the run ends.
 */
public interface ToolBackendPort {

    /**
     * Opens a connection to the next endpoint of the pool.
     *
     * @throws ToolBackendException
     *             if the endpoint cannot be reached or the handshake fails
     */
    ToolBackendConnection acquire();

    /**
     * Configured endpoints, in round-robin order.
     */
    List<String> endpoints();
}
