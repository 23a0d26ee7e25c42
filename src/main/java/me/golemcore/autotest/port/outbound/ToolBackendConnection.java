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

import me.golemcore.autotest.domain.model.ToolDefinition;
import me.golemcore.autotest.domain.model.ToolResult;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A run-scoped session with one tool backend endpoint.
 */
public interface ToolBackendConnection extends Closeable {

    /**
     * Tool catalog of the endpoint.
     */
    List<ToolDefinition> listTools();

    /**
     * Calls a tool. A tool that reports an error completes normally with a
     * failed {@link ToolResult}; a transport or protocol failure completes the
     * future exceptionally.
     */
    CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments);

    /**
     * Calls a tool and waits for the result, strictly one call at a time per
     * run.
     *
     * @throws ToolBackendException
     *             on transport or protocol failure
     */
    default ToolResult invoke(String name, Map<String, Object> arguments) {
        try {
            return callTool(name, arguments).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolBackendException("Interrupted while calling " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new ToolBackendException("Tool call " + name + " failed: " + reason, cause);
        }
    }

    String endpoint();

    /**
     * Best-effort close; never throws.
     */
    @Override
    void close();
}
