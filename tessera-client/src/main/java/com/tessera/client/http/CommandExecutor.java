/*
 * Copyright (c) 2024-2025 Tessera
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a command payload to one Data API resource and returns the parsed response.
 * Failures are reported as unchecked {@link com.tessera.protocol.DataApiException}s.
 */
public interface CommandExecutor {

    JsonNode execute(ObjectNode payload);

    CompletableFuture<JsonNode> executeAsync(ObjectNode payload);

    /**
     * @return a human readable location of the resource, used in logs and errors
     */
    String getAddress();
}
