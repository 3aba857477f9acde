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

package com.tessera.client.results;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * @param deletedCount number of deleted documents, or -1 when the server does not report it
 * @param rawResponses one response per request sent
 */
public record DeleteResult(int deletedCount, List<JsonNode> rawResponses) {

    public DeleteResult {
        rawResponses = List.copyOf(rawResponses);
    }
}
