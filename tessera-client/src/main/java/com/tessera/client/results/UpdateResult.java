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
 * Outcome of an update or replace command. A multi-document update may take several
 * requests; the counts are summed over all of them.
 *
 * @param matchedCount  number of documents matching the filter
 * @param modifiedCount number of documents actually changed
 * @param upsertedId    the id of the document created by an upsert, or null
 * @param rawStatuses   the {@code status} object of each response
 */
public record UpdateResult(int matchedCount, int modifiedCount, Object upsertedId, List<JsonNode> rawStatuses) {

    public UpdateResult {
        rawStatuses = List.copyOf(rawStatuses);
    }
}
