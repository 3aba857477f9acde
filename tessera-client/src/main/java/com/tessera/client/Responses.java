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

package com.tessera.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.client.results.DeleteResult;
import com.tessera.client.results.InsertOneResult;
import com.tessera.client.results.UpdateResult;
import com.tessera.common.JSONUtils;
import com.tessera.protocol.UnexpectedDataApiResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the results out of Data API responses. Shared by the synchronous and the
 * asynchronous facades.
 */
final class Responses {

    private Responses() {
    }

    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return JSONUtils.objectMapper.convertValue(node, Object.class);
    }

    static Optional<Map<String, Object>> document(JsonNode response, String command) {
        JsonNode data = response.get("data");
        if (data == null || !data.isObject()) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Faulty response from %s API command (no 'data').", command), response
            );
        }
        JsonNode document = data.get("document");
        if (document == null || document.isNull()) {
            return Optional.empty();
        }
        return Optional.of(JSONUtils.toDocument(document));
    }

    static List<Object> insertedIds(JsonNode response, String command) {
        JsonNode ids = response.path("status").get("insertedIds");
        if (ids == null || !ids.isArray()) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Faulty response from %s API command (no 'insertedIds').", command), response
            );
        }
        List<Object> insertedIds = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            insertedIds.add(toJava(id));
        }
        return insertedIds;
    }

    static InsertOneResult insertOneResult(JsonNode response) {
        List<Object> ids = insertedIds(response, "insertOne");
        if (ids.isEmpty()) {
            throw new UnexpectedDataApiResponseException(
                    "Faulty response from insertOne API command (empty 'insertedIds').", response
            );
        }
        return new InsertOneResult(ids.get(0), response);
    }

    /**
     * Sums the counts of the {@code status} objects of one or more update responses.
     */
    static UpdateResult updateResult(List<JsonNode> statuses) {
        int matched = 0;
        int modified = 0;
        Object upsertedId = null;
        for (JsonNode status : statuses) {
            matched += status.path("matchedCount").asInt(0);
            modified += status.path("modifiedCount").asInt(0);
            if (status.hasNonNull("upsertedId")) {
                upsertedId = toJava(status.get("upsertedId"));
            }
        }
        return new UpdateResult(matched, modified, upsertedId, statuses);
    }

    /**
     * @return the deleted count of a response, -1 if the server did not count
     */
    static int deletedCount(JsonNode response, String command) {
        JsonNode count = response.path("status").get("deletedCount");
        if (count == null || !count.canConvertToInt()) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Faulty response from %s API command (no 'deletedCount').", command), response
            );
        }
        return count.asInt();
    }

    static DeleteResult deleteResult(List<JsonNode> responses) {
        int total = 0;
        for (JsonNode response : responses) {
            int count = deletedCount(response, "deleteMany");
            if (count < 0) {
                total = -1;
                break;
            }
            total += count;
        }
        return new DeleteResult(total, responses);
    }

    /**
     * @throws TooManyDocumentsToCountException if the server stopped counting or the count exceeds the upper bound
     */
    static int count(JsonNode response, int upperBound) {
        JsonNode status = response.path("status");
        JsonNode count = status.get("count");
        if (count == null || !count.canConvertToInt()) {
            throw new UnexpectedDataApiResponseException(
                    "Faulty response from countDocuments API command (no 'count').", response
            );
        }
        int value = count.asInt();
        if (status.path("moreData").asBoolean(false)) {
            throw new TooManyDocumentsToCountException(
                    String.format("Document count exceeds %d, the maximum allowed by the server", value), value, true
            );
        }
        if (value > upperBound) {
            throw new TooManyDocumentsToCountException("Document count exceeds required upper bound", upperBound, false);
        }
        return value;
    }

    static int estimatedCount(JsonNode response) {
        JsonNode count = response.path("status").get("count");
        if (count == null || !count.canConvertToInt()) {
            throw new UnexpectedDataApiResponseException(
                    "Faulty response from estimatedDocumentCount API command (no 'count').", response
            );
        }
        return count.asInt();
    }
}
