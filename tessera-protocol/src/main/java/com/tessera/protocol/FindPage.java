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

package com.tessera.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.common.JSONUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of a find response.
 *
 * @param documents     the documents of this page, in server order
 * @param nextPageState the continuation token, {@code null} on the last page
 */
public record FindPage(List<Map<String, Object>> documents, String nextPageState) {

    public FindPage {
        documents = Collections.unmodifiableList(documents);
    }

    public boolean hasNextPage() {
        return nextPageState != null;
    }

    public int size() {
        return documents.size();
    }

    /**
     * Parses the body of a {@code find} response.
     *
     * @throws UnexpectedDataApiResponseException if {@code data.documents} is missing
     */
    public static FindPage fromResponse(JsonNode response) {
        JsonNode data = response.path("data");
        JsonNode documents = data.get("documents");
        if (documents == null || !documents.isArray()) {
            throw new UnexpectedDataApiResponseException(
                    "Faulty response from find API command (no 'documents').", response
            );
        }
        List<Map<String, Object>> parsed = new ArrayList<>(documents.size());
        for (JsonNode document : documents) {
            parsed.add(JSONUtils.toDocument(document));
        }
        JsonNode nextPageState = data.get("nextPageState");
        String token = (nextPageState == null || nextPageState.isNull()) ? null : nextPageState.asText();
        return new FindPage(parsed, token);
    }

    @Override
    public String toString() {
        return "FindPage{documents=<" + documents.size() + " entries>" + (nextPageState != null ? ", nextPageState=..." : "") + "}";
    }
}
