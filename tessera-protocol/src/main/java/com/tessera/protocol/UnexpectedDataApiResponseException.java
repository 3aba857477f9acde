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

/**
 * Thrown when the Data API answers with a body that does not have the shape
 * expected for the command, e.g. a find response without {@code data.documents}.
 */
public class UnexpectedDataApiResponseException extends DataApiException {
    private final transient JsonNode rawResponse;

    public UnexpectedDataApiResponseException(String message, JsonNode rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public UnexpectedDataApiResponseException(String message, JsonNode rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    /**
     * @return the response as received, or {@code null} if it could not be parsed at all
     */
    public JsonNode getRawResponse() {
        return rawResponse;
    }
}
