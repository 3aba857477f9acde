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
import com.tessera.protocol.DataApiException;

import java.util.List;

/**
 * Raised when the Data API accepted a request but reported errors in the response body.
 */
public class DataApiResponseException extends DataApiException {
    private final List<ErrorDescriptor> errors;
    private final transient JsonNode rawResponse;

    public DataApiResponseException(String message, List<ErrorDescriptor> errors, JsonNode rawResponse) {
        super(message);
        this.errors = List.copyOf(errors);
        this.rawResponse = rawResponse;
    }

    public List<ErrorDescriptor> getErrors() {
        return errors;
    }

    public JsonNode getRawResponse() {
        return rawResponse;
    }
}
