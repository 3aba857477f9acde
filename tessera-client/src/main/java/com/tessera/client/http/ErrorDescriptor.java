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
import com.tessera.common.JSONUtils;

import java.util.Collections;
import java.util.Map;

/**
 * One entry of the {@code errors} array of a Data API response.
 *
 * @param errorCode  the error code, may be null
 * @param message    the error message, may be null
 * @param attributes every other field of the entry
 */
public record ErrorDescriptor(String errorCode, String message, Map<String, Object> attributes) {

    public ErrorDescriptor {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(attributes);
    }

    public static ErrorDescriptor fromJson(JsonNode node) {
        if (!node.isObject()) {
            return new ErrorDescriptor(null, node.asText(), null);
        }
        Map<String, Object> attributes = JSONUtils.toDocument(node);
        Object errorCode = attributes.remove("errorCode");
        Object message = attributes.remove("message");
        return new ErrorDescriptor(
                errorCode == null ? null : errorCode.toString(),
                message == null ? null : message.toString(),
                attributes
        );
    }
}
