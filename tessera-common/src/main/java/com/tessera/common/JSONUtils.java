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

package com.tessera.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class JSONUtils {
    public static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);
    private static final Logger LOGGER = LoggerFactory.getLogger(JSONUtils.class);
    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    public static JsonNode readTree(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to parse JSON content into a tree. ", e);
            throw new TesseraException("JSON deserialization failed", e);
        }
    }

    public static String writeValueAsString(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize Java object to a JSON string. ", e);
            throw new TesseraException("JSON serialization failed", e);
        }
    }

    /**
     * Converts a JSON object node into an insertion-ordered map of plain Java values.
     *
     * @param node a JSON object, must not be null
     * @return a mutable map holding the node's fields in order
     */
    public static Map<String, Object> toDocument(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new TesseraException("Expected a JSON object but found: " + node);
        }
        return objectMapper.convertValue(node, DOCUMENT_TYPE);
    }

    /**
     * Converts an arbitrary Java value (maps, lists, scalars) into a JSON tree.
     */
    public static JsonNode valueToTree(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Failed to convert Java object to a JSON tree. ", e);
            throw new TesseraException("JSON serialization failed", e);
        }
    }

    public static ObjectNode newObject() {
        return objectMapper.createObjectNode();
    }
}
