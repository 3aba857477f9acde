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

package com.tessera.protocol.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.JSONUtils;

import java.util.Set;

/**
 * Describes how far the Data API supports a column.
 */
public record ApiSupportDescriptor(String cqlDefinition, boolean createTable, boolean insert, boolean read,
                                   boolean filter) {
    private static final Set<String> KNOWN_KEYS = Set.of("cqlDefinition", "createTable", "insert", "read", "filter");

    public static ApiSupportDescriptor fromJson(JsonNode node) {
        Descriptors.warnResidualKeys(ApiSupportDescriptor.class, node, KNOWN_KEYS);
        return new ApiSupportDescriptor(
                node.path("cqlDefinition").asText(null),
                node.path("createTable").asBoolean(false),
                node.path("insert").asBoolean(false),
                node.path("read").asBoolean(false),
                node.path("filter").asBoolean(false)
        );
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtils.newObject();
        if (cqlDefinition != null) {
            node.put("cqlDefinition", cqlDefinition);
        }
        node.put("createTable", createTable);
        node.put("insert", insert);
        node.put("read", read);
        node.put("filter", filter);
        return node;
    }
}
