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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.JSONUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary key of a table: the partition key columns followed by the clustering
 * columns with their sort direction.
 */
public record PrimaryKeyDescriptor(List<String> partitionBy, Map<String, Integer> partitionSort) {

    public PrimaryKeyDescriptor {
        if (partitionBy == null || partitionBy.isEmpty()) {
            throw new IllegalArgumentException("partitionBy cannot be empty");
        }
        partitionBy = List.copyOf(partitionBy);
        partitionSort = partitionSort == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(partitionSort));
    }

    public static PrimaryKeyDescriptor of(String column) {
        return new PrimaryKeyDescriptor(List.of(column), Map.of());
    }

    /**
     * Parses either the object form or the shorthand where a single column name
     * stands for the whole key.
     */
    public static PrimaryKeyDescriptor fromJson(JsonNode node) {
        if (node.isTextual()) {
            return of(node.asText());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Cannot parse a primary key from " + node);
        }
        Descriptors.warnResidualKeys(PrimaryKeyDescriptor.class, node, Set.of("partitionBy", "partitionSort"));
        List<String> partitionBy = new ArrayList<>();
        for (JsonNode column : node.path("partitionBy")) {
            partitionBy.add(column.asText());
        }
        Map<String, Integer> partitionSort = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("partitionSort").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            partitionSort.put(field.getKey(), field.getValue().asInt());
        }
        return new PrimaryKeyDescriptor(partitionBy, partitionSort);
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtils.newObject();
        ArrayNode columns = node.putArray("partitionBy");
        partitionBy.forEach(columns::add);
        ObjectNode sort = node.putObject("partitionSort");
        partitionSort.forEach(sort::put);
        return node;
    }
}
