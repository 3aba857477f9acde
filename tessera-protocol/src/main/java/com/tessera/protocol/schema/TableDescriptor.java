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
 * A table as listed by {@code listTables} with {@code explain} enabled.
 */
public record TableDescriptor(String name, TableDefinition definition) {

    public static TableDescriptor fromJson(JsonNode node) {
        Descriptors.warnResidualKeys(TableDescriptor.class, node, Set.of("name", "definition"));
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            throw new IllegalArgumentException("table descriptor has no name: " + node);
        }
        return new TableDescriptor(name.asText(), TableDefinition.fromJson(node.path("definition")));
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtils.newObject();
        node.put("name", name);
        node.set("definition", definition.toJson());
        return node;
    }
}
