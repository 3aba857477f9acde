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
 * A collection as listed by {@code findCollections} with {@code explain} enabled.
 * The options object is kept as sent by the server.
 */
public record CollectionDescriptor(String name, ObjectNode options) {

    public CollectionDescriptor {
        options = options == null ? JSONUtils.newObject() : options.deepCopy();
    }

    public static CollectionDescriptor fromJson(JsonNode node) {
        if (node.isTextual()) {
            return new CollectionDescriptor(node.asText(), null);
        }
        Descriptors.warnResidualKeys(CollectionDescriptor.class, node, Set.of("name", "options"));
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            throw new IllegalArgumentException("collection descriptor has no name: " + node);
        }
        JsonNode options = node.get("options");
        return new CollectionDescriptor(name.asText(), options instanceof ObjectNode objectNode ? objectNode : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtils.newObject();
        node.put("name", name);
        node.set("options", options.deepCopy());
        return node;
    }
}
