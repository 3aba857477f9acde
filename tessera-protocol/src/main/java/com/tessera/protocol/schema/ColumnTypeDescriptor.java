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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The type of a table column, as found in table definitions.
 *
 * <p>Parsing never fails on a shape it does not recognize: anything that is not one of
 * the known variants becomes {@link Unknown}, which keeps the raw payload and writes it
 * back verbatim. Servers are free to introduce new column types.
 */
public sealed interface ColumnTypeDescriptor {

    /**
     * @return the API support details sent by the server, or {@code null}
     */
    ApiSupportDescriptor apiSupport();

    JsonNode toJson();

    /**
     * Builds a descriptor from a server-provided JSON value.
     */
    static ColumnTypeDescriptor fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("column type descriptor cannot be null");
        }
        if (node.isTextual()) {
            ObjectNode shorthand = JSONUtils.newObject();
            shorthand.put("type", node.asText());
            return fromJson(shorthand);
        }
        if (!node.isObject()) {
            return new Unknown(node);
        }
        String type = node.path("type").isTextual() ? node.get("type").asText() : null;
        if (node.has("keyType")) {
            return KeyValued.parse(node, type);
        }
        if (node.has("valueType")) {
            return Valued.parse(node, type);
        }
        if ("vector".equalsIgnoreCase(type)) {
            return Vector.parse(node);
        }
        if (Unsupported.TYPE.equals(type)) {
            return Unsupported.parse(node);
        }
        Optional<ColumnType> scalar = ColumnType.fromValue(type);
        if (scalar.isPresent()) {
            Descriptors.warnResidualKeys(Scalar.class, node, Set.of("type", "apiSupport"));
            return new Scalar(scalar.get(), parseApiSupport(node));
        }
        return new Unknown(node);
    }

    /**
     * Normalizes a descriptor given in any accepted form: an existing descriptor, a bare
     * type name such as {@code "text"}, a JSON node or a map of the JSON shape.
     */
    static ColumnTypeDescriptor coerce(Object raw) {
        if (raw instanceof ColumnTypeDescriptor descriptor) {
            return descriptor;
        }
        if (raw instanceof ColumnType columnType) {
            return new Scalar(columnType, null);
        }
        if (raw instanceof JsonNode node) {
            return fromJson(node);
        }
        if (raw instanceof String || raw instanceof Map<?, ?>) {
            return fromJson(JSONUtils.valueToTree(raw));
        }
        throw new IllegalArgumentException("Cannot coerce " + raw + " into a column type descriptor");
    }

    private static ApiSupportDescriptor parseApiSupport(JsonNode node) {
        JsonNode apiSupport = node.get("apiSupport");
        if (apiSupport == null || !apiSupport.isObject()) {
            return null;
        }
        return ApiSupportDescriptor.fromJson(apiSupport);
    }

    private static ObjectNode typed(String type, ApiSupportDescriptor apiSupport) {
        ObjectNode node = JSONUtils.newObject();
        node.put("type", type);
        if (apiSupport != null) {
            node.set("apiSupport", apiSupport.toJson());
        }
        return node;
    }

    record Scalar(ColumnType columnType, ApiSupportDescriptor apiSupport) implements ColumnTypeDescriptor {
        public Scalar(ColumnType columnType) {
            this(columnType, null);
        }

        @Override
        public JsonNode toJson() {
            return typed(columnType.getValue(), apiSupport);
        }
    }

    /**
     * A vector column. The dimension may be absent for columns whose vectors are
     * computed by a server-side embedding service.
     */
    record Vector(Integer dimension, JsonNode service, ApiSupportDescriptor apiSupport) implements ColumnTypeDescriptor {
        public Vector(int dimension) {
            this(dimension, null, null);
        }

        private static ColumnTypeDescriptor parse(JsonNode node) {
            Descriptors.warnResidualKeys(Vector.class, node, Set.of("type", "dimension", "service", "apiSupport"));
            JsonNode dimension = node.get("dimension");
            if (dimension != null && !dimension.isNull() && !dimension.canConvertToInt()) {
                return new Unknown(node);
            }
            JsonNode service = node.get("service");
            return new Vector(
                    dimension == null || dimension.isNull() ? null : dimension.asInt(),
                    service == null || service.isNull() ? null : service,
                    parseApiSupport(node)
            );
        }

        @Override
        public JsonNode toJson() {
            ObjectNode node = typed("vector", null);
            if (dimension != null) {
                node.put("dimension", dimension);
            }
            if (service != null) {
                node.set("service", service);
            }
            if (apiSupport != null) {
                node.set("apiSupport", apiSupport.toJson());
            }
            return node;
        }
    }

    enum ValuedKind {
        LIST,
        SET;

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * A list or a set of scalar values.
     */
    record Valued(ValuedKind kind, ColumnType valueType, ApiSupportDescriptor apiSupport) implements ColumnTypeDescriptor {
        public Valued(ValuedKind kind, ColumnType valueType) {
            this(kind, valueType, null);
        }

        private static ColumnTypeDescriptor parse(JsonNode node, String type) {
            Descriptors.warnResidualKeys(Valued.class, node, Set.of("type", "valueType", "apiSupport"));
            ValuedKind kind;
            if ("list".equalsIgnoreCase(type)) {
                kind = ValuedKind.LIST;
            } else if ("set".equalsIgnoreCase(type)) {
                kind = ValuedKind.SET;
            } else {
                return new Unknown(node);
            }
            JsonNode valueType = node.get("valueType");
            Optional<ColumnType> value = valueType.isTextual() ? ColumnType.fromValue(valueType.asText()) : Optional.empty();
            if (value.isEmpty()) {
                return new Unknown(node);
            }
            return new Valued(kind, value.get(), parseApiSupport(node));
        }

        @Override
        public JsonNode toJson() {
            ObjectNode node = typed(kind.getValue(), null);
            node.put("valueType", valueType.getValue());
            if (apiSupport != null) {
                node.set("apiSupport", apiSupport.toJson());
            }
            return node;
        }
    }

    /**
     * A map column with scalar keys and values.
     */
    record KeyValued(ColumnType keyType, ColumnType valueType, ApiSupportDescriptor apiSupport) implements ColumnTypeDescriptor {
        public KeyValued(ColumnType keyType, ColumnType valueType) {
            this(keyType, valueType, null);
        }

        private static ColumnTypeDescriptor parse(JsonNode node, String type) {
            Descriptors.warnResidualKeys(KeyValued.class, node, Set.of("type", "keyType", "valueType", "apiSupport"));
            if (!"map".equalsIgnoreCase(type)) {
                return new Unknown(node);
            }
            JsonNode keyType = node.get("keyType");
            JsonNode valueType = node.path("valueType");
            Optional<ColumnType> key = keyType.isTextual() ? ColumnType.fromValue(keyType.asText()) : Optional.empty();
            Optional<ColumnType> value = valueType.isTextual() ? ColumnType.fromValue(valueType.asText()) : Optional.empty();
            if (key.isEmpty() || value.isEmpty()) {
                return new Unknown(node);
            }
            return new KeyValued(key.get(), value.get(), parseApiSupport(node));
        }

        @Override
        public JsonNode toJson() {
            ObjectNode node = typed("map", null);
            node.put("keyType", keyType.getValue());
            node.put("valueType", valueType.getValue());
            if (apiSupport != null) {
                node.set("apiSupport", apiSupport.toJson());
            }
            return node;
        }
    }

    /**
     * A column the server reports but cannot serve through the Data API. Only found in
     * responses; its CQL definition is available from {@link #apiSupport()}.
     */
    record Unsupported(ApiSupportDescriptor apiSupport) implements ColumnTypeDescriptor {
        static final String TYPE = "UNSUPPORTED";

        private static ColumnTypeDescriptor parse(JsonNode node) {
            Descriptors.warnResidualKeys(Unsupported.class, node, Set.of("type", "apiSupport"));
            return new Unsupported(parseApiSupport(node));
        }

        @Override
        public JsonNode toJson() {
            return typed(TYPE, apiSupport);
        }
    }

    /**
     * Any column type shape this client does not recognize, kept as received.
     */
    record Unknown(JsonNode raw) implements ColumnTypeDescriptor {

        @Override
        public ApiSupportDescriptor apiSupport() {
            JsonNode apiSupport = raw.get("apiSupport");
            if (apiSupport == null || !apiSupport.isObject()) {
                return null;
            }
            return ApiSupportDescriptor.fromJson(apiSupport);
        }

        @Override
        public JsonNode toJson() {
            return raw.deepCopy();
        }
    }
}
