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
import com.tessera.protocol.Sorts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column layout and primary key of a table, in the shape used both by
 * {@code createTable} and by {@code listTables} responses.
 *
 * <pre>{@code
 * TableDefinition definition = TableDefinition.builder()
 *     .addColumn("city", ColumnType.TEXT)
 *     .addColumn("name", ColumnType.TEXT)
 *     .addColumn("age", ColumnType.INT)
 *     .addPartitionBy("city")
 *     .addPartitionSort("name", Sorts.ASCENDING)
 *     .build();
 * }</pre>
 */
public record TableDefinition(Map<String, ColumnTypeDescriptor> columns, PrimaryKeyDescriptor primaryKey) {

    public TableDefinition {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("a table needs at least one column");
        }
        if (primaryKey == null) {
            throw new IllegalArgumentException("primaryKey cannot be null");
        }
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TableDefinition fromJson(JsonNode node) {
        Descriptors.warnResidualKeys(TableDefinition.class, node, Set.of("columns", "primaryKey"));
        Map<String, ColumnTypeDescriptor> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("columns").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            columns.put(field.getKey(), ColumnTypeDescriptor.fromJson(field.getValue()));
        }
        JsonNode primaryKey = node.get("primaryKey");
        if (primaryKey == null) {
            throw new IllegalArgumentException("table definition has no primaryKey");
        }
        return new TableDefinition(columns, PrimaryKeyDescriptor.fromJson(primaryKey));
    }

    public ObjectNode toJson() {
        ObjectNode node = JSONUtils.newObject();
        ObjectNode columnsNode = node.putObject("columns");
        columns.forEach((name, descriptor) -> columnsNode.set(name, descriptor.toJson()));
        node.set("primaryKey", primaryKey.toJson());
        return node;
    }

    public static class Builder {
        private final Map<String, ColumnTypeDescriptor> columns = new LinkedHashMap<>();
        private final List<String> partitionBy = new ArrayList<>();
        private final Map<String, Integer> partitionSort = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addColumn(String name, ColumnType type) {
            return addColumn(name, new ColumnTypeDescriptor.Scalar(type));
        }

        public Builder addColumn(String name, ColumnTypeDescriptor descriptor) {
            columns.put(name, descriptor);
            return this;
        }

        public Builder addVectorColumn(String name, int dimension) {
            return addColumn(name, new ColumnTypeDescriptor.Vector(dimension));
        }

        public Builder addListColumn(String name, ColumnType valueType) {
            return addColumn(name, new ColumnTypeDescriptor.Valued(ColumnTypeDescriptor.ValuedKind.LIST, valueType));
        }

        public Builder addSetColumn(String name, ColumnType valueType) {
            return addColumn(name, new ColumnTypeDescriptor.Valued(ColumnTypeDescriptor.ValuedKind.SET, valueType));
        }

        public Builder addMapColumn(String name, ColumnType keyType, ColumnType valueType) {
            return addColumn(name, new ColumnTypeDescriptor.KeyValued(keyType, valueType));
        }

        public Builder addPartitionBy(String column) {
            partitionBy.add(column);
            return this;
        }

        /**
         * @param direction {@link Sorts#ASCENDING} or {@link Sorts#DESCENDING}
         */
        public Builder addPartitionSort(String column, int direction) {
            if (direction != Sorts.ASCENDING && direction != Sorts.DESCENDING) {
                throw new IllegalArgumentException("direction must be 1 or -1");
            }
            partitionSort.put(column, direction);
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(columns, new PrimaryKeyDescriptor(partitionBy, partitionSort));
        }
    }
}
