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

package com.tessera.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.tessera.client.cursor.Cursor;
import com.tessera.client.http.CommandExecutor;
import com.tessera.client.results.DeleteResult;
import com.tessera.client.results.InsertManyResult;
import com.tessera.client.results.InsertOneResult;
import com.tessera.client.results.UpdateResult;
import com.tessera.common.utils.Utils;
import com.tessera.protocol.CommandBuilder;
import com.tessera.protocol.DataApiException;
import com.tessera.protocol.FindArgs;
import com.tessera.protocol.UpdateArgs;
import com.tessera.protocol.schema.TableDefinition;
import com.tessera.protocol.schema.TableDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * A table with a fixed schema. Rows are read and written as maps keyed by column name.
 */
public class Table {
    private static final Logger LOGGER = LoggerFactory.getLogger(Table.class);

    private final Database database;
    private final String name;
    private final CommandExecutor commander;
    private final CommandBuilder cmd = new CommandBuilder();

    Table(Database database, String name) {
        Preconditions.checkArgument(!Utils.isBlank(name), "table name cannot be empty");
        this.database = database;
        this.name = name;
        this.commander = database.newCommander(name);
    }

    public String getName() {
        return name;
    }

    public Database getDatabase() {
        return database;
    }

    /**
     * Looks up the definition of this table through {@code listTables}.
     *
     * @throws DataApiException if the table does not exist
     */
    public TableDefinition definition() {
        for (TableDescriptor descriptor : database.listTables()) {
            if (descriptor.name().equals(name)) {
                return descriptor.definition();
            }
        }
        throw new DataApiException(String.format("Table '%s' not found in keyspace '%s'", name, database.getKeyspace()));
    }

    public Cursor<Map<String, Object>> find(Map<String, ?> filter) {
        return find(filter, null);
    }

    public Cursor<Map<String, Object>> find(Map<String, ?> filter, FindArgs options) {
        return find(filter, options, database.getClient().getOptions().getPrefetched());
    }

    /**
     * @param prefetched rows buffered by a background worker for this cursor; 0 disables prefetching
     */
    public Cursor<Map<String, Object>> find(Map<String, ?> filter, FindArgs options, int prefetched) {
        return new Cursor<>(
                commander,
                Collection.query(filter, options),
                prefetched,
                database.getClient().getPrefetchThreadFactory(),
                Function.identity()
        );
    }

    public Optional<Map<String, Object>> findOne(Map<String, ?> filter) {
        return findOne(filter, null);
    }

    public Optional<Map<String, Object>> findOne(Map<String, ?> filter, FindArgs options) {
        return Responses.document(commander.execute(cmd.findOne(Collection.query(filter, options))), "findOne");
    }

    public List<Object> distinct(String key, Map<String, ?> filter) {
        try (Cursor<Map<String, Object>> cursor = find(filter)) {
            return cursor.distinct(key);
        }
    }

    /**
     * @return the result, whose id is the list of primary key values of the row
     */
    public InsertOneResult insertOne(Map<String, ?> row) {
        return Responses.insertOneResult(commander.execute(cmd.insertOne(row)));
    }

    public InsertManyResult insertMany(List<? extends Map<String, ?>> rows, boolean ordered) {
        Preconditions.checkNotNull(rows, "rows cannot be null");
        int chunkSize = database.getClient().getOptions().getInsertManyChunkSize();
        LOGGER.info("starting insertMany on table '{}' ({} rows, chunk size {})", name, rows.size(), chunkSize);
        List<Object> insertedIds = new ArrayList<>();
        List<JsonNode> responses = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += chunkSize) {
            List<? extends Map<String, ?>> chunk = rows.subList(from, Math.min(from + chunkSize, rows.size()));
            JsonNode response = commander.execute(cmd.insertMany(chunk, ordered));
            insertedIds.addAll(Responses.insertedIds(response, "insertMany"));
            responses.add(response);
        }
        return new InsertManyResult(insertedIds, responses);
    }

    /**
     * Updates the row selected by a full primary key filter. Tables report no counts.
     */
    public UpdateResult updateOne(Map<String, ?> filter, Map<String, ?> update) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update);
        JsonNode response = commander.execute(cmd.updateOne(args));
        return Responses.updateResult(List.of(response.path("status")));
    }

    public void deleteOne(Map<String, ?> filter) {
        commander.execute(cmd.deleteOne(filter, null));
    }

    /**
     * Deletes the rows matching the filter. Tables delete all matches in one request and
     * report no count, so the result carries -1.
     */
    public DeleteResult deleteMany(Map<String, ?> filter) {
        JsonNode response = commander.execute(cmd.deleteMany(filter));
        return new DeleteResult(-1, List.of(response));
    }

    public void drop() {
        database.dropTable(name);
    }

    @Override
    public String toString() {
        return String.format("Table(name=\"%s\", keyspace=\"%s\")", name, database.getKeyspace());
    }
}
