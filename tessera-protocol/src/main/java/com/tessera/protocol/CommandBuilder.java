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

package com.tessera.protocol;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.tessera.common.JSONUtils;
import com.tessera.protocol.schema.TableDefinition;

import java.util.List;
import java.util.Map;

/**
 * The {@code CommandBuilder} class constructs the JSON payloads of the Data API commands:
 * document reads and writes on collections and tables, and the schema commands that
 * create, list and drop them.
 * <p>
 * Every method returns the full request body, a single-key object naming the command,
 * e.g. {@code {"insertOne": {"document": {...}}}}. Commands with a rich set of options
 * take an argument object, see {@link FindArgs} and {@link UpdateArgs}.
 */
public class CommandBuilder {

    /**
     * Constructs a {@code find} command.
     *
     * @param findArgs filter, projection, sort and paging options of the query
     * @return the request payload
     */
    public ObjectNode find(FindArgs findArgs) {
        return findArgs.build(CommandType.FIND);
    }

    public ObjectNode findOne(FindArgs findArgs) {
        return findArgs.build(CommandType.FIND_ONE);
    }

    /**
     * Constructs an {@code insertOne} command.
     *
     * @param document the document or row to insert; must not be null
     * @return the request payload
     */
    public ObjectNode insertOne(Map<String, ?> document) {
        Preconditions.checkNotNull(document, "document cannot be null");
        ObjectNode command = JSONUtils.newObject();
        command.set("document", JSONUtils.valueToTree(document));
        return wrap(CommandType.INSERT_ONE, command);
    }

    /**
     * Constructs an {@code insertMany} command for one chunk of documents.
     *
     * @param documents the documents of this chunk
     * @param ordered   whether the server stops at the first failure
     * @return the request payload
     */
    public ObjectNode insertMany(List<? extends Map<String, ?>> documents, boolean ordered) {
        ObjectNode command = JSONUtils.newObject();
        ArrayNode array = command.putArray("documents");
        for (Map<String, ?> document : documents) {
            array.add(JSONUtils.valueToTree(document));
        }
        command.putObject("options").put("ordered", ordered);
        return wrap(CommandType.INSERT_MANY, command);
    }

    public ObjectNode updateOne(UpdateArgs updateArgs) {
        return updateArgs.build(CommandType.UPDATE_ONE);
    }

    public ObjectNode updateMany(UpdateArgs updateArgs) {
        return updateArgs.build(CommandType.UPDATE_MANY);
    }

    public ObjectNode findOneAndUpdate(UpdateArgs updateArgs) {
        return updateArgs.build(CommandType.FIND_ONE_AND_UPDATE);
    }

    public ObjectNode findOneAndReplace(UpdateArgs updateArgs) {
        return updateArgs.build(CommandType.FIND_ONE_AND_REPLACE);
    }

    /**
     * Constructs a {@code deleteOne} command.
     *
     * @param filter the filter selecting the document
     * @param sort   an optional sort deciding which document is deleted when several match
     * @return the request payload
     */
    public ObjectNode deleteOne(Map<String, ?> filter, Map<String, ?> sort) {
        ObjectNode command = filterCommand(filter);
        Map<String, Object> normalized = Sorts.normalize(sort);
        if (normalized != null) {
            command.set("sort", JSONUtils.valueToTree(normalized));
        }
        return wrap(CommandType.DELETE_ONE, command);
    }

    /**
     * Constructs a {@code deleteMany} command. The server deletes a bounded number of
     * documents per call and reports {@code moreData} when the caller has to repeat it.
     */
    public ObjectNode deleteMany(Map<String, ?> filter) {
        return wrap(CommandType.DELETE_MANY, filterCommand(filter));
    }

    public ObjectNode findOneAndDelete(Map<String, ?> filter, Map<String, ?> projection, Map<String, ?> sort) {
        ObjectNode command = filterCommand(filter);
        Map<String, Object> normalizedProjection = Projections.normalize(projection);
        if (normalizedProjection != null) {
            command.set("projection", JSONUtils.valueToTree(normalizedProjection));
        }
        Map<String, Object> normalizedSort = Sorts.normalize(sort);
        if (normalizedSort != null) {
            command.set("sort", JSONUtils.valueToTree(normalizedSort));
        }
        return wrap(CommandType.FIND_ONE_AND_DELETE, command);
    }

    public ObjectNode countDocuments(Map<String, ?> filter) {
        return wrap(CommandType.COUNT_DOCUMENTS, filterCommand(filter));
    }

    public ObjectNode estimatedDocumentCount() {
        return wrap(CommandType.ESTIMATED_DOCUMENT_COUNT, JSONUtils.newObject());
    }

    /**
     * Constructs a {@code createCollection} command.
     *
     * @param name    the collection name
     * @param options collection options such as {@code vector} or {@code indexing}; may be null
     * @return the request payload
     */
    public ObjectNode createCollection(String name, Map<String, ?> options) {
        ObjectNode command = named(name);
        if (options != null && !options.isEmpty()) {
            command.set("options", JSONUtils.valueToTree(options));
        }
        return wrap(CommandType.CREATE_COLLECTION, command);
    }

    /**
     * Constructs a {@code findCollections} command.
     *
     * @param explain whether the server describes each collection instead of naming it
     * @return the request payload
     */
    public ObjectNode findCollections(boolean explain) {
        ObjectNode command = JSONUtils.newObject();
        command.putObject("options").put("explain", explain);
        return wrap(CommandType.FIND_COLLECTIONS, command);
    }

    public ObjectNode deleteCollection(String name) {
        return wrap(CommandType.DELETE_COLLECTION, named(name));
    }

    /**
     * Constructs a {@code createTable} command.
     *
     * @param name        the table name
     * @param definition  columns and primary key of the table
     * @param ifNotExists whether an existing table with the same name is accepted
     * @return the request payload
     */
    public ObjectNode createTable(String name, TableDefinition definition, boolean ifNotExists) {
        ObjectNode command = named(name);
        command.set("definition", definition.toJson());
        if (ifNotExists) {
            command.putObject("options").put("ifNotExists", true);
        }
        return wrap(CommandType.CREATE_TABLE, command);
    }

    public ObjectNode listTables(boolean explain) {
        ObjectNode command = JSONUtils.newObject();
        command.putObject("options").put("explain", explain);
        return wrap(CommandType.LIST_TABLES, command);
    }

    public ObjectNode dropTable(String name, boolean ifExists) {
        ObjectNode command = named(name);
        if (ifExists) {
            command.putObject("options").put("ifExists", true);
        }
        return wrap(CommandType.DROP_TABLE, command);
    }

    private ObjectNode filterCommand(Map<String, ?> filter) {
        ObjectNode command = JSONUtils.newObject();
        command.set("filter", JSONUtils.valueToTree(filter == null ? Map.of() : filter));
        return command;
    }

    private ObjectNode named(String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "name cannot be empty");
        ObjectNode command = JSONUtils.newObject();
        command.put("name", name);
        return command;
    }

    private ObjectNode wrap(CommandType type, ObjectNode command) {
        ObjectNode payload = JSONUtils.newObject();
        payload.set(type.getCommand(), command);
        return payload;
    }
}
