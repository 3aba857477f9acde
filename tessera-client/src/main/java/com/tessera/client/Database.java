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
import com.tessera.client.http.ApiCommander;
import com.tessera.client.http.UserAgent;
import com.tessera.common.utils.Utils;
import com.tessera.protocol.CommandBuilder;
import com.tessera.protocol.UnexpectedDataApiResponseException;
import com.tessera.protocol.schema.CollectionDescriptor;
import com.tessera.protocol.schema.TableDefinition;
import com.tessera.protocol.schema.TableDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A keyspace of a Data API database: creates, lists and drops its collections and tables.
 */
public class Database {
    private static final Logger LOGGER = LoggerFactory.getLogger(Database.class);

    private final DataApiClient client;
    private final String endpoint;
    private final String keyspace;
    private final ApiCommander commander;
    private final CommandBuilder cmd = new CommandBuilder();

    Database(DataApiClient client, String endpoint, String keyspace) {
        Preconditions.checkArgument(!Utils.isBlank(endpoint), "endpoint cannot be empty");
        Preconditions.checkArgument(!Utils.isBlank(keyspace), "keyspace cannot be empty");
        this.client = client;
        this.endpoint = endpoint;
        this.keyspace = keyspace;
        this.commander = newCommander(null);
    }

    ApiCommander newCommander(String resource) {
        ClientOptions options = client.getOptions();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(options.getAuthHeader(), client.getTokenProvider().getToken());
        headers.put("User-Agent", UserAgent.compose(options.getCallers()));
        String path = Utils.joinPath(options.getApiPath(), options.getApiVersion(), keyspace, resource);
        return new ApiCommander(
                client.getHttpClient(),
                endpoint,
                path,
                headers,
                options.getRequestTimeout(),
                options.getRedactedHeaders()
        );
    }

    DataApiClient getClient() {
        return client;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public Collection getCollection(String name) {
        return new Collection(this, name);
    }

    public Collection createCollection(String name) {
        return createCollection(name, null);
    }

    /**
     * Creates a collection and returns a handle to it.
     *
     * @param options collection options such as {@code vector} or {@code indexing}; may be null
     */
    public Collection createCollection(String name, Map<String, ?> options) {
        LOGGER.info("createCollection '{}' in keyspace '{}'", name, keyspace);
        commander.request(cmd.createCollection(name, options));
        return getCollection(name);
    }

    public List<String> listCollectionNames() {
        List<String> names = new ArrayList<>();
        for (JsonNode collection : listed(commander.request(cmd.findCollections(false)), "collections", "findCollections")) {
            names.add(collection.asText());
        }
        return names;
    }

    public List<CollectionDescriptor> listCollections() {
        List<CollectionDescriptor> descriptors = new ArrayList<>();
        for (JsonNode collection : listed(commander.request(cmd.findCollections(true)), "collections", "findCollections")) {
            descriptors.add(CollectionDescriptor.fromJson(collection));
        }
        return descriptors;
    }

    public void dropCollection(String name) {
        LOGGER.info("deleteCollection '{}' in keyspace '{}'", name, keyspace);
        commander.request(cmd.deleteCollection(name));
    }

    public Table getTable(String name) {
        return new Table(this, name);
    }

    public Table createTable(String name, TableDefinition definition) {
        return createTable(name, definition, false);
    }

    public Table createTable(String name, TableDefinition definition, boolean ifNotExists) {
        LOGGER.info("createTable '{}' in keyspace '{}'", name, keyspace);
        commander.request(cmd.createTable(name, definition, ifNotExists));
        return getTable(name);
    }

    public List<String> listTableNames() {
        List<String> names = new ArrayList<>();
        for (JsonNode table : listed(commander.request(cmd.listTables(false)), "tables", "listTables")) {
            names.add(table.asText());
        }
        return names;
    }

    public List<TableDescriptor> listTables() {
        List<TableDescriptor> descriptors = new ArrayList<>();
        for (JsonNode table : listed(commander.request(cmd.listTables(true)), "tables", "listTables")) {
            descriptors.add(TableDescriptor.fromJson(table));
        }
        return descriptors;
    }

    public void dropTable(String name) {
        dropTable(name, false);
    }

    public void dropTable(String name, boolean ifExists) {
        LOGGER.info("dropTable '{}' in keyspace '{}'", name, keyspace);
        commander.request(cmd.dropTable(name, ifExists));
    }

    private static JsonNode listed(JsonNode response, String field, String command) {
        JsonNode items = response.path("status").get(field);
        if (items == null || !items.isArray()) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Faulty response from %s API command (no '%s').", command, field), response
            );
        }
        return items;
    }

    @Override
    public String toString() {
        return String.format("Database(endpoint=\"%s\", keyspace=\"%s\")", endpoint, keyspace);
    }
}
