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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.tessera.client.cursor.Cursor;
import com.tessera.client.http.CommandExecutor;
import com.tessera.client.results.DeleteResult;
import com.tessera.client.results.InsertManyResult;
import com.tessera.client.results.InsertOneResult;
import com.tessera.client.results.UpdateResult;
import com.tessera.common.JSONUtils;
import com.tessera.common.utils.Utils;
import com.tessera.protocol.CommandBuilder;
import com.tessera.protocol.FindArgs;
import com.tessera.protocol.ReturnDocument;
import com.tessera.protocol.UpdateArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * A collection of JSON documents.
 *
 * <p>Reads return lazy {@link Cursor}s; nothing is sent to the server before a cursor is
 * consumed. Writes are sent immediately. Operations touching many documents may take
 * several requests, which are issued one after the other.
 */
public class Collection {
    private static final Logger LOGGER = LoggerFactory.getLogger(Collection.class);

    private final Database database;
    private final String name;
    private final CommandExecutor commander;
    private final CommandBuilder cmd = new CommandBuilder();

    Collection(Database database, String name) {
        Preconditions.checkArgument(!Utils.isBlank(name), "collection name cannot be empty");
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

    public String getAddress() {
        return commander.getAddress();
    }

    private ClientOptions options() {
        return database.getClient().getOptions();
    }

    public Cursor<Map<String, Object>> find() {
        return find(null, null);
    }

    public Cursor<Map<String, Object>> find(Map<String, ?> filter) {
        return find(filter, null);
    }

    /**
     * Creates a cursor over the documents matching the filter. No request is sent until
     * the cursor is consumed.
     *
     * @param filter  the filter, null for all documents
     * @param options projection, sort, skip and limit; may be null
     */
    public Cursor<Map<String, Object>> find(Map<String, ?> filter, FindArgs options) {
        return find(filter, options, Function.identity());
    }

    /**
     * Same as {@link #find(Map, FindArgs)}, converting each document to the given class with Jackson.
     */
    public <R> Cursor<R> find(Map<String, ?> filter, FindArgs options, Class<R> documentClass) {
        return find(filter, options, document -> JSONUtils.objectMapper.convertValue(document, documentClass));
    }

    /**
     * Same as {@link #find(Map, FindArgs)}, buffering up to {@code prefetched} documents
     * on a background worker instead of the client-wide setting. 0 disables prefetching.
     */
    public Cursor<Map<String, Object>> find(Map<String, ?> filter, FindArgs options, int prefetched) {
        return find(filter, options, prefetched, Function.identity());
    }

    private <R> Cursor<R> find(Map<String, ?> filter, FindArgs options, Function<Map<String, Object>, R> mapper) {
        return find(filter, options, options().getPrefetched(), mapper);
    }

    private <R> Cursor<R> find(Map<String, ?> filter, FindArgs options, int prefetched, Function<Map<String, Object>, R> mapper) {
        return new Cursor<>(
                commander,
                query(filter, options),
                prefetched,
                database.getClient().getPrefetchThreadFactory(),
                mapper
        );
    }

    static FindArgs query(Map<String, ?> filter, FindArgs options) {
        FindArgs query = options == null ? new FindArgs() : options.copy();
        if (filter != null) {
            query.filter(filter);
        }
        return query;
    }

    public Optional<Map<String, Object>> findOne(Map<String, ?> filter) {
        return findOne(filter, null);
    }

    /**
     * @param options projection and sort; skip and limit are not accepted
     */
    public Optional<Map<String, Object>> findOne(Map<String, ?> filter, FindArgs options) {
        return Responses.document(commander.execute(cmd.findOne(query(filter, options))), "findOne");
    }

    public List<Object> distinct(String key) {
        return distinct(key, null);
    }

    /**
     * Lists the distinct values found under {@code key} in the documents matching the filter.
     * This reads every matching document, see {@link Cursor#distinct(String)}.
     */
    public List<Object> distinct(String key, Map<String, ?> filter) {
        try (Cursor<Map<String, Object>> cursor = find(filter)) {
            return cursor.distinct(key);
        }
    }

    /**
     * Counts the documents matching the filter.
     *
     * @param upperBound the highest count the caller is prepared to accept
     * @throws TooManyDocumentsToCountException if the count exceeds {@code upperBound} or the server's limit
     */
    public int countDocuments(Map<String, ?> filter, int upperBound) {
        return Responses.count(commander.execute(cmd.countDocuments(filter)), upperBound);
    }

    public int estimatedDocumentCount() {
        return Responses.estimatedCount(commander.execute(cmd.estimatedDocumentCount()));
    }

    public InsertOneResult insertOne(Map<String, ?> document) {
        return Responses.insertOneResult(commander.execute(cmd.insertOne(document)));
    }

    public InsertManyResult insertMany(List<? extends Map<String, ?>> documents) {
        return insertMany(documents, true);
    }

    /**
     * Inserts documents in chunks of {@code insert_many.chunk_size}, one request after the other.
     * A failing chunk stops the operation; the chunks sent before it stay inserted.
     */
    public InsertManyResult insertMany(List<? extends Map<String, ?>> documents, boolean ordered) {
        Preconditions.checkNotNull(documents, "documents cannot be null");
        int chunkSize = options().getInsertManyChunkSize();
        LOGGER.info("starting insertMany on '{}' ({} documents, chunk size {})", name, documents.size(), chunkSize);
        List<Object> insertedIds = new ArrayList<>();
        List<JsonNode> responses = new ArrayList<>();
        for (int from = 0; from < documents.size(); from += chunkSize) {
            List<? extends Map<String, ?>> chunk = documents.subList(from, Math.min(from + chunkSize, documents.size()));
            JsonNode response = commander.execute(cmd.insertMany(chunk, ordered));
            insertedIds.addAll(Responses.insertedIds(response, "insertMany"));
            responses.add(response);
        }
        LOGGER.info("finished insertMany on '{}'", name);
        return new InsertManyResult(insertedIds, responses);
    }

    public UpdateResult updateOne(Map<String, ?> filter, Map<String, ?> update) {
        return updateOne(filter, update, false);
    }

    public UpdateResult updateOne(Map<String, ?> filter, Map<String, ?> update, boolean upsert) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update).upsert(upsert);
        JsonNode response = commander.execute(cmd.updateOne(args));
        return Responses.updateResult(List.of(response.path("status")));
    }

    public UpdateResult updateMany(Map<String, ?> filter, Map<String, ?> update) {
        return updateMany(filter, update, false);
    }

    /**
     * Updates every matching document. The server processes a bounded number of documents per
     * request and returns a {@code nextPageState} when more remain; requests are repeated
     * until it is absent and the counts are summed.
     */
    public UpdateResult updateMany(Map<String, ?> filter, Map<String, ?> update, boolean upsert) {
        LOGGER.info("starting updateMany on '{}'", name);
        List<JsonNode> statuses = new ArrayList<>();
        String pageState = null;
        do {
            UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update).upsert(upsert).pageState(pageState);
            JsonNode status = commander.execute(cmd.updateMany(args)).path("status");
            statuses.add(status);
            JsonNode next = status.get("nextPageState");
            pageState = next == null || next.isNull() ? null : next.asText();
        } while (pageState != null);
        LOGGER.info("finished updateMany on '{}' ({} requests)", name, statuses.size());
        return Responses.updateResult(statuses);
    }

    public UpdateResult replaceOne(Map<String, ?> filter, Map<String, ?> replacement) {
        return replaceOne(filter, replacement, false);
    }

    public UpdateResult replaceOne(Map<String, ?> filter, Map<String, ?> replacement, boolean upsert) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).replacement(replacement).upsert(upsert);
        JsonNode response = commander.execute(cmd.findOneAndReplace(args));
        return Responses.updateResult(List.of(response.path("status")));
    }

    public DeleteResult deleteOne(Map<String, ?> filter) {
        return deleteOne(filter, null);
    }

    public DeleteResult deleteOne(Map<String, ?> filter, Map<String, ?> sort) {
        JsonNode response = commander.execute(cmd.deleteOne(filter, sort));
        return new DeleteResult(Responses.deletedCount(response, "deleteOne"), List.of(response));
    }

    /**
     * Deletes every matching document, repeating the request while the server reports
     * {@code moreData}. An empty filter deletes the whole collection, in which case the
     * server does not count and the result reports -1.
     */
    public DeleteResult deleteMany(Map<String, ?> filter) {
        LOGGER.info("starting deleteMany on '{}'", name);
        List<JsonNode> responses = new ArrayList<>();
        boolean moreData;
        do {
            JsonNode response = commander.execute(cmd.deleteMany(filter));
            responses.add(response);
            moreData = response.path("status").path("moreData").asBoolean(false);
        } while (moreData);
        LOGGER.info("finished deleteMany on '{}' ({} requests)", name, responses.size());
        return Responses.deleteResult(responses);
    }

    public Optional<Map<String, Object>> findOneAndUpdate(Map<String, ?> filter, Map<String, ?> update, ReturnDocument returnDocument) {
        return findOneAndUpdate(UpdateArgs.Builder.filter(filter).update(update).returnDocument(returnDocument));
    }

    public Optional<Map<String, Object>> findOneAndUpdate(UpdateArgs args) {
        return Responses.document(commander.execute(cmd.findOneAndUpdate(args)), "findOneAndUpdate");
    }

    public Optional<Map<String, Object>> findOneAndReplace(Map<String, ?> filter, Map<String, ?> replacement, ReturnDocument returnDocument) {
        return findOneAndReplace(UpdateArgs.Builder.filter(filter).replacement(replacement).returnDocument(returnDocument));
    }

    public Optional<Map<String, Object>> findOneAndReplace(UpdateArgs args) {
        return Responses.document(commander.execute(cmd.findOneAndReplace(args)), "findOneAndReplace");
    }

    public Optional<Map<String, Object>> findOneAndDelete(Map<String, ?> filter) {
        return findOneAndDelete(filter, null, null);
    }

    public Optional<Map<String, Object>> findOneAndDelete(Map<String, ?> filter, Map<String, ?> projection, Map<String, ?> sort) {
        ObjectNode payload = cmd.findOneAndDelete(filter, projection, sort);
        return Responses.document(commander.execute(payload), "findOneAndDelete");
    }

    /**
     * Drops this collection and every document in it.
     */
    public void drop() {
        database.dropCollection(name);
    }

    /**
     * @return an asynchronous view of this collection, sharing its connection settings
     */
    public AsyncCollection toAsync() {
        return new AsyncCollection(database, name, commander);
    }

    @Override
    public String toString() {
        return String.format("Collection(name=\"%s\", keyspace=\"%s\")", name, database.getKeyspace());
    }
}
