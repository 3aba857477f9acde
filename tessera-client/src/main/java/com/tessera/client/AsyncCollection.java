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
import com.tessera.client.cursor.AsyncCursor;
import com.tessera.client.http.CommandExecutor;
import com.tessera.client.results.DeleteResult;
import com.tessera.client.results.InsertManyResult;
import com.tessera.client.results.InsertOneResult;
import com.tessera.client.results.UpdateResult;
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
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Non-blocking view of a {@link Collection}. Every method returns immediately; results
 * and errors are delivered through {@link CompletableFuture}s. Operations that take
 * several requests still send them one at a time.
 */
public class AsyncCollection {
    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncCollection.class);

    private final Database database;
    private final String name;
    private final CommandExecutor commander;
    private final CommandBuilder cmd = new CommandBuilder();

    AsyncCollection(Database database, String name, CommandExecutor commander) {
        this.database = database;
        this.name = name;
        this.commander = commander;
    }

    public String getName() {
        return name;
    }

    public Collection toSync() {
        return database.getCollection(name);
    }

    public AsyncCursor<Map<String, Object>> find(Map<String, ?> filter) {
        return find(filter, null);
    }

    public AsyncCursor<Map<String, Object>> find(Map<String, ?> filter, FindArgs options) {
        return new AsyncCursor<>(commander, Collection.query(filter, options), Function.identity());
    }

    public CompletableFuture<Optional<Map<String, Object>>> findOne(Map<String, ?> filter) {
        return findOne(filter, null);
    }

    public CompletableFuture<Optional<Map<String, Object>>> findOne(Map<String, ?> filter, FindArgs options) {
        return commander.executeAsync(cmd.findOne(Collection.query(filter, options)))
                .thenApply(response -> Responses.document(response, "findOne"));
    }

    public CompletableFuture<List<Object>> distinct(String key, Map<String, ?> filter) {
        return find(filter).distinct(key);
    }

    public CompletableFuture<Integer> countDocuments(Map<String, ?> filter, int upperBound) {
        return commander.executeAsync(cmd.countDocuments(filter))
                .thenApply(response -> Responses.count(response, upperBound));
    }

    public CompletableFuture<Integer> estimatedDocumentCount() {
        return commander.executeAsync(cmd.estimatedDocumentCount()).thenApply(Responses::estimatedCount);
    }

    public CompletableFuture<InsertOneResult> insertOne(Map<String, ?> document) {
        return commander.executeAsync(cmd.insertOne(document)).thenApply(Responses::insertOneResult);
    }

    public CompletableFuture<InsertManyResult> insertMany(List<? extends Map<String, ?>> documents, boolean ordered) {
        Preconditions.checkNotNull(documents, "documents cannot be null");
        int chunkSize = database.getClient().getOptions().getInsertManyChunkSize();
        LOGGER.info("starting insertMany on '{}' ({} documents, chunk size {})", name, documents.size(), chunkSize);
        List<Object> insertedIds = new ArrayList<>();
        List<JsonNode> responses = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int from = 0; from < documents.size(); from += chunkSize) {
            List<? extends Map<String, ?>> chunk = documents.subList(from, Math.min(from + chunkSize, documents.size()));
            chain = chain
                    .thenCompose(ignored -> commander.executeAsync(cmd.insertMany(chunk, ordered)))
                    .thenAccept(response -> {
                        insertedIds.addAll(Responses.insertedIds(response, "insertMany"));
                        responses.add(response);
                    });
        }
        return chain.thenApply(ignored -> new InsertManyResult(insertedIds, responses));
    }

    public CompletableFuture<UpdateResult> updateOne(Map<String, ?> filter, Map<String, ?> update, boolean upsert) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update).upsert(upsert);
        return commander.executeAsync(cmd.updateOne(args))
                .thenApply(response -> Responses.updateResult(List.of(response.path("status"))));
    }

    public CompletableFuture<UpdateResult> updateMany(Map<String, ?> filter, Map<String, ?> update, boolean upsert) {
        LOGGER.info("starting updateMany on '{}'", name);
        List<JsonNode> statuses = new ArrayList<>();
        return updatePage(filter, update, upsert, null, statuses)
                .thenApply(ignored -> Responses.updateResult(statuses));
    }

    private CompletableFuture<Void> updatePage(Map<String, ?> filter, Map<String, ?> update, boolean upsert,
                                               String pageState, List<JsonNode> statuses) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update).upsert(upsert).pageState(pageState);
        return commander.executeAsync(cmd.updateMany(args)).thenCompose(response -> {
            JsonNode status = response.path("status");
            statuses.add(status);
            JsonNode next = status.get("nextPageState");
            if (next == null || next.isNull()) {
                return CompletableFuture.completedFuture(null);
            }
            return updatePage(filter, update, upsert, next.asText(), statuses);
        });
    }

    public CompletableFuture<UpdateResult> replaceOne(Map<String, ?> filter, Map<String, ?> replacement, boolean upsert) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).replacement(replacement).upsert(upsert);
        return commander.executeAsync(cmd.findOneAndReplace(args))
                .thenApply(response -> Responses.updateResult(List.of(response.path("status"))));
    }

    public CompletableFuture<DeleteResult> deleteOne(Map<String, ?> filter) {
        return commander.executeAsync(cmd.deleteOne(filter, null))
                .thenApply(response -> new DeleteResult(Responses.deletedCount(response, "deleteOne"), List.of(response)));
    }

    public CompletableFuture<DeleteResult> deleteMany(Map<String, ?> filter) {
        LOGGER.info("starting deleteMany on '{}'", name);
        List<JsonNode> responses = new ArrayList<>();
        return deleteChunk(filter, responses).thenApply(ignored -> Responses.deleteResult(responses));
    }

    private CompletableFuture<Void> deleteChunk(Map<String, ?> filter, List<JsonNode> responses) {
        return commander.executeAsync(cmd.deleteMany(filter)).thenCompose(response -> {
            responses.add(response);
            if (response.path("status").path("moreData").asBoolean(false)) {
                return deleteChunk(filter, responses);
            }
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<Optional<Map<String, Object>>> findOneAndUpdate(Map<String, ?> filter, Map<String, ?> update,
                                                                            ReturnDocument returnDocument) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).update(update).returnDocument(returnDocument);
        return commander.executeAsync(cmd.findOneAndUpdate(args))
                .thenApply(response -> Responses.document(response, "findOneAndUpdate"));
    }

    public CompletableFuture<Optional<Map<String, Object>>> findOneAndReplace(Map<String, ?> filter, Map<String, ?> replacement,
                                                                             ReturnDocument returnDocument) {
        UpdateArgs args = UpdateArgs.Builder.filter(filter).replacement(replacement).returnDocument(returnDocument);
        return commander.executeAsync(cmd.findOneAndReplace(args))
                .thenApply(response -> Responses.document(response, "findOneAndReplace"));
    }

    public CompletableFuture<Optional<Map<String, Object>>> findOneAndDelete(Map<String, ?> filter) {
        return commander.executeAsync(cmd.findOneAndDelete(filter, null, null))
                .thenApply(response -> Responses.document(response, "findOneAndDelete"));
    }
}
