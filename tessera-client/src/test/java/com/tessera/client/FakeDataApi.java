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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.JSONUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory stand-in for the Data API, good enough to exercise the client: equality and
 * comparison filters, projections, sorting, skip, limit and real pagination.
 */
public class FakeDataApi {
    public static final int PAGE_SIZE = 20;
    public static final int COUNT_LIMIT = 1000;

    private final Map<String, List<Map<String, Object>>> stores = new LinkedHashMap<>();
    private final Map<String, ObjectNode> collectionOptions = new LinkedHashMap<>();
    private final Map<String, ObjectNode> tableDefinitions = new LinkedHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();
    private final AtomicInteger findRequests = new AtomicInteger();
    private final Map<String, AtomicInteger> commandCounts = new LinkedHashMap<>();
    private volatile int failFindFrom = -1;
    private volatile long findDelayMillis;

    public synchronized void createCollection(String name) {
        stores.putIfAbsent(name, new ArrayList<>());
        collectionOptions.putIfAbsent(name, JSONUtils.newObject());
    }

    /**
     * Stores documents as they are, without assigning ids.
     */
    public synchronized void seed(String name, List<Map<String, Object>> documents) {
        createCollection(name);
        for (Map<String, Object> document : documents) {
            stores.get(name).add(new LinkedHashMap<>(document));
        }
    }

    public synchronized List<Map<String, Object>> documents(String name) {
        return new ArrayList<>(stores.getOrDefault(name, List.of()));
    }

    public int getRequestCount() {
        return requests.get();
    }

    public int getFindRequestCount() {
        return findRequests.get();
    }

    public synchronized int getCommandCount(String command) {
        AtomicInteger count = commandCounts.get(command);
        return count == null ? 0 : count.get();
    }

    /**
     * Makes every find request from the n-th one (1-based) answer with an error.
     */
    public void failFindRequestsFrom(int n) {
        this.failFindFrom = n;
    }

    public void setFindDelayMillis(long findDelayMillis) {
        this.findDelayMillis = findDelayMillis;
    }

    /**
     * Executes one command.
     *
     * @param resource the collection or table name, null for keyspace-level commands
     * @param payload  the request body
     * @return the response body
     */
    public JsonNode handle(String resource, JsonNode payload) {
        requests.incrementAndGet();
        String command = payload.fieldNames().next();
        JsonNode body = payload.get(command);
        synchronized (this) {
            commandCounts.computeIfAbsent(command, (k) -> new AtomicInteger()).incrementAndGet();
        }
        if (command.equals("find")) {
            int number = findRequests.incrementAndGet();
            sleep(findDelayMillis);
            if (failFindFrom > 0 && number >= failFindFrom) {
                return error("FIND_FAILED", "find request " + number + " failed");
            }
        }
        synchronized (this) {
            switch (command) {
                case "find":
                    return find(resource, body);
                case "findOne":
                    return findOne(resource, body);
                case "insertOne":
                    return insert(resource, List.of(body.get("document")));
                case "insertMany":
                    List<JsonNode> documents = new ArrayList<>();
                    body.get("documents").forEach(documents::add);
                    return insert(resource, documents);
                case "updateOne":
                    return updateOne(resource, body);
                case "updateMany":
                    return updateMany(resource, body);
                case "findOneAndUpdate":
                case "findOneAndReplace":
                    return findOneAndModify(resource, body, command.equals("findOneAndReplace"));
                case "findOneAndDelete":
                    return findOneAndDelete(resource, body);
                case "deleteOne":
                    return deleteOne(resource, body);
                case "deleteMany":
                    return deleteMany(resource, body);
                case "countDocuments":
                    return countDocuments(resource, body);
                case "estimatedDocumentCount":
                    return status("count", store(resource).size());
                case "createCollection":
                    createCollection(body.get("name").asText());
                    if (body.has("options")) {
                        collectionOptions.put(body.get("name").asText(), (ObjectNode) body.get("options"));
                    }
                    return status("ok", 1);
                case "findCollections":
                    return findCollections(body.path("options").path("explain").asBoolean(false));
                case "deleteCollection":
                    stores.remove(body.get("name").asText());
                    collectionOptions.remove(body.get("name").asText());
                    return status("ok", 1);
                case "createTable":
                    tableDefinitions.put(body.get("name").asText(), (ObjectNode) body.get("definition"));
                    stores.putIfAbsent(body.get("name").asText(), new ArrayList<>());
                    return status("ok", 1);
                case "listTables":
                    return listTables(body.path("options").path("explain").asBoolean(false));
                case "dropTable":
                    tableDefinitions.remove(body.get("name").asText());
                    stores.remove(body.get("name").asText());
                    return status("ok", 1);
                default:
                    return error("UNKNOWN_COMMAND", "Unknown command: " + command);
            }
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<Map<String, Object>> store(String resource) {
        List<Map<String, Object>> store = stores.get(resource);
        if (store == null) {
            throw new IllegalStateException("No such collection or table: " + resource);
        }
        return store;
    }

    private List<Map<String, Object>> matching(String resource, JsonNode body) {
        Map<String, Object> filter = body.has("filter") ? JSONUtils.toDocument(body.get("filter")) : Map.of();
        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map<String, Object> document : store(resource)) {
            if (matches(document, filter)) {
                matches.add(document);
            }
        }
        if (body.has("sort")) {
            matches.sort(comparator(JSONUtils.toDocument(body.get("sort"))));
        }
        return matches;
    }

    private JsonNode find(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        JsonNode options = body.path("options");
        int skip = options.path("skip").asInt(0);
        int limit = options.has("limit") ? options.get("limit").asInt() : Integer.MAX_VALUE;
        int from = Math.min(skip, matches.size());
        int to = (int) Math.min((long) from + limit, matches.size());
        List<Map<String, Object>> selected = matches.subList(from, to);

        int offset = options.has("pageState") ? Integer.parseInt(options.get("pageState").asText()) : 0;
        int end = Math.min(offset + PAGE_SIZE, selected.size());
        Map<String, Object> projection = body.has("projection") ? JSONUtils.toDocument(body.get("projection")) : null;

        ObjectNode response = JSONUtils.newObject();
        ObjectNode data = response.putObject("data");
        ArrayNode documents = data.putArray("documents");
        for (Map<String, Object> document : selected.subList(Math.min(offset, end), end)) {
            documents.add(JSONUtils.valueToTree(project(document, projection)));
        }
        if (end < selected.size()) {
            data.put("nextPageState", String.valueOf(end));
        } else {
            data.putNull("nextPageState");
        }
        return response;
    }

    private JsonNode findOne(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        Map<String, Object> projection = body.has("projection") ? JSONUtils.toDocument(body.get("projection")) : null;
        ObjectNode response = JSONUtils.newObject();
        ObjectNode data = response.putObject("data");
        if (matches.isEmpty()) {
            data.putNull("document");
        } else {
            data.set("document", JSONUtils.valueToTree(project(matches.get(0), projection)));
        }
        return response;
    }

    private JsonNode insert(String resource, List<JsonNode> documents) {
        List<Map<String, Object>> store = store(resource);
        ObjectNode definition = tableDefinitions.get(resource);
        ObjectNode response = JSONUtils.newObject();
        ArrayNode ids = response.putObject("status").putArray("insertedIds");
        for (JsonNode node : documents) {
            Map<String, Object> document = JSONUtils.toDocument(node);
            if (definition != null) {
                List<Object> key = new ArrayList<>();
                for (JsonNode column : definition.path("primaryKey").path("partitionBy")) {
                    key.add(document.get(column.asText()));
                }
                ids.add(JSONUtils.valueToTree(key));
            } else {
                document.putIfAbsent("_id", UUID.randomUUID().toString());
                ids.add(JSONUtils.valueToTree(document.get("_id")));
            }
            store.add(document);
        }
        return response;
    }

    private JsonNode updateOne(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        Map<String, Object> update = JSONUtils.toDocument(body.get("update"));
        ObjectNode response = JSONUtils.newObject();
        ObjectNode status = response.putObject("status");
        if (matches.isEmpty()) {
            status.put("matchedCount", 0);
            status.put("modifiedCount", 0);
            if (body.path("options").path("upsert").asBoolean(false)) {
                Map<String, Object> created = new LinkedHashMap<>(JSONUtils.toDocument(body.get("filter")));
                applyUpdate(created, update);
                created.putIfAbsent("_id", UUID.randomUUID().toString());
                store(resource).add(created);
                status.set("upsertedId", JSONUtils.valueToTree(created.get("_id")));
            }
            return response;
        }
        status.put("matchedCount", 1);
        status.put("modifiedCount", applyUpdate(matches.get(0), update) ? 1 : 0);
        return response;
    }

    private JsonNode updateMany(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        Map<String, Object> update = JSONUtils.toDocument(body.get("update"));
        JsonNode options = body.path("options");
        int offset = options.has("pageState") ? Integer.parseInt(options.get("pageState").asText()) : 0;
        int end = Math.min(offset + PAGE_SIZE, matches.size());
        int modified = 0;
        for (Map<String, Object> document : matches.subList(Math.min(offset, end), end)) {
            if (applyUpdate(document, update)) {
                modified++;
            }
        }
        ObjectNode response = JSONUtils.newObject();
        ObjectNode status = response.putObject("status");
        status.put("matchedCount", end - Math.min(offset, end));
        status.put("modifiedCount", modified);
        if (end < matches.size()) {
            status.put("nextPageState", String.valueOf(end));
        }
        return response;
    }

    private JsonNode findOneAndModify(String resource, JsonNode body, boolean replace) {
        List<Map<String, Object>> matches = matching(resource, body);
        Map<String, Object> projection = body.has("projection") ? JSONUtils.toDocument(body.get("projection")) : null;
        boolean after = "after".equals(body.path("options").path("returnDocument").asText("before"));
        ObjectNode response = JSONUtils.newObject();
        ObjectNode data = response.putObject("data");
        ObjectNode status = response.putObject("status");
        if (matches.isEmpty()) {
            data.putNull("document");
            status.put("matchedCount", 0);
            status.put("modifiedCount", 0);
            return response;
        }
        Map<String, Object> document = matches.get(0);
        Map<String, Object> before = new LinkedHashMap<>(document);
        if (replace) {
            Object id = document.get("_id");
            document.clear();
            document.putAll(JSONUtils.toDocument(body.get("replacement")));
            document.putIfAbsent("_id", id);
        } else {
            applyUpdate(document, JSONUtils.toDocument(body.get("update")));
        }
        data.set("document", JSONUtils.valueToTree(project(after ? document : before, projection)));
        status.put("matchedCount", 1);
        status.put("modifiedCount", before.equals(document) ? 0 : 1);
        return response;
    }

    private JsonNode findOneAndDelete(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        ObjectNode response = JSONUtils.newObject();
        ObjectNode data = response.putObject("data");
        if (matches.isEmpty()) {
            data.putNull("document");
            response.putObject("status").put("deletedCount", 0);
            return response;
        }
        Map<String, Object> document = matches.get(0);
        store(resource).remove(document);
        Map<String, Object> projection = body.has("projection") ? JSONUtils.toDocument(body.get("projection")) : null;
        data.set("document", JSONUtils.valueToTree(project(document, projection)));
        response.putObject("status").put("deletedCount", 1);
        return response;
    }

    private JsonNode deleteOne(String resource, JsonNode body) {
        List<Map<String, Object>> matches = matching(resource, body);
        if (!matches.isEmpty()) {
            store(resource).remove(matches.get(0));
        }
        return status("deletedCount", matches.isEmpty() ? 0 : 1);
    }

    private JsonNode deleteMany(String resource, JsonNode body) {
        List<Map<String, Object>> store = store(resource);
        if (!body.has("filter") || body.get("filter").isEmpty()) {
            store.clear();
            return status("deletedCount", -1);
        }
        List<Map<String, Object>> matches = matching(resource, body);
        List<Map<String, Object>> batch = matches.subList(0, Math.min(PAGE_SIZE, matches.size()));
        for (Map<String, Object> document : batch) {
            store.remove(document);
        }
        ObjectNode response = JSONUtils.newObject();
        ObjectNode status = response.putObject("status");
        status.put("deletedCount", batch.size());
        if (matches.size() > PAGE_SIZE) {
            status.put("moreData", true);
        }
        return response;
    }

    private JsonNode countDocuments(String resource, JsonNode body) {
        int count = matching(resource, body).size();
        ObjectNode response = JSONUtils.newObject();
        ObjectNode status = response.putObject("status");
        if (count > COUNT_LIMIT) {
            status.put("count", COUNT_LIMIT);
            status.put("moreData", true);
        } else {
            status.put("count", count);
        }
        return response;
    }

    private JsonNode findCollections(boolean explain) {
        ObjectNode response = JSONUtils.newObject();
        ArrayNode collections = response.putObject("status").putArray("collections");
        for (Map.Entry<String, ObjectNode> entry : collectionOptions.entrySet()) {
            if (explain) {
                ObjectNode descriptor = collections.addObject();
                descriptor.put("name", entry.getKey());
                descriptor.set("options", entry.getValue());
            } else {
                collections.add(entry.getKey());
            }
        }
        return response;
    }

    private JsonNode listTables(boolean explain) {
        ObjectNode response = JSONUtils.newObject();
        ArrayNode tables = response.putObject("status").putArray("tables");
        for (Map.Entry<String, ObjectNode> entry : tableDefinitions.entrySet()) {
            if (explain) {
                ObjectNode descriptor = tables.addObject();
                descriptor.put("name", entry.getKey());
                descriptor.set("definition", entry.getValue());
            } else {
                tables.add(entry.getKey());
            }
        }
        return response;
    }

    @SuppressWarnings("unchecked")
    private static boolean applyUpdate(Map<String, Object> document, Map<String, Object> update) {
        Map<String, Object> before = new LinkedHashMap<>(document);
        for (Map.Entry<String, Object> operator : update.entrySet()) {
            Map<String, Object> fields = (Map<String, Object>) operator.getValue();
            switch (operator.getKey()) {
                case "$set":
                    document.putAll(fields);
                    break;
                case "$unset":
                    fields.keySet().forEach(document::remove);
                    break;
                case "$inc":
                    fields.forEach((field, delta) -> {
                        Object current = document.getOrDefault(field, 0);
                        document.put(field, ((Number) current).longValue() + ((Number) delta).longValue());
                    });
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported update operator: " + operator.getKey());
            }
        }
        return !before.equals(document);
    }

    @SuppressWarnings("unchecked")
    private static boolean matches(Map<String, Object> document, Map<String, Object> filter) {
        for (Map.Entry<String, Object> condition : filter.entrySet()) {
            Object value = resolve(document, condition.getKey());
            Object expected = condition.getValue();
            if (expected instanceof Map<?, ?> && !((Map<?, ?>) expected).isEmpty()
                    && ((Map<String, Object>) expected).keySet().iterator().next().startsWith("$")) {
                for (Map.Entry<String, Object> operator : ((Map<String, Object>) expected).entrySet()) {
                    if (!matchesOperator(value, operator.getKey(), operator.getValue())) {
                        return false;
                    }
                }
            } else if (!equal(value, expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesOperator(Object value, String operator, Object operand) {
        switch (operator) {
            case "$ne":
                return !equal(value, operand);
            case "$in":
                for (Object candidate : (List<?>) operand) {
                    if (equal(value, candidate)) {
                        return true;
                    }
                }
                return false;
            case "$gt":
                return value != null && compare(value, operand) > 0;
            case "$gte":
                return value != null && compare(value, operand) >= 0;
            case "$lt":
                return value != null && compare(value, operand) < 0;
            case "$lte":
                return value != null && compare(value, operand) <= 0;
            case "$exists":
                return (value != null) == Boolean.TRUE.equals(operand);
            default:
                throw new IllegalArgumentException("Unsupported filter operator: " + operator);
        }
    }

    private static Object resolve(Map<String, Object> document, String path) {
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static boolean equal(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        return ((Comparable<Object>) a).compareTo(b);
    }

    private static Comparator<Map<String, Object>> comparator(Map<String, Object> sort) {
        Comparator<Map<String, Object>> comparator = (a, b) -> 0;
        for (Map.Entry<String, Object> entry : sort.entrySet()) {
            String field = entry.getKey();
            int direction = ((Number) entry.getValue()).intValue();
            Comparator<Map<String, Object>> byField = (a, b) -> compare(resolve(a, field), resolve(b, field));
            comparator = comparator.thenComparing(direction < 0 ? byField.reversed() : byField);
        }
        return comparator;
    }

    private static Map<String, Object> project(Map<String, Object> document, Map<String, Object> projection) {
        if (projection == null || projection.isEmpty()) {
            return document;
        }
        boolean inclusion = false;
        for (Map.Entry<String, Object> entry : projection.entrySet()) {
            if (!entry.getKey().equals("_id") && included(entry.getValue())) {
                inclusion = true;
            }
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        if (inclusion) {
            boolean keepId = !projection.containsKey("_id") || included(projection.get("_id"));
            for (Map.Entry<String, Object> field : document.entrySet()) {
                boolean listed = false;
                for (String path : projection.keySet()) {
                    if (path.equals(field.getKey()) || path.startsWith(field.getKey() + ".")) {
                        listed = included(projection.get(path));
                    }
                }
                if (listed || (field.getKey().equals("_id") && keepId)) {
                    projected.put(field.getKey(), field.getValue());
                }
            }
        } else {
            projected.putAll(document);
            Iterator<String> keys = projected.keySet().iterator();
            while (keys.hasNext()) {
                String key = keys.next();
                if (projection.containsKey(key) && !included(projection.get(key))) {
                    keys.remove();
                }
            }
        }
        return projected;
    }

    private static boolean included(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof Number && ((Number) value).intValue() != 0;
    }

    private static ObjectNode status(String field, int value) {
        ObjectNode response = JSONUtils.newObject();
        response.putObject("status").put(field, value);
        return response;
    }

    private static ObjectNode error(String code, String message) {
        ObjectNode response = JSONUtils.newObject();
        ObjectNode error = response.putArray("errors").addObject();
        error.put("errorCode", code);
        error.put("message", message);
        return response;
    }
}
