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

package com.tessera.client.cursor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.client.FakeDataApi;
import com.tessera.client.InMemoryCommandExecutor;
import com.tessera.client.http.DataApiResponseException;
import com.tessera.protocol.FindArgs;
import com.tessera.protocol.Sorts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CursorTest {
    private static final String COLLECTION = "items";
    private static final Map<String, Object> BY_VALUE = Map.of("value", Sorts.ASCENDING);

    private final ThreadFactory threadFactory = new ThreadFactoryBuilder()
            .setNameFormat("test.cursor-prefetch-%d")
            .setDaemon(true)
            .build();
    private FakeDataApi api;
    private InMemoryCommandExecutor executor;

    @BeforeEach
    public void setUp() {
        api = new FakeDataApi();
        api.createCollection(COLLECTION);
        executor = new InMemoryCommandExecutor(api, COLLECTION);
    }

    private void seed(int count) {
        List<Map<String, Object>> documents = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("_id", "doc-" + i);
            document.put("value", i);
            document.put("field", "f" + i);
            document.put("tags", List.of("t" + (i % 3), "common"));
            documents.add(document);
        }
        api.seed(COLLECTION, documents);
    }

    private Cursor<Map<String, Object>> cursor(FindArgs args, int prefetched) {
        return new Cursor<>(executor, args, prefetched, threadFactory, Function.identity());
    }

    private static List<Integer> values(List<Map<String, Object>> documents) {
        List<Integer> values = new ArrayList<>();
        for (Map<String, Object> document : documents) {
            values.add((Integer) document.get("value"));
        }
        return values;
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> values = new ArrayList<>();
        for (int i = from; i < to; i++) {
            values.add(i);
        }
        return values;
    }

    @Test
    public void testIterateAcrossPages() {
        seed(45);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0);
        assertEquals(range(0, 45), values(cursor.toList()));
        assertEquals(3, api.getFindRequestCount());
        assertEquals(45, cursor.getRetrieved());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 10})
    public void testLimitWithExclusionProjection(int prefetched) {
        seed(200);
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), prefetched)
                .limit(183)
                .projection(Map.of("field", 0));

        List<Map<String, Object>> documents = cursor.toList();
        assertEquals(183, documents.size());
        Set<Object> ids = new HashSet<>();
        for (Map<String, Object> document : documents) {
            ids.add(document.get("_id"));
            assertFalse(document.containsKey("field"));
        }
        assertEquals(183, ids.size());
    }

    @Test
    public void testSlice() {
        seed(10);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0).slice(5, 9);
        assertEquals(5, cursor.getSkip());
        assertEquals(4, cursor.getLimit());
        assertEquals(List.of(5, 6, 7, 8), values(cursor.toList()));
    }

    @Test
    public void testSliceRejectsArbitraryStep() {
        seed(10);
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 0);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> cursor.slice(0, 8, 2));
        assertEquals("Cursor slicing cannot have arbitrary step", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> cursor.slice(4, 4));
        assertThrows(IllegalArgumentException.class, () -> cursor.slice(-1, 4));
        assertNull(cursor.getLimit());
    }

    @Test
    public void testZeroLimitIsUnbounded() {
        seed(45);
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 0).limit(5).limit(0);
        assertNull(cursor.getLimit());
        assertEquals(45, cursor.toList().size());
    }

    @Test
    public void testSettersRejectedAfterStart() {
        seed(5);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.filter(Map.of("value", Map.of("$lt", 3))), 0);
        assertTrue(cursor.hasNext());
        assertEquals(CursorState.RUNNING, cursor.getState());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> cursor.filter(Map.of()));
        assertEquals("Cursor has already been used", e.getMessage());
        assertThrows(IllegalStateException.class, () -> cursor.limit(1));
        assertThrows(IllegalStateException.class, () -> cursor.skip(1));
        assertThrows(IllegalStateException.class, () -> cursor.sort(BY_VALUE));
        assertThrows(IllegalStateException.class, () -> cursor.projection(List.of("value")));
        assertThrows(IllegalStateException.class, () -> cursor.slice(0, 1));
        assertThrows(IllegalStateException.class, () -> cursor.get(0));

        assertEquals(Map.of("value", Map.of("$lt", 3)), cursor.getFilter());
        assertNull(cursor.getLimit());
        assertEquals(3, cursor.toList().size());
    }

    @Test
    public void testSettersRejectedOnClosedCursor() {
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 0);
        cursor.close();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> cursor.limit(3));
        assertEquals("Cursor is closed.", e.getMessage());
    }

    @Test
    public void testStateTransitions() {
        seed(3);
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 0);
        assertEquals(CursorState.NEW, cursor.getState());
        assertTrue(cursor.isAlive());
        assertFalse(cursor.isStarted());

        cursor.next();
        assertEquals(CursorState.RUNNING, cursor.getState());
        cursor.next();
        cursor.next();
        assertFalse(cursor.hasNext());
        assertEquals(CursorState.EXHAUSTED, cursor.getState());

        int requests = api.getFindRequestCount();
        assertFalse(cursor.hasNext());
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
        assertTrue(cursor.toList().isEmpty());
        assertEquals(requests, api.getFindRequestCount());
        assertEquals(3, cursor.getRetrieved());

        cursor.close();
        assertEquals(CursorState.CLOSED, cursor.getState());
    }

    @Test
    public void testCloseIsIdempotent() {
        seed(30);
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 5);
        cursor.next();
        cursor.close();
        cursor.close();
        assertEquals(CursorState.CLOSED, cursor.getState());
        assertFalse(cursor.hasNext());
    }

    @Test
    public void testRewind() {
        seed(30);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0);
        for (int i = 0; i < 25; i++) {
            cursor.next();
        }
        cursor.rewind();
        assertEquals(CursorState.NEW, cursor.getState());
        assertEquals(0, cursor.getRetrieved());
        assertEquals(range(0, 30), values(cursor.toList()));

        cursor.close();
        cursor.rewind();
        assertEquals(CursorState.NEW, cursor.getState());
        assertEquals(30, cursor.toList().size());
    }

    @Test
    public void testCloneIsIndependent() {
        seed(30);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0).skip(10);
        cursor.next();
        cursor.next();

        Cursor<Map<String, Object>> clone = cursor.clone();
        assertEquals(CursorState.NEW, clone.getState());
        assertEquals(10, clone.getSkip());
        clone.limit(3);
        assertEquals(List.of(10, 11, 12), values(clone.toList()));

        assertNull(cursor.getLimit());
        assertEquals(range(12, 30), values(cursor.toList()));
    }

    @Test
    public void testGetRunsAnIndependentProbe() {
        seed(30);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0).skip(4);
        assertEquals(7, cursor.get(7).get("value"));
        assertEquals(CursorState.NEW, cursor.getState());
        assertEquals(4, cursor.getSkip());
        assertThrows(IndexOutOfBoundsException.class, () -> cursor.get(30));
        assertEquals(range(4, 30), values(cursor.toList()));
    }

    @Test
    public void testDistinct() {
        seed(7);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0);
        assertEquals(List.of("t0", "common", "t1", "t2"), cursor.distinct("tags"));
        assertEquals(List.of("t0", "t1", "t2"), cursor.distinct("tags.0"));
        assertEquals(CursorState.NEW, cursor.getState());
    }

    @Test
    public void testDistinctOnNestedDocuments() {
        api.seed(COLLECTION, List.of(
                Map.of("_id", 1, "sub", Map.of("a", "x")),
                Map.of("_id", 2, "sub", List.of(Map.of("a", "y"), Map.of("a", "x"))),
                Map.of("_id", 3, "other", true)
        ));
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(Map.of("_id", Sorts.ASCENDING)), 0);
        assertEquals(List.of("x", "y"), cursor.distinct("sub.a"));
    }

    @Test
    public void testFetchFailureExhaustsCursor() {
        seed(45);
        api.failFindRequestsFrom(2);
        Cursor<Map<String, Object>> cursor = cursor(FindArgs.Builder.sort(BY_VALUE), 0);
        for (int i = 0; i < FakeDataApi.PAGE_SIZE; i++) {
            assertEquals(i, cursor.next().get("value"));
        }
        DataApiResponseException e = assertThrows(DataApiResponseException.class, cursor::hasNext);
        assertEquals("FIND_FAILED", e.getErrors().get(0).errorCode());
        assertEquals(CursorState.EXHAUSTED, cursor.getState());
        assertFalse(cursor.hasNext());
    }

    @Test
    public void testPrefetchYieldsSameItems() {
        seed(95);
        FindArgs args = FindArgs.Builder.sort(Map.of("value", Sorts.DESCENDING)).skip(3);
        List<Map<String, Object>> plain = cursor(args, 0).toList();
        List<Map<String, Object>> prefetched = cursor(args, 7).toList();
        assertEquals(92, plain.size());
        assertEquals(plain, prefetched);
    }

    @Test
    public void testMapper() {
        seed(4);
        Cursor<String> cursor = new Cursor<>(executor, FindArgs.Builder.sort(BY_VALUE), 0, threadFactory,
                document -> (String) document.get("field"));
        List<String> fields = new ArrayList<>();
        for (String field : cursor) {
            fields.add(field);
        }
        assertEquals(List.of("f0", "f1", "f2", "f3"), fields);
    }

    @Test
    public void testArgsAreCopied() {
        FindArgs args = FindArgs.Builder.limit(5);
        Cursor<Map<String, Object>> cursor = cursor(args, 0);
        args.limit(9);
        cursor.skip(2);
        assertEquals(5, cursor.getLimit());
        assertNull(args.getSkip());
        cursor.getArgs().limit(1);
        assertEquals(5, cursor.getLimit());
    }

    @Test
    public void testToString() {
        Cursor<Map<String, Object>> cursor = cursor(new FindArgs(), 0);
        assertEquals("Cursor(\"memory://items\", new, retrieved: 0)", cursor.toString());
        assertThat(cursor.getCursorId()).isNotEqualTo(cursor.clone().getCursorId());
    }

    @Test
    public void testPrefetchRequiresThreadFactory() {
        assertThrows(IllegalArgumentException.class,
                () -> new Cursor<>(executor, new FindArgs(), 3, null, Function.identity()));
        assertThrows(IllegalArgumentException.class,
                () -> new Cursor<>(executor, new FindArgs(), -1, threadFactory, Function.identity()));
    }

    private static ThreadFactory workerFactory(String prefix) {
        return new ThreadFactoryBuilder().setNameFormat(prefix + "-%d").setDaemon(true).build();
    }

    private static long liveWorkers(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.isAlive() && thread.getName().startsWith(prefix + "-"))
                .count();
    }

    @Test
    public void testCloseStopsPrefetchWorker() {
        seed(200);
        String prefix = "test.cursor-close";
        Cursor<Map<String, Object>> cursor = new Cursor<>(executor, FindArgs.Builder.sort(BY_VALUE), 5,
                workerFactory(prefix), Function.identity());
        assertEquals(0, cursor.next().get("value"));
        assertEquals(1, liveWorkers(prefix));

        cursor.close();
        await().atMost(5, TimeUnit.SECONDS).until(() -> liveWorkers(prefix) == 0);
        assertEquals(CursorState.CLOSED, cursor.getState());
    }

    @Test
    public void testRewindStopsPrefetchWorker() {
        seed(200);
        String prefix = "test.cursor-rewind";
        Cursor<Map<String, Object>> cursor = new Cursor<>(executor, FindArgs.Builder.sort(BY_VALUE), 5,
                workerFactory(prefix), Function.identity());
        for (int i = 0; i < 3; i++) {
            cursor.next();
        }
        assertEquals(1, liveWorkers(prefix));

        cursor.rewind();
        await().atMost(5, TimeUnit.SECONDS).until(() -> liveWorkers(prefix) == 0);
        assertEquals(CursorState.NEW, cursor.getState());

        assertEquals(0, cursor.next().get("value"));
        assertEquals(1, liveWorkers(prefix));
        cursor.close();
        await().atMost(5, TimeUnit.SECONDS).until(() -> liveWorkers(prefix) == 0);
    }

    private void startAndDiscard(ThreadFactory factory) {
        Cursor<Map<String, Object>> cursor = new Cursor<>(executor, FindArgs.Builder.sort(BY_VALUE), 5,
                factory, Function.identity());
        assertEquals(0, cursor.next().get("value"));
    }

    @Test
    public void testDiscardedCursorStopsPrefetchWorker() {
        seed(200);
        String prefix = "test.cursor-discard";
        startAndDiscard(workerFactory(prefix));
        assertEquals(1, liveWorkers(prefix));

        await().atMost(10, TimeUnit.SECONDS).until(() -> {
            System.gc();
            return liveWorkers(prefix) == 0;
        });
    }
}
