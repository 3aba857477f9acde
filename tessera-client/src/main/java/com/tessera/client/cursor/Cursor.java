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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.client.http.CommandExecutor;
import com.tessera.protocol.CommandType;
import com.tessera.protocol.DocumentPaths;
import com.tessera.protocol.FindArgs;
import com.tessera.protocol.FindPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.function.Function;

/**
 * A lazy, forward-only iteration over the results of a {@code find} command.
 *
 * <p>Pages are fetched as the cursor is consumed, either on the consumer's thread or,
 * when {@code prefetched} is positive, by a background worker that keeps up to that many
 * documents buffered. Use the cursor in a try-with-resources block, or call
 * {@link #close()}, to stop the worker promptly when the results are not read to the end;
 * an abandoned cursor is also closed once it is garbage collected, but only as a fallback.
 *
 * <pre>{@code
 * try (Cursor<Map<String, Object>> cursor = collection.find(Map.of("status", "active"))) {
 *     for (Map<String, Object> document : cursor.limit(100)) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <p>A cursor is not thread-safe and is meant to be consumed by a single thread.
 *
 * @param <T> the type of the items produced
 */
public class Cursor<T> extends BaseCursor<T, Cursor<T>> implements Iterator<T>, Iterable<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Cursor.class);
    private static final Cleaner CLEANER = Cleaner.create(
            new ThreadFactoryBuilder().setNameFormat("tessera.cursor-cleaner-%d").setDaemon(true).build()
    );

    private final int prefetched;
    private final ThreadFactory threadFactory;
    private DocumentIterator iterator;
    private Cleaner.Cleanable cleanable;

    /**
     * @param executor      runs the {@code find} commands
     * @param args          the initial query, copied
     * @param prefetched    documents buffered by a background worker; 0 disables prefetching
     * @param threadFactory creates the prefetch worker
     * @param mapper        turns each raw document into an item
     */
    public Cursor(CommandExecutor executor,
                  FindArgs args,
                  int prefetched,
                  ThreadFactory threadFactory,
                  Function<Map<String, Object>, T> mapper) {
        super(executor, args, mapper);
        Preconditions.checkArgument(prefetched >= 0, "prefetched cannot be negative");
        Preconditions.checkArgument(prefetched == 0 || threadFactory != null, "a thread factory is required to prefetch");
        this.prefetched = prefetched;
        this.threadFactory = threadFactory;
    }

    @Override
    protected Cursor<T> self() {
        return this;
    }

    @Override
    public Cursor<T> clone() {
        return new Cursor<>(executor, args, prefetched, threadFactory, mapper);
    }

    public int getPrefetched() {
        return prefetched;
    }

    private void start() {
        FindArgs query = args.copy();
        // The fetcher must not reference this cursor, or a prefetch worker would keep it reachable.
        CommandExecutor commandExecutor = executor;
        PageFetcher fetcher = pageState -> {
            LOGGER.info("cursor fetching a page from {}{}", commandExecutor.getAddress(), pageState == null ? "" : " (continuing)");
            FindPage page = FindPage.fromResponse(commandExecutor.execute(query.withPageState(pageState).build(CommandType.FIND)));
            LOGGER.debug("cursor finished fetching a page: {}", page);
            return page;
        };
        iterator = DocumentIterators.open(fetcher, query.getLimit(), prefetched, threadFactory);
        cleanable = CLEANER.register(this, new IteratorCloser(iterator));
        started = true;
    }

    @Override
    public boolean hasNext() {
        if (!alive) {
            return false;
        }
        if (iterator == null) {
            start();
        }
        boolean hasNext;
        try {
            hasNext = iterator.hasNext();
        } catch (RuntimeException e) {
            exhaust();
            throw e;
        }
        if (!hasNext) {
            exhaust();
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Cursor has no more documents");
        }
        Map<String, Object> document = iterator.next();
        retrieved++;
        return mapper.apply(document);
    }

    /**
     * Returns this cursor itself: iterating it twice does not restart the query,
     * use {@link #rewind()} for that.
     */
    @Override
    public Iterator<T> iterator() {
        return this;
    }

    /**
     * Drains the remaining items of this cursor.
     */
    public List<T> toList() {
        List<T> items = new ArrayList<>();
        while (hasNext()) {
            items.add(next());
        }
        return items;
    }

    /**
     * Returns the item at the given position of the result set, without touching this
     * cursor: a separate query is run with the position as {@code skip} and a limit of one.
     *
     * @throws IndexOutOfBoundsException if the result set has no item at that position
     */
    public T get(int index) {
        ensureNotStartedAndAlive();
        Preconditions.checkArgument(index >= 0, "index must be non-negative");
        FindArgs probe = args.copy().skip(index).limit(1);
        try (Cursor<T> cursor = new Cursor<>(executor, probe, 0, threadFactory, mapper)) {
            if (cursor.hasNext()) {
                return cursor.next();
            }
        }
        throw new IndexOutOfBoundsException("no such item for Cursor instance: " + index);
    }

    /**
     * Collects the distinct values found under {@code key} in every document of the
     * result set. The key is in dot notation: numeric segments index into lists, other
     * lists are unrolled. Values are listed in the order they are first met.
     *
     * <p>This reads the whole result set through a fresh copy of the cursor; this cursor
     * is left untouched.
     */
    public List<Object> distinct(String key) {
        String projectionKey = DocumentPaths.safeProjectionPrefix(key);
        FindArgs query = args.copy().projection(Map.of(projectionKey, true));
        Set<Object> seen = new HashSet<>();
        List<Object> values = new ArrayList<>();
        try (Cursor<Map<String, Object>> cursor = new Cursor<>(executor, query, prefetched, threadFactory, Function.identity())) {
            while (cursor.hasNext()) {
                for (Object value : DocumentPaths.extract(cursor.next(), key)) {
                    if (seen.add(value)) {
                        values.add(value);
                    }
                }
            }
        }
        return values;
    }

    @Override
    protected void releaseResources() {
        if (cleanable != null) {
            cleanable.clean();
            cleanable = null;
        }
        iterator = null;
    }

    private record IteratorCloser(DocumentIterator iterator) implements Runnable {
        @Override
        public void run() {
            iterator.close();
        }
    }
}
