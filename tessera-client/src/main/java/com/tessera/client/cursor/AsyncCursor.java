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
import com.tessera.client.http.CommandExecutor;
import com.tessera.protocol.CommandType;
import com.tessera.protocol.DocumentPaths;
import com.tessera.protocol.FindArgs;
import com.tessera.protocol.FindPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * The asynchronous counterpart of {@link Cursor}: same query shape and state machine,
 * with every pull returning a {@link CompletableFuture}.
 *
 * <p>At most one page request is in flight at any time. Calls to {@link #next()} made
 * before the previous one completed are chained behind it, so items are always produced
 * in server order.
 *
 * @param <T> the type of the items produced
 */
public class AsyncCursor<T> extends BaseCursor<T, AsyncCursor<T>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncCursor.class);

    private final Deque<Map<String, Object>> buffer = new ArrayDeque<>();
    private AsyncPageFetcher fetcher;
    private Integer limit;
    private String nextPageState;
    private boolean firstPageFetched;
    private int produced;
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    public AsyncCursor(CommandExecutor executor, FindArgs args, Function<Map<String, Object>, T> mapper) {
        super(executor, args, mapper);
    }

    @Override
    protected AsyncCursor<T> self() {
        return this;
    }

    @Override
    public AsyncCursor<T> clone() {
        return new AsyncCursor<>(executor, args, mapper);
    }

    /**
     * Pulls the next item.
     *
     * @return a future completed with the item, or with an empty optional once the
     * cursor is exhausted or closed
     */
    public synchronized CompletableFuture<Optional<T>> next() {
        CompletableFuture<Optional<T>> result = tail.thenCompose(ignored -> pull());
        tail = result.handle((item, throwable) -> null);
        return result;
    }

    private synchronized CompletableFuture<Optional<T>> pull() {
        if (!alive) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!started) {
            start();
        }
        if (limit != null && produced >= limit) {
            exhaust();
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!buffer.isEmpty()) {
            produced++;
            retrieved++;
            return CompletableFuture.completedFuture(Optional.of(mapper.apply(buffer.poll())));
        }
        if (firstPageFetched && nextPageState == null) {
            exhaust();
            return CompletableFuture.completedFuture(Optional.empty());
        }
        AsyncPageFetcher current = fetcher;
        return current.fetch(nextPageState)
                .handle((page, throwable) -> onPage(current, page, throwable))
                .thenCompose(Function.identity());
    }

    private synchronized CompletableFuture<Optional<T>> onPage(AsyncPageFetcher source, FindPage page, Throwable throwable) {
        if (source != fetcher) {
            // rewound or closed while the page was in flight, the outcome belongs to a previous run
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (throwable != null) {
            exhaust();
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                    ? throwable.getCause()
                    : throwable;
            return CompletableFuture.failedFuture(cause);
        }
        firstPageFetched = true;
        nextPageState = page.nextPageState();
        buffer.addAll(page.documents());
        return pull();
    }

    private void start() {
        FindArgs query = args.copy();
        CommandExecutor commandExecutor = executor;
        fetcher = pageState -> {
            LOGGER.info("cursor fetching a page from {}{}", commandExecutor.getAddress(), pageState == null ? "" : " (continuing)");
            return commandExecutor.executeAsync(query.withPageState(pageState).build(CommandType.FIND))
                    .thenApply(FindPage::fromResponse);
        };
        limit = query.getLimit();
        started = true;
    }

    /**
     * Drains the remaining items of this cursor.
     */
    public CompletableFuture<List<T>> toList() {
        List<T> items = new ArrayList<>();
        return drain(items).thenApply(ignored -> items);
    }

    private CompletableFuture<Void> drain(List<T> items) {
        return next().thenCompose(item -> {
            if (item.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            items.add(item.get());
            return drain(items);
        });
    }

    /**
     * Returns the item at the given position of the result set through a separate query,
     * leaving this cursor untouched. The future fails with an
     * {@link IndexOutOfBoundsException} if there is no such item.
     */
    public CompletableFuture<T> get(int index) {
        ensureNotStartedAndAlive();
        Preconditions.checkArgument(index >= 0, "index must be non-negative");
        AsyncCursor<T> probe = new AsyncCursor<>(executor, args.copy().skip(index).limit(1), mapper);
        return probe.next().thenApply(item -> {
            probe.close();
            return item.orElseThrow(() -> new IndexOutOfBoundsException("no such item for AsyncCursor instance: " + index));
        });
    }

    /**
     * Asynchronous version of {@link Cursor#distinct(String)}.
     */
    public CompletableFuture<List<Object>> distinct(String key) {
        String projectionKey = DocumentPaths.safeProjectionPrefix(key);
        AsyncCursor<Map<String, Object>> cursor = new AsyncCursor<>(
                executor, args.copy().projection(Map.of(projectionKey, true)), Function.identity()
        );
        return cursor.toList().thenApply(documents -> {
            Set<Object> seen = new HashSet<>();
            List<Object> values = new ArrayList<>();
            for (Map<String, Object> document : documents) {
                for (Object value : DocumentPaths.extract(document, key)) {
                    if (seen.add(value)) {
                        values.add(value);
                    }
                }
            }
            return values;
        });
    }

    @Override
    protected synchronized void releaseResources() {
        buffer.clear();
        fetcher = null;
        limit = null;
        nextPageState = null;
        firstPageFetched = false;
        produced = 0;
    }
}
