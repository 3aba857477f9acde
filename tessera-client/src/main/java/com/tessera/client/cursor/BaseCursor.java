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
import com.tessera.protocol.FindArgs;

import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Query shape and state machine shared by {@link Cursor} and {@link AsyncCursor}.
 *
 * <p>A cursor is created {@link CursorState#NEW}: the query can be refined with the
 * setters below. The first pull starts it and freezes the query. It then runs until the
 * results are exhausted or {@link #close()} is called. {@link #rewind()} brings it back
 * to {@code NEW} with the same query, {@code clone()} creates an independent fresh copy.
 *
 * @param <T> the type of the items produced
 * @param <C> the concrete cursor type, returned by the chaining setters
 */
public abstract class BaseCursor<T, C extends BaseCursor<T, C>> implements AutoCloseable {
    protected final CommandExecutor executor;
    protected final Function<Map<String, Object>, T> mapper;
    private final String cursorId = UUID.randomUUID().toString();
    protected FindArgs args;
    protected volatile boolean started;
    protected volatile boolean alive = true;
    protected volatile boolean closed;
    protected volatile int retrieved;

    protected BaseCursor(CommandExecutor executor, FindArgs args, Function<Map<String, Object>, T> mapper) {
        Preconditions.checkNotNull(executor, "executor cannot be null");
        Preconditions.checkNotNull(mapper, "mapper cannot be null");
        this.executor = executor;
        this.args = args == null ? new FindArgs() : args.copy();
        this.mapper = mapper;
    }

    protected abstract C self();

    /**
     * @return a fresh cursor with the same query, independent of this one
     */
    public abstract C clone();

    public C filter(Map<String, ?> filter) {
        ensureNotStartedAndAlive();
        args.filter(filter);
        return self();
    }

    public C projection(Map<String, ?> projection) {
        ensureNotStartedAndAlive();
        args.projection(projection);
        return self();
    }

    public C projection(Iterable<String> fields) {
        ensureNotStartedAndAlive();
        args.projection(fields);
        return self();
    }

    public C sort(Map<String, ?> sort) {
        ensureNotStartedAndAlive();
        args.sort(sort);
        return self();
    }

    public C skip(Integer skip) {
        ensureNotStartedAndAlive();
        args.skip(skip);
        return self();
    }

    /**
     * Sets the overall number of items to return. {@code limit(0)} removes the limit
     * instead of asking for no items at all.
     */
    public C limit(Integer limit) {
        ensureNotStartedAndAlive();
        args.limit(limit);
        return self();
    }

    public C slice(int start, int stop) {
        return slice(start, stop, 1);
    }

    /**
     * Restricts this cursor to the items in {@code [start, stop)} of its result set.
     * Unlike {@code get}, this changes the cursor itself.
     *
     * @throws IllegalArgumentException if {@code step} is not 1 or the bounds are invalid
     */
    public C slice(int start, int stop, int step) {
        ensureNotStartedAndAlive();
        Preconditions.checkArgument(step == 1, "Cursor slicing cannot have arbitrary step");
        Preconditions.checkArgument(start >= 0, "slice start must be non-negative");
        Preconditions.checkArgument(stop > start, "slice stop must be greater than start");
        args.limit(stop - start).skip(start);
        return self();
    }

    /**
     * Resets this cursor to its pristine state, keeping the query.
     */
    public C rewind() {
        releaseResources();
        started = false;
        alive = true;
        closed = false;
        retrieved = 0;
        return self();
    }

    /**
     * Stops the cursor whatever its state. Calling it more than once has no effect.
     */
    @Override
    public void close() {
        if (!alive) {
            return;
        }
        alive = false;
        closed = true;
        releaseResources();
    }

    /**
     * Marks the cursor as having no more items and releases its resources.
     */
    protected void exhaust() {
        alive = false;
        releaseResources();
    }

    protected abstract void releaseResources();

    protected void ensureNotStarted() {
        Preconditions.checkState(!started, "Cursor has already been used");
    }

    protected void ensureAlive() {
        Preconditions.checkState(alive, "Cursor is closed.");
    }

    protected void ensureNotStartedAndAlive() {
        ensureNotStarted();
        ensureAlive();
    }

    /**
     * @return the query this cursor runs, as a copy
     */
    public FindArgs getArgs() {
        return args.copy();
    }

    public Map<String, Object> getFilter() {
        return args.getFilter();
    }

    public Map<String, Object> getProjection() {
        return args.getProjection();
    }

    public Map<String, Object> getSort() {
        return args.getSort();
    }

    public Integer getSkip() {
        return args.getSkip();
    }

    public Integer getLimit() {
        return args.getLimit();
    }

    public CursorState getState() {
        if (alive) {
            return started ? CursorState.RUNNING : CursorState.NEW;
        }
        return closed ? CursorState.CLOSED : CursorState.EXHAUSTED;
    }

    public boolean isAlive() {
        return alive;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * @return the number of items produced so far
     */
    public int getRetrieved() {
        return retrieved;
    }

    /**
     * @return the location of the collection or table this cursor reads
     */
    public String getAddress() {
        return executor.getAddress();
    }

    public String getCursorId() {
        return cursorId;
    }

    @Override
    public String toString() {
        return String.format("%s(\"%s\", %s, retrieved: %d)",
                getClass().getSimpleName(), getAddress(), getState().name().toLowerCase(), retrieved);
    }
}
