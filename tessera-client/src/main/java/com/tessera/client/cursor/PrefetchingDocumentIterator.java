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

import com.tessera.protocol.DataApiException;
import com.tessera.protocol.FindPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches pages on a dedicated background thread and hands documents over through a
 * bounded FIFO queue, so the consumer usually finds the next document already there.
 *
 * <p>The worker blocks while the queue holds {@code prefetched} documents. It checks the
 * termination flag between page fetches and while waiting for room in the queue, and
 * stops when the source is exhausted, when the overall limit is reached, when a page
 * fetch fails or when {@link #close()} is called. A failure is handed over through the
 * queue too and re-thrown by the consumer's next pull, after the documents that
 * preceded it.
 */
public class PrefetchingDocumentIterator implements DocumentIterator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrefetchingDocumentIterator.class);
    private static final long OFFER_TIMEOUT_MS = 100;
    private static final Object END = new Object();

    private final PageFetcher fetcher;
    private final Integer limit;
    private final BlockingQueue<Object> queue;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final Thread worker;
    private Object head;
    private volatile boolean finished;

    public PrefetchingDocumentIterator(PageFetcher fetcher, Integer limit, int prefetched, ThreadFactory threadFactory) {
        if (prefetched <= 0) {
            throw new IllegalArgumentException("prefetched must be a positive integer");
        }
        this.fetcher = fetcher;
        this.limit = limit;
        this.queue = new LinkedBlockingQueue<>(prefetched);
        this.worker = threadFactory.newThread(this::fetchLoop);
        this.worker.start();
    }

    private void fetchLoop() {
        String pageState = null;
        int enqueued = 0;
        try {
            do {
                if (terminated.get()) {
                    return;
                }
                FindPage page = fetcher.fetch(pageState);
                pageState = page.nextPageState();
                for (Map<String, Object> document : page.documents()) {
                    if (limit != null && enqueued >= limit) {
                        break;
                    }
                    if (!offer(document)) {
                        return;
                    }
                    enqueued++;
                }
            } while (pageState != null && (limit == null || enqueued < limit));
            offer(END);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Prefetch worker interrupted", e);
        } catch (RuntimeException e) {
            if (terminated.get()) {
                LOGGER.debug("Page fetch failed after the iterator was closed", e);
                return;
            }
            try {
                offer(new Failure(e));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOGGER.debug("Prefetch worker interrupted while reporting a failure", e);
            }
        }
    }

    /**
     * @return false if the iterator was closed before the item could be queued
     */
    private boolean offer(Object item) throws InterruptedException {
        while (!terminated.get()) {
            if (queue.offer(item, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (head == null) {
            try {
                head = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new DataApiException("Interrupted while waiting for the next document", e);
            }
        }
        if (head == END) {
            head = null;
            finished = true;
            return false;
        }
        if (head instanceof Failure failure) {
            head = null;
            finished = true;
            terminated.set(true);
            throw failure.error();
        }
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, Object> document = (Map<String, Object>) head;
        head = null;
        return document;
    }

    @Override
    public void close() {
        if (terminated.compareAndSet(false, true)) {
            worker.interrupt();
        }
        finished = true;
        head = null;
        // wakes up a consumer blocked in take(); the worker may still slip in its last item
        queue.clear();
        while (!queue.offer(END)) {
            queue.clear();
        }
    }

    boolean isWorkerAlive() {
        return worker.isAlive();
    }

    private record Failure(RuntimeException error) {
    }
}
