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

import com.tessera.protocol.FindPage;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Fetches pages on demand, on the consumer's thread.
 */
public class PagingDocumentIterator implements DocumentIterator {
    private final PageFetcher fetcher;
    private final Integer limit;
    private Iterator<Map<String, Object>> current = Collections.emptyIterator();
    private String nextPageState;
    private boolean firstPageFetched;
    private boolean closed;
    private int produced;

    /**
     * @param fetcher the page source
     * @param limit   the overall number of documents to return, {@code null} for no limit
     */
    public PagingDocumentIterator(PageFetcher fetcher, Integer limit) {
        this.fetcher = fetcher;
        this.limit = limit;
    }

    @Override
    public boolean hasNext() {
        if (closed || (limit != null && produced >= limit)) {
            return false;
        }
        while (!current.hasNext()) {
            if (firstPageFetched && nextPageState == null) {
                return false;
            }
            FindPage page;
            try {
                page = fetcher.fetch(nextPageState);
            } catch (RuntimeException e) {
                closed = true;
                throw e;
            }
            firstPageFetched = true;
            nextPageState = page.nextPageState();
            current = page.documents().iterator();
        }
        return true;
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        produced++;
        return current.next();
    }

    @Override
    public void close() {
        closed = true;
        current = Collections.emptyIterator();
    }
}
