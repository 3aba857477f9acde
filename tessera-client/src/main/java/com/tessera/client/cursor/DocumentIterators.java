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

import java.util.concurrent.ThreadFactory;

public final class DocumentIterators {

    private DocumentIterators() {
    }

    /**
     * Opens a document sequence over the given page source.
     *
     * @param fetcher       the page source
     * @param limit         the overall number of documents to return, {@code null} for no limit
     * @param prefetched    the number of documents to buffer ahead; 0 fetches pages on demand
     * @param threadFactory creates the prefetch worker, unused when {@code prefetched} is 0
     */
    public static DocumentIterator open(PageFetcher fetcher, Integer limit, int prefetched, ThreadFactory threadFactory) {
        if (prefetched > 0) {
            return new PrefetchingDocumentIterator(fetcher, limit, prefetched, threadFactory);
        }
        return new PagingDocumentIterator(fetcher, limit);
    }
}
