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

import com.tessera.protocol.DataApiException;

/**
 * Raised by {@code countDocuments} when the count exceeds the caller's upper bound or
 * the server's own counting ceiling.
 */
public class TooManyDocumentsToCountException extends DataApiException {
    private final int limit;
    private final boolean serverCapped;

    public TooManyDocumentsToCountException(String message, int limit, boolean serverCapped) {
        super(message);
        this.limit = limit;
        this.serverCapped = serverCapped;
    }

    /**
     * @return the bound that was exceeded
     */
    public int getLimit() {
        return limit;
    }

    /**
     * @return true if the server stopped counting, false if the caller's bound was exceeded
     */
    public boolean isServerCapped() {
        return serverCapped;
    }
}
