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

import java.util.Iterator;
import java.util.Map;

/**
 * A forward-only, non-restartable sequence of documents spanning any number of pages.
 * Closing it stops any further page fetch.
 */
public interface DocumentIterator extends Iterator<Map<String, Object>>, AutoCloseable {

    @Override
    void close();
}
