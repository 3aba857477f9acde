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

/**
 * Fetches one page of a query. This is the only network call made while iterating.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * @param pageState the continuation token of the previous page, {@code null} for the first page
     * @return the page
     */
    FindPage fetch(String pageState);
}
