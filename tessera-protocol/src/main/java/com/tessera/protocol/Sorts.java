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

package com.tessera.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Sorts {
    public static final int ASCENDING = 1;
    public static final int DESCENDING = -1;

    private Sorts() {
    }

    /**
     * @return a plain insertion-ordered copy of the sort, or {@code null} if it is empty
     */
    public static Map<String, Object> normalize(Map<String, ?> sort) {
        if (sort == null || sort.isEmpty()) {
            return null;
        }
        return new LinkedHashMap<>(sort);
    }

    public static Map<String, Object> ascending(String field) {
        Map<String, Object> sort = new LinkedHashMap<>();
        sort.put(field, ASCENDING);
        return sort;
    }

    public static Map<String, Object> descending(String field) {
        Map<String, Object> sort = new LinkedHashMap<>();
        sort.put(field, DESCENDING);
        return sort;
    }
}
