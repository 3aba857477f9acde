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

public final class Projections {

    private Projections() {
    }

    /**
     * Copies a projection map. Values are passed to the server unchanged, so both
     * booleans and 0/1 are accepted.
     *
     * @return a new insertion-ordered map, or {@code null} if the projection is empty
     */
    public static Map<String, Object> normalize(Map<String, ?> projection) {
        if (projection == null || projection.isEmpty()) {
            return null;
        }
        return new LinkedHashMap<>(projection);
    }

    /**
     * Expands a list of field names into an inclusion projection.
     *
     * @return {@code {field: true, ...}}, or {@code null} if no field is given
     */
    public static Map<String, Object> normalize(Iterable<String> fields) {
        if (fields == null) {
            return null;
        }
        Map<String, Object> projection = new LinkedHashMap<>();
        for (String field : fields) {
            projection.put(field, true);
        }
        return projection.isEmpty() ? null : projection;
    }
}
