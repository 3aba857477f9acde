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

package com.tessera.protocol.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

final class Descriptors {
    private static final Logger LOGGER = LoggerFactory.getLogger(Descriptors.class);

    private Descriptors() {
    }

    /**
     * Logs the keys of a server-provided object that the descriptor does not model.
     * Newer servers may add fields at any time; they are reported, never rejected.
     */
    static void warnResidualKeys(Class<?> type, JsonNode node, Set<String> knownKeys) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> residual = new ArrayList<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!knownKeys.contains(name)) {
                residual.add(name);
            }
        }
        if (!residual.isEmpty()) {
            LOGGER.warn("Unexpected key(s) encountered parsing a dictionary into a {}: {}", type.getSimpleName(), residual);
        }
    }
}
