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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.JSONUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One configuration axis of a find request. The set of variants is closed:
 * a filter, a projection, a sort, a skip, a limit and a continuation token.
 * {@link FindArgs} holds at most one variant per axis.
 */
public sealed interface FindOption {

    /**
     * Writes this option into a find command body.
     *
     * @param command the command body, e.g. the object under {@code "find"}
     * @param options the {@code "options"} object of the same command
     */
    void writeTo(ObjectNode command, ObjectNode options);

    record Filter(Map<String, Object> value) implements FindOption {
        public Filter {
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            command.set("filter", JSONUtils.valueToTree(value));
        }
    }

    record Projection(Map<String, Object> value) implements FindOption {
        public Projection {
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            command.set("projection", JSONUtils.valueToTree(value));
        }
    }

    record Sort(Map<String, Object> value) implements FindOption {
        public Sort {
            value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            command.set("sort", JSONUtils.valueToTree(value));
        }
    }

    record Skip(int value) implements FindOption {
        public Skip {
            if (value < 0) {
                throw new IllegalArgumentException("skip must be a non-negative integer");
            }
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            options.put("skip", value);
        }
    }

    record Limit(int value) implements FindOption {
        public Limit {
            if (value <= 0) {
                throw new IllegalArgumentException("limit must be a positive integer");
            }
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            options.put("limit", value);
        }
    }

    record PageState(String value) implements FindOption {
        public PageState {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("pageState cannot be empty");
            }
        }

        @Override
        public void writeTo(ObjectNode command, ObjectNode options) {
            options.put("pageState", value);
        }
    }
}
