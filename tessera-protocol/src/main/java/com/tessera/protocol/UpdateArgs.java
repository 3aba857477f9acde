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

import java.util.Map;

/**
 * Arguments shared by the update, replace and find-and-modify commands.
 * Only the fields a given command understands are written by {@link #build(CommandType)}.
 */
public class UpdateArgs {
    private Map<String, ?> filter;
    private Map<String, ?> update;
    private Map<String, ?> replacement;
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    private boolean upsert;
    private ReturnDocument returnDocument;
    private String pageState;

    public UpdateArgs filter(Map<String, ?> filter) {
        this.filter = filter;
        return this;
    }

    public UpdateArgs update(Map<String, ?> update) {
        this.update = update;
        return this;
    }

    public UpdateArgs replacement(Map<String, ?> replacement) {
        this.replacement = replacement;
        return this;
    }

    public UpdateArgs sort(Map<String, ?> sort) {
        this.sort = Sorts.normalize(sort);
        return this;
    }

    public UpdateArgs projection(Map<String, ?> projection) {
        this.projection = Projections.normalize(projection);
        return this;
    }

    public UpdateArgs upsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public UpdateArgs returnDocument(ReturnDocument returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    public UpdateArgs pageState(String pageState) {
        this.pageState = pageState;
        return this;
    }

    public ObjectNode build(CommandType type) {
        ObjectNode command = JSONUtils.newObject();
        ObjectNode options = JSONUtils.newObject();
        command.set("filter", JSONUtils.valueToTree(filter == null ? Map.of() : filter));
        switch (type) {
            case UPDATE_ONE:
                requireUpdate(type);
                command.set("update", JSONUtils.valueToTree(update));
                putSort(command);
                putUpsert(options);
                break;
            case UPDATE_MANY:
                requireUpdate(type);
                command.set("update", JSONUtils.valueToTree(update));
                putUpsert(options);
                if (pageState != null) {
                    options.put("pageState", pageState);
                }
                break;
            case FIND_ONE_AND_UPDATE:
                requireUpdate(type);
                command.set("update", JSONUtils.valueToTree(update));
                putProjection(command);
                putSort(command);
                putReturnDocument(options);
                putUpsert(options);
                break;
            case FIND_ONE_AND_REPLACE:
                if (replacement == null) {
                    throw new IllegalArgumentException("replacement cannot be empty");
                }
                command.set("replacement", JSONUtils.valueToTree(replacement));
                putProjection(command);
                putSort(command);
                putReturnDocument(options);
                putUpsert(options);
                break;
            default:
                throw new IllegalArgumentException("UpdateArgs cannot build a " + type.getCommand() + " command");
        }
        if (!options.isEmpty()) {
            command.set("options", options);
        }
        ObjectNode payload = JSONUtils.newObject();
        payload.set(type.getCommand(), command);
        return payload;
    }

    private void requireUpdate(CommandType type) {
        if (update == null || update.isEmpty()) {
            throw new IllegalArgumentException("update cannot be empty for " + type.getCommand());
        }
    }

    private void putSort(ObjectNode command) {
        if (sort != null) {
            command.set("sort", JSONUtils.valueToTree(sort));
        }
    }

    private void putProjection(ObjectNode command) {
        if (projection != null) {
            command.set("projection", JSONUtils.valueToTree(projection));
        }
    }

    private void putUpsert(ObjectNode options) {
        if (upsert) {
            options.put("upsert", true);
        }
    }

    private void putReturnDocument(ObjectNode options) {
        if (returnDocument != null) {
            options.put("returnDocument", returnDocument.getValue());
        }
    }

    public static class Builder {
        private Builder() {
        }

        public static UpdateArgs filter(Map<String, ?> filter) {
            return new UpdateArgs().filter(filter);
        }
    }
}
