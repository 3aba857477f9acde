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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Arguments of a {@code find} or {@code findOne} command.
 *
 * <p>Each setter replaces the option of its axis; passing {@code null} clears it.
 * A projection given as a collection of field names is normalized into an
 * inclusion map and a sort is copied into an insertion-ordered map.
 *
 * <pre>{@code
 * ObjectNode payload = FindArgs.Builder.filter(Map.of("status", "active"))
 *     .sort(Map.of("createdAt", -1))
 *     .limit(50)
 *     .build(CommandType.FIND);
 * }</pre>
 */
public class FindArgs {
    private FindOption.Filter filter;
    private FindOption.Projection projection;
    private FindOption.Sort sort;
    private FindOption.Skip skip;
    private FindOption.Limit limit;
    private FindOption.PageState pageState;

    public FindArgs filter(Map<String, ?> filter) {
        this.filter = filter == null ? null : new FindOption.Filter(Collections.unmodifiableMap(filter));
        return this;
    }

    public FindArgs projection(Map<String, ?> projection) {
        Map<String, Object> normalized = Projections.normalize(projection);
        this.projection = normalized == null ? null : new FindOption.Projection(normalized);
        return this;
    }

    public FindArgs projection(Iterable<String> fields) {
        Map<String, Object> normalized = Projections.normalize(fields);
        this.projection = normalized == null ? null : new FindOption.Projection(normalized);
        return this;
    }

    public FindArgs sort(Map<String, ?> sort) {
        Map<String, Object> normalized = Sorts.normalize(sort);
        this.sort = normalized == null ? null : new FindOption.Sort(normalized);
        return this;
    }

    public FindArgs skip(Integer skip) {
        this.skip = skip == null ? null : new FindOption.Skip(skip);
        return this;
    }

    /**
     * Sets the overall number of documents to return. Zero, like {@code null},
     * means "no limit".
     */
    public FindArgs limit(Integer limit) {
        this.limit = (limit == null || limit == 0) ? null : new FindOption.Limit(limit);
        return this;
    }

    public FindArgs pageState(String pageState) {
        this.pageState = pageState == null ? null : new FindOption.PageState(pageState);
        return this;
    }

    public Map<String, Object> getFilter() {
        return filter == null ? null : filter.value();
    }

    public Map<String, Object> getProjection() {
        return projection == null ? null : projection.value();
    }

    public Map<String, Object> getSort() {
        return sort == null ? null : sort.value();
    }

    public Integer getSkip() {
        return skip == null ? null : skip.value();
    }

    public Integer getLimit() {
        return limit == null ? null : limit.value();
    }

    public String getPageState() {
        return pageState == null ? null : pageState.value();
    }

    /**
     * @return the options currently set, in wire order
     */
    public List<FindOption> options() {
        List<FindOption> options = new ArrayList<>();
        for (FindOption option : new FindOption[]{filter, projection, sort, skip, limit, pageState}) {
            if (option != null) {
                options.add(option);
            }
        }
        return options;
    }

    /**
     * Returns a copy of these arguments carrying the given continuation token.
     */
    public FindArgs withPageState(String pageState) {
        FindArgs copy = copy();
        copy.pageState(pageState);
        return copy;
    }

    public FindArgs copy() {
        FindArgs copy = new FindArgs();
        copy.filter = filter;
        copy.projection = projection;
        copy.sort = sort;
        copy.skip = skip;
        copy.limit = limit;
        copy.pageState = pageState;
        return copy;
    }

    /**
     * Builds the request payload of the given command.
     *
     * @param type either {@link CommandType#FIND} or {@link CommandType#FIND_ONE}
     * @return the full payload, e.g. {@code {"find": {...}}}
     * @throws IllegalArgumentException if the command is not a find command, or if
     *                                  paging options are given for {@code findOne}
     */
    public ObjectNode build(CommandType type) {
        if (type != CommandType.FIND && type != CommandType.FIND_ONE) {
            throw new IllegalArgumentException("FindArgs cannot build a " + type.getCommand() + " command");
        }
        if (type == CommandType.FIND_ONE && (skip != null || limit != null || pageState != null)) {
            throw new IllegalArgumentException("findOne does not accept skip, limit or pageState");
        }
        ObjectNode command = JSONUtils.newObject();
        ObjectNode options = JSONUtils.newObject();
        for (FindOption option : options()) {
            option.writeTo(command, options);
        }
        if (!options.isEmpty()) {
            command.set("options", options);
        }
        ObjectNode payload = JSONUtils.newObject();
        payload.set(type.getCommand(), command);
        return payload;
    }

    public static class Builder {
        private Builder() {
        }

        public static FindArgs filter(Map<String, ?> filter) {
            return new FindArgs().filter(filter);
        }

        public static FindArgs projection(Map<String, ?> projection) {
            return new FindArgs().projection(projection);
        }

        public static FindArgs projection(Iterable<String> fields) {
            return new FindArgs().projection(fields);
        }

        public static FindArgs sort(Map<String, ?> sort) {
            return new FindArgs().sort(sort);
        }

        public static FindArgs skip(Integer skip) {
            return new FindArgs().skip(skip);
        }

        public static FindArgs limit(Integer limit) {
            return new FindArgs().limit(limit);
        }
    }
}
