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

import com.google.common.base.Preconditions;
import com.tessera.client.http.Caller;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings shared by everything created from a {@link DataApiClient}.
 *
 * <p>The defaults live in the {@code tessera.client} block of {@code reference.conf} and can be
 * overridden in {@code application.conf}, through system properties or with {@link #builder()}.
 */
public class ClientOptions {
    public static final String CONFIG_PATH = "tessera.client";

    private final String apiPath;
    private final String apiVersion;
    private final String keyspace;
    private final String authHeader;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final int prefetched;
    private final int insertManyChunkSize;
    private final List<String> redactedHeaders;
    private final List<Caller> callers;

    private ClientOptions(Builder builder) {
        this.apiPath = builder.apiPath;
        this.apiVersion = builder.apiVersion;
        this.keyspace = builder.keyspace;
        this.authHeader = builder.authHeader;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.prefetched = builder.prefetched;
        this.insertManyChunkSize = builder.insertManyChunkSize;
        this.redactedHeaders = List.copyOf(builder.redactedHeaders);
        this.callers = List.copyOf(builder.callers);
    }

    /**
     * @return the options loaded from the application's configuration
     */
    public static ClientOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    public static ClientOptions fromConfig(Config config) {
        return new Builder(config.getConfig(CONFIG_PATH)).build();
    }

    /**
     * @return a builder initialized with the values of the application's configuration
     */
    public static Builder builder() {
        return new Builder(ConfigFactory.load().getConfig(CONFIG_PATH));
    }

    public String getApiPath() {
        return apiPath;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getAuthHeader() {
        return authHeader;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getPrefetched() {
        return prefetched;
    }

    public int getInsertManyChunkSize() {
        return insertManyChunkSize;
    }

    public List<String> getRedactedHeaders() {
        return redactedHeaders;
    }

    public List<Caller> getCallers() {
        return callers;
    }

    public static class Builder {
        private String apiPath;
        private String apiVersion;
        private String keyspace;
        private String authHeader;
        private Duration requestTimeout;
        private Duration connectTimeout;
        private int prefetched;
        private int insertManyChunkSize;
        private List<String> redactedHeaders;
        private final List<Caller> callers = new ArrayList<>();

        private Builder(Config config) {
            this.apiPath = config.getString("api_path");
            this.apiVersion = config.getString("api_version");
            this.keyspace = config.getString("keyspace");
            this.authHeader = config.getString("auth_header");
            this.requestTimeout = config.getDuration("request_timeout");
            this.connectTimeout = config.getDuration("connect_timeout");
            this.prefetched = config.getInt("cursor.prefetched");
            this.insertManyChunkSize = config.getInt("insert_many.chunk_size");
            this.redactedHeaders = new ArrayList<>(config.getStringList("redacted_headers"));
            if (config.hasPath("caller.name")) {
                String version = config.hasPath("caller.version") ? config.getString("caller.version") : null;
                this.callers.add(new Caller(config.getString("caller.name"), version));
            }
        }

        public Builder apiPath(String apiPath) {
            this.apiPath = apiPath;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder keyspace(String keyspace) {
            this.keyspace = keyspace;
            return this;
        }

        public Builder authHeader(String authHeader) {
            this.authHeader = authHeader;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder prefetched(int prefetched) {
            this.prefetched = prefetched;
            return this;
        }

        public Builder insertManyChunkSize(int insertManyChunkSize) {
            this.insertManyChunkSize = insertManyChunkSize;
            return this;
        }

        public Builder redactedHeaders(List<String> redactedHeaders) {
            this.redactedHeaders = new ArrayList<>(redactedHeaders);
            return this;
        }

        public Builder caller(String name, String version) {
            this.callers.add(new Caller(name, version));
            return this;
        }

        public ClientOptions build() {
            Preconditions.checkArgument(prefetched >= 0, "prefetched cannot be negative");
            Preconditions.checkArgument(insertManyChunkSize > 0, "insert_many.chunk_size must be positive");
            Preconditions.checkNotNull(keyspace, "keyspace cannot be null");
            return new ClientOptions(this);
        }
    }
}
