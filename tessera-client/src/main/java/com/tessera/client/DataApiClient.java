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
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tessera.client.auth.StaticTokenProvider;
import com.tessera.client.auth.TokenProvider;
import com.tessera.common.utils.ExecutorServiceUtil;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * Entry point of the library. A client holds the credentials, the options and the
 * HTTP connection pool shared by every database, collection, table and cursor created
 * from it.
 *
 * <pre>{@code
 * try (DataApiClient client = new DataApiClient(new StaticTokenProvider(token), ClientOptions.defaults())) {
 *     Collection collection = client.getDatabase("https://db.example.com").getCollection("books");
 *     ...
 * }
 * }</pre>
 */
public class DataApiClient implements AutoCloseable {
    private final TokenProvider tokenProvider;
    private final ClientOptions options;
    private final ExecutorService httpExecutor;
    private final HttpClient httpClient;
    private final ThreadFactory prefetchThreadFactory;

    public DataApiClient(String token) {
        this(new StaticTokenProvider(token), ClientOptions.defaults());
    }

    public DataApiClient(TokenProvider tokenProvider, ClientOptions options) {
        Preconditions.checkNotNull(tokenProvider, "tokenProvider cannot be null");
        Preconditions.checkNotNull(options, "options cannot be null");
        this.tokenProvider = tokenProvider;
        this.options = options;

        ThreadFactory httpThreadFactory = new ThreadFactoryBuilder()
                .setNameFormat("tessera.http-%d")
                .setDaemon(true)
                .build();
        this.httpExecutor = Executors.newCachedThreadPool(httpThreadFactory);
        HttpClient.Builder builder = HttpClient.newBuilder().executor(httpExecutor);
        if (options.getConnectTimeout() != null) {
            builder.connectTimeout(options.getConnectTimeout());
        }
        this.httpClient = builder.build();
        this.prefetchThreadFactory = new ThreadFactoryBuilder()
                .setNameFormat("tessera.cursor-prefetch-%d")
                .setDaemon(true)
                .build();
    }

    public Database getDatabase(String endpoint) {
        return getDatabase(endpoint, options.getKeyspace());
    }

    public Database getDatabase(String endpoint, String keyspace) {
        return new Database(this, endpoint, keyspace);
    }

    public TokenProvider getTokenProvider() {
        return tokenProvider;
    }

    public ClientOptions getOptions() {
        return options;
    }

    HttpClient getHttpClient() {
        return httpClient;
    }

    ThreadFactory getPrefetchThreadFactory() {
        return prefetchThreadFactory;
    }

    /**
     * Stops the threads serving HTTP requests. Requests still in flight are cancelled.
     */
    @Override
    public void close() {
        ExecutorServiceUtil.shutdownNowThenAwaitTermination("HTTP", httpExecutor);
    }
}
