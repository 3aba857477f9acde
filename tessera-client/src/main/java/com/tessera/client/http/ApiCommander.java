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

package com.tessera.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.tessera.common.JSONUtils;
import com.tessera.common.utils.Utils;
import com.tessera.protocol.DataApiException;
import com.tessera.protocol.UnexpectedDataApiResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Issues JSON commands against a single Data API resource, e.g. one collection.
 *
 * <p>The full URL is the endpoint joined with the resource path. Every request carries
 * the JSON content headers and the headers given at construction; headers with a
 * {@code null} value are left out. Responses are parsed and checked: HTTP errors,
 * unparseable bodies and an {@code errors} array in the body all surface as
 * {@link DataApiException}s, while {@code status.warnings} are only logged.
 * No request is ever retried here.
 */
public class ApiCommander implements CommandExecutor {
    public static final String REDACTED = "***";
    public static final Set<String> DEFAULT_REDACTED_HEADERS = Set.of(
            "token",
            "authorization",
            "x-embedding-api-key",
            "x-embedding-access-id",
            "x-embedding-secret-id"
    );
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiCommander.class);

    private final HttpClient httpClient;
    private final String fullUrl;
    private final Map<String, String> headers;
    private final Duration requestTimeout;
    private final Set<String> redactedHeaders;

    public ApiCommander(HttpClient httpClient,
                        String endpoint,
                        String path,
                        Map<String, String> headers,
                        Duration requestTimeout,
                        Collection<String> extraRedactedHeaders) {
        Preconditions.checkNotNull(httpClient, "httpClient cannot be null");
        Preconditions.checkArgument(!Utils.isBlank(endpoint), "endpoint cannot be empty");
        this.httpClient = httpClient;
        this.fullUrl = Utils.joinPath(endpoint, path);
        this.requestTimeout = requestTimeout;

        Map<String, String> all = new LinkedHashMap<>();
        all.put("Content-Type", "application/json");
        all.put("Accept", "application/json");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null) {
                    all.put(name, value);
                }
            });
        }
        this.headers = Collections.unmodifiableMap(all);

        Set<String> redacted = new HashSet<>(DEFAULT_REDACTED_HEADERS);
        if (extraRedactedHeaders != null) {
            for (String name : extraRedactedHeaders) {
                redacted.add(name.toLowerCase(Locale.ROOT));
            }
        }
        this.redactedHeaders = Collections.unmodifiableSet(redacted);
    }

    public String getFullUrl() {
        return fullUrl;
    }

    @Override
    public String getAddress() {
        return fullUrl;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public JsonNode execute(ObjectNode payload) {
        return request(HttpMethod.POST, payload, null);
    }

    @Override
    public CompletableFuture<JsonNode> executeAsync(ObjectNode payload) {
        return requestAsync(HttpMethod.POST, payload, null);
    }

    public JsonNode request(ObjectNode payload) {
        return request(HttpMethod.POST, payload, null);
    }

    /**
     * Sends a request and blocks until the response is processed.
     *
     * @param method         the HTTP method
     * @param payload        the JSON body, may be null
     * @param additionalPath a path appended to the resource URL, may be null
     * @return the parsed response body
     */
    public JsonNode request(HttpMethod method, ObjectNode payload, String additionalPath) {
        String command = commandName(payload);
        HttpRequest request = buildRequest(method, payload, additionalPath);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw transportError(command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataApiException(String.format("Interrupted while waiting for the '%s' command", command), e);
        }
        return processResponse(command, response);
    }

    public CompletableFuture<JsonNode> requestAsync(HttpMethod method, ObjectNode payload, String additionalPath) {
        String command = commandName(payload);
        HttpRequest request = buildRequest(method, payload, additionalPath);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause()
                                : throwable;
                        if (cause instanceof IOException ioException) {
                            throw transportError(command, ioException);
                        }
                        throw new DataApiHttpException(String.format("Request for the '%s' command failed", command), cause);
                    }
                    return processResponse(command, response);
                });
    }

    private HttpRequest buildRequest(HttpMethod method, ObjectNode payload, String additionalPath) {
        String url = Utils.isEmpty(additionalPath) ? fullUrl : Utils.joinPath(fullUrl, additionalPath);
        String body = payload == null ? null : JSONUtils.writeValueAsString(payload);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .method(method.name(), body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        headers.forEach(builder::header);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Request: {} {}, headers: {}, payload: {}", method, url, redactHeaders(headers), body);
        }
        return builder.build();
    }

    private DataApiException transportError(String command, IOException e) {
        if (e instanceof HttpTimeoutException) {
            return new DataApiTimeoutException(
                    String.format("The '%s' command timed out after %s", command, requestTimeout), requestTimeout, e
            );
        }
        return new DataApiHttpException(String.format("Request for the '%s' command failed: %s", command, e.getMessage()), e);
    }

    JsonNode processResponse(String command, HttpResponse<String> response) {
        String body = response.body();
        LOGGER.debug("Response: status {}, body: {}", response.statusCode(), body);
        if (response.statusCode() >= 400) {
            throw new DataApiHttpException(
                    String.format("The Data API answered the '%s' command with HTTP %d", command, response.statusCode()),
                    response.statusCode(),
                    body
            );
        }

        JsonNode node;
        try {
            node = Utils.isBlank(body) ? null : JSONUtils.objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Unparseable response from the '%s' command: %s", command, body), null, e
            );
        }
        if (node == null || !node.isObject()) {
            throw new UnexpectedDataApiResponseException(
                    String.format("Unexpected response from the '%s' command: %s", command, body), node
            );
        }

        JsonNode errors = node.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            List<ErrorDescriptor> descriptors = new ArrayList<>();
            for (JsonNode error : errors) {
                descriptors.add(ErrorDescriptor.fromJson(error));
            }
            String message = descriptors.get(0).message();
            throw new DataApiResponseException(
                    message == null ? String.format("The '%s' command returned errors", command) : message,
                    descriptors,
                    node
            );
        }

        for (JsonNode warning : node.path("status").path("warnings")) {
            LOGGER.warn("The Data API returned a warning for the '{}' command: {}", command, warning);
        }
        return node;
    }

    Map<String, String> redactHeaders(Map<String, String> source) {
        Map<String, String> redacted = new LinkedHashMap<>();
        source.forEach((name, value) ->
                redacted.put(name, redactedHeaders.contains(name.toLowerCase(Locale.ROOT)) ? REDACTED : value)
        );
        return redacted;
    }

    private static String commandName(ObjectNode payload) {
        if (payload == null || payload.isEmpty()) {
            return "<empty>";
        }
        return payload.fieldNames().next();
    }
}
