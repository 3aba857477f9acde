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

package com.tessera.client.auth;

import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds the token expected by Data API deployments that authenticate with
 * a username and a password instead of an application token.
 */
public class UsernamePasswordTokenProvider implements TokenProvider {
    private static final String PREFIX = "Cassandra";

    private final String username;
    private final String token;

    public UsernamePasswordTokenProvider(String username, String password) {
        Preconditions.checkNotNull(username, "username cannot be null");
        Preconditions.checkNotNull(password, "password cannot be null");
        this.username = username;
        this.token = String.format("%s:%s:%s", PREFIX, encode(username), encode(password));
    }

    private static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "UsernamePasswordTokenProvider(" + username + ", ***)";
    }
}
