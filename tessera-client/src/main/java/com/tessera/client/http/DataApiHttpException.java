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

import com.tessera.protocol.DataApiException;

/**
 * Raised when a request fails at the HTTP level: the transport failed or the server
 * answered with an error status.
 */
public class DataApiHttpException extends DataApiException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String body;

    public DataApiHttpException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.body = null;
    }

    public DataApiHttpException(String message, int statusCode, String body) {
        super(message);
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * @return the HTTP status code, or {@link #NO_STATUS} if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
