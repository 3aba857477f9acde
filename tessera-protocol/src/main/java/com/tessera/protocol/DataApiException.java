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

import com.tessera.common.TesseraException;

/**
 * Base class of the errors that originate from talking to the Data API.
 */
public class DataApiException extends TesseraException {

    public DataApiException(String message) {
        super(message);
    }

    public DataApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
