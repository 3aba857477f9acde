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

package com.tessera.common;

/**
 * Root of every unchecked exception thrown by the Tessera client libraries.
 */
public class TesseraException extends RuntimeException {

    public TesseraException() {
        super();
    }

    public TesseraException(String message) {
        super(message);
    }

    public TesseraException(Throwable cause) {
        super(cause);
    }

    public TesseraException(String message, Throwable cause) {
        super(message, cause);
    }
}
