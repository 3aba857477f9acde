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

import java.util.ArrayList;
import java.util.List;

public final class UserAgent {
    public static final String LIBRARY_NAME = "tessera";
    public static final String LIBRARY_VERSION = "0.3";

    private UserAgent() {
    }

    /**
     * Composes the User-Agent header value: the callers in the given order, then this library.
     *
     * @return e.g. {@code "my-app/1.2 tessera/0.3"}
     */
    public static String compose(List<Caller> callers) {
        List<Caller> all = new ArrayList<>();
        if (callers != null) {
            all.addAll(callers);
        }
        all.add(new Caller(LIBRARY_NAME, LIBRARY_VERSION));
        return join(all);
    }

    /**
     * @return the space separated {@code name/version} blocks, or {@code null} when no caller has a name
     */
    static String join(List<Caller> callers) {
        List<String> blocks = new ArrayList<>();
        for (Caller caller : callers) {
            if (caller == null || caller.name() == null) {
                continue;
            }
            blocks.add(caller.version() == null ? caller.name() : caller.name() + "/" + caller.version());
        }
        return blocks.isEmpty() ? null : String.join(" ", blocks);
    }
}
