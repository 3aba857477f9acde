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

package com.tessera.common.utils;

public class Utils {

    public static boolean isEmpty(final CharSequence cs) {
        // Source: https://commons.apache.org/proper/commons-lang/javadocs/api-release/src-html/org/apache/commons/lang3/StringUtils.html#line.3583
        return cs == null || cs.length() == 0;
    }

    public static boolean isBlank(final CharSequence cs) {
        if (isEmpty(cs)) {
            return true;
        }
        for (int i = 0; i < cs.length(); i++) {
            if (!Character.isWhitespace(cs.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Joins URL path segments with a single slash, ignoring empty segments and
     * collapsing the slashes at each boundary.
     *
     * @param first the leading segment, typically a scheme and authority
     * @param rest  further segments
     * @return the joined path, without a trailing slash
     */
    public static String joinPath(String first, String... rest) {
        StringBuilder sb = new StringBuilder(stripTrailingSlashes(first == null ? "" : first));
        for (String segment : rest) {
            if (isEmpty(segment)) {
                continue;
            }
            String trimmed = stripTrailingSlashes(stripLeadingSlashes(segment));
            if (trimmed.isEmpty()) {
                continue;
            }
            sb.append('/').append(trimmed);
        }
        return sb.toString();
    }

    public static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    public static String stripLeadingSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }

    /**
     * Returns a loggable form of a secret: the last three characters are kept
     * and everything else is masked with '*'.
     */
    public static String redact(String secret) {
        if (secret == null) {
            return null;
        }
        if (secret.length() <= 3) {
            return "***";
        }
        return "*".repeat(Math.min(secret.length() - 3, 8)) + secret.substring(secret.length() - 3);
    }
}
