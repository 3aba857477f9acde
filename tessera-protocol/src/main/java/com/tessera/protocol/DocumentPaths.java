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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Dot-notation field paths as understood by the Data API.
 *
 * <p>Segments are separated by '.', and '&amp;' escapes a literal '.' or '&amp;'
 * inside a field name: {@code "a&.b.c&&d"} denotes the segments {@code ["a.b", "c&d"]}.
 */
public final class DocumentPaths {
    private static final char ESCAPE_CHAR = '&';
    private static final char SEPARATOR = '.';

    private DocumentPaths() {
    }

    /**
     * Splits an escaped field path into its literal segments.
     *
     * @throws IllegalArgumentException on an illegal or unterminated escape sequence
     */
    public static List<String> unescape(String fieldPath) {
        List<String> segments = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (int i = 0; i < fieldPath.length(); i++) {
            char c = fieldPath.charAt(i);
            if (c == SEPARATOR) {
                segments.add(buffer.toString());
                buffer.setLength(0);
            } else if (c == ESCAPE_CHAR) {
                if (i + 1 >= fieldPath.length()) {
                    throw new IllegalArgumentException(
                            String.format("Unterminated escape sequence found at end of path specification '%s'", fieldPath)
                    );
                }
                char escaped = fieldPath.charAt(++i);
                if (escaped != SEPARATOR && escaped != ESCAPE_CHAR) {
                    throw new IllegalArgumentException(
                            String.format("Illegal escape sequence found while parsing field path specification '%s': '&%c'", fieldPath, escaped)
                    );
                }
                buffer.append(escaped);
            } else {
                buffer.append(c);
            }
        }
        segments.add(buffer.toString());
        return segments;
    }

    public static String escape(String fieldName) {
        StringBuilder sb = new StringBuilder(fieldName.length());
        for (int i = 0; i < fieldName.length(); i++) {
            char c = fieldName.charAt(i);
            if (c == SEPARATOR || c == ESCAPE_CHAR) {
                sb.append(ESCAPE_CHAR);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Returns the leading part of a distinct key that is safe to use as a projection:
     * every segment up to, excluding, the first one that looks like a list index.
     *
     * @throws IllegalArgumentException if the key is empty or starts with a list index
     */
    public static String safeProjectionPrefix(String key) {
        List<String> valid = new ArrayList<>();
        for (String block : key.split("\\.", -1)) {
            if (listIndex(block) != null) {
                break;
            }
            valid.add(block);
        }
        if (valid.isEmpty()) {
            throw new IllegalArgumentException("The 'key' parameter for distinct cannot be empty or start with a list index.");
        }
        if (valid.get(0).isEmpty()) {
            throw new IllegalArgumentException("Field path specification cannot be empty or have empty segments");
        }
        return String.join(".", valid);
    }

    /**
     * Collects the values found under a field path in a document. Numeric segments
     * also index into lists, lists met along the way are unrolled, and a list found
     * at the end of the path contributes its items.
     *
     * @param document the document to inspect
     * @param key      an escaped, dot-notation field path
     * @return the values in document order; empty if the path is absent
     */
    public static List<Object> extract(Map<String, ?> document, String key) {
        List<String> segments = unescape(key);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Field path specification cannot be empty or have empty segments");
            }
        }
        List<Object> values = new ArrayList<>();
        extract(segments, 0, document, values::add);
        return values;
    }

    private static void extract(List<String> segments, int position, Object value, Consumer<Object> sink) {
        if (position == segments.size()) {
            if (value instanceof Collection<?> items) {
                items.forEach(sink);
            } else {
                sink.accept(value);
            }
            return;
        }
        String segment = segments.get(position);
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey(segment)) {
                extract(segments, position + 1, map.get(segment), sink);
            }
        } else if (value instanceof List<?> list) {
            Integer index = listIndex(segment);
            if (index != null) {
                if (index < list.size()) {
                    extract(segments, position + 1, list.get(index), sink);
                }
            } else {
                for (Object item : list) {
                    extract(segments, position, item, sink);
                }
            }
        }
    }

    /**
     * @return the index denoted by the segment, or {@code null} if it is not a canonical
     * non-negative integer ("0" and "12" are, "01" and "-3" are not)
     */
    static Integer listIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return null;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return null;
            }
        }
        if (segment.length() > 1 && segment.charAt(0) == '0') {
            return null;
        }
        return Integer.parseInt(segment);
    }
}
