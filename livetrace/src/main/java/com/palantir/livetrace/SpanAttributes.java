/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.palantir.livetrace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** Normalizes attribute maps handed over by the instrumentation layer. */
final class SpanAttributes {

    private SpanAttributes() {}

    /**
     * Returns an ordered copy with null keys and values removed. Strings, numbers and booleans are kept as they are;
     * anything else is replaced by its string form.
     */
    static Map<String, Object> normalize(@Nullable Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key != null && value != null) {
                normalized.put(key, normalizeValue(value));
            }
        });
        return normalized;
    }

    /** Merges {@code update} into {@code existing}; values from {@code update} win. */
    static Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> update) {
        if (update.isEmpty()) {
            return existing;
        }
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        merged.putAll(update);
        return merged;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }
}
