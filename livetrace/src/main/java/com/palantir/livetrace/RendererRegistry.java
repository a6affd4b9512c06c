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

import static com.palantir.logsafe.Preconditions.checkArgument;
import static com.palantir.logsafe.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps attribute keys to the {@link SpanRenderer} used for spans carrying that attribute. Spans matching no registered
 * key are rendered by the default renderer.
 *
 * <p>This class is thread-safe. Registrations may happen at any time; a span is always resolved against the
 * registrations current at the moment it is rendered.
 */
public final class RendererRegistry {

    private static final SafeLogger log = SafeLoggerFactory.get(RendererRegistry.class);

    private final SpanRenderer defaultRenderer;

    // Only access in an instance-synchronized fashion
    private final Map<String, SpanRenderer> renderersByKey = new LinkedHashMap<>();
    // Resolution runs on every span event, so readers see a pre-computed copy that is replaced on registration
    private volatile ImmutableMap<String, SpanRenderer> registrations = ImmutableMap.of();

    public RendererRegistry(SpanRenderer defaultRenderer) {
        this.defaultRenderer = checkNotNull(defaultRenderer, "defaultRenderer");
    }

    /**
     * Registers the renderer for spans carrying the given attribute key. A later registration for the same key
     * replaces the earlier renderer but keeps the key's original position in resolution order. Returns the renderer
     * previously registered for the key, if any.
     */
    @CanIgnoreReturnValue
    public synchronized Optional<SpanRenderer> register(String attributeKey, SpanRenderer renderer) {
        checkArgument(!Strings.isNullOrEmpty(attributeKey), "attributeKey must be non-empty");
        checkNotNull(renderer, "renderer");
        SpanRenderer previous = renderersByKey.put(attributeKey, renderer);
        if (previous != null) {
            log.info(
                    "Overwriting registered renderer",
                    SafeArg.of("attributeKey", attributeKey),
                    UnsafeArg.of("previous", previous),
                    UnsafeArg.of("renderer", renderer));
        }
        registrations = ImmutableMap.copyOf(renderersByKey);
        return Optional.ofNullable(previous);
    }

    /** The inverse of {@link #register}. Returns the removed renderer, if any. */
    @CanIgnoreReturnValue
    public synchronized Optional<SpanRenderer> unregister(String attributeKey) {
        SpanRenderer removed = renderersByKey.remove(attributeKey);
        registrations = ImmutableMap.copyOf(renderersByKey);
        return Optional.ofNullable(removed);
    }

    /**
     * Returns the renderer of the first registered attribute key, in registration order, present on the span, or the
     * default renderer if the span carries none of them.
     */
    public SpanRenderer resolve(LiveSpan span) {
        Map<String, Object> attributes = span.getAttributes();
        if (attributes.isEmpty()) {
            return defaultRenderer;
        }
        for (Map.Entry<String, SpanRenderer> entry : registrations.entrySet()) {
            if (attributes.containsKey(entry.getKey())) {
                return entry.getValue();
            }
        }
        return defaultRenderer;
    }

    public SpanRenderer defaultRenderer() {
        return defaultRenderer;
    }
}
