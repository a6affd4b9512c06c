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
package com.palantir.livetrace.otel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.livetrace.api.LiveSpanEvent;
import com.palantir.livetrace.api.SpanStatus;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.AttributeType;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.EventData;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

final class Translation {

    private Translation() {}

    static SpanStatus fromOpenTelemetry(StatusCode code) {
        switch (code) {
            case UNSET:
                return SpanStatus.UNSET;
            case OK:
                return SpanStatus.OK;
            case ERROR:
                return SpanStatus.ERROR;
        }
        throw new UnsupportedOperationException();
    }

    @Nullable
    static String parentSpanId(@Nullable SpanContext parent) {
        return parent != null && parent.isValid() ? parent.getSpanId() : null;
    }

    static Optional<String> description(@Nullable String description) {
        return Optional.ofNullable(description).filter(value -> !value.isEmpty());
    }

    static Map<String, Object> attributes(Attributes attributes) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builderWithExpectedSize(attributes.size());
        attributes.forEach((key, value) -> builder.put(key.getKey(), attributeValue(key, value)));
        return builder.buildKeepingLast();
    }

    static List<LiveSpanEvent> events(List<EventData> events) {
        ImmutableList.Builder<LiveSpanEvent> builder = ImmutableList.builderWithExpectedSize(events.size());
        for (EventData event : events) {
            builder.add(LiveSpanEvent.of(event.getName(), event.getEpochNanos(), attributes(event.getAttributes())));
        }
        return builder.build();
    }

    private static Object attributeValue(AttributeKey<?> key, Object attributeValue) {
        AttributeType type = key.getType();
        switch (type) {
            case STRING:
            case BOOLEAN:
            case LONG:
            case DOUBLE:
                return attributeValue;
            case STRING_ARRAY:
            case BOOLEAN_ARRAY:
            case LONG_ARRAY:
            case DOUBLE_ARRAY:
                return commaSeparated((List<?>) attributeValue);
        }
        throw new IllegalStateException("Unknown attribute type: " + type);
    }

    private static String commaSeparated(List<?> values) {
        StringBuilder builder = new StringBuilder();
        for (Object value : values) {
            if (builder.length() != 0) {
                builder.append(',');
            }
            builder.append(value);
        }
        return builder.toString();
    }
}
