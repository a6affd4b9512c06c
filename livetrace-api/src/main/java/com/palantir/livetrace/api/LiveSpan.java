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

package com.palantir.livetrace.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.immutables.value.Value;

/**
 * A value class representing a span as currently known to the live view. A span is open until
 * {@link #getEndTimeNanos()} is present; every change produces a new instance.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class LiveSpan {

    /** Returns the identifier assigned by the instrumentation layer. */
    public abstract String getSpanId();

    /** Returns the identifier of the enclosing span, if one exists. */
    public abstract Optional<String> getParentSpanId();

    public abstract String getName();

    /** Returns the start timestamp in nanoseconds. */
    public abstract long getStartTimeNanos();

    /** Returns the end timestamp in nanoseconds, absent while the span is open. */
    public abstract OptionalLong getEndTimeNanos();

    @Value.Default
    public SpanStatus getStatus() {
        return SpanStatus.UNSET;
    }

    public abstract Optional<String> getStatusDescription();

    /**
     * Returns the span attributes in the order they were first recorded. Values are strings, numbers or booleans.
     */
    public abstract Map<String, Object> getAttributes();

    public abstract List<LiveSpanEvent> getEvents();

    /** Returns the store sequence number of the most recent change to this span. */
    @Value.Default
    public long getSequence() {
        return 0L;
    }

    public final boolean isOpen() {
        return !getEndTimeNanos().isPresent();
    }

    /** Returns the duration of a closed span, or empty while the span is open. */
    public final OptionalLong getDurationNanos() {
        OptionalLong end = getEndTimeNanos();
        return end.isPresent() ? OptionalLong.of(end.getAsLong() - getStartTimeNanos()) : OptionalLong.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableLiveSpan.Builder {}
}
