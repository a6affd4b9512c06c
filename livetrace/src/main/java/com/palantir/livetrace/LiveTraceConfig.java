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

import com.palantir.logsafe.SafeArg;
import java.util.List;
import org.immutables.value.Value;

/** Settings of a {@link LiveTracing} instance. Every setting has a default. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class LiveTraceConfig {

    /** The id of the element root spans are rendered into. */
    @Value.Default
    public String containerId() {
        return "telemetry-container";
    }

    /** Path of the live-update stream; the view page and JSON dump are served below it. */
    @Value.Default
    public String endpoint() {
        return "/telemetry";
    }

    /** Number of deltas buffered per viewer before the oldest is dropped. */
    @Value.Default
    public int queueCapacity() {
        return 1024;
    }

    /** Interval of keep-alive messages on idle streams. */
    @Value.Default
    public long keepAliveMillis() {
        return 15_000L;
    }

    /** Span name fragments, matched case-insensitively, whose spans the default renderer shows expanded. */
    public abstract List<String> autoExpandPatterns();

    @Value.Default
    public String title() {
        return "Live Traces";
    }

    @Value.Check
    protected final void check() {
        checkArgument(!containerId().isEmpty(), "containerId must be non-empty");
        checkArgument(endpoint().startsWith("/"), "endpoint must start with '/'", SafeArg.of("endpoint", endpoint()));
        checkArgument(
                queueCapacity() > 0, "queueCapacity must be positive", SafeArg.of("queueCapacity", queueCapacity()));
        checkArgument(
                keepAliveMillis() > 0,
                "keepAliveMillis must be positive",
                SafeArg.of("keepAliveMillis", keepAliveMillis()));
    }

    public static LiveTraceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableLiveTraceConfig.Builder {}
}
