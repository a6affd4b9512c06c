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

import java.util.Map;
import org.immutables.value.Value;

/** A timestamped event recorded on a span while it was open. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class LiveSpanEvent {

    @Value.Parameter
    public abstract String getName();

    @Value.Parameter
    public abstract long getTimestampNanos();

    @Value.Parameter
    public abstract Map<String, Object> getAttributes();

    public static LiveSpanEvent of(String name, long timestampNanos, Map<String, ?> attributes) {
        return ImmutableLiveSpanEvent.of(name, timestampNanos, attributes);
    }
}
