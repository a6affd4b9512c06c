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

import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Fragments;
import org.immutables.value.Value;

/** One fragment of a {@link SpanDelta} together with where and how it is attached. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public interface DeltaPatch {

    @Value.Parameter
    String targetId();

    @Value.Parameter
    SpanDelta.Swap swap();

    @Value.Parameter
    Fragment fragment();

    static DeltaPatch append(String targetId, Fragment fragment) {
        return ImmutableDeltaPatch.of(targetId, SpanDelta.Swap.APPEND, fragment);
    }

    static DeltaPatch replaceContent(String targetId, Fragment fragment) {
        return ImmutableDeltaPatch.of(targetId, SpanDelta.Swap.REPLACE_CONTENT, fragment);
    }

    static DeltaPatch remove(String targetId) {
        return ImmutableDeltaPatch.of(targetId, SpanDelta.Swap.REMOVE, Fragments.empty());
    }
}
