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
import com.palantir.livetrace.api.LiveSpan;
import java.util.List;

/**
 * Strategy converting a span into displayable fragments. Header, status and body are rendered separately so that a
 * closing span can refresh them in place; {@link #renderSpan} assembles them into the full span element.
 *
 * <p>Implementations must be thread-safe, they are invoked concurrently from instrumented threads.
 */
public interface SpanRenderer {

    /** Renders the content of the span header, typically its name and duration. */
    Fragment renderHeader(LiveSpan span);

    /** Renders the content of the span body, typically attributes and events. */
    Fragment renderBody(LiveSpan span);

    /** Renders the content of the status indicator. */
    Fragment renderStatus(LiveSpan span);

    /**
     * Renders the complete span element with the given, already rendered, children. The returned element must carry
     * the ids from {@link SpanElementIds} so that later updates can address its parts.
     */
    default Fragment renderSpan(LiveSpan span, boolean root, List<Fragment> children) {
        return SpanLayouts.collapsible(this, span, root, children);
    }
}
