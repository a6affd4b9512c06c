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

import com.palantir.livetrace.api.LiveSpan;
import java.util.List;
import org.immutables.value.Value;

/** A span together with its direct children, ordered by start time. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public interface SpanTreeNode {

    @Value.Parameter
    LiveSpan span();

    @Value.Parameter
    List<SpanTreeNode> children();

    static SpanTreeNode of(LiveSpan span, List<SpanTreeNode> children) {
        return ImmutableSpanTreeNode.of(span, children);
    }
}
