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

import com.google.common.collect.ImmutableList;
import com.palantir.livetrace.api.LiveSpan;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.immutables.value.Value;

/** An immutable, consistent view of every span held by a {@link SpanStore} at one point in time. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public interface SpanSnapshot {

    /** Spans without a parent in the store, ordered by start time. */
    List<SpanTreeNode> roots();

    /** The sequence number of the last store mutation visible in this snapshot. */
    long version();

    /** All spans, roots first and depth-first, children ordered by start time. */
    @Value.Lazy
    default ImmutableList<LiveSpan> orderedSpans() {
        return roots().stream()
                .flatMap(SpanSnapshot::depthFirstTraversal)
                .collect(ImmutableList.toImmutableList());
    }

    @Value.Lazy
    default int spanCount() {
        return orderedSpans().size();
    }

    @Value.Lazy
    default int closedCount() {
        return (int) orderedSpans().stream().filter(span -> !span.isOpen()).count();
    }

    default Optional<LiveSpan> find(String spanId) {
        return orderedSpans().stream()
                .filter(span -> span.getSpanId().equals(spanId))
                .findFirst();
    }

    default Optional<SpanTreeNode> findNode(String spanId) {
        return roots().stream()
                .flatMap(SpanSnapshot::depthFirstNodes)
                .filter(node -> node.span().getSpanId().equals(spanId))
                .findFirst();
    }

    private static Stream<LiveSpan> depthFirstTraversal(SpanTreeNode node) {
        return depthFirstNodes(node).map(SpanTreeNode::span);
    }

    private static Stream<SpanTreeNode> depthFirstNodes(SpanTreeNode node) {
        return Stream.concat(
                Stream.of(node), node.children().stream().flatMap(SpanSnapshot::depthFirstNodes));
    }

    static SpanSnapshot of(List<SpanTreeNode> roots, long version) {
        return ImmutableSpanSnapshot.builder().roots(roots).version(version).build();
    }
}
