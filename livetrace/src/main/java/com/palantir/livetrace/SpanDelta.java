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

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * An incremental render update for one container. Each {@link DeltaPatch} names the element it applies to, so a
 * client can attach the fragment at the right position of its tree.
 */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public interface SpanDelta {

    Kind kind();

    /** The span this delta describes; absent for {@link Kind#SNAPSHOT}. */
    Optional<String> spanId();

    String containerId();

    /** The store sequence number of the change this delta renders. */
    long sequence();

    List<DeltaPatch> patches();

    enum Kind {
        /** The full tree of a container, sent first to a newly connected viewer. */
        SNAPSHOT,
        /** A span started and its element is appended to its parent, or to the container for roots. */
        CREATED,
        /** A span changed and parts of its element are replaced. */
        UPDATED
    }

    enum Swap {
        /** Append the fragment as the last child of the target element. */
        APPEND,
        /** Replace the content of the target element with the fragment. */
        REPLACE_CONTENT,
        /** Remove the target element; the fragment is empty. */
        REMOVE
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableSpanDelta.Builder {}
}
