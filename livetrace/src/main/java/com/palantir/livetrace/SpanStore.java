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

import com.google.common.base.Strings;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.livetrace.api.LiveSpanEvent;
import com.palantir.livetrace.api.SpanStatus;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * In-memory registry of every span seen by the process, indexed by span id and by parent id.
 *
 * <p>Spans may arrive in any order: a span whose parent has not started yet is reported as a root until the parent
 * shows up. Malformed events (duplicate starts, ends for unknown or closed spans, missing ids) are logged and ignored;
 * no method of this class throws on bad telemetry.
 *
 * <p>This class is thread-safe. Mutations are mutually exclusive with each other and with reads; reads may run
 * concurrently.
 */
public final class SpanStore {

    private static final SafeLogger log = SafeLoggerFactory.get(SpanStore.class);

    private static final Comparator<LiveSpan> START_ORDER = Comparator.comparingLong(LiveSpan::getStartTimeNanos);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock. Insertion order breaks start time ties.
    private final Map<String, LiveSpan> spans = new LinkedHashMap<>();
    // Guarded by lock. Keyed by parent id whether or not the parent is known yet.
    private final ListMultimap<String, String> childIdsByParentId = ArrayListMultimap.create();
    // Guarded by lock
    private long version = 0L;

    /**
     * Records a newly started span. Returns the stored span, or empty if the event was ignored because the id is
     * missing, already known, or the name is missing.
     */
    public Optional<LiveSpan> onStart(
            String spanId,
            @Nullable String parentSpanId,
            String name,
            long startTimeNanos,
            @Nullable Map<String, ?> attributes) {
        if (Strings.isNullOrEmpty(spanId) || Strings.isNullOrEmpty(name)) {
            log.warn(
                    "Ignoring span start with a missing id or name",
                    SafeArg.of("spanId", spanId),
                    UnsafeArg.of("name", name));
            return Optional.empty();
        }
        Optional<String> parent = Optional.ofNullable(Strings.emptyToNull(parentSpanId));
        if (parent.isPresent() && parent.get().equals(spanId)) {
            log.warn("Span names itself as parent, treating it as a root", SafeArg.of("spanId", spanId));
            parent = Optional.empty();
        }
        Map<String, Object> normalized = SpanAttributes.normalize(attributes);

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (spans.containsKey(spanId)) {
                log.warn("Ignoring duplicate start of span", SafeArg.of("spanId", spanId), UnsafeArg.of("name", name));
                return Optional.empty();
            }
            LiveSpan span = LiveSpan.builder()
                    .spanId(spanId)
                    .parentSpanId(parent)
                    .name(name)
                    .startTimeNanos(startTimeNanos)
                    .attributes(normalized)
                    .sequence(++version)
                    .build();
            spans.put(spanId, span);
            parent.ifPresent(parentId -> childIdsByParentId.put(parentId, spanId));
            return Optional.of(span);
        } finally {
            writeLock.unlock();
        }
    }

    /** Closes a span. See {@link #onEnd(String, long, SpanStatus, Optional, Map, List)}. */
    public Optional<LiveSpan> onEnd(
            String spanId, long endTimeNanos, @Nullable SpanStatus status, @Nullable Map<String, ?> finalAttributes) {
        return onEnd(spanId, endTimeNanos, status, Optional.empty(), finalAttributes, ImmutableList.of());
    }

    /**
     * Closes a span, merging {@code finalAttributes} over the attributes recorded so far. Values supplied at close win
     * over earlier values for the same key. Returns the closed span, or empty if the span is unknown or already
     * closed, in which case the store is left untouched.
     */
    public Optional<LiveSpan> onEnd(
            String spanId,
            long endTimeNanos,
            @Nullable SpanStatus status,
            Optional<String> statusDescription,
            @Nullable Map<String, ?> finalAttributes,
            List<LiveSpanEvent> events) {
        Map<String, Object> normalized = SpanAttributes.normalize(finalAttributes);

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            LiveSpan existing = spanId == null ? null : spans.get(spanId);
            if (existing == null) {
                log.warn("Ignoring end of unknown span", SafeArg.of("spanId", spanId));
                return Optional.empty();
            }
            if (!existing.isOpen()) {
                log.warn("Ignoring end of span which is already closed", SafeArg.of("spanId", spanId));
                return Optional.empty();
            }
            LiveSpan closed = LiveSpan.builder()
                    .from(existing)
                    .endTimeNanos(endTimeNanos)
                    .status(status == null ? SpanStatus.UNSET : status)
                    .statusDescription(statusDescription)
                    .attributes(SpanAttributes.merge(existing.getAttributes(), normalized))
                    .events(events)
                    .sequence(++version)
                    .build();
            spans.put(spanId, closed);
            return Optional.of(closed);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Adds attributes to an open span. Returns the updated span, or empty if the span is unknown or closed; attributes
     * of a closed span never change.
     */
    public Optional<LiveSpan> putAttributes(String spanId, @Nullable Map<String, ?> attributes) {
        Map<String, Object> normalized = SpanAttributes.normalize(attributes);

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            LiveSpan existing = spanId == null ? null : spans.get(spanId);
            if (existing == null || !existing.isOpen()) {
                log.warn(
                        "Ignoring attributes for a span which is unknown or closed",
                        SafeArg.of("spanId", spanId),
                        SafeArg.of("known", existing != null));
                return Optional.empty();
            }
            LiveSpan updated = LiveSpan.builder()
                    .from(existing)
                    .attributes(SpanAttributes.merge(existing.getAttributes(), normalized))
                    .sequence(++version)
                    .build();
            spans.put(spanId, updated);
            return Optional.of(updated);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<LiveSpan> get(String spanId) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return Optional.ofNullable(spans.get(spanId));
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return spans.size();
        } finally {
            readLock.unlock();
        }
    }

    /** Returns the direct children of the given span at call time, ordered by start time. */
    public List<LiveSpan> childrenOf(String spanId) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return childIdsByParentId.get(spanId).stream()
                    .map(spans::get)
                    .sorted(START_ORDER)
                    .collect(ImmutableList.toImmutableList());
        } finally {
            readLock.unlock();
        }
    }

    public SpanSnapshot snapshot() {
        return readLocked(Function.identity());
    }

    /**
     * Takes a snapshot and applies {@code action} to it while still holding the read lock, so no mutation can happen
     * between the two. The action must not call back into mutating methods of this store.
     */
    public <T> T readLocked(Function<SpanSnapshot, T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.apply(buildSnapshot());
        } finally {
            readLock.unlock();
        }
    }

    // Requires lock to be held
    private SpanSnapshot buildSnapshot() {
        Set<String> visited = new HashSet<>();
        List<SpanTreeNode> roots = spans.values().stream()
                .filter(this::isRoot)
                .sorted(START_ORDER)
                .map(span -> node(span, visited))
                .collect(Collectors.toCollection(ArrayList::new));

        if (visited.size() < spans.size()) {
            // only reachable through a parent cycle, which the instrumentation layer should never produce
            List<LiveSpan> unreachable = spans.values().stream()
                    .filter(span -> !visited.contains(span.getSpanId()))
                    .collect(Collectors.toList());
            log.warn("Spans unreachable from any root, showing them as roots", SafeArg.of("count", unreachable.size()));
            for (LiveSpan span : unreachable) {
                if (!visited.contains(span.getSpanId())) {
                    roots.add(node(span, visited));
                }
            }
            roots.sort(Comparator.comparing(SpanTreeNode::span, START_ORDER));
        }
        return SpanSnapshot.of(roots, version);
    }

    private boolean isRoot(LiveSpan span) {
        return span.getParentSpanId()
                .map(parentId -> !spans.containsKey(parentId))
                .orElse(true);
    }

    private SpanTreeNode node(LiveSpan span, Set<String> visited) {
        visited.add(span.getSpanId());
        List<SpanTreeNode> children = childIdsByParentId.get(span.getSpanId()).stream()
                .filter(childId -> !visited.contains(childId))
                .map(spans::get)
                .sorted(START_ORDER)
                .map(child -> node(child, visited))
                .collect(ImmutableList.toImmutableList());
        return SpanTreeNode.of(span, children);
    }
}
