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
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.livetrace.api.LiveSpanEvent;
import com.palantir.livetrace.api.SpanStatus;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Entry point for the instrumentation layer. Each span event is recorded in the {@link SpanStore}, rendered with the
 * renderer resolved from the {@link RendererRegistry}, and published to the viewers of the container.
 *
 * <p>Span starts change the shape of the tree and are handled one at a time, exclusively of every other event. A span
 * is appended under its parent only once the parent's created delta has been published, otherwise it is shown at the
 * root. When the parent starts later, the children shown at the root are removed and re-rendered inside it. Ends and
 * attribute updates run concurrently with each other, one at a time per span, so the created delta of a span always
 * reaches the broadcaster before any of its updates.
 *
 * <p>Locks are taken in a fixed order: structure, span stripe, store, broadcaster; the store lock is released before
 * publishing.
 *
 * <p>No method of this class throws: a telemetry failure must not destabilize the traced application.
 */
public final class LiveSpanProcessor {

    private static final SafeLogger log = SafeLoggerFactory.get(LiveSpanProcessor.class);

    private static final int LOCK_STRIPES = 64;

    private final SpanStore store;
    private final SpanRendering rendering;
    private final UpdateBroadcaster broadcaster;
    private final String containerId;
    private final ReadWriteLock structureLock = new ReentrantReadWriteLock();
    private final Striped<Lock> spanLocks = Striped.lock(LOCK_STRIPES);
    // Written under the structure write lock
    private final Set<String> publishedSpanIds = ConcurrentHashMap.newKeySet();

    public LiveSpanProcessor(
            SpanStore store, RendererRegistry registry, UpdateBroadcaster broadcaster, String containerId) {
        this.store = store;
        this.rendering = new SpanRendering(registry);
        this.broadcaster = broadcaster;
        this.containerId = containerId;
    }

    public String containerId() {
        return containerId;
    }

    /** Records a started span and publishes its created delta. */
    public void spanStarted(
            String spanId,
            @Nullable String parentSpanId,
            String name,
            long startTimeNanos,
            @Nullable Map<String, ?> attributes) {
        withLock(structureLock.writeLock(), spanId, "start", () -> store.onStart(
                        spanId, parentSpanId, name, startTimeNanos, attributes)
                .map(this::created));
    }

    /** Records a finished span and publishes an update with its final status, timing and attributes. */
    public void spanEnded(
            String spanId, long endTimeNanos, @Nullable SpanStatus status, @Nullable Map<String, ?> attributes) {
        spanEnded(spanId, endTimeNanos, status, Optional.empty(), attributes, ImmutableList.of());
    }

    /** Records a finished span including its status description and events. */
    public void spanEnded(
            String spanId,
            long endTimeNanos,
            @Nullable SpanStatus status,
            Optional<String> statusDescription,
            @Nullable Map<String, ?> attributes,
            List<LiveSpanEvent> events) {
        withSpanLock(spanId, "end", () -> store.onEnd(
                        spanId, endTimeNanos, status, statusDescription, attributes, events)
                .map(this::ended));
    }

    /** Records attributes added to an open span and publishes an update of its body. */
    public void attributesUpdated(String spanId, @Nullable Map<String, ?> attributes) {
        withSpanLock(spanId, "attributes", () -> store.putAttributes(spanId, attributes)
                .map(this::attributesChanged));
    }

    private SpanDelta created(LiveSpan span) {
        String spanId = span.getSpanId();
        Optional<String> parentId = span.getParentSpanId().filter(publishedSpanIds::contains);
        String targetId = parentId.map(SpanElementIds::children).orElse(containerId);
        boolean root = !parentId.isPresent();

        ImmutableList.Builder<DeltaPatch> patches = ImmutableList.builder();
        Fragment fragment;
        List<LiveSpan> earlyChildren = store.childrenOf(spanId);
        if (earlyChildren.isEmpty()) {
            fragment = rendering.renderSpan(span, root, ImmutableList.of());
        } else {
            // children that started first are shown at the root, move them with their subtrees under this span
            earlyChildren.forEach(child -> patches.add(DeltaPatch.remove(SpanElementIds.span(child.getSpanId()))));
            SpanTreeNode node = store.snapshot()
                    .findNode(spanId)
                    .orElseGet(() -> SpanTreeNode.of(span, ImmutableList.of()));
            fragment = rendering.renderTree(node, root);
        }
        patches.add(DeltaPatch.append(targetId, fragment));
        // no other start runs until this delta is published
        publishedSpanIds.add(spanId);
        return delta(SpanDelta.Kind.CREATED, span, patches.build());
    }

    private SpanDelta ended(LiveSpan span) {
        String spanId = span.getSpanId();
        return delta(
                SpanDelta.Kind.UPDATED,
                span,
                ImmutableList.of(
                        DeltaPatch.replaceContent(SpanElementIds.header(spanId), rendering.renderHeader(span)),
                        DeltaPatch.replaceContent(SpanElementIds.status(spanId), rendering.renderStatus(span)),
                        DeltaPatch.replaceContent(SpanElementIds.body(spanId), rendering.renderBody(span))));
    }

    private SpanDelta attributesChanged(LiveSpan span) {
        return delta(
                SpanDelta.Kind.UPDATED,
                span,
                ImmutableList.of(
                        DeltaPatch.replaceContent(SpanElementIds.body(span.getSpanId()), rendering.renderBody(span))));
    }

    private SpanDelta delta(SpanDelta.Kind kind, LiveSpan span, List<DeltaPatch> patches) {
        return SpanDelta.builder()
                .kind(kind)
                .spanId(span.getSpanId())
                .containerId(containerId)
                .sequence(span.getSequence())
                .patches(patches)
                .build();
    }

    private void withSpanLock(@Nullable String spanId, String event, Supplier<Optional<SpanDelta>> handler) {
        Lock shared = structureLock.readLock();
        shared.lock();
        try {
            withLock(spanLocks.get(Strings.nullToEmpty(spanId)), spanId, event, handler);
        } finally {
            shared.unlock();
        }
    }

    private void withLock(Lock lock, @Nullable String spanId, String event, Supplier<Optional<SpanDelta>> handler) {
        lock.lock();
        try {
            handler.get().ifPresent(delta -> broadcaster.publish(containerId, delta));
        } catch (RuntimeException e) {
            log.error(
                    "Failed to process span event",
                    SafeArg.of("event", event),
                    SafeArg.of("spanId", spanId),
                    UnsafeArg.of("containerId", containerId),
                    e);
        } finally {
            lock.unlock();
        }
    }
}
