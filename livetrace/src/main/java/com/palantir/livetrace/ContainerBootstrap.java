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
import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragment;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.List;
import java.util.Map;

/**
 * Brings a newly connected viewer up to date: renders the full current tree and subscribes the viewer to every later
 * delta.
 *
 * <p>The snapshot is taken and the subscription registered under the store's read lock, so no mutation falls between
 * the two. The subscription skips deltas for changes the snapshot already contains, so nothing is lost and nothing is
 * shown twice.
 */
public final class ContainerBootstrap {

    private static final SafeLogger log = SafeLoggerFactory.get(ContainerBootstrap.class);

    private final SpanStore store;
    private final SpanRendering rendering;
    private final UpdateBroadcaster broadcaster;

    public ContainerBootstrap(SpanStore store, RendererRegistry registry, UpdateBroadcaster broadcaster) {
        this.store = store;
        this.rendering = new SpanRendering(registry);
        this.broadcaster = broadcaster;
    }

    /** Renders the current tree for the container and subscribes a new viewer to its future deltas. */
    public ViewerSession connect(String containerId) {
        Map.Entry<SpanSnapshot, ViewerConnection> subscribed = store.readLocked(
                snapshot -> Map.entry(snapshot, broadcaster.subscribe(containerId, snapshot.version())));
        SpanSnapshot snapshot = subscribed.getKey();
        ViewerConnection connection = subscribed.getValue();
        log.debug(
                "Bootstrapped viewer",
                SafeArg.of("connectionId", connection.id()),
                SafeArg.of("spans", snapshot.spanCount()),
                SafeArg.of("version", snapshot.version()));
        return new ViewerSession(snapshotDelta(containerId, snapshot), connection);
    }

    /** Renders the current tree without subscribing anyone. */
    public SpanDelta renderSnapshot(String containerId) {
        return snapshotDelta(containerId, store.snapshot());
    }

    private SpanDelta snapshotDelta(String containerId, SpanSnapshot snapshot) {
        List<Fragment> roots = snapshot.roots().stream()
                .map(root -> rendering.renderTree(root, true))
                .collect(ImmutableList.toImmutableList());
        // display: contents keeps the wrapper out of the layout, so roots appended later line up with these
        Fragment tree = Element.builder()
                .tag("div")
                .putAttributes("id", containerId + "-snapshot")
                .putAttributes("style", "display: contents;")
                .addAllChildren(roots)
                .build();
        return SpanDelta.builder()
                .kind(SpanDelta.Kind.SNAPSHOT)
                .containerId(containerId)
                .sequence(snapshot.version())
                .addPatches(DeltaPatch.replaceContent(containerId, tree))
                .build();
    }
}
