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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.SpanStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class ContainerBootstrapTest {

    private static final String CONTAINER = "telemetry-container";

    private final LiveTracing liveTracing = LiveTracing.create(LiveTraceConfig.builder()
            .containerId(CONTAINER)
            .autoExpandPatterns(ImmutableList.of("Tool:"))
            .build());

    @AfterEach
    public void after() {
        liveTracing.close();
    }

    @Test
    public void testEmptyStoreRendersEmptyContainer() {
        SpanDelta snapshot = liveTracing.bootstrap().renderSnapshot(CONTAINER);

        assertThat(snapshot.kind()).isEqualTo(SpanDelta.Kind.SNAPSHOT);
        assertThat(snapshot.spanId()).isEmpty();
        assertThat(snapshot.patches()).singleElement().satisfies(patch -> {
            assertThat(patch.targetId()).isEqualTo(CONTAINER);
            assertThat(patch.swap()).isEqualTo(SpanDelta.Swap.REPLACE_CONTENT);
            assertThat(((Element) patch.fragment()).children()).isEmpty();
        });
    }

    @Test
    public void testSnapshotNestsSpans() {
        LiveSpanProcessor processor = liveTracing.processor();
        processor.spanStarted("root", null, "agent run", 1L, null);
        processor.spanStarted("tool", "root", "Tool: search", 2L, null);
        processor.spanStarted("other", null, "background", 3L, null);
        processor.spanEnded("tool", 5L, SpanStatus.OK, ImmutableMap.of("result", "found"));

        SpanDelta snapshot = liveTracing.bootstrap().renderSnapshot(CONTAINER);

        Element tree = (Element) snapshot.patches().get(0).fragment();
        assertThat(tree.children()).hasSize(2);
        assertThat(FragmentInspector.ids(tree.children().get(0))).contains(SpanElementIds.span("tool"));
        Element rootChildren = FragmentInspector.findById(tree, SpanElementIds.children("root"))
                .get();
        assertThat(FragmentInspector.ids(rootChildren)).contains(SpanElementIds.span("tool"));
        assertThat(FragmentInspector.text(tree)).contains("agent run", "Tool: search", "background", "found");
        assertThat(snapshot.sequence()).isEqualTo(liveTracing.store().snapshot().version());
    }

    @Test
    public void testRootsAndAutoExpandedSpansStartExpanded() {
        LiveSpanProcessor processor = liveTracing.processor();
        processor.spanStarted("root", null, "agent run", 1L, null);
        processor.spanStarted("tool", "root", "Tool: search", 2L, null);
        processor.spanStarted("plain", "root", "http get", 3L, null);

        Element tree = (Element) liveTracing.bootstrap().renderSnapshot(CONTAINER).patches().get(0).fragment();

        assertThat(isChecked(tree, "root")).isTrue();
        assertThat(isChecked(tree, "tool")).isTrue();
        assertThat(isChecked(tree, "plain")).isFalse();
    }

    @Test
    public void testLateParentAdoptsOrphanInSnapshot() {
        LiveSpanProcessor processor = liveTracing.processor();
        processor.spanStarted("child", "parent", "child", 2L, null);
        processor.spanStarted("parent", null, "parent", 1L, null);

        Element tree = (Element) liveTracing.bootstrap().renderSnapshot(CONTAINER).patches().get(0).fragment();

        assertThat(tree.children()).hasSize(1);
        Element parentChildren = FragmentInspector.findById(tree, SpanElementIds.children("parent"))
                .get();
        assertThat(FragmentInspector.ids(parentChildren)).contains(SpanElementIds.span("child"));
    }

    @Test
    public void testConnectSkipsDeltasAlreadyInSnapshot() {
        LiveSpanProcessor processor = liveTracing.processor();
        processor.spanStarted("a", null, "before", 1L, null);

        try (ViewerSession session = liveTracing.connect()) {
            assertThat(FragmentInspector.text(session.snapshot().patches().get(0).fragment())).contains("before");

            processor.spanStarted("b", null, "after", 2L, null);
            processor.spanEnded("a", 3L, SpanStatus.OK, null);

            assertThat(session.connection().drain())
                    .extracting(delta -> delta.spanId().get() + ":" + delta.kind())
                    .containsExactly("b:CREATED", "a:UPDATED");
        }
        assertThat(liveTracing.broadcaster().connectionCount(CONTAINER)).isZero();
    }

    @Test
    public void testNoSpanIsLostOrDuplicatedAcrossConnect() throws Exception {
        int threads = 4;
        int spansPerThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < spansPerThread; i++) {
                        liveTracing.processor().spanStarted(thread + "-" + i, null, "op", i, null);
                    }
                    return null;
                }));
            }
            start.countDown();
            try (ViewerSession session = liveTracing.connect()) {
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }

                List<String> seen = new ArrayList<>();
                seen.addAll(renderedSpanIds(session.snapshot()));
                for (SpanDelta delta : session.connection().drain()) {
                    assertThat(delta.sequence()).isGreaterThan(session.snapshot().sequence());
                    seen.add(delta.spanId().get());
                }

                assertThat(seen).hasSize(threads * spansPerThread).doesNotHaveDuplicates();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<String> renderedSpanIds(SpanDelta snapshot) {
        List<String> spanIds = new ArrayList<>();
        for (String id : FragmentInspector.ids(snapshot.patches().get(0).fragment())) {
            if (id.startsWith("span-") && !id.startsWith("span-header-")
                    && !id.startsWith("span-status-")
                    && !id.startsWith("span-body-")
                    && !id.startsWith("span-children-")
                    && !id.startsWith("span-checkbox-")) {
                spanIds.add(id.substring("span-".length()));
            }
        }
        return spanIds;
    }

    private static boolean isChecked(Element tree, String spanId) {
        return FragmentInspector.findById(tree, SpanElementIds.checkbox(spanId))
                .get()
                .attributes()
                .containsKey("checked");
    }
}
