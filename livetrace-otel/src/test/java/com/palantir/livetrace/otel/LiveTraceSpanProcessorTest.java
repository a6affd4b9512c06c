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
package com.palantir.livetrace.otel;

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.livetrace.LiveTraceConfig;
import com.palantir.livetrace.LiveTracing;
import com.palantir.livetrace.SpanSnapshot;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.livetrace.api.SpanStatus;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public final class LiveTraceSpanProcessorTest {

    private final LiveTracing liveTracing = LiveTracing.create(LiveTraceConfig.defaults());
    private final SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(LiveTraceSpanProcessor.of(liveTracing))
            .build();
    private final Tracer tracer = tracerProvider.get("livetrace-test");

    @AfterEach
    public void after() {
        tracerProvider.close();
        liveTracing.close();
    }

    @Test
    public void testStartedSpanIsOpen() {
        Span span = tracer.spanBuilder("agent run")
                .setAttribute("gen_ai.system", "openai")
                .startSpan();

        LiveSpan live = liveTracing.store().get(span.getSpanContext().getSpanId()).get();
        assertThat(live.getName()).isEqualTo("agent run");
        assertThat(live.isOpen()).isTrue();
        assertThat(live.getParentSpanId()).isEmpty();
        assertThat(live.getAttributes()).containsEntry("gen_ai.system", "openai");

        span.end();
        assertThat(liveTracing.store().get(span.getSpanContext().getSpanId()).get().isOpen())
                .isFalse();
    }

    @Test
    public void testParentIsTakenFromContext() {
        Span parent = tracer.spanBuilder("parent").startSpan();
        Span child;
        try (Scope ignored = parent.makeCurrent()) {
            child = tracer.spanBuilder("child").startSpan();
        }
        child.end();
        parent.end();

        String parentId = parent.getSpanContext().getSpanId();
        assertThat(liveTracing.store().get(child.getSpanContext().getSpanId()).get().getParentSpanId())
                .hasValue(parentId);
        SpanSnapshot snapshot = liveTracing.store().snapshot();
        assertThat(snapshot.roots()).singleElement().satisfies(root -> {
            assertThat(root.span().getSpanId()).isEqualTo(parentId);
            assertThat(root.children()).hasSize(1);
        });
        assertThat(snapshot.closedCount()).isEqualTo(2);
    }

    @Test
    public void testEndMapsStatusAttributesAndEvents() {
        Span span = tracer.spanBuilder("tool call").startSpan();
        span.setAttribute(AttributeKey.longKey("tokens"), 42L);
        span.addEvent("retry", Attributes.of(AttributeKey.stringKey("reason"), "timeout"));
        span.setStatus(StatusCode.ERROR, "upstream failed");
        span.end();

        LiveSpan live = liveTracing.store().get(span.getSpanContext().getSpanId()).get();
        assertThat(live.getStatus()).isEqualTo(SpanStatus.ERROR);
        assertThat(live.getStatusDescription()).hasValue("upstream failed");
        assertThat(live.getAttributes()).containsEntry("tokens", 42L);
        assertThat(live.getEvents()).singleElement().satisfies(event -> {
            assertThat(event.getName()).isEqualTo("retry");
            assertThat(event.getAttributes()).containsEntry("reason", "timeout");
            assertThat(event.getTimestampNanos()).isGreaterThanOrEqualTo(live.getStartTimeNanos());
        });
        assertThat(live.getDurationNanos()).isPresent();
    }

    @Test
    public void testEmptyDescriptionIsAbsent() {
        Span span = tracer.spanBuilder("ok").startSpan();
        span.setStatus(StatusCode.OK);
        span.end();

        LiveSpan live = liveTracing.store().get(span.getSpanContext().getSpanId()).get();
        assertThat(live.getStatus()).isEqualTo(SpanStatus.OK);
        assertThat(live.getStatusDescription()).isEmpty();
    }

    @Test
    public void testArrayAttributesAreJoined() {
        Span span = tracer.spanBuilder("batch")
                .setAttribute(AttributeKey.stringArrayKey("ids"), List.of("a", "b", "c"))
                .setAttribute(AttributeKey.booleanKey("cached"), true)
                .startSpan();
        span.end();

        assertThat(liveTracing.store().get(span.getSpanContext().getSpanId()).get().getAttributes())
                .containsEntry("ids", "a,b,c")
                .containsEntry("cached", true);
    }

    @Test
    public void testStatusMapping() {
        assertThat(Translation.fromOpenTelemetry(StatusCode.UNSET)).isEqualTo(SpanStatus.UNSET);
        assertThat(Translation.fromOpenTelemetry(StatusCode.OK)).isEqualTo(SpanStatus.OK);
        assertThat(Translation.fromOpenTelemetry(StatusCode.ERROR)).isEqualTo(SpanStatus.ERROR);
    }
}
