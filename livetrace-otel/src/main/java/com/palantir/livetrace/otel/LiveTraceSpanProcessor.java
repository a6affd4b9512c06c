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

import com.palantir.livetrace.LiveSpanProcessor;
import com.palantir.livetrace.LiveTracing;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;
import javax.annotation.Nullable;

/**
 * An OpenTelemetry {@link SpanProcessor} forwarding the start and end of every span to a {@link LiveSpanProcessor}.
 *
 * <pre>{@code
 * SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
 *         .addSpanProcessor(LiveTraceSpanProcessor.of(liveTracing))
 *         .build();
 * }</pre>
 */
public final class LiveTraceSpanProcessor implements SpanProcessor {

    private static final SafeLogger log = SafeLoggerFactory.get(LiveTraceSpanProcessor.class);

    private final LiveSpanProcessor delegate;

    private LiveTraceSpanProcessor(LiveSpanProcessor delegate) {
        this.delegate = delegate;
    }

    public static LiveTraceSpanProcessor of(LiveTracing liveTracing) {
        return of(liveTracing.processor());
    }

    public static LiveTraceSpanProcessor of(LiveSpanProcessor delegate) {
        return new LiveTraceSpanProcessor(delegate);
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        try {
            SpanData data = span.toSpanData();
            delegate.spanStarted(
                    span.getSpanContext().getSpanId(),
                    Translation.parentSpanId(span.getParentSpanContext()),
                    span.getName(),
                    data.getStartEpochNanos(),
                    Translation.attributes(data.getAttributes()));
        } catch (RuntimeException e) {
            log.warn("Failed to forward span start", SafeArg.of("spanId", spanId(span)), e);
        }
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        try {
            SpanData data = span.toSpanData();
            StatusData status = data.getStatus();
            delegate.spanEnded(
                    span.getSpanContext().getSpanId(),
                    data.getEndEpochNanos(),
                    Translation.fromOpenTelemetry(status.getStatusCode()),
                    Translation.description(status.getDescription()),
                    Translation.attributes(data.getAttributes()),
                    Translation.events(data.getEvents()));
        } catch (RuntimeException e) {
            log.warn("Failed to forward span end", SafeArg.of("spanId", spanId(span)), e);
        }
    }

    @Override
    public boolean isEndRequired() {
        return true;
    }

    @Nullable
    private static String spanId(ReadableSpan span) {
        SpanContext context = span.getSpanContext();
        return context == null ? null : context.getSpanId();
    }
}
