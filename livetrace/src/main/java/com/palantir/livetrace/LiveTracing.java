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

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.util.Optional;

/**
 * The live tracing view of one process: a span store, a renderer registry, a broadcaster, and the processor and
 * bootstrap operating on them.
 *
 * <p>Create one instance at startup and hand it to the instrumentation layer and the web layer. There is deliberately
 * no static accessor.
 *
 * <pre>{@code
 * LiveTracing liveTracing = LiveTracing.create(LiveTraceConfig.defaults());
 * liveTracing.registerRenderer("gen_ai.operation.name", new MyAiRenderer());
 * liveTracing.processor().spanStarted("a1", null, "handle request", System.nanoTime(), Map.of());
 * }</pre>
 */
public final class LiveTracing implements Closeable {

    private static final SafeLogger log = SafeLoggerFactory.get(LiveTracing.class);

    private final LiveTraceConfig config;
    private final SpanStore store;
    private final RendererRegistry registry;
    private final UpdateBroadcaster broadcaster;
    private final LiveSpanProcessor processor;
    private final ContainerBootstrap bootstrap;

    private LiveTracing(LiveTraceConfig config, SpanRenderer defaultRenderer) {
        this.config = config;
        this.store = new SpanStore();
        this.registry = new RendererRegistry(defaultRenderer);
        this.broadcaster = new UpdateBroadcaster(config.queueCapacity());
        this.processor = new LiveSpanProcessor(store, registry, broadcaster, config.containerId());
        this.bootstrap = new ContainerBootstrap(store, registry, broadcaster);
    }

    /** Creates an instance rendering unmatched spans with a {@link DefaultSpanRenderer}. */
    public static LiveTracing create(LiveTraceConfig config) {
        return create(config, new DefaultSpanRenderer(config.autoExpandPatterns()));
    }

    public static LiveTracing create(LiveTraceConfig config, SpanRenderer defaultRenderer) {
        LiveTracing liveTracing = new LiveTracing(config, defaultRenderer);
        log.info(
                "Live tracing initialized",
                SafeArg.of("containerId", config.containerId()),
                SafeArg.of("endpoint", config.endpoint()),
                SafeArg.of("queueCapacity", config.queueCapacity()));
        return liveTracing;
    }

    /** Registers a renderer for spans carrying the given attribute. See {@link RendererRegistry#register}. */
    public Optional<SpanRenderer> registerRenderer(String attributeKey, SpanRenderer renderer) {
        return registry.register(attributeKey, renderer);
    }

    /** Connects a viewer to this instance's container. See {@link ContainerBootstrap#connect}. */
    public ViewerSession connect() {
        return bootstrap.connect(config.containerId());
    }

    public LiveTraceConfig config() {
        return config;
    }

    public SpanStore store() {
        return store;
    }

    public RendererRegistry registry() {
        return registry;
    }

    public UpdateBroadcaster broadcaster() {
        return broadcaster;
    }

    public LiveSpanProcessor processor() {
        return processor;
    }

    public ContainerBootstrap bootstrap() {
        return bootstrap;
    }

    /** Disconnects all viewers. Spans recorded so far remain readable. */
    @Override
    public void close() {
        broadcaster.close();
        log.info("Live tracing closed", SafeArg.of("containerId", config.containerId()));
    }
}
