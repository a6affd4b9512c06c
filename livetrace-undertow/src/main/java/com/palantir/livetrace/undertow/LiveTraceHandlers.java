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
package com.palantir.livetrace.undertow;

import com.palantir.livetrace.LiveTraceConfig;
import com.palantir.livetrace.LiveTracing;
import io.undertow.Handlers;
import io.undertow.server.handlers.PathHandler;

/**
 * Mounts the live tracing endpoints of a {@link LiveTracing} instance.
 *
 * <ul>
 *   <li>{@code {endpoint}}: the server-sent event stream of the container
 *   <li>{@code {endpoint}/view}: a page showing the container
 *   <li>{@code {endpoint}/spans}: the current spans as JSON
 * </ul>
 */
public final class LiveTraceHandlers {

    private LiveTraceHandlers() {}

    public static PathHandler routes(LiveTracing liveTracing) {
        return addTo(Handlers.path(), liveTracing);
    }

    /** Adds the endpoints to an existing path handler, for applications serving their own pages next to them. */
    public static PathHandler addTo(PathHandler pathHandler, LiveTracing liveTracing) {
        LiveTraceConfig config = liveTracing.config();
        return pathHandler
                .addExactPath(config.endpoint(), TelemetryStreamHandler.of(liveTracing).handler())
                .addExactPath(config.endpoint() + "/view", new TelemetryPageHandler(config))
                .addExactPath(config.endpoint() + "/spans", new SnapshotJsonHandler(liveTracing.store()));
    }
}
