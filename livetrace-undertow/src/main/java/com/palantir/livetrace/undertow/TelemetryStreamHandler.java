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

import com.palantir.livetrace.ContainerBootstrap;
import com.palantir.livetrace.LiveTracing;
import com.palantir.livetrace.SpanDelta;
import com.palantir.livetrace.ViewerConnection;
import com.palantir.livetrace.ViewerSession;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import io.undertow.server.handlers.sse.ServerSentEventConnection;
import io.undertow.server.handlers.sse.ServerSentEventConnectionCallback;
import io.undertow.server.handlers.sse.ServerSentEventHandler;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import org.xnio.IoUtils;

/**
 * Streams a container to browsers as server-sent events. Every new event stream starts with the full render of the
 * container, followed by the deltas published after it.
 *
 * <p>Each stream holds at most one event in flight: the next delta is taken from the viewer's queue only once the
 * previous send completed, so a slow browser makes its own queue drop old deltas rather than buffering without bound.
 * No thread is parked per stream.
 */
public final class TelemetryStreamHandler implements ServerSentEventConnectionCallback {

    private static final SafeLogger log = SafeLoggerFactory.get(TelemetryStreamHandler.class);

    private final ContainerBootstrap bootstrap;
    private final String containerId;
    private final long keepAliveMillis;

    public TelemetryStreamHandler(ContainerBootstrap bootstrap, String containerId, long keepAliveMillis) {
        this.bootstrap = bootstrap;
        this.containerId = containerId;
        this.keepAliveMillis = keepAliveMillis;
    }

    public static TelemetryStreamHandler of(LiveTracing liveTracing) {
        return new TelemetryStreamHandler(
                liveTracing.bootstrap(),
                liveTracing.config().containerId(),
                liveTracing.config().keepAliveMillis());
    }

    /** Wraps this callback in the Undertow handler performing the event stream handshake. */
    public ServerSentEventHandler handler() {
        return new ServerSentEventHandler(this);
    }

    @Override
    public void connected(ServerSentEventConnection connection, @Nullable String lastEventId) {
        ViewerSession session;
        try {
            session = bootstrap.connect(containerId);
        } catch (RuntimeException e) {
            log.warn("Failed to bootstrap viewer", SafeArg.of("containerId", containerId), e);
            IoUtils.safeClose(connection);
            return;
        }
        log.debug(
                "Viewer stream opened",
                SafeArg.of("connectionId", session.connection().id()),
                SafeArg.of("lastEventId", lastEventId),
                SafeArg.of("sequence", session.snapshot().sequence()));
        connection.setKeepAliveTime(keepAliveMillis);
        connection.addCloseTask(_channel -> session.close());
        new Pump(connection, session).start();
    }

    @Override
    public String toString() {
        return "TelemetryStreamHandler{containerId=" + containerId + ", keepAliveMillis=" + keepAliveMillis + '}';
    }

    private static final class Pump implements ServerSentEventConnection.EventCallback {
        private final ServerSentEventConnection connection;
        private final ViewerSession session;
        private final ViewerConnection viewer;

        /** Whether an event is in flight. */
        private final AtomicBoolean sending = new AtomicBoolean();

        /** Pending pump requests; only the caller raising it from zero runs the loop. */
        private final AtomicInteger requests = new AtomicInteger();

        Pump(ServerSentEventConnection connection, ViewerSession session) {
            this.connection = connection;
            this.session = session;
            this.viewer = session.connection();
        }

        void start() {
            sending.set(true);
            viewer.onAvailable(this::pump);
            send(session.snapshot());
        }

        private void pump() {
            if (requests.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            do {
                if (!sending.get()) {
                    Optional<SpanDelta> next = viewer.poll();
                    if (next.isPresent()) {
                        sending.set(true);
                        send(next.get());
                    }
                }
                missed = requests.addAndGet(-missed);
            } while (missed != 0);
        }

        private void send(SpanDelta delta) {
            connection.send(DeltaMessages.data(delta), DeltaMessages.EVENT_NAME, DeltaMessages.eventId(delta), this);
        }

        @Override
        public void done(ServerSentEventConnection _connection, String _data, String _event, String _id) {
            sending.set(false);
            pump();
        }

        @Override
        public void failed(
                ServerSentEventConnection _connection, String _data, String _event, String id, IOException error) {
            log.debug(
                    "Failed to send event, closing viewer stream",
                    SafeArg.of("connectionId", viewer.id()),
                    SafeArg.of("eventId", id),
                    error);
            session.close();
            IoUtils.safeClose(connection);
        }
    }
}
