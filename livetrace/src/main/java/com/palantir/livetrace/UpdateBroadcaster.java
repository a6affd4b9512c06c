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

import static com.palantir.logsafe.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.util.List;
import java.util.UUID;

/**
 * Fans render deltas out to every viewer connected to a container.
 *
 * <p>This class is thread-safe. Publishing reads a pre-computed copy of the subscriber set and never takes the
 * subscription lock, so viewers connecting or disconnecting never delay publication to the others.
 */
public final class UpdateBroadcaster implements Closeable {

    private static final SafeLogger log = SafeLoggerFactory.get(UpdateBroadcaster.class);

    private final int queueCapacity;

    // Only access in an instance-synchronized fashion
    private final SetMultimap<String, ViewerConnection> connectionsByContainer = LinkedHashMultimap.create();
    // Only access in an instance-synchronized fashion
    private boolean closed = false;
    // Single volatile write on every change to connectionsByContainer
    private volatile ImmutableSetMultimap<String, ViewerConnection> subscribers = ImmutableSetMultimap.of();

    public UpdateBroadcaster(int queueCapacity) {
        checkArgument(queueCapacity > 0, "queueCapacity must be positive", SafeArg.of("queueCapacity", queueCapacity));
        this.queueCapacity = queueCapacity;
    }

    /** Subscribes a new viewer to every delta published for the container from now on. */
    public ViewerConnection subscribe(String containerId) {
        return subscribe(containerId, 0L);
    }

    /**
     * Subscribes a new viewer which already reflects every change up to and including {@code afterSequence}. Deltas
     * for those changes are not delivered to it, even if they are published after this call.
     */
    public synchronized ViewerConnection subscribe(String containerId, long afterSequence) {
        checkArgument(!Strings.isNullOrEmpty(containerId), "containerId must be non-empty");
        if (closed) {
            throw new SafeIllegalStateException("Broadcaster is closed", SafeArg.of("containerId", containerId));
        }
        ViewerConnection connection = new ViewerConnection(
                UUID.randomUUID().toString(), containerId, afterSequence, queueCapacity, this::remove);
        connectionsByContainer.put(containerId, connection);
        subscribers = ImmutableSetMultimap.copyOf(connectionsByContainer);
        log.info(
                "Viewer connected",
                SafeArg.of("connectionId", connection.id()),
                SafeArg.of("containerId", containerId),
                SafeArg.of("viewers", connectionsByContainer.get(containerId).size()));
        return connection;
    }

    /** Removes the viewer and releases its buffered deltas. Safe to call more than once. */
    public void unsubscribe(ViewerConnection connection) {
        connection.close();
        remove(connection);
    }

    /**
     * Delivers the delta to every viewer currently subscribed to the container. Never blocks on a viewer; returns the
     * number of viewers which accepted the delta.
     */
    @CanIgnoreReturnValue
    public int publish(String containerId, SpanDelta delta) {
        int delivered = 0;
        for (ViewerConnection connection : subscribers.get(containerId)) {
            if (connection.offer(delta)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int connectionCount(String containerId) {
        return subscribers.get(containerId).size();
    }

    /** Disconnects every viewer and rejects further subscriptions. */
    @Override
    public void close() {
        List<ViewerConnection> connections;
        synchronized (this) {
            closed = true;
            connections = ImmutableList.copyOf(connectionsByContainer.values());
        }
        connections.forEach(ViewerConnection::close);
    }

    private synchronized void remove(ViewerConnection connection) {
        if (connectionsByContainer.remove(connection.containerId(), connection)) {
            subscribers = ImmutableSetMultimap.copyOf(connectionsByContainer);
            log.info(
                    "Viewer disconnected",
                    SafeArg.of("connectionId", connection.id()),
                    SafeArg.of("containerId", connection.containerId()));
        }
    }
}
