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
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A single viewer subscribed to the deltas of one container. Deltas are buffered in a bounded queue; when the viewer
 * falls behind, the oldest buffered delta is dropped so that publishing never waits on a slow consumer.
 *
 * <p>Consumers either block in {@link #poll(Duration)} or register an {@link #onAvailable} listener and drain without
 * blocking. Closing the connection unsubscribes it.
 */
public final class ViewerConnection implements Closeable {

    private static final SafeLogger log = SafeLoggerFactory.get(ViewerConnection.class);

    private final String id;
    private final String containerId;
    private final long afterSequence;
    private final int capacity;
    private final Consumer<ViewerConnection> onClose;

    private final Lock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    // Guarded by lock
    private final Deque<SpanDelta> queue = new ArrayDeque<>();
    // Guarded by lock
    private boolean closed = false;
    // Guarded by lock
    private long dropped = 0L;

    @Nullable
    private volatile Runnable listener;

    ViewerConnection(
            String id, String containerId, long afterSequence, int capacity, Consumer<ViewerConnection> onClose) {
        this.id = id;
        this.containerId = containerId;
        this.afterSequence = afterSequence;
        this.capacity = capacity;
        this.onClose = onClose;
    }

    public String id() {
        return id;
    }

    public String containerId() {
        return containerId;
    }

    /** Deltas with a sequence number up to and including this one are already reflected in what the viewer shows. */
    public long afterSequence() {
        return afterSequence;
    }

    /**
     * Enqueues a delta, dropping the oldest buffered one if the queue is full. Returns false if the connection is
     * closed or the delta renders a change the viewer already has.
     */
    boolean offer(SpanDelta delta) {
        if (delta.kind() != SpanDelta.Kind.SNAPSHOT && delta.sequence() <= afterSequence) {
            return false;
        }
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped++;
                if (log.isDebugEnabled()) {
                    log.debug(
                            "Viewer is falling behind, dropped its oldest delta",
                            SafeArg.of("connectionId", id),
                            SafeArg.of("dropped", dropped));
                }
            }
            queue.addLast(delta);
            available.signalAll();
        } finally {
            lock.unlock();
        }
        notifyListener();
        return true;
    }

    /** Returns the next delta if one is buffered, without waiting. */
    public Optional<SpanDelta> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next delta. Returns empty on timeout or once the connection is closed.
     */
    public Optional<SpanDelta> poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (queue.isEmpty() && !closed) {
                if (remainingNanos <= 0L) {
                    return Optional.empty();
                }
                remainingNanos = available.awaitNanos(remainingNanos);
            }
            return Optional.ofNullable(queue.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /** Waits up to the given time for the next delta. */
    public Optional<SpanDelta> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return poll(Duration.ofNanos(unit.toNanos(timeout)));
    }

    /** Removes and returns every buffered delta, oldest first. */
    public List<SpanDelta> drain() {
        lock.lock();
        try {
            List<SpanDelta> drained = queue.stream().collect(Collectors.toList());
            queue.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return !queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a callback run after each enqueued delta, on the publishing thread. The callback must be cheap and must
     * not block; it is typically used to wake up a non-blocking transport. Replaces any previous listener.
     */
    public void onAvailable(Runnable newListener) {
        this.listener = newListener;
        if (hasPending()) {
            notifyListener();
        }
    }

    /** Number of deltas discarded because this viewer fell behind. */
    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Closes the connection and unsubscribes it. Calling this more than once has no further effect. */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            queue.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }

    private void notifyListener() {
        Runnable current = listener;
        if (current == null) {
            return;
        }
        try {
            current.run();
        } catch (RuntimeException e) {
            log.warn(
                    "Viewer listener failed",
                    SafeArg.of("connectionId", id),
                    UnsafeArg.of("listener", current),
                    e);
        }
    }

    @Override
    public String toString() {
        return "ViewerConnection{id=" + id + ", containerId=" + containerId + ", afterSequence=" + afterSequence + '}';
    }
}
