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

import java.io.Closeable;

/** The result of connecting a viewer: the initial full render and the connection delivering later deltas. */
public final class ViewerSession implements Closeable {

    private final SpanDelta snapshot;
    private final ViewerConnection connection;

    ViewerSession(SpanDelta snapshot, ViewerConnection connection) {
        this.snapshot = snapshot;
        this.connection = connection;
    }

    /** A {@link SpanDelta.Kind#SNAPSHOT} delta replacing the container content with the full current tree. */
    public SpanDelta snapshot() {
        return snapshot;
    }

    public ViewerConnection connection() {
        return connection;
    }

    @Override
    public void close() {
        connection.close();
    }

    @Override
    public String toString() {
        return "ViewerSession{connection=" + connection + ", sequence=" + snapshot.sequence() + '}';
    }
}
