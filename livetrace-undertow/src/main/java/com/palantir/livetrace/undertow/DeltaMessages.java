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

import com.palantir.livetrace.DeltaPatch;
import com.palantir.livetrace.SpanDelta;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;

/**
 * Converts {@link SpanDelta}s into server-sent event payloads understood by the htmx sse extension. Each patch
 * becomes an out-of-band swap addressed to its target element.
 */
public final class DeltaMessages {

    /** Name of the server-sent events carrying deltas. */
    public static final String EVENT_NAME = "TelemetryEvent";

    private DeltaMessages() {}

    public static String data(SpanDelta delta) {
        StringBuilder sb = new StringBuilder();
        for (DeltaPatch patch : delta.patches()) {
            sb.append("<div id=\"")
                    .append(HtmlWriter.escape(patch.targetId()))
                    .append("\" hx-swap-oob=\"")
                    .append(swapStyle(patch.swap()))
                    .append("\">");
            HtmlWriter.write(patch.fragment(), sb);
            sb.append("</div>");
        }
        return sb.toString();
    }

    /** The event id, which lets a reconnecting browser report the last sequence it has seen. */
    public static String eventId(SpanDelta delta) {
        return Long.toString(delta.sequence());
    }

    static String swapStyle(SpanDelta.Swap swap) {
        switch (swap) {
            case APPEND:
                return "beforeend";
            case REPLACE_CONTENT:
                return "innerHTML";
            case REMOVE:
                return "delete";
        }
        throw new SafeIllegalArgumentException("Unknown swap", SafeArg.of("swap", swap));
    }
}
