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

import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Fragments;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.List;

/** Minimal one-line rendering: a colored status dot followed by the span name. Attributes are not shown. */
public enum CompactSpanRenderer implements SpanRenderer {
    INSTANCE;

    @Override
    public Fragment renderHeader(LiveSpan span) {
        return Fragments.span("font-medium text-sm", span.getName());
    }

    @Override
    public Fragment renderBody(LiveSpan _span) {
        return Fragments.empty();
    }

    @Override
    public Fragment renderStatus(LiveSpan span) {
        if (span.isOpen()) {
            return Fragments.span("text-neutral", "○");
        }
        switch (span.getStatus()) {
            case OK:
                return Fragments.span("text-green-500", "●");
            case ERROR:
                return Fragments.span("text-red-500", "●");
            case UNSET:
                return Fragments.span("text-yellow-500", "●");
        }
        throw new SafeIllegalArgumentException("Unknown status", SafeArg.of("status", span.getStatus()));
    }

    @Override
    public Fragment renderSpan(LiveSpan span, boolean _root, List<Fragment> children) {
        return SpanLayouts.compact(this, span, children);
    }
}
