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

import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Fragments;
import com.palantir.livetrace.api.LiveSpan;
import java.util.List;

/**
 * Standard arrangements of the parts produced by a {@link SpanRenderer}. Every layout emits the ids of
 * {@link SpanElementIds}.
 */
public final class SpanLayouts {

    private SpanLayouts() {}

    /** A collapsible card whose header toggles the body; children are always visible below it. */
    public static Element collapsible(SpanRenderer renderer, LiveSpan span, boolean expanded, List<Fragment> children) {
        String spanId = span.getSpanId();
        String checkboxId = SpanElementIds.checkbox(spanId);

        Element.Builder checkbox = Element.builder()
                .tag("input")
                .putAttributes("type", "checkbox")
                .putAttributes("class", "collapse-checkbox")
                .putAttributes("id", checkboxId);
        if (expanded) {
            checkbox.putAttributes("checked", "");
        }

        Element title = Element.builder()
                .tag("label")
                .putAttributes("for", checkboxId)
                .putAttributes("class", "collapse-title text-sm font-medium p-2 cursor-pointer")
                .addChildren(part(SpanElementIds.header(spanId), "flex items-center", renderer.renderHeader(span)))
                .addChildren(part(SpanElementIds.status(spanId), "text-xs", renderer.renderStatus(span)))
                .build();

        Element details = Fragments.div(
                "collapse collapse-arrow bg-base-100 border border-base-300 rounded-lg my-1",
                checkbox.build(),
                title,
                part(SpanElementIds.body(spanId), "collapse-content pl-4 space-y-2", renderer.renderBody(span)));

        return Fragments.withId(
                Fragments.div(
                        "my-1", details, part(SpanElementIds.children(spanId), "pl-4 space-y-1 border-l", children)),
                SpanElementIds.span(spanId));
    }

    /** A single line with status and header; the body is kept hidden. */
    public static Element compact(SpanRenderer renderer, LiveSpan span, List<Fragment> children) {
        String spanId = span.getSpanId();
        Element line = Fragments.div(
                "flex items-center",
                part(SpanElementIds.status(spanId), "mr-2", renderer.renderStatus(span)),
                part(SpanElementIds.header(spanId), "", renderer.renderHeader(span)));
        return Fragments.withId(
                Fragments.div(
                        "py-1",
                        line,
                        part(SpanElementIds.body(spanId), "hidden", renderer.renderBody(span)),
                        part(SpanElementIds.children(spanId), "pl-6", children)),
                SpanElementIds.span(spanId));
    }

    private static Element part(String id, String cssClass, Fragment content) {
        return part(id, cssClass, List.of(content));
    }

    private static Element part(String id, String cssClass, List<Fragment> content) {
        return Fragments.withId(Fragments.div(cssClass, content), id);
    }
}
