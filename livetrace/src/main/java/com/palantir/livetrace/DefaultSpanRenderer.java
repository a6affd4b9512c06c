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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Fragments;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.livetrace.api.LiveSpanEvent;
import com.palantir.livetrace.api.SpanStatus;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders every span as a collapsible card: name and duration in the header, a status badge, and the attributes and
 * events in the body. Root spans, and spans whose name contains one of the auto-expand patterns, start expanded.
 */
public final class DefaultSpanRenderer implements SpanRenderer {

    private static final ImmutableMap<SpanStatus, String> STATUS_COLORS = Maps.immutableEnumMap(ImmutableMap.of(
            SpanStatus.OK, "text-success",
            SpanStatus.ERROR, "text-error",
            SpanStatus.UNSET, "text-warning"));

    private final ImmutableList<String> autoExpandPatterns;

    public DefaultSpanRenderer() {
        this(ImmutableList.of());
    }

    public DefaultSpanRenderer(Collection<String> autoExpandPatterns) {
        this.autoExpandPatterns = autoExpandPatterns.stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public Fragment renderHeader(LiveSpan span) {
        String duration = span.getDurationNanos().isPresent()
                ? Durations.renderNanos(span.getDurationNanos().getAsLong())
                : "...";
        return Fragments.div(
                "flex justify-between items-center w-full",
                Fragments.span("font-semibold " + statusColor(span.getStatus()), span.getName()),
                Fragments.span("ml-auto text-xs opacity-60", duration));
    }

    @Override
    public Fragment renderStatus(LiveSpan span) {
        String label = span.isOpen() ? "OPEN" : span.getStatus().name();
        String text = span.getStatusDescription()
                .map(description -> label + ": " + description)
                .orElse(label);
        return Fragments.span("opacity-70 " + statusColor(span.getStatus()), text);
    }

    @Override
    public Fragment renderBody(LiveSpan span) {
        return Fragments.div("space-y-2", renderAttributes(span), renderEvents(span));
    }

    @Override
    public Fragment renderSpan(LiveSpan span, boolean root, List<Fragment> children) {
        return SpanLayouts.collapsible(this, span, root || shouldAutoExpand(span), children);
    }

    private Fragment renderAttributes(LiveSpan span) {
        if (span.getAttributes().isEmpty()) {
            return Fragments.empty();
        }
        List<Element> items = span.getAttributes().entrySet().stream()
                .map(DefaultSpanRenderer::attributeItem)
                .collect(ImmutableList.toImmutableList());
        return Fragments.element("ul", "pl-1 space-y-[1px]", items);
    }

    private static Element attributeItem(Map.Entry<String, Object> attribute) {
        return Fragments.element(
                "li",
                "flex text-xs py-[1px]",
                List.of(
                        Fragments.span("opacity-70 mr-1", attribute.getKey()),
                        Fragments.span("font-mono break-all", String.valueOf(attribute.getValue()))));
    }

    private static Fragment renderEvents(LiveSpan span) {
        if (span.getEvents().isEmpty()) {
            return Fragments.empty();
        }
        List<Element> events = span.getEvents().stream()
                .map(event -> eventItem(span, event))
                .collect(ImmutableList.toImmutableList());
        return Fragments.div("space-y-1", events);
    }

    private static Element eventItem(LiveSpan span, LiveSpanEvent event) {
        String offset = "+" + Durations.renderNanos(event.getTimestampNanos() - span.getStartTimeNanos());
        return Fragments.div(
                "border-l-2 border-info pl-2 py-1",
                Fragments.span("font-medium text-xs", event.getName()),
                Fragments.span("text-xs opacity-60 ml-1", offset));
    }

    private boolean shouldAutoExpand(LiveSpan span) {
        String name = span.getName().toLowerCase(Locale.ROOT);
        return autoExpandPatterns.stream().anyMatch(name::contains);
    }

    private static String statusColor(SpanStatus status) {
        return STATUS_COLORS.getOrDefault(status, "text-neutral");
    }

    @Override
    public String toString() {
        return "DefaultSpanRenderer{autoExpandPatterns=" + autoExpandPatterns + '}';
    }
}
