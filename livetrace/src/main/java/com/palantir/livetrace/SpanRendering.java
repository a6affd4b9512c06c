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
import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Fragments;
import com.palantir.livetrace.api.LiveSpan;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.List;
import java.util.function.Function;

/**
 * Renders spans with the renderer resolved from a {@link RendererRegistry}. A renderer that throws is replaced by the
 * default renderer for that span only, so one broken renderer never blanks the rest of the tree. If the default
 * renderer throws as well, the span is drawn as plain text in the standard layout.
 */
final class SpanRendering {

    private static final SafeLogger log = SafeLoggerFactory.get(SpanRendering.class);

    private final RendererRegistry registry;

    SpanRendering(RendererRegistry registry) {
        this.registry = registry;
    }

    /** Renders a span and, nested inside it, every descendant of the node. */
    Fragment renderTree(SpanTreeNode node, boolean root) {
        List<Fragment> children = node.children().stream()
                .map(child -> renderTree(child, false))
                .collect(ImmutableList.toImmutableList());
        return renderSpan(node.span(), root, children);
    }

    Fragment renderSpan(LiveSpan span, boolean root, List<Fragment> children) {
        Fragment rendered = render(span, renderer -> renderer.renderSpan(span, root, children));
        if (rendered instanceof Element && ((Element) rendered).id().isPresent()) {
            return rendered;
        }
        // later updates of the span are addressed by id
        return Fragments.withId(Fragments.div("", rendered), SpanElementIds.span(span.getSpanId()));
    }

    Fragment renderHeader(LiveSpan span) {
        return render(span, renderer -> renderer.renderHeader(span));
    }

    Fragment renderStatus(LiveSpan span) {
        return render(span, renderer -> renderer.renderStatus(span));
    }

    Fragment renderBody(LiveSpan span) {
        return render(span, renderer -> renderer.renderBody(span));
    }

    private Fragment render(LiveSpan span, Function<SpanRenderer, Fragment> action) {
        SpanRenderer renderer = registry.resolve(span);
        SpanRenderer defaultRenderer = registry.defaultRenderer();
        if (renderer != defaultRenderer) {
            try {
                return action.apply(renderer);
            } catch (RuntimeException e) {
                log.warn(
                        "Renderer failed, falling back to the default renderer",
                        SafeArg.of("spanId", span.getSpanId()),
                        UnsafeArg.of("renderer", renderer),
                        e);
            }
        }
        try {
            return action.apply(defaultRenderer);
        } catch (RuntimeException e) {
            log.error(
                    "Default renderer failed to render span",
                    SafeArg.of("spanId", span.getSpanId()),
                    UnsafeArg.of("renderer", defaultRenderer),
                    e);
            return action.apply(PlainTextRenderer.INSTANCE);
        }
    }

    /** Last resort renderer, it only reads the span name and status. */
    private enum PlainTextRenderer implements SpanRenderer {
        INSTANCE;

        @Override
        public Fragment renderHeader(LiveSpan span) {
            return Fragments.span("text-error", span.getName());
        }

        @Override
        public Fragment renderBody(LiveSpan _span) {
            return Fragments.empty();
        }

        @Override
        public Fragment renderStatus(LiveSpan span) {
            return Fragments.text(span.isOpen() ? "OPEN" : span.getStatus().name());
        }
    }
}
