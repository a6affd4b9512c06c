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
package com.palantir.livetrace.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import org.junit.jupiter.api.Test;

public final class LiveSpanTest {

    private static final LiveSpan OPEN = LiveSpan.builder()
            .spanId("a")
            .parentSpanId("p")
            .name("op")
            .startTimeNanos(100L)
            .build();

    @Test
    public void testDefaults() {
        assertThat(OPEN.isOpen()).isTrue();
        assertThat(OPEN.getStatus()).isEqualTo(SpanStatus.UNSET);
        assertThat(OPEN.getSequence()).isZero();
        assertThat(OPEN.getDurationNanos()).isEmpty();
        assertThat(OPEN.getAttributes()).isEmpty();
        assertThat(OPEN.getEvents()).isEmpty();
    }

    @Test
    public void testClosedSpanHasDuration() {
        LiveSpan closed = LiveSpan.builder()
                .from(OPEN)
                .endTimeNanos(350L)
                .status(SpanStatus.OK)
                .build();

        assertThat(closed.isOpen()).isFalse();
        assertThat(closed.getDurationNanos()).hasValue(250L);
        assertThat(closed.getParentSpanId()).hasValue("p");
    }

    @Test
    public void testRequiredFields() {
        assertThatThrownBy(() -> LiveSpan.builder().spanId("a").build()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testFragments() {
        Element div = Fragments.withId(Fragments.div("card", Fragments.span("name", "op")), "span-a");

        assertThat(div.id()).hasValue("span-a");
        assertThat(div.attributes()).containsEntry("class", "card");
        assertThat(div.children()).singleElement().isInstanceOfSatisfying(Element.class, span -> {
            assertThat(span.tag()).isEqualTo("span");
            assertThat(span.children()).containsExactly(Text.of("op"));
        });
        assertThat(Fragments.empty().attributes()).isEmpty();
        assertThat(Fragments.withId(div, "other").id()).hasValue("other");
    }

    @Test
    public void testElementRequiresTag() {
        assertThatThrownBy(() -> Element.builder().tag("").build())
                .isInstanceOf(SafeIllegalArgumentException.class)
                .hasMessage("Element tag must be non-empty");
    }
}
