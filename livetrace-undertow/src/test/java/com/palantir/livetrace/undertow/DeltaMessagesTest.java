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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.livetrace.DeltaPatch;
import com.palantir.livetrace.SpanDelta;
import com.palantir.livetrace.api.Fragments;
import org.junit.jupiter.api.Test;

public final class DeltaMessagesTest {

    @Test
    public void testPatchesBecomeOutOfBandSwaps() {
        SpanDelta delta = SpanDelta.builder()
                .kind(SpanDelta.Kind.UPDATED)
                .spanId("a")
                .containerId("telemetry-container")
                .sequence(7L)
                .addPatches(DeltaPatch.replaceContent("span-header-a", Fragments.text("done")))
                .addPatches(DeltaPatch.append("span-children-a", Fragments.span("", "child")))
                .build();

        assertThat(DeltaMessages.data(delta))
                .isEqualTo("<div id=\"span-header-a\" hx-swap-oob=\"innerHTML\">done</div>"
                        + "<div id=\"span-children-a\" hx-swap-oob=\"beforeend\"><span>child</span></div>");
        assertThat(DeltaMessages.eventId(delta)).isEqualTo("7");
    }

    @Test
    public void testMovedSpansAreDeletedBeforeTheirNewParentIsAppended() {
        SpanDelta delta = SpanDelta.builder()
                .kind(SpanDelta.Kind.CREATED)
                .spanId("parent")
                .containerId("telemetry-container")
                .sequence(3L)
                .addPatches(DeltaPatch.remove("span-child"))
                .addPatches(DeltaPatch.append("telemetry-container", Fragments.span("", "parent")))
                .build();

        assertThat(DeltaMessages.data(delta))
                .isEqualTo("<div id=\"span-child\" hx-swap-oob=\"delete\"><div></div></div>"
                        + "<div id=\"telemetry-container\" hx-swap-oob=\"beforeend\"><span>parent</span></div>");
    }

    @Test
    public void testTargetIdIsEscaped() {
        SpanDelta delta = SpanDelta.builder()
                .kind(SpanDelta.Kind.CREATED)
                .containerId("c")
                .sequence(1L)
                .addPatches(DeltaPatch.append("a\"b", Fragments.text("x")))
                .build();

        assertThat(DeltaMessages.data(delta)).startsWith("<div id=\"a&quot;b\"");
    }
}
