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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableMap;
import com.palantir.livetrace.api.LiveSpan;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public final class RendererRegistryTest {

    private final SpanRenderer defaultRenderer = new DefaultSpanRenderer();
    private final RendererRegistry registry = new RendererRegistry(defaultRenderer);

    @Mock
    private SpanRenderer aiRenderer;

    @Mock
    private SpanRenderer mathRenderer;

    @Test
    public void testUnmatchedSpanUsesDefault() {
        registry.register("gen_ai.operation.name", aiRenderer);

        assertThat(registry.resolve(span(ImmutableMap.of()))).isSameAs(defaultRenderer);
        assertThat(registry.resolve(span(ImmutableMap.of("http.method", "GET")))).isSameAs(defaultRenderer);
    }

    @Test
    public void testFirstRegisteredKeyWins() {
        registry.register("gen_ai.operation.name", aiRenderer);
        registry.register("math.operation", mathRenderer);

        LiveSpan both = span(ImmutableMap.of("math.operation", "add", "gen_ai.operation.name", "chat"));
        assertThat(registry.resolve(both)).isSameAs(aiRenderer);
        assertThat(registry.resolve(span(ImmutableMap.of("math.operation", "add")))).isSameAs(mathRenderer);
    }

    @Test
    public void testReRegistrationReplacesRendererAndKeepsPosition() {
        registry.register("gen_ai.operation.name", aiRenderer);
        registry.register("math.operation", mathRenderer);

        assertThat(registry.register("gen_ai.operation.name", CompactSpanRenderer.INSTANCE))
                .containsSame(aiRenderer);

        LiveSpan both = span(ImmutableMap.of("math.operation", "add", "gen_ai.operation.name", "chat"));
        assertThat(registry.resolve(both)).isSameAs(CompactSpanRenderer.INSTANCE);
    }

    @Test
    public void testUnregister() {
        registry.register("math.operation", mathRenderer);

        assertThat(registry.unregister("math.operation")).containsSame(mathRenderer);
        assertThat(registry.unregister("math.operation")).isEmpty();
        assertThat(registry.resolve(span(ImmutableMap.of("math.operation", "add")))).isSameAs(defaultRenderer);
    }

    @Test
    public void testInvalidRegistration() {
        assertThatLoggableExceptionThrownBy(() -> registry.register("", aiRenderer))
                .hasLogMessage("attributeKey must be non-empty")
                .hasExactlyArgs();
        assertThatLoggableExceptionThrownBy(() -> registry.register("key", null))
                .hasLogMessage("renderer")
                .hasExactlyArgs();
    }

    private static LiveSpan span(Map<String, ?> attributes) {
        return LiveSpan.builder()
                .spanId("a")
                .name("op")
                .startTimeNanos(0L)
                .putAllAttributes(attributes)
                .build();
    }
}
