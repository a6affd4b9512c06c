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

import com.palantir.logsafe.SafeArg;
import org.junit.jupiter.api.Test;

public final class LiveTraceConfigTest {

    @Test
    public void testDefaults() {
        LiveTraceConfig config = LiveTraceConfig.defaults();

        assertThat(config.containerId()).isEqualTo("telemetry-container");
        assertThat(config.endpoint()).isEqualTo("/telemetry");
        assertThat(config.queueCapacity()).isEqualTo(1024);
        assertThat(config.keepAliveMillis()).isEqualTo(15_000L);
        assertThat(config.autoExpandPatterns()).isEmpty();
        assertThat(config.title()).isEqualTo("Live Traces");
    }

    @Test
    public void testValidation() {
        assertThatLoggableExceptionThrownBy(
                        () -> LiveTraceConfig.builder().queueCapacity(0).build())
                .hasLogMessage("queueCapacity must be positive")
                .hasExactlyArgs(SafeArg.of("queueCapacity", 0));
        assertThatLoggableExceptionThrownBy(
                        () -> LiveTraceConfig.builder().endpoint("telemetry").build())
                .hasLogMessage("endpoint must start with '/'");
        assertThatLoggableExceptionThrownBy(
                        () -> LiveTraceConfig.builder().containerId("").build())
                .hasLogMessage("containerId must be non-empty")
                .hasExactlyArgs();
    }

    @Test
    public void testLiveTracingUsesConfiguredContainer() {
        try (LiveTracing liveTracing = LiveTracing.create(
                LiveTraceConfig.builder().containerId("traces").build())) {
            liveTracing.processor().spanStarted("a", null, "op", 1L, null);

            try (ViewerSession session = liveTracing.connect()) {
                assertThat(session.connection().containerId()).isEqualTo("traces");
                assertThat(session.snapshot().patches().get(0).targetId()).isEqualTo("traces");
            }
        }
    }
}
