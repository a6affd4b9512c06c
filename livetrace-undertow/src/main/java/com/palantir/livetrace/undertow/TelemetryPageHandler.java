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

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import com.palantir.livetrace.LiveTraceConfig;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Serves a standalone page showing the live container, connected to the telemetry stream. */
public final class TelemetryPageHandler implements HttpHandler {

    private static final String TEMPLATE = "livetrace/view.html";

    private final String page;

    public TelemetryPageHandler(LiveTraceConfig config) {
        this.page = template(
                TEMPLATE,
                ImmutableMap.<String, String>builder()
                        .put("{{TITLE}}", HtmlWriter.escape(config.title()))
                        .put("{{CONTAINER_ID}}", HtmlWriter.escape(config.containerId()))
                        .put("{{ENDPOINT}}", HtmlWriter.escape(config.endpoint()))
                        .put("{{EVENT_NAME}}", DeltaMessages.EVENT_NAME)
                        .build());
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
        exchange.getResponseSender().send(page, StandardCharsets.UTF_8);
    }

    String page() {
        return page;
    }

    private static String template(String resourceName, Map<String, String> values) {
        try {
            String template = Resources.toString(Resources.getResource(resourceName), StandardCharsets.UTF_8);
            for (Map.Entry<String, String> entry : values.entrySet()) {
                template = template.replace(entry.getKey(), entry.getValue());
            }
            return template;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read resource " + resourceName, e);
        }
    }
}
