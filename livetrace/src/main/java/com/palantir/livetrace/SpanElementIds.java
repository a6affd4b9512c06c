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

/** Element ids under which the parts of a rendered span can be addressed by later updates. */
public final class SpanElementIds {

    private SpanElementIds() {}

    public static String span(String spanId) {
        return "span-" + spanId;
    }

    public static String header(String spanId) {
        return "span-header-" + spanId;
    }

    public static String status(String spanId) {
        return "span-status-" + spanId;
    }

    public static String body(String spanId) {
        return "span-body-" + spanId;
    }

    /** The element new child spans are appended to. */
    public static String children(String spanId) {
        return "span-children-" + spanId;
    }

    public static String checkbox(String spanId) {
        return "span-checkbox-" + spanId;
    }
}
