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

/**
 * A node of a rendered markup tree. Fragments are produced by span renderers and serialized by the transport; the
 * live tracing core passes them along without inspecting them.
 */
public interface Fragment {

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitElement(Element element);

        T visitText(Text text);
    }
}
