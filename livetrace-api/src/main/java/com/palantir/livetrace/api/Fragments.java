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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Static factories for the handful of elements span renderers commonly need. */
public final class Fragments {

    private Fragments() {}

    public static Text text(String value) {
        return Text.of(value);
    }

    /** An element without content, used where a renderer has nothing to show. */
    public static Element empty() {
        return Element.builder().tag("div").build();
    }

    public static Element div(String cssClass, Fragment... children) {
        return element("div", cssClass, Arrays.asList(children));
    }

    public static Element div(String cssClass, List<? extends Fragment> children) {
        return element("div", cssClass, children);
    }

    public static Element span(String cssClass, String text) {
        return element("span", cssClass, List.of(text(text)));
    }

    public static Element element(String tag, String cssClass, List<? extends Fragment> children) {
        Element.Builder builder = Element.builder().tag(tag);
        if (!cssClass.isEmpty()) {
            builder.putAttributes("class", cssClass);
        }
        return builder.addAllChildren(children).build();
    }

    /** Returns a copy of the element with the given id attribute. */
    public static Element withId(Element element, String id) {
        Map<String, String> attributes = new LinkedHashMap<>(element.attributes());
        attributes.put("id", id);
        return Element.builder().from(element).attributes(attributes).build();
    }
}
