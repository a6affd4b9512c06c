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

import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragments;
import org.junit.jupiter.api.Test;

public final class HtmlWriterTest {

    @Test
    public void testNestedElements() {
        Element tree = Fragments.withId(
                Fragments.div("card", Fragments.span("name", "query"), Fragments.text("done")), "span-1");

        assertThat(HtmlWriter.toHtml(tree))
                .isEqualTo("<div class=\"card\" id=\"span-1\"><span class=\"name\">query</span>done</div>");
    }

    @Test
    public void testTextAndAttributesAreEscaped() {
        Element element = Element.builder()
                .tag("span")
                .putAttributes("title", "\"quoted\" & <tagged>")
                .addChildren(Fragments.text("<script>alert('x')</script>"))
                .build();

        assertThat(HtmlWriter.toHtml(element))
                .isEqualTo("<span title=\"&quot;quoted&quot; &amp; &lt;tagged&gt;\">"
                        + "&lt;script&gt;alert(&#39;x&#39;)&lt;/script&gt;</span>");
    }

    @Test
    public void testVoidElementsHaveNoClosingTag() {
        Element input = Element.builder()
                .tag("input")
                .putAttributes("type", "checkbox")
                .putAttributes("checked", "")
                .build();

        assertThat(HtmlWriter.toHtml(Fragments.div("", input)))
                .isEqualTo("<div><input type=\"checkbox\" checked=\"\"></div>");
    }

    @Test
    public void testEmptyFragment() {
        assertThat(HtmlWriter.toHtml(Fragments.empty())).isEqualTo("<div></div>");
    }
}
