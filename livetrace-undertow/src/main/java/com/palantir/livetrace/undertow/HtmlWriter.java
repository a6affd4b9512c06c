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

import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.palantir.livetrace.api.Element;
import com.palantir.livetrace.api.Fragment;
import com.palantir.livetrace.api.Text;
import java.util.Map;

/** Serializes {@link Fragment} trees to HTML. Text and attribute values are escaped. */
public final class HtmlWriter {

    private static final Escaper escaper = HtmlEscapers.htmlEscaper();

    private static final ImmutableSet<String> VOID_ELEMENTS =
            ImmutableSet.of("area", "br", "col", "hr", "img", "input", "link", "meta", "source", "wbr");

    private HtmlWriter() {}

    public static String toHtml(Fragment fragment) {
        StringBuilder sb = new StringBuilder();
        write(fragment, sb);
        return sb.toString();
    }

    public static void write(Fragment fragment, StringBuilder sb) {
        fragment.accept(new Writer(sb));
    }

    static String escape(String value) {
        return escaper.escape(value);
    }

    private static final class Writer implements Fragment.Visitor<Void> {
        private final StringBuilder sb;

        Writer(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitElement(Element element) {
            sb.append('<').append(element.tag());
            for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
                sb.append(' ')
                        .append(attribute.getKey())
                        .append("=\"")
                        .append(escape(attribute.getValue()))
                        .append('"');
            }
            sb.append('>');
            if (VOID_ELEMENTS.contains(element.tag())) {
                return null;
            }
            for (Fragment child : element.children()) {
                child.accept(this);
            }
            sb.append("</").append(element.tag()).append('>');
            return null;
        }

        @Override
        public Void visitText(Text text) {
            sb.append(escape(text.value()));
            return null;
        }
    }
}
