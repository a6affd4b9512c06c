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

import com.palantir.logsafe.Preconditions;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** A markup element with ordered attributes and child fragments. */
@Value.Immutable
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE)
public abstract class Element implements Fragment {

    public abstract String tag();

    public abstract Map<String, String> attributes();

    public abstract List<Fragment> children();

    public final Optional<String> id() {
        return Optional.ofNullable(attributes().get("id"));
    }

    @Override
    public final <T> T accept(Visitor<T> visitor) {
        return visitor.visitElement(this);
    }

    @Value.Check
    protected final void check() {
        Preconditions.checkArgument(!tag().isEmpty(), "Element tag must be non-empty");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends ImmutableElement.Builder {}
}
