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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

final class Durations {

    private static final ImmutableMap<TimeUnit, TimeUnit> LARGER_UNIT = ImmutableMap.<TimeUnit, TimeUnit>builder()
            .put(TimeUnit.NANOSECONDS, TimeUnit.MICROSECONDS)
            .put(TimeUnit.MICROSECONDS, TimeUnit.MILLISECONDS)
            .put(TimeUnit.MILLISECONDS, TimeUnit.SECONDS)
            .build();

    private static final ImmutableMap<TimeUnit, String> ABBREVIATION = ImmutableMap.<TimeUnit, String>builder()
            .put(TimeUnit.NANOSECONDS, "ns")
            .put(TimeUnit.MICROSECONDS, "micros")
            .put(TimeUnit.MILLISECONDS, "ms")
            .put(TimeUnit.SECONDS, "s")
            .build();

    private Durations() {}

    static String renderNanos(long nanos) {
        return render(nanos, TimeUnit.NANOSECONDS);
    }

    static String render(float amount, TimeUnit timeUnit) {
        TimeUnit bigger = LARGER_UNIT.get(timeUnit);
        if (Math.abs(amount) >= 1000 && bigger != null) {
            return render(amount / 1000, bigger);
        }
        return String.format(Locale.ROOT, "%.2f %s", amount, ABBREVIATION.get(timeUnit));
    }
}
