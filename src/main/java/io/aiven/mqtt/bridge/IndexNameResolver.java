/*
 * Copyright 2026 Aiven Oy
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.aiven.mqtt.bridge;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the date placeholders {@code {Y}}, {@code {m}} and {@code {d}} of an index name template with the
 * current date. Any other {@code {...}} token is left as is.
 */
public class IndexNameResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexNameResolver.class);

    public static final String YEAR_PLACEHOLDER = "{Y}";

    public static final String MONTH_PLACEHOLDER = "{m}";

    public static final String DAY_PLACEHOLDER = "{d}";

    private final Clock clock;

    public IndexNameResolver() {
        this(Clock.systemDefaultZone());
    }

    public IndexNameResolver(final Clock clock) {
        this.clock = clock;
    }

    public String resolve(final String template) {
        final var today = LocalDate.now(clock);
        final var index = template.replace(YEAR_PLACEHOLDER, String.format(Locale.ROOT, "%04d", today.getYear()))
                .replace(MONTH_PLACEHOLDER, String.format(Locale.ROOT, "%02d", today.getMonthValue()))
                .replace(DAY_PLACEHOLDER, String.format(Locale.ROOT, "%02d", today.getDayOfMonth()));
        if (!index.equals(template)) {
            LOGGER.debug("Replaced placeholders in index name {} -> {}", template, index);
        }
        return index;
    }

}
