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

/**
 * Matching of MQTT topic names against subscription filters.
 */
public final class TopicFilters {

    private static final String LEVEL_SEPARATOR = "/";

    private static final String SINGLE_LEVEL_WILDCARD = "+";

    private static final String MULTI_LEVEL_WILDCARD = "#";

    private TopicFilters() {
    }

    public static boolean isWildcard(final String filter) {
        return filter.contains(SINGLE_LEVEL_WILDCARD) || filter.contains(MULTI_LEVEL_WILDCARD);
    }

    /**
     * Checks the filter syntax: {@code #} only as the last level, wildcards only as whole levels.
     *
     * @throws IllegalArgumentException
     *             if the filter is malformed
     */
    public static void validate(final String filter) {
        if (filter.isEmpty()) {
            throw new IllegalArgumentException("Topic filter must not be empty");
        }
        final var levels = filter.split(LEVEL_SEPARATOR, -1);
        for (int i = 0; i < levels.length; i++) {
            final var level = levels[i];
            if (level.equals(MULTI_LEVEL_WILDCARD)) {
                if (i != levels.length - 1) {
                    throw new IllegalArgumentException("'#' must be the last level of topic filter " + filter);
                }
            } else if (!level.equals(SINGLE_LEVEL_WILDCARD)
                    && (level.contains(SINGLE_LEVEL_WILDCARD) || level.contains(MULTI_LEVEL_WILDCARD))) {
                throw new IllegalArgumentException("Wildcards must occupy a whole level of topic filter " + filter);
            }
        }
    }

    public static boolean matches(final String filter, final String topic) {
        if (filter.equals(topic)) {
            return true;
        }
        // topics like $SYS/... are not matched by filters starting with a wildcard
        if (topic.startsWith("$") && (filter.startsWith(SINGLE_LEVEL_WILDCARD)
                || filter.startsWith(MULTI_LEVEL_WILDCARD))) {
            return false;
        }
        final var filterLevels = filter.split(LEVEL_SEPARATOR, -1);
        final var topicLevels = topic.split(LEVEL_SEPARATOR, -1);
        for (int i = 0; i < filterLevels.length; i++) {
            final var level = filterLevels[i];
            if (level.equals(MULTI_LEVEL_WILDCARD)) {
                // "sport/#" also matches "sport"
                return true;
            }
            if (i >= topicLevels.length) {
                return false;
            }
            if (!level.equals(SINGLE_LEVEL_WILDCARD) && !level.equals(topicLevels[i])) {
                return false;
            }
        }
        return filterLevels.length == topicLevels.length;
    }

}
