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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.kafka.common.config.ConfigException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable table of topic filters and the index each of them is written to, in file order.
 */
public final class TopicMapping {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopicMapping.class);

    public static final String INDEX_FIELD = "elasticIndex";

    public static final String BODY_FIELD = "elasticBody";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<String, IndexMapping> entries;

    private final List<IndexMapping> wildcardEntries;

    public TopicMapping(final Collection<IndexMapping> mappings) {
        final var byTopic = new LinkedHashMap<String, IndexMapping>();
        final var wildcards = new ArrayList<IndexMapping>();
        for (final var mapping : mappings) {
            try {
                TopicFilters.validate(mapping.topicFilter());
            } catch (final IllegalArgumentException e) {
                throw new ConfigException(e.getMessage());
            }
            byTopic.put(mapping.topicFilter(), mapping);
            if (TopicFilters.isWildcard(mapping.topicFilter())) {
                wildcards.add(mapping);
            }
        }
        this.entries = Collections.unmodifiableMap(byTopic);
        this.wildcardEntries = Collections.unmodifiableList(wildcards);
    }

    public static TopicMapping load(final Path path) {
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(Files.readAllBytes(path));
        } catch (final IOException e) {
            throw new ConfigException("Couldn't read mapping file " + path + ": " + e.getMessage());
        }
        return parse(root, path.toString());
    }

    static TopicMapping parse(final JsonNode root, final String source) {
        if (Objects.isNull(root) || !root.isObject()) {
            throw new ConfigException("Mapping " + source + " must be a JSON object of topic to index mappings");
        }
        final var mappings = new ArrayList<IndexMapping>();
        root.fields().forEachRemaining(field -> mappings.add(toIndexMapping(field.getKey(), field.getValue())));
        if (mappings.isEmpty()) {
            LOGGER.warn("Mapping {} contains no topics, nothing will be subscribed", source);
        }
        return new TopicMapping(mappings);
    }

    private static IndexMapping toIndexMapping(final String topic, final JsonNode value) {
        if (!value.isObject()) {
            throw new ConfigException("Mapping of topic " + topic + " must be a JSON object");
        }
        final var index = value.get(INDEX_FIELD);
        if (Objects.isNull(index) || !index.isTextual() || index.asText().isBlank()) {
            throw new ConfigException("Mapping of topic " + topic + " needs a non-empty " + INDEX_FIELD);
        }
        final var body = value.get(BODY_FIELD);
        if (Objects.isNull(body) || body.isNull()) {
            return new IndexMapping(topic, index.asText(), OBJECT_MAPPER.createObjectNode());
        }
        if (!body.isObject()) {
            throw new ConfigException("Mapping of topic " + topic + " has a " + BODY_FIELD + " which is not an object");
        }
        return new IndexMapping(topic, index.asText(), (ObjectNode) body);
    }

    /**
     * Finds the entry for a received topic: an exact match first, then the first wildcard filter that matches.
     */
    public Optional<IndexMapping> resolve(final String topic) {
        final var exact = entries.get(topic);
        if (Objects.nonNull(exact)) {
            return Optional.of(exact);
        }
        return wildcardEntries.stream().filter(m -> TopicFilters.matches(m.topicFilter(), topic)).findFirst();
    }

    public List<String> topicFilters() {
        return List.copyOf(entries.keySet());
    }

    public Collection<IndexMapping> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

}
