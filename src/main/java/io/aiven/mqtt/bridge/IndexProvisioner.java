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

import io.aiven.mqtt.bridge.store.DocumentStoreClient;
import io.aiven.mqtt.bridge.store.StoreException;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and removes the indices named by the topic mapping. Index name templates are resolved against the
 * current date on every call.
 */
public class IndexProvisioner {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexProvisioner.class);

    private final DocumentStoreClient client;

    private final IndexNameResolver indexNameResolver;

    public IndexProvisioner(final DocumentStoreClient client, final IndexNameResolver indexNameResolver) {
        this.client = client;
        this.indexNameResolver = indexNameResolver;
    }

    /**
     * Creates the index with the given body unless it already exists.
     *
     * @return the resolved index name
     */
    public String ensureIndex(final String indexNameTemplate, final ObjectNode body) {
        final var index = indexNameResolver.resolve(indexNameTemplate);
        if (client.indexExists(index)) {
            LOGGER.debug("Index {} already exists", index);
            return index;
        }
        if (client.createIndex(index, body)) {
            LOGGER.info("Created index {}", index);
        } else {
            LOGGER.debug("Index {} was created concurrently", index);
        }
        return index;
    }

    public void removeIndex(final String indexNameTemplate) {
        final var index = indexNameResolver.resolve(indexNameTemplate);
        if (!client.indexExists(index)) {
            LOGGER.info("Index {} doesn't exist, nothing to remove", index);
            return;
        }
        if (client.deleteIndex(index)) {
            LOGGER.info("Removed index {}", index);
        }
    }

    public void provisionAll(final TopicMapping mapping) {
        for (final var entry : mapping.entries()) {
            final var index = ensureIndex(entry.indexNameTemplate(), entry.indexBody());
            LOGGER.debug("Topic {} is written to index {}", entry.topicFilter(), index);
        }
    }

    /**
     * Removes the index of every mapping entry. A failure doesn't stop the remaining removals.
     *
     * @return {@code true} if every index was removed or absent
     */
    public boolean removeAll(final TopicMapping mapping) {
        var succeeded = true;
        for (final var entry : mapping.entries()) {
            try {
                removeIndex(entry.indexNameTemplate());
            } catch (final StoreException e) {
                LOGGER.error("Couldn't remove index {} of topic {}",
                        entry.indexNameTemplate(), entry.topicFilter(), e);
                succeeded = false;
            }
        }
        return succeeded;
    }

}
