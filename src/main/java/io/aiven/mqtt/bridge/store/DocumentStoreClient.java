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
package io.aiven.mqtt.bridge.store;

import java.io.IOException;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The operations the bridge needs from a document store. Implementations do not retry, every failure is reported
 * to the caller as a {@link StoreException}.
 */
public interface DocumentStoreClient extends AutoCloseable {

    boolean indexExists(String index);

    /**
     * Creates the index with the given settings and mappings.
     *
     * @return {@code true} if the index was created, {@code false} if it already existed
     */
    boolean createIndex(String index, ObjectNode body);

    /**
     * @return {@code true} if the index was deleted, {@code false} if it didn't exist
     */
    boolean deleteIndex(String index);

    /**
     * Indexes one document and returns the result reported by the store, e.g. {@code created}.
     */
    String indexDocument(String index, ObjectNode document);

    @Override
    void close() throws IOException;

}
