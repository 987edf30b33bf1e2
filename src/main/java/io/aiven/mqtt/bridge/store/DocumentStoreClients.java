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

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DocumentStoreClients {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStoreClients.class);

    private DocumentStoreClients() {
    }

    /**
     * Creates the client of the configured backend. No request is sent to the store.
     */
    public static DocumentStoreClient create(final MqttBridgeConfig config) {
        final var backend = config.storeBackend();
        LOGGER.info("Using {} as document store", backend);
        switch (backend) {
            case ELASTICSEARCH:
                return new ElasticsearchStoreClient(config);
            case OPENSEARCH:
                return new OpenSearchStoreClient(config);
            default:
                throw new IllegalStateException("Unknown store backend " + backend);
        }
    }

}
