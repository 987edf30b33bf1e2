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
import java.io.StringReader;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.opensearch.client.json.JsonpDeserializer;
import org.opensearch.client.json.JsonpMapper;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.OpenSearchException;
import org.opensearch.client.opensearch._types.mapping.TypeMapping;
import org.opensearch.client.opensearch.core.IndexRequest;
import org.opensearch.client.opensearch.indices.Alias;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.DeleteIndexRequest;
import org.opensearch.client.opensearch.indices.ExistsRequest;
import org.opensearch.client.opensearch.indices.IndexSettings;
import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;
import org.opensearch.client.util.MissingRequiredPropertyException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.json.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OpenSearchStoreClient implements DocumentStoreClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenSearchStoreClient.class);

    static final String RESOURCE_ALREADY_EXISTS_EXCEPTION = "resource_already_exists_exception";

    static final String INDEX_NOT_FOUND_EXCEPTION = "index_not_found_exception";

    private static final JsonpMapper JSONP_MAPPER = new JacksonJsonpMapper();

    /* visible for testing */
    protected final OpenSearchClient client;

    public OpenSearchStoreClient(final MqttBridgeConfig config) {
        this(new OpenSearchClient(ApacheHttpClient5TransportBuilder.builder(config.opensearchHosts())
                .setMapper(JSONP_MAPPER)
                .setCompressionEnabled(true)
                .setHttpClientConfigCallback(new HttpClientConfigCallback(config))
                .build()));
    }

    protected OpenSearchStoreClient(final OpenSearchClient client) {
        this.client = client;
    }

    @Override
    public boolean indexExists(final String index) {
        try {
            return client.indices().exists(ExistsRequest.of(b -> b.index(index))).value();
        } catch (final OpenSearchException | IOException e) {
            throw new StoreException("Couldn't check that index " + index + " exists", e);
        }
    }

    @Override
    public boolean createIndex(final String index, final ObjectNode body) {
        final var request = createIndexRequest(index, body);
        try {
            client.indices().create(request);
            return true;
        } catch (final OpenSearchException oe) {
            if (RESOURCE_ALREADY_EXISTS_EXCEPTION.equals(oe.error().type())) {
                LOGGER.info("Index {} already exists", index);
                return false;
            }
            throw new StoreException("Couldn't create index " + index, oe);
        } catch (final IOException e) {
            throw new StoreException("Couldn't create index " + index, e);
        }
    }

    /* visible for testing */
    static CreateIndexRequest createIndexRequest(final String index, final ObjectNode body) {
        final var builder = new CreateIndexRequest.Builder().index(index);
        try {
            if (body.hasNonNull("mappings")) {
                builder.mappings(deserialize(body.get("mappings"), TypeMapping._DESERIALIZER));
            }
            if (body.hasNonNull("settings")) {
                builder.settings(deserialize(body.get("settings"), IndexSettings._DESERIALIZER));
            }
            if (body.hasNonNull("aliases")) {
                body.get("aliases").fields().forEachRemaining(alias ->
                        builder.aliases(alias.getKey(), deserialize(alias.getValue(), Alias._DESERIALIZER)));
            }
        } catch (final JsonException | MissingRequiredPropertyException | IllegalArgumentException e) {
            throw new StoreException("Couldn't read the body of index " + index, e);
        }
        body.fieldNames().forEachRemaining(field -> {
            if (!"mappings".equals(field) && !"settings".equals(field) && !"aliases".equals(field)) {
                LOGGER.warn("Ignoring unsupported field {} in the body of index {}", field, index);
            }
        });
        return builder.build();
    }

    private static <T> T deserialize(final JsonNode node, final JsonpDeserializer<T> deserializer) {
        try (var parser = JSONP_MAPPER.jsonProvider().createParser(new StringReader(node.toString()))) {
            return deserializer.deserialize(parser, JSONP_MAPPER);
        }
    }

    @Override
    public boolean deleteIndex(final String index) {
        try {
            return client.indices().delete(DeleteIndexRequest.of(b -> b.index(index))).acknowledged();
        } catch (final OpenSearchException oe) {
            if (INDEX_NOT_FOUND_EXCEPTION.equals(oe.error().type())) {
                LOGGER.info("Index {} doesn't exist", index);
                return false;
            }
            throw new StoreException("Couldn't delete index " + index, oe);
        } catch (final IOException e) {
            throw new StoreException("Couldn't delete index " + index, e);
        }
    }

    @Override
    public String indexDocument(final String index, final ObjectNode document) {
        try {
            return client.index(new IndexRequest.Builder<ObjectNode>().index(index).document(document).build())
                    .result()
                    .jsonValue();
        } catch (final OpenSearchException | IOException e) {
            throw new StoreException("Couldn't index document into " + index, e);
        }
    }

    @Override
    public void close() throws IOException {
        client._transport().close();
    }

}
