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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch._types.ErrorResponse;
import org.opensearch.client.opensearch._types.OpenSearchException;
import org.opensearch.client.opensearch._types.Result;
import org.opensearch.client.opensearch.core.IndexRequest;
import org.opensearch.client.opensearch.core.IndexResponse;
import org.opensearch.client.opensearch.indices.CreateIndexRequest;
import org.opensearch.client.opensearch.indices.CreateIndexResponse;
import org.opensearch.client.opensearch.indices.DeleteIndexRequest;
import org.opensearch.client.opensearch.indices.DeleteIndexResponse;
import org.opensearch.client.opensearch.indices.ExistsRequest;
import org.opensearch.client.opensearch.indices.OpenSearchIndicesClient;
import org.opensearch.client.transport.OpenSearchTransport;
import org.opensearch.client.transport.endpoints.BooleanResponse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenSearchStoreClientTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Mock
    OpenSearchClient openSearchClient;

    @Mock
    OpenSearchIndicesClient indicesClient;

    private OpenSearchStoreClient client;

    @BeforeEach
    void setup() {
        client = new OpenSearchStoreClient(openSearchClient);
    }

    @Test
    void checksIndexExistence() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.exists(any(ExistsRequest.class))).thenReturn(new BooleanResponse(true));

        assertTrue(client.indexExists("sensors"));

        final var request = ArgumentCaptor.forClass(ExistsRequest.class);
        verify(indicesClient).exists(request.capture());
        assertEquals("sensors", request.getValue().index().get(0));
    }

    @Test
    void createsIndexWithBody() throws Exception {
        final ObjectNode body = (ObjectNode) OBJECT_MAPPER.readTree("{"
                + "\"settings\":{\"number_of_shards\":1},"
                + "\"mappings\":{\"properties\":{\"celsius\":{\"type\":\"float\"}}},"
                + "\"aliases\":{\"sensors-all\":{}}}");
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.create(any(CreateIndexRequest.class)))
                .thenReturn(CreateIndexResponse.of(b -> b.index("sensors")
                        .acknowledged(true)
                        .shardsAcknowledged(true)));

        assertTrue(client.createIndex("sensors", body));

        final var request = ArgumentCaptor.forClass(CreateIndexRequest.class);
        verify(indicesClient).create(request.capture());
        assertEquals("sensors", request.getValue().index());
        assertTrue(request.getValue().mappings().properties().get("celsius").isFloat());
        assertNotNull(request.getValue().settings());
        assertTrue(request.getValue().aliases().containsKey("sensors-all"));
    }

    @Test
    void createsIndexWithoutBody() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.create(any(CreateIndexRequest.class)))
                .thenReturn(CreateIndexResponse.of(b -> b.index("sensors")
                        .acknowledged(true)
                        .shardsAcknowledged(true)));

        assertTrue(client.createIndex("sensors", OBJECT_MAPPER.createObjectNode()));

        final var request = ArgumentCaptor.forClass(CreateIndexRequest.class);
        verify(indicesClient).create(request.capture());
        assertNull(request.getValue().mappings());
        assertNull(request.getValue().settings());
    }

    @Test
    void rejectsMalformedIndexBody() throws Exception {
        final ObjectNode body = (ObjectNode) OBJECT_MAPPER.readTree("{\"mappings\":[1,2]}");

        assertThrows(StoreException.class, () -> client.createIndex("sensors", body));
    }

    @Test
    void reportsExistingIndexOnCreate() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.create(any(CreateIndexRequest.class))).thenThrow(new OpenSearchException(
                ErrorResponse.of(b -> b.status(400)
                        .error(e -> e.type("resource_already_exists_exception")
                                .reason("index [sensors] already exists")))));

        assertFalse(client.createIndex("sensors", OBJECT_MAPPER.createObjectNode()));
    }

    @Test
    void wrapsCreateFailures() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.create(any(CreateIndexRequest.class))).thenThrow(new IOException("Connection refused"));

        assertThrows(StoreException.class, () -> client.createIndex("sensors", OBJECT_MAPPER.createObjectNode()));
    }

    @Test
    void deletesIndex() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.delete(any(DeleteIndexRequest.class)))
                .thenReturn(DeleteIndexResponse.of(b -> b.acknowledged(true)));

        assertTrue(client.deleteIndex("sensors"));
    }

    @Test
    void reportsMissingIndexOnDelete() throws Exception {
        when(openSearchClient.indices()).thenReturn(indicesClient);
        when(indicesClient.delete(any(DeleteIndexRequest.class))).thenThrow(new OpenSearchException(
                ErrorResponse.of(b -> b.status(404)
                        .error(e -> e.type("index_not_found_exception").reason("no such index [sensors]")))));

        assertFalse(client.deleteIndex("sensors"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void indexesDocumentAndReturnsResult(final @Mock IndexResponse response) throws Exception {
        final var document = OBJECT_MAPPER.createObjectNode().put("celsius", 21.5);
        when(openSearchClient.index(any(IndexRequest.class))).thenReturn(response);
        when(response.result()).thenReturn(Result.Created);

        assertEquals("created", client.indexDocument("sensors", document));

        final ArgumentCaptor<IndexRequest<ObjectNode>> request = ArgumentCaptor.forClass(IndexRequest.class);
        verify(openSearchClient).index(request.capture());
        assertEquals("sensors", request.getValue().index());
        assertEquals(document, request.getValue().document());
    }

    @Test
    void wrapsIndexingFailures() throws Exception {
        when(openSearchClient.index(any(IndexRequest.class))).thenThrow(new IOException("timeout"));

        assertThrows(StoreException.class,
                () -> client.indexDocument("sensors", OBJECT_MAPPER.createObjectNode()));
    }

    @Test
    void closesTransport(final @Mock OpenSearchTransport transport) throws Exception {
        when(openSearchClient._transport()).thenReturn(transport);

        client.close();

        verify(transport).close();
    }

    @Test
    void buildsClientFromConfig() {
        final var props = new HashMap<String, Object>();
        props.put(MqttBridgeConfig.MQTT_SERVER_CONFIG, "broker");
        props.put(MqttBridgeConfig.MQTT_PORT_CONFIG, 1883);
        props.put(MqttBridgeConfig.OPENSEARCH_HOSTS_CONFIG, List.of(Map.of("host", "localhost", "port", 9200)));
        props.put(MqttBridgeConfig.OPENSEARCH_TLS_CONFIG, true);

        final var storeClient = new OpenSearchStoreClient(new MqttBridgeConfig(props));

        assertDoesNotThrow(storeClient::close);
    }

}
