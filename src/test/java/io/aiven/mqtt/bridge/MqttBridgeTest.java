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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import io.aiven.mqtt.bridge.mqtt.MqttMessageListener;
import io.aiven.mqtt.bridge.mqtt.MqttSubscriber;
import io.aiven.mqtt.bridge.mqtt.MqttSubscriberException;
import io.aiven.mqtt.bridge.mqtt.MqttSubscribers;
import io.aiven.mqtt.bridge.store.DocumentStoreClient;
import io.aiven.mqtt.bridge.store.StoreBackend;
import io.aiven.mqtt.bridge.store.StoreException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MqttBridgeTest {

    private static final String MAPPING = "{\n"
            + "  \"home/door\": {\"elasticIndex\": \"door\"},\n"
            + "  \"sensors/#\": {\"elasticIndex\": \"sensors-{Y}\"}\n"
            + "}";

    @TempDir
    Path tmpFolder;

    @Mock
    DocumentStoreClient client;

    @Mock
    MqttSubscriber subscriber;

    private Path configFile;

    private Path mappingFile;

    private final List<List<String>> subscribedFilters = new ArrayList<>();

    private final AtomicReference<MqttBridgeConfig> storeConfig = new AtomicReference<>();

    private MqttBridge bridge;

    @BeforeEach
    void setup() throws Exception {
        configFile = tmpFolder.resolve("config.json");
        mappingFile = tmpFolder.resolve("mapping.json");
        Files.writeString(mappingFile, MAPPING);
        bridge = new MqttBridge(
                config -> {
                    storeConfig.set(config);
                    return client;
                },
                (final MqttBridgeConfig config, final List<String> filters, final MqttMessageListener listener) -> {
                    subscribedFilters.add(filters);
                    return subscriber;
                },
                new IndexNameResolver(Clock.fixed(Instant.parse("2024-03-07T10:15:30Z"), ZoneOffset.UTC)));
    }

    private void writeConfig(final String extra) throws Exception {
        Files.writeString(configFile, "{\"mqtt\": {\"server\": \"broker\", \"port\": 1883}, "
                + "\"opensearch\": {\"hosts\": [{\"host\": \"localhost\"}]}" + extra + "}");
    }

    @Test
    void provisionsIndicesAndRunsSubscriber() throws Exception {
        writeConfig("");
        when(client.indexExists(anyString())).thenReturn(false);
        when(client.createIndex(anyString(), any())).thenReturn(true);

        assertEquals(0, bridge.run(configFile, mappingFile));

        final var order = inOrder(client, subscriber);
        order.verify(client).createIndex(eq("door"), any());
        order.verify(client).createIndex(eq("sensors-2024"), any());
        order.verify(subscriber).run();
        order.verify(client).close();
        assertEquals(List.of(List.of("home/door", "sensors/#")), subscribedFilters);
    }

    @Test
    void failsBeforeConnectingWhenBothBackendsAreConfigured() throws Exception {
        writeConfig(", \"elasticsearch\": {\"cluster\": [\"http://localhost:9200\"]}");

        assertEquals(1, bridge.run(configFile, mappingFile));

        assertNull(storeConfig.get());
        assertEquals(List.of(), subscribedFilters);
    }

    @Test
    void failsBeforeConnectingWhenNoBackendIsConfigured() throws Exception {
        Files.writeString(configFile, "{\"mqtt\": {\"server\": \"broker\", \"port\": 1883}}");

        assertEquals(1, bridge.run(configFile, mappingFile));

        assertNull(storeConfig.get());
    }

    @Test
    void failsOnMissingMappingFile() throws Exception {
        writeConfig("");

        assertEquals(1, bridge.run(configFile, tmpFolder.resolve("missing.json")));

        assertNull(storeConfig.get());
    }

    @Test
    void removesIndicesAndExits() throws Exception {
        writeConfig(", \"removeIndex\": true");
        when(client.indexExists(anyString())).thenReturn(true);
        when(client.deleteIndex(anyString())).thenReturn(true);

        assertEquals(0, bridge.run(configFile, mappingFile));

        verify(client).deleteIndex("door");
        verify(client).deleteIndex("sensors-2024");
        verify(client, never()).createIndex(anyString(), any());
        verify(client).close();
        assertEquals(List.of(), subscribedFilters);
    }

    @Test
    void exitsWithErrorWhenRemovalFails() throws Exception {
        writeConfig(", \"removeIndex\": true");
        when(client.indexExists(anyString())).thenReturn(true);
        when(client.deleteIndex("door")).thenThrow(new StoreException("boom"));
        when(client.deleteIndex("sensors-2024")).thenReturn(true);

        assertEquals(1, bridge.run(configFile, mappingFile));

        verify(client).deleteIndex("sensors-2024");
    }

    @Test
    void recreatesIndicesAfterRemovalWhenNotExiting() throws Exception {
        writeConfig(", \"removeIndex\": true, \"removeIndexExit\": false");
        when(client.indexExists(anyString())).thenReturn(true, true, false, false);
        when(client.deleteIndex(anyString())).thenReturn(true);
        when(client.createIndex(anyString(), any())).thenReturn(true);

        assertEquals(0, bridge.run(configFile, mappingFile));

        final var order = inOrder(client, subscriber);
        order.verify(client).deleteIndex("door");
        order.verify(client).deleteIndex("sensors-2024");
        order.verify(client).createIndex(eq("door"), any());
        order.verify(client).createIndex(eq("sensors-2024"), any());
        order.verify(subscriber).run();
    }

    @Test
    void exitsWithErrorWhenProvisioningFails() throws Exception {
        writeConfig("");
        when(client.indexExists("door")).thenThrow(new StoreException("unreachable"));

        assertEquals(1, bridge.run(configFile, mappingFile));

        assertEquals(List.of(), subscribedFilters);
        verify(client).close();
    }

    @Test
    void exitsWithErrorWhenBrokerIsUnreachable() throws Exception {
        writeConfig("");
        when(client.indexExists(anyString())).thenReturn(true);
        doThrow(new MqttSubscriberException("Couldn't connect", new RuntimeException("refused")))
                .when(subscriber).run();

        assertEquals(1, bridge.run(configFile, mappingFile));

        verify(client).close();
    }

    @Test
    void exitsWithErrorOnMalformedBrokerAddress() throws Exception {
        Files.writeString(configFile, "{\"mqtt\": {\"server\": \"bad host\", \"port\": 1883}, "
                + "\"opensearch\": {\"hosts\": [{\"host\": \"localhost\"}]}}");
        when(client.indexExists(anyString())).thenReturn(true);
        final var pahoBridge = new MqttBridge(config -> client, MqttSubscribers::create,
                new IndexNameResolver(Clock.fixed(Instant.parse("2024-03-07T10:15:30Z"), ZoneOffset.UTC)));

        assertEquals(1, pahoBridge.run(configFile, mappingFile));

        verify(client).close();
    }

    @Test
    void shutdownBeforeRunStopsSubscriberImmediately() throws Exception {
        writeConfig("");
        when(client.indexExists(anyString())).thenReturn(true);

        bridge.shutdown();

        assertEquals(0, bridge.run(configFile, mappingFile));
        final var order = inOrder(subscriber);
        order.verify(subscriber).shutdown();
        order.verify(subscriber).run();
    }

    @Test
    void passesLoadedConfigToStoreFactory() throws Exception {
        writeConfig(", \"removeIndex\": true");
        when(client.indexExists(anyString())).thenReturn(false);

        bridge.run(configFile, mappingFile);

        assertSame(StoreBackend.OPENSEARCH, storeConfig.get().storeBackend());
    }

}
