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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import io.aiven.mqtt.bridge.store.DocumentStoreClient;
import io.aiven.mqtt.bridge.store.StoreException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexProvisionerTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Mock
    DocumentStoreClient client;

    private IndexProvisioner provisioner;

    private ObjectNode body;

    @BeforeEach
    void setup() {
        provisioner = new IndexProvisioner(client,
                new IndexNameResolver(Clock.fixed(Instant.parse("2024-03-07T10:15:30Z"), ZoneOffset.UTC)));
        body = OBJECT_MAPPER.createObjectNode();
        body.putObject("settings").put("number_of_shards", 1);
    }

    @Test
    void createsMissingIndexWithBody() {
        when(client.indexExists("logs-2024.03")).thenReturn(false);
        when(client.createIndex("logs-2024.03", body)).thenReturn(true);

        assertEquals("logs-2024.03", provisioner.ensureIndex("logs-{Y}.{m}", body));

        verify(client).createIndex("logs-2024.03", body);
    }

    @Test
    void leavesExistingIndexAlone() {
        when(client.indexExists("logs")).thenReturn(true);

        assertEquals("logs", provisioner.ensureIndex("logs", body));
        assertEquals("logs", provisioner.ensureIndex("logs", body));

        verify(client, never()).createIndex(anyString(), any());
    }

    @Test
    void treatsConcurrentCreationAsSuccess() {
        when(client.indexExists("logs")).thenReturn(false);
        when(client.createIndex("logs", body)).thenReturn(false);

        assertEquals("logs", provisioner.ensureIndex("logs", body));
    }

    @Test
    void removesOnlyExistingIndex() {
        when(client.indexExists("a")).thenReturn(false);
        when(client.indexExists("b")).thenReturn(true);
        when(client.deleteIndex("b")).thenReturn(true);

        provisioner.removeIndex("a");
        provisioner.removeIndex("b");

        verify(client, never()).deleteIndex("a");
        verify(client).deleteIndex("b");
    }

    @Test
    void provisionsEveryEntryInOrder() {
        final var mapping = new TopicMapping(List.of(
                new IndexMapping("a", "index-a", body),
                new IndexMapping("b/+", "index-b-{d}", body)));
        when(client.indexExists(anyString())).thenReturn(false);
        when(client.createIndex(anyString(), any())).thenReturn(true);

        provisioner.provisionAll(mapping);

        final var order = inOrder(client);
        order.verify(client).createIndex("index-a", body);
        order.verify(client).createIndex("index-b-07", body);
    }

    @Test
    void failsProvisioningOnStoreError() {
        final var mapping = new TopicMapping(List.of(new IndexMapping("a", "index-a", body)));
        when(client.indexExists("index-a")).thenThrow(new StoreException("boom"));

        assertThrows(StoreException.class, () -> provisioner.provisionAll(mapping));
    }

    @Test
    void removesAllEntriesAndReportsFailures() {
        final var mapping = new TopicMapping(List.of(
                new IndexMapping("a", "index-a", body),
                new IndexMapping("b", "index-b", body),
                new IndexMapping("c", "index-c", body)));
        when(client.indexExists(anyString())).thenReturn(true);
        when(client.deleteIndex("index-a")).thenReturn(true);
        when(client.deleteIndex("index-b")).thenThrow(new StoreException("boom"));
        when(client.deleteIndex("index-c")).thenReturn(true);

        assertFalse(provisioner.removeAll(mapping));

        final var order = inOrder(client);
        order.verify(client).deleteIndex("index-a");
        order.verify(client).deleteIndex("index-b");
        order.verify(client).deleteIndex("index-c");
    }

    @Test
    void removesBeforeRecreating() {
        final var mapping = new TopicMapping(List.of(
                new IndexMapping("a", "index-a", body),
                new IndexMapping("b", "index-b", body)));
        when(client.indexExists(anyString())).thenReturn(true, true, false, false);
        when(client.deleteIndex(anyString())).thenReturn(true);
        when(client.createIndex(anyString(), any())).thenReturn(true);

        assertTrue(provisioner.removeAll(mapping));
        provisioner.provisionAll(mapping);

        final var order = inOrder(client);
        order.verify(client).deleteIndex("index-a");
        order.verify(client).deleteIndex("index-b");
        order.verify(client).createIndex("index-a", body);
        order.verify(client).createIndex("index-b", body);
    }

}
