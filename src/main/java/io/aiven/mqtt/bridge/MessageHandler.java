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
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import io.aiven.mqtt.bridge.mqtt.MqttMessageListener;
import io.aiven.mqtt.bridge.store.DocumentStoreClient;
import io.aiven.mqtt.bridge.store.StoreException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every received MQTT message as a document into the index mapped to its topic.
 */
public class MessageHandler implements MqttMessageListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageHandler.class);

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final TopicMapping topicMapping;

    private final IndexProvisioner indexProvisioner;

    private final DocumentStoreClient client;

    public MessageHandler(final TopicMapping topicMapping,
                          final IndexProvisioner indexProvisioner,
                          final DocumentStoreClient client) {
        this.topicMapping = topicMapping;
        this.indexProvisioner = indexProvisioner;
        this.client = client;
    }

    @Override
    public void onMessage(final String topic, final byte[] payload) {
        LOGGER.debug("Received message on topic {}", topic);
        final var mapping = topicMapping.resolve(topic);
        if (mapping.isEmpty()) {
            LOGGER.error("No index mapped to topic {}, message dropped", topic);
            return;
        }
        try {
            final var index = indexProvisioner.ensureIndex(
                    mapping.get().indexNameTemplate(), mapping.get().indexBody());
            final var document = parseDocument(payload);
            LOGGER.info("Add data to index {}", index);
            final var result = client.indexDocument(index, document);
            LOGGER.debug("Indexed document from topic {} into {}: {}", topic, index, result);
        } catch (final InvalidPayloadException e) {
            LOGGER.error("Invalid payload on topic {}: {}", topic, e.getMessage());
        } catch (final StoreException e) {
            LOGGER.error("Couldn't write message from topic {}", topic, e);
        }
    }

    static ObjectNode parseDocument(final byte[] payload) {
        final String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (final CharacterCodingException e) {
            throw new InvalidPayloadException("payload is not valid UTF-8", e);
        }
        try {
            final var node = OBJECT_MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new InvalidPayloadException("payload is not a JSON object", null);
            }
            return (ObjectNode) node;
        } catch (final IOException e) {
            throw new InvalidPayloadException("payload is not valid JSON", e);
        }
    }

    static class InvalidPayloadException extends RuntimeException {

        InvalidPayloadException(final String message, final Throwable cause) {
            super(message, cause);
        }

    }

}
