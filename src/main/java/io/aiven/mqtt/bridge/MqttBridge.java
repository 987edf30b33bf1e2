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
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.apache.kafka.common.config.ConfigException;

import io.aiven.mqtt.bridge.mqtt.MqttMessageListener;
import io.aiven.mqtt.bridge.mqtt.MqttSubscriber;
import io.aiven.mqtt.bridge.mqtt.MqttSubscriberException;
import io.aiven.mqtt.bridge.mqtt.MqttSubscribers;
import io.aiven.mqtt.bridge.store.DocumentStoreClient;
import io.aiven.mqtt.bridge.store.DocumentStoreClients;
import io.aiven.mqtt.bridge.store.StoreException;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: subscribes to the mapped MQTT topics and writes every message into Elasticsearch or OpenSearch.
 */
public class MqttBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(MqttBridge.class);

    public static final String CONFIG_FILE_ENV = "CONFIG_FILE";

    public static final String CONFIG_FILE_DEFAULT = "/app/etc/mqtt2elasticsearch.json";

    public static final String MAPPING_FILE_ENV = "ELASTICSEARCH_MAPPING_FILE";

    public static final String MAPPING_FILE_DEFAULT = "/app/etc/mqtt2elasticsearch-mappings.json";

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    @FunctionalInterface
    interface SubscriberFactory {
        MqttSubscriber create(MqttBridgeConfig config, List<String> topicFilters, MqttMessageListener listener);
    }

    private final Function<MqttBridgeConfig, DocumentStoreClient> storeClientFactory;

    private final SubscriberFactory subscriberFactory;

    private final IndexNameResolver indexNameResolver;

    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile MqttSubscriber subscriber;

    private volatile boolean shutdownRequested;

    public MqttBridge() {
        this(DocumentStoreClients::create, MqttSubscribers::create, new IndexNameResolver());
    }

    MqttBridge(final Function<MqttBridgeConfig, DocumentStoreClient> storeClientFactory,
               final SubscriberFactory subscriberFactory,
               final IndexNameResolver indexNameResolver) {
        this.storeClientFactory = storeClientFactory;
        this.subscriberFactory = subscriberFactory;
        this.indexNameResolver = indexNameResolver;
    }

    public static void main(final String[] args) {
        final var bridge = new MqttBridge();
        Runtime.getRuntime().addShutdownHook(new Thread(bridge::stop, "mqtt-bridge-shutdown"));
        final var exitCode = bridge.run(path(CONFIG_FILE_ENV, CONFIG_FILE_DEFAULT),
                path(MAPPING_FILE_ENV, MAPPING_FILE_DEFAULT));
        System.exit(exitCode);
    }

    private static Path path(final String env, final String defaultValue) {
        final var value = System.getenv(env);
        return Path.of(Objects.isNull(value) || value.isBlank() ? defaultValue : value);
    }

    /**
     * Runs the bridge until {@link #shutdown()} is called or a fatal error occurs.
     *
     * @return the process exit code
     */
    public int run(final Path configFile, final Path mappingFile) {
        try {
            LOGGER.info("MQTT to search bridge v{} started", Version.getVersion());
            return doRun(configFile, mappingFile);
        } finally {
            LOGGER.info("MQTT to search bridge stopped");
            stopped.countDown();
        }
    }

    private int doRun(final Path configFile, final Path mappingFile) {
        final MqttBridgeConfig config;
        final TopicMapping mapping;
        try {
            config = MqttBridgeConfig.load(configFile);
            mapping = TopicMapping.load(mappingFile);
        } catch (final ConfigException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
        if (config.debug()) {
            Configurator.setRootLevel(Level.DEBUG);
            LOGGER.debug("Debug logging enabled");
        }

        final DocumentStoreClient client;
        try {
            client = storeClientFactory.apply(config);
        } catch (final ConfigException e) {
            LOGGER.error("Invalid document store configuration: {}", e.getMessage());
            return 1;
        }
        try {
            return runWith(config, mapping, client);
        } finally {
            close(client);
        }
    }

    private int runWith(final MqttBridgeConfig config, final TopicMapping mapping, final DocumentStoreClient client) {
        final var provisioner = new IndexProvisioner(client, indexNameResolver);
        if (config.removeIndex()) {
            LOGGER.info("Removing {} mapped indices", mapping.size());
            final var removed = provisioner.removeAll(mapping);
            if (config.removeIndexExit()) {
                return removed ? 0 : 1;
            }
        }
        try {
            provisioner.provisionAll(mapping);
        } catch (final StoreException e) {
            LOGGER.error("Couldn't provision indices", e);
            return 1;
        }

        final var handler = new MessageHandler(mapping, provisioner, client);
        try {
            subscriber = subscriberFactory.create(config, mapping.topicFilters(), handler);
            if (shutdownRequested) {
                subscriber.shutdown();
            }
            subscriber.run();
        } catch (final MqttSubscriberException e) {
            LOGGER.error("MQTT subscriber failed: {}", e.getMessage(), e.getCause());
            return 1;
        }
        return 0;
    }

    private static void close(final DocumentStoreClient client) {
        try {
            client.close();
        } catch (final IOException e) {
            LOGGER.warn("Couldn't close document store client", e);
        }
    }

    public void shutdown() {
        shutdownRequested = true;
        final var current = subscriber;
        if (Objects.nonNull(current)) {
            current.shutdown();
        }
    }

    private void stop() {
        shutdown();
        try {
            if (!stopped.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Bridge didn't stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

}
