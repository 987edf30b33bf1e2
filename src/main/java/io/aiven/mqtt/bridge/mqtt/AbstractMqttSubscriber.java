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
package io.aiven.mqtt.bridge.mqtt;

import javax.net.ssl.SSLSocketFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractMqttSubscriber implements MqttSubscriber {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractMqttSubscriber.class);

    protected final MqttBridgeConfig config;

    protected final List<String> topicFilters;

    private final MqttMessageListener listener;

    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    protected AbstractMqttSubscriber(final MqttBridgeConfig config,
                                     final List<String> topicFilters,
                                     final MqttMessageListener listener) {
        this.config = config;
        this.topicFilters = List.copyOf(topicFilters);
        this.listener = listener;
    }

    @Override
    public void run() {
        LOGGER.info("Connecting to MQTT broker {} using protocol version {}",
                config.mqttServerUri(), config.mqttProtocolVersion());
        connect();
        try {
            shutdownLatch.await();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            disconnect();
        }
    }

    @Override
    public void shutdown() {
        LOGGER.info("Shutting down MQTT subscriber");
        shutdownLatch.countDown();
    }

    protected abstract void connect();

    protected abstract void disconnect();

    protected void dispatch(final String topic, final byte[] payload) {
        try {
            listener.onMessage(topic, payload);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to handle message on topic {}", topic, e);
        }
    }

    protected void onConnected(final boolean reconnect, final String serverUri) {
        if (reconnect) {
            LOGGER.info("Reconnected to MQTT broker {}", serverUri);
        } else {
            LOGGER.info("Connected to MQTT broker {}", serverUri);
        }
        if (topicFilters.isEmpty()) {
            LOGGER.warn("No topics to subscribe to");
            return;
        }
        subscribe(topicFilters.toArray(new String[0]), qosLevels());
    }

    protected abstract void subscribe(String[] filters, int[] qos);

    protected void onSubscribed() {
        LOGGER.info("Subscribed to topics {} with QoS {}", topicFilters, config.mqttQos());
    }

    protected void onSubscribeFailed(final Throwable cause) {
        LOGGER.error("Couldn't subscribe to topics {}", topicFilters, cause);
    }

    protected SSLSocketFactory socketFactory() {
        if (!config.mqttHostnameValidation()) {
            LOGGER.warn("MQTT broker host name validation disabled. Not recommended for production environments.");
        }
        return (SSLSocketFactory) SSLSocketFactory.getDefault();
    }

    private int[] qosLevels() {
        final var qos = new int[topicFilters.size()];
        Arrays.fill(qos, config.mqttQos());
        return qos;
    }

}
