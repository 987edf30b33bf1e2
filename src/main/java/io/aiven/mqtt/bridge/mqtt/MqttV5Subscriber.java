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

import java.nio.charset.StandardCharsets;
import java.util.List;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.eclipse.paho.mqttv5.client.IMqttAsyncClient;
import org.eclipse.paho.mqttv5.client.IMqttToken;
import org.eclipse.paho.mqttv5.client.MqttActionListener;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttCallback;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.MqttDisconnectResponse;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.eclipse.paho.mqttv5.common.MqttMessage;
import org.eclipse.paho.mqttv5.common.packet.MqttProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MQTT 5 subscriber on top of the Paho {@code mqttv5} asynchronous client.
 */
public class MqttV5Subscriber extends AbstractMqttSubscriber implements MqttCallback {

    private static final Logger LOGGER = LoggerFactory.getLogger(MqttV5Subscriber.class);

    private final IMqttAsyncClient client;

    public MqttV5Subscriber(final MqttBridgeConfig config,
                            final List<String> topicFilters,
                            final MqttMessageListener listener) {
        this(config, topicFilters, listener, createClient(config));
    }

    MqttV5Subscriber(final MqttBridgeConfig config,
                     final List<String> topicFilters,
                     final MqttMessageListener listener,
                     final IMqttAsyncClient client) {
        super(config, topicFilters, listener);
        this.client = client;
        this.client.setCallback(this);
    }

    private static IMqttAsyncClient createClient(final MqttBridgeConfig config) {
        try {
            return new MqttAsyncClient(config.mqttServerUri(), config.mqttClientId().orElse(""),
                    new MemoryPersistence());
        } catch (final MqttException | IllegalArgumentException e) {
            throw new MqttSubscriberException("Couldn't create MQTT client for " + config.mqttServerUri(), e);
        }
    }

    MqttConnectionOptions connectOptions() {
        final var options = new MqttConnectionOptions();
        options.setCleanStart(true);
        options.setAutomaticReconnect(true);
        options.setKeepAliveInterval(config.mqttKeepAlive());
        if (config.mqttAuthenticated()) {
            options.setUserName(config.mqttUser());
            options.setPassword(config.mqttPassword().value().getBytes(StandardCharsets.UTF_8));
        }
        if (config.mqttTls()) {
            options.setSocketFactory(socketFactory());
            options.setHttpsHostnameVerificationEnabled(config.mqttHostnameValidation());
        }
        return options;
    }

    @Override
    protected void connect() {
        try {
            client.connect(connectOptions()).waitForCompletion();
        } catch (final MqttException e) {
            throw new MqttSubscriberException(
                    "Couldn't connect to MQTT broker " + config.mqttServerUri() + ", reason code "
                            + e.getReasonCode(), e);
        }
    }

    @Override
    protected void subscribe(final String[] filters, final int[] qos) {
        try {
            client.subscribe(filters, qos, null, new MqttActionListener() {
                @Override
                public void onSuccess(final IMqttToken asyncActionToken) {
                    onSubscribed();
                }

                @Override
                public void onFailure(final IMqttToken asyncActionToken, final Throwable exception) {
                    onSubscribeFailed(exception);
                }
            });
        } catch (final MqttException e) {
            onSubscribeFailed(e);
        }
    }

    @Override
    protected void disconnect() {
        try {
            if (client.isConnected()) {
                client.disconnect().waitForCompletion();
            }
            client.close();
            LOGGER.info("Disconnected from MQTT broker {}", config.mqttServerUri());
        } catch (final MqttException e) {
            LOGGER.warn("Couldn't disconnect cleanly from MQTT broker {}", config.mqttServerUri(), e);
        }
    }

    @Override
    public void connectComplete(final boolean reconnect, final String serverURI) {
        onConnected(reconnect, serverURI);
    }

    @Override
    public void disconnected(final MqttDisconnectResponse disconnectResponse) {
        LOGGER.warn("Disconnected by MQTT broker, reason code {}, reconnecting",
                disconnectResponse.getReturnCode(), disconnectResponse.getException());
    }

    @Override
    public void mqttErrorOccurred(final MqttException exception) {
        LOGGER.error("MQTT client error", exception);
    }

    @Override
    public void messageArrived(final String topic, final MqttMessage message) {
        dispatch(topic, message.getPayload());
    }

    @Override
    public void deliveryComplete(final IMqttToken token) {
        // subscribe only
    }

    @Override
    public void authPacketArrived(final int reasonCode, final MqttProperties properties) {
        LOGGER.debug("Ignoring AUTH packet with reason code {}", reasonCode);
    }

}
