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

import java.util.List;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

public final class MqttSubscribers {

    private MqttSubscribers() {
    }

    public static MqttSubscriber create(final MqttBridgeConfig config,
                                        final List<String> topicFilters,
                                        final MqttMessageListener listener) {
        switch (config.mqttProtocolVersion()) {
            case MQTT_5:
                return new MqttV5Subscriber(config, topicFilters, listener);
            case MQTT_3_1_1:
            default:
                return new MqttV3Subscriber(config, topicFilters, listener);
        }
    }

}
