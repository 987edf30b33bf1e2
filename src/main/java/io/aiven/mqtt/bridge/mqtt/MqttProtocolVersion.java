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

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

public enum MqttProtocolVersion {

    MQTT_3_1_1(3),
    MQTT_5(5);

    private final int version;

    MqttProtocolVersion(final int version) {
        this.version = version;
    }

    public int version() {
        return version;
    }

    public static MqttProtocolVersion of(final int version) {
        return Arrays.stream(values())
                .filter(v -> v.version == version)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported MQTT protocol version " + version));
    }

    public static String possibleValues() {
        return Arrays.stream(values())
                .map(v -> String.format("``%d``", v.version))
                .collect(Collectors.joining(", "));
    }

    public static final ConfigDef.Validator VALIDATOR = new ConfigDef.Validator() {
        @Override
        public void ensureValid(final String name, final Object value) {
            if (Objects.isNull(value)) {
                return;
            }
            try {
                MqttProtocolVersion.of((Integer) value);
            } catch (final IllegalArgumentException e) {
                throw new ConfigException(name, value,
                        "MQTT protocol version must be one of: " + MqttProtocolVersion.possibleValues());
            }
        }

        @Override
        public String toString() {
            return MqttProtocolVersion.possibleValues();
        }
    };

}
