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
package io.aiven.mqtt.bridge.spi;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import org.apache.hc.client5.http.impl.async.HttpAsyncClientBuilder;

/**
 * The extension point to customize the OpenSearch HTTP client based on the provided configuration.
 */
public interface OpenSearchClientConfigurator {

    /**
     * Apply the configurator to the {@link HttpAsyncClientBuilder} instance according to the provided configuration.
     *
     * @param config
     *            provided configuration
     * @param builder
     *            {@link HttpAsyncClientBuilder} instance
     * @return {@code true} if the configuration was applied, {@code false} if it doesn't apply to the configuration
     */
    boolean apply(MqttBridgeConfig config, HttpAsyncClientBuilder builder);

}
