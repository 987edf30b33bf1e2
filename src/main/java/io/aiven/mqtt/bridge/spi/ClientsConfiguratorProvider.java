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

import java.util.ArrayList;
import java.util.Collection;
import java.util.ServiceLoader;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

public final class ClientsConfiguratorProvider {

    private ClientsConfiguratorProvider() {
    }

    /**
     * Use {@link ServiceLoader} mechanism to discover available configurators for the OpenSearch client.
     *
     * @param config
     *            provided configuration
     * @return the discovered {@link OpenSearchClientConfigurator} configurators
     */
    public static Collection<OpenSearchClientConfigurator> forOpenSearch(final MqttBridgeConfig config) {
        final Collection<OpenSearchClientConfigurator> configurators = new ArrayList<>();
        ServiceLoader.load(OpenSearchClientConfigurator.class, ClientsConfiguratorProvider.class.getClassLoader())
                .forEach(configurators::add);
        return configurators;
    }

}
