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
package io.aiven.mqtt.bridge.basicauth;

import java.util.Objects;

import io.aiven.mqtt.bridge.MqttBridgeConfig;
import io.aiven.mqtt.bridge.spi.OpenSearchClientConfigurator;

import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.impl.async.HttpAsyncClientBuilder;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;

public class OpenSearchBasicAuthClientConfigurator implements OpenSearchClientConfigurator {

    @Override
    public boolean apply(final MqttBridgeConfig config, final HttpAsyncClientBuilder builder) {
        if (!isAuthenticatedConnection(config)) {
            return false;
        }

        final var credentialsProvider = new BasicCredentialsProvider();
        for (final var httpHost : config.opensearchHosts()) {
            credentialsProvider.setCredentials(new AuthScope(httpHost), new UsernamePasswordCredentials(
                    config.opensearchUsername(), config.opensearchPassword().value().toCharArray()));
        }

        builder.setDefaultCredentialsProvider(credentialsProvider);
        return true;
    }

    private static boolean isAuthenticatedConnection(final MqttBridgeConfig config) {
        return Objects.nonNull(config.opensearchUsername()) && Objects.nonNull(config.opensearchPassword());
    }

}
