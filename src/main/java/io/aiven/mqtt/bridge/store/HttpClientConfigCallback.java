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
package io.aiven.mqtt.bridge.store;

import javax.net.ssl.SSLContext;

import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;

import org.apache.kafka.common.config.ConfigException;

import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;

import io.aiven.mqtt.bridge.MqttBridgeConfig;
import io.aiven.mqtt.bridge.auth.PemTrustStoreBuilder;
import io.aiven.mqtt.bridge.spi.ClientsConfiguratorProvider;

import org.apache.hc.client5.http.impl.async.HttpAsyncClientBuilder;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManager;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.ClientTlsStrategyBuilder;
import org.apache.hc.client5.http.ssl.HttpsSupport;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record HttpClientConfigCallback(MqttBridgeConfig config)
        implements ApacheHttpClient5TransportBuilder.HttpClientConfigCallback {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientConfigCallback.class);

    @Override
    public HttpAsyncClientBuilder customizeHttpClient(final HttpAsyncClientBuilder httpClientBuilder) {
        final var configurators = ClientsConfiguratorProvider.forOpenSearch(config);
        configurators.forEach(configurator -> {
            if (configurator.apply(config, httpClientBuilder)) {
                LOGGER.debug("Successfully applied {} configurator to OpenSearch client",
                        configurator.getClass().getName());
            }
        });

        if (config.opensearchTls()) {
            httpClientBuilder.setConnectionManager(createConnectionManager());
        }
        return httpClientBuilder;
    }

    private PoolingAsyncClientConnectionManager createConnectionManager() {
        return PoolingAsyncClientConnectionManagerBuilder.create()
                .setTlsStrategy(ClientTlsStrategyBuilder.create()
                        .setSslContext(sslContext())
                        .setHostnameVerifier(config.opensearchVerifyCerts()
                                ? HttpsSupport.getDefaultHostnameVerifier()
                                : NoopHostnameVerifier.INSTANCE)
                        .build())
                .build();
    }

    private SSLContext sslContext() {
        final var sslContextBuilder = SSLContextBuilder.create();
        try {
            if (config.opensearchVerifyCerts()) {
                sslContextBuilder.loadTrustMaterial(PemTrustStoreBuilder.build(config.opensearchCaCertsPath()), null);
            } else {
                LOGGER.warn("Certificate verification disabled. Not recommended for production environments.");
                sslContextBuilder.loadTrustMaterial(TrustAllStrategy.INSTANCE);
            }
            return sslContextBuilder.build();
        } catch (final NoSuchAlgorithmException | KeyStoreException | KeyManagementException e) {
            throw new ConfigException("Unable to build SSL context for OpenSearch", e);
        }
    }
}
