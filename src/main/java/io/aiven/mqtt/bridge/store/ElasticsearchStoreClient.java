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

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigException;

import io.aiven.mqtt.bridge.MqttBridgeConfig;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ElasticsearchStoreClient implements DocumentStoreClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ElasticsearchStoreClient.class);

    static final String RESOURCE_ALREADY_EXISTS_EXCEPTION = "resource_already_exists_exception";

    static final String INDEX_NOT_FOUND_EXCEPTION = "index_not_found_exception";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final RestClient restClient;

    /* visible for testing */
    protected final ElasticsearchClient client;

    public ElasticsearchStoreClient(final MqttBridgeConfig config) {
        this(restClient(config));
    }

    private ElasticsearchStoreClient(final RestClient restClient) {
        this(restClient, new ElasticsearchClient(new RestClientTransport(restClient, new JacksonJsonpMapper())));
    }

    protected ElasticsearchStoreClient(final RestClient restClient, final ElasticsearchClient client) {
        this.restClient = restClient;
        this.client = client;
    }

    private static RestClient restClient(final MqttBridgeConfig config) {
        final List<URI> endpoints;
        try {
            endpoints = config.elasticsearchCluster().stream()
                    .map(ElasticsearchStoreClient::endpointUri)
                    .collect(Collectors.toList());
        } catch (final IllegalArgumentException e) {
            throw new ConfigException(MqttBridgeConfig.ELASTICSEARCH_CLUSTER_CONFIG, config.elasticsearchCluster(),
                    e.getMessage());
        }
        final var pathPrefixes = endpoints.stream()
                .map(ElasticsearchStoreClient::pathPrefix)
                .distinct()
                .collect(Collectors.toList());
        if (pathPrefixes.size() > 1) {
            throw new ConfigException(MqttBridgeConfig.ELASTICSEARCH_CLUSTER_CONFIG, config.elasticsearchCluster(),
                    "All endpoints must use the same path");
        }
        final var builder = RestClient.builder(endpoints.stream()
                .map(uri -> new HttpHost(uri.getHost(), uri.getPort(), uri.getScheme()))
                .toArray(HttpHost[]::new));
        if (!pathPrefixes.get(0).isEmpty()) {
            builder.setPathPrefix(pathPrefixes.get(0));
        }
        config.elasticsearchApiKey().ifPresent(apiKey -> {
            LOGGER.debug("Using API key authentication for Elasticsearch");
            builder.setDefaultHeaders(new Header[] { new BasicHeader("Authorization", "ApiKey " + apiKey.value()) });
        });
        return builder.build();
    }

    /**
     * Parses an endpoint such as {@code https://es.example.com:9200/}. Without a port the scheme's default is used.
     */
    static URI endpointUri(final String endpoint) {
        final var uri = URI.create(endpoint.trim());
        final var scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Endpoint " + endpoint + " must start with http:// or https://");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Endpoint " + endpoint + " has no host");
        }
        return uri;
    }

    static String pathPrefix(final URI endpoint) {
        var path = endpoint.getRawPath() == null ? "" : endpoint.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    @Override
    public boolean indexExists(final String index) {
        try {
            return client.indices().exists(ExistsRequest.of(b -> b.index(index))).value();
        } catch (final ElasticsearchException | IOException e) {
            throw new StoreException("Couldn't check that index " + index + " exists", e);
        }
    }

    @Override
    public boolean createIndex(final String index, final ObjectNode body) {
        final String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(body);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Couldn't serialize the body of index " + index, e);
        }
        try {
            client.indices().create(CreateIndexRequest.of(b -> b.index(index).withJson(new StringReader(json))));
            return true;
        } catch (final ElasticsearchException ee) {
            if (RESOURCE_ALREADY_EXISTS_EXCEPTION.equals(ee.error().type())) {
                LOGGER.info("Index {} already exists", index);
                return false;
            }
            throw new StoreException("Couldn't create index " + index, ee);
        } catch (final IOException e) {
            throw new StoreException("Couldn't create index " + index, e);
        }
    }

    @Override
    public boolean deleteIndex(final String index) {
        try {
            return client.indices().delete(DeleteIndexRequest.of(b -> b.index(index))).acknowledged();
        } catch (final ElasticsearchException ee) {
            if (INDEX_NOT_FOUND_EXCEPTION.equals(ee.error().type())) {
                LOGGER.info("Index {} doesn't exist", index);
                return false;
            }
            throw new StoreException("Couldn't delete index " + index, ee);
        } catch (final IOException e) {
            throw new StoreException("Couldn't delete index " + index, e);
        }
    }

    @Override
    public String indexDocument(final String index, final ObjectNode document) {
        try {
            return client.index(new IndexRequest.Builder<ObjectNode>().index(index).document(document).build())
                    .result()
                    .jsonValue();
        } catch (final ElasticsearchException | IOException e) {
            throw new StoreException("Couldn't index document into " + index, e);
        }
    }

    @Override
    public void close() throws IOException {
        restClient.close();
    }

}
