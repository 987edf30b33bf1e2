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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.config.types.Password;

import io.aiven.mqtt.bridge.mqtt.MqttProtocolVersion;
import io.aiven.mqtt.bridge.store.StoreBackend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.core5.http.HttpHost;

public class MqttBridgeConfig extends AbstractConfig {

    public static final String BRIDGE_GROUP_NAME = "Bridge";

    public static final String MQTT_GROUP_NAME = "MQTT";

    public static final String ELASTICSEARCH_GROUP_NAME = "Elasticsearch";

    public static final String OPENSEARCH_GROUP_NAME = "OpenSearch";

    public static final String DEBUG_CONFIG = "DEBUG";
    private static final String DEBUG_DOC = "Log at DEBUG level instead of INFO.";

    public static final String REMOVE_INDEX_CONFIG = "removeIndex";
    private static final String REMOVE_INDEX_DOC = "Delete the indices of all mapping entries at startup. "
            + "Intended to reset indices before the bridge begins normal operation.";

    public static final String REMOVE_INDEX_EXIT_CONFIG = "removeIndexExit";
    private static final String REMOVE_INDEX_EXIT_DOC = "Whether the process exits once all indices were deleted "
            + "when ``" + REMOVE_INDEX_CONFIG + "`` is ``true``. If ``false`` the indices are recreated and the "
            + "bridge keeps running.";

    public static final String MQTT_PREFIX = "mqtt.";

    public static final String MQTT_SERVER_CONFIG = MQTT_PREFIX + "server";
    private static final String MQTT_SERVER_DOC = "Host name or address of the MQTT broker.";

    public static final String MQTT_PORT_CONFIG = MQTT_PREFIX + "port";
    private static final String MQTT_PORT_DOC = "Port of the MQTT broker.";

    public static final String MQTT_CLIENT_ID_CONFIG = MQTT_PREFIX + "client_id";
    private static final String MQTT_CLIENT_ID_DOC = "MQTT client identifier. "
            + "If not set the broker assigns one to the session.";

    public static final String MQTT_USER_CONFIG = MQTT_PREFIX + "user";
    private static final String MQTT_USER_DOC = "The username used to authenticate with the broker. "
            + "Authentication is only performed if both username and password are non-empty.";

    public static final String MQTT_PASSWORD_CONFIG = MQTT_PREFIX + "password";
    private static final String MQTT_PASSWORD_DOC = "The password used to authenticate with the broker. "
            + "Authentication is only performed if both username and password are non-empty.";

    public static final String MQTT_TLS_CONFIG = MQTT_PREFIX + "tls";
    private static final String MQTT_TLS_DOC = "Connect to the broker over TLS. "
            + "The broker certificate chain is verified against the JVM trust store.";

    public static final String MQTT_HOSTNAME_VALIDATION_CONFIG = MQTT_PREFIX + "hostname_validation";
    private static final String MQTT_HOSTNAME_VALIDATION_DOC = "Verify that the broker certificate matches "
            + "its host name. Disable only for self-signed or internal CA environments.";

    public static final String MQTT_PROTOCOL_VERSION_CONFIG = MQTT_PREFIX + "protocol_version";
    private static final String MQTT_PROTOCOL_VERSION_DOC = "MQTT protocol version. Valid values are "
            + MqttProtocolVersion.possibleValues() + ".";

    public static final String MQTT_KEEPALIVE_CONFIG = MQTT_PREFIX + "keepalive";
    private static final String MQTT_KEEPALIVE_DOC = "Keep alive interval in seconds.";

    public static final String MQTT_QOS_CONFIG = MQTT_PREFIX + "qos";
    private static final String MQTT_QOS_DOC = "Quality of service requested for the topic subscriptions.";

    public static final String ELASTICSEARCH_PREFIX = "elasticsearch.";

    public static final String ELASTICSEARCH_CLUSTER_CONFIG = ELASTICSEARCH_PREFIX + "cluster";
    private static final String ELASTICSEARCH_CLUSTER_DOC = "List of Elasticsearch HTTP endpoints e.g. "
            + "``http://eshost1:9200,http://eshost2:9200``.";

    public static final String ELASTICSEARCH_API_KEY_CONFIG = ELASTICSEARCH_PREFIX + "api_key";
    private static final String ELASTICSEARCH_API_KEY_DOC = "Encoded API key used to authenticate "
            + "with Elasticsearch.";

    public static final String OPENSEARCH_PREFIX = "opensearch.";

    public static final String OPENSEARCH_HOSTS_CONFIG = OPENSEARCH_PREFIX + "hosts";
    private static final String OPENSEARCH_HOSTS_DOC = "List of OpenSearch nodes, each given as "
            + "``{\"host\": ..., \"port\": ...}``. The port defaults to " + "9200.";

    public static final String OPENSEARCH_USERNAME_CONFIG = OPENSEARCH_PREFIX + "username";
    private static final String OPENSEARCH_USERNAME_DOC = "The username used to authenticate with OpenSearch. "
            + "Authentication is only performed if both the username and password are set.";

    public static final String OPENSEARCH_PASSWORD_CONFIG = OPENSEARCH_PREFIX + "password";
    private static final String OPENSEARCH_PASSWORD_DOC = "The password used to authenticate with OpenSearch. "
            + "Authentication is only performed if both the username and password are set.";

    public static final String OPENSEARCH_TLS_CONFIG = OPENSEARCH_PREFIX + "tls";
    private static final String OPENSEARCH_TLS_DOC = "Use HTTPS to talk to OpenSearch.";

    public static final String OPENSEARCH_VERIFY_CERTS_CONFIG = OPENSEARCH_PREFIX + "verify_certs";
    private static final String OPENSEARCH_VERIFY_CERTS_DOC = "Verify the OpenSearch certificate chain against "
            + "the CA bundle in ``" + OPENSEARCH_PREFIX + "ca_certs_path`` and check host names.";

    public static final String OPENSEARCH_CA_CERTS_PATH_CONFIG = OPENSEARCH_PREFIX + "ca_certs_path";
    private static final String OPENSEARCH_CA_CERTS_PATH_DOC = "Path to a PEM file with the trusted CA certificates.";
    public static final String OPENSEARCH_CA_CERTS_PATH_DEFAULT = "/etc/ssl/certs/ca-certificates.crt";

    public static final int OPENSEARCH_DEFAULT_PORT = 9200;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public MqttBridgeConfig(final Map<?, ?> props) {
        super(CONFIG, props);
        validate();
    }

    /**
     * Reads the JSON configuration file. Nested objects are flattened into dotted keys, so that
     * {@code {"mqtt": {"server": "broker"}}} becomes {@code mqtt.server=broker}.
     */
    public static MqttBridgeConfig load(final Path path) {
        final Map<String, Object> json;
        try {
            json = OBJECT_MAPPER.readValue(Files.readAllBytes(path), new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (final IOException e) {
            throw new ConfigException("Couldn't read configuration file " + path + ": " + e.getMessage());
        }
        if (Objects.isNull(json)) {
            throw new ConfigException("Configuration file " + path + " is empty");
        }
        return new MqttBridgeConfig(flatten(json));
    }

    static Map<String, Object> flatten(final Map<String, Object> json) {
        final var flat = new LinkedHashMap<String, Object>();
        flatten("", json, flat);
        return flat;
    }

    @SuppressWarnings("unchecked")
    private static void flatten(final String prefix, final Map<String, Object> source,
            final Map<String, Object> target) {
        for (final var entry : source.entrySet()) {
            final var key = prefix + entry.getKey();
            if (entry.getValue() instanceof Map) {
                flatten(key + ".", (Map<String, Object>) entry.getValue(), target);
            } else if (Objects.nonNull(entry.getValue())) {
                target.put(key, entry.getValue());
            }
        }
    }

    protected static ConfigDef baseConfigDef() {
        final ConfigDef configDef = new ConfigDef();
        addBridgeConfigGroup(configDef);
        addMqttConfigGroup(configDef);
        addElasticsearchConfigGroup(configDef);
        addOpenSearchConfigGroup(configDef);
        return configDef;
    }

    private static void addBridgeConfigGroup(final ConfigDef configDef) {
        int order = 0;
        configDef.define(DEBUG_CONFIG, Type.BOOLEAN, false, Importance.LOW, DEBUG_DOC, BRIDGE_GROUP_NAME, ++order,
                Width.SHORT, "Debug Logging")
                .define(REMOVE_INDEX_CONFIG, Type.BOOLEAN, false, Importance.LOW, REMOVE_INDEX_DOC,
                        BRIDGE_GROUP_NAME, ++order, Width.SHORT, "Remove Indices")
                .define(REMOVE_INDEX_EXIT_CONFIG, Type.BOOLEAN, true, Importance.LOW, REMOVE_INDEX_EXIT_DOC,
                        BRIDGE_GROUP_NAME, ++order, Width.SHORT, "Exit After Removing Indices");
    }

    private static void addMqttConfigGroup(final ConfigDef configDef) {
        int order = 0;
        configDef.define(MQTT_SERVER_CONFIG, Type.STRING, ConfigDef.NO_DEFAULT_VALUE, new ConfigDef.NonEmptyString(),
                Importance.HIGH, MQTT_SERVER_DOC, MQTT_GROUP_NAME, ++order, Width.LONG, "Broker Host")
                .define(MQTT_PORT_CONFIG, Type.INT, ConfigDef.NO_DEFAULT_VALUE, ConfigDef.Range.between(1, 65535),
                        Importance.HIGH, MQTT_PORT_DOC, MQTT_GROUP_NAME, ++order, Width.SHORT, "Broker Port")
                .define(MQTT_CLIENT_ID_CONFIG, Type.STRING, null, Importance.MEDIUM, MQTT_CLIENT_ID_DOC,
                        MQTT_GROUP_NAME, ++order, Width.MEDIUM, "Client Id")
                .define(MQTT_USER_CONFIG, Type.STRING, null, Importance.MEDIUM, MQTT_USER_DOC, MQTT_GROUP_NAME,
                        ++order, Width.SHORT, "Username")
                .define(MQTT_PASSWORD_CONFIG, Type.PASSWORD, null, Importance.MEDIUM, MQTT_PASSWORD_DOC,
                        MQTT_GROUP_NAME, ++order, Width.SHORT, "Password")
                .define(MQTT_TLS_CONFIG, Type.BOOLEAN, false, Importance.MEDIUM, MQTT_TLS_DOC, MQTT_GROUP_NAME,
                        ++order, Width.SHORT, "TLS")
                .define(MQTT_HOSTNAME_VALIDATION_CONFIG, Type.BOOLEAN, true, Importance.LOW,
                        MQTT_HOSTNAME_VALIDATION_DOC, MQTT_GROUP_NAME, ++order, Width.SHORT,
                        "Host Name Validation")
                .define(MQTT_PROTOCOL_VERSION_CONFIG, Type.INT, MqttProtocolVersion.MQTT_3_1_1.version(),
                        MqttProtocolVersion.VALIDATOR, Importance.LOW, MQTT_PROTOCOL_VERSION_DOC, MQTT_GROUP_NAME,
                        ++order, Width.SHORT, "Protocol Version")
                .define(MQTT_KEEPALIVE_CONFIG, Type.INT, 60, ConfigDef.Range.atLeast(0), Importance.LOW,
                        MQTT_KEEPALIVE_DOC, MQTT_GROUP_NAME, ++order, Width.SHORT, "Keep Alive Interval")
                .define(MQTT_QOS_CONFIG, Type.INT, 0, ConfigDef.Range.between(0, 2), Importance.LOW, MQTT_QOS_DOC,
                        MQTT_GROUP_NAME, ++order, Width.SHORT, "Subscription QoS");
    }

    private static void addElasticsearchConfigGroup(final ConfigDef configDef) {
        int order = 0;
        configDef.define(ELASTICSEARCH_CLUSTER_CONFIG, Type.LIST, null, NON_EMPTY_URL_LIST, Importance.HIGH,
                ELASTICSEARCH_CLUSTER_DOC, ELASTICSEARCH_GROUP_NAME, ++order, Width.LONG, "Cluster Endpoints")
                .define(ELASTICSEARCH_API_KEY_CONFIG, Type.PASSWORD, null, Importance.MEDIUM,
                        ELASTICSEARCH_API_KEY_DOC, ELASTICSEARCH_GROUP_NAME, ++order, Width.MEDIUM, "API Key");
    }

    private static void addOpenSearchConfigGroup(final ConfigDef configDef) {
        int order = 0;
        configDef.define(OPENSEARCH_HOSTS_CONFIG, Type.LIST, null, NON_EMPTY_HOST_LIST, Importance.HIGH,
                OPENSEARCH_HOSTS_DOC, OPENSEARCH_GROUP_NAME, ++order, Width.LONG, "Hosts")
                .define(OPENSEARCH_USERNAME_CONFIG, Type.STRING, null, Importance.MEDIUM, OPENSEARCH_USERNAME_DOC,
                        OPENSEARCH_GROUP_NAME, ++order, Width.SHORT, "Username")
                .define(OPENSEARCH_PASSWORD_CONFIG, Type.PASSWORD, null, Importance.MEDIUM, OPENSEARCH_PASSWORD_DOC,
                        OPENSEARCH_GROUP_NAME, ++order, Width.SHORT, "Password")
                .define(OPENSEARCH_TLS_CONFIG, Type.BOOLEAN, false, Importance.MEDIUM, OPENSEARCH_TLS_DOC,
                        OPENSEARCH_GROUP_NAME, ++order, Width.SHORT, "TLS")
                .define(OPENSEARCH_VERIFY_CERTS_CONFIG, Type.BOOLEAN, false, Importance.MEDIUM,
                        OPENSEARCH_VERIFY_CERTS_DOC, OPENSEARCH_GROUP_NAME, ++order, Width.SHORT,
                        "Verify Certificates")
                .define(OPENSEARCH_CA_CERTS_PATH_CONFIG, Type.STRING, OPENSEARCH_CA_CERTS_PATH_DEFAULT,
                        new ConfigDef.NonEmptyString(), Importance.LOW, OPENSEARCH_CA_CERTS_PATH_DOC,
                        OPENSEARCH_GROUP_NAME, ++order, Width.LONG, "CA Certificates Path");
    }

    private static final ConfigDef.Validator NON_EMPTY_URL_LIST = new ConfigDef.Validator() {
        @Override
        public void ensureValid(final String name, final Object value) {
            if (Objects.isNull(value)) {
                return;
            }
            final var urls = (List<?>) value;
            if (urls.isEmpty()) {
                throw new ConfigException(name, value, "At least one endpoint must be configured");
            }
            for (final var url : urls) {
                if (!(url instanceof String) || ((String) url).isBlank()) {
                    throw new ConfigException(name, value, "Endpoints must be non-empty strings");
                }
            }
        }

        @Override
        public String toString() {
            return "Non-empty list of endpoint URLs";
        }
    };

    private static final ConfigDef.Validator NON_EMPTY_HOST_LIST = new ConfigDef.Validator() {
        @Override
        public void ensureValid(final String name, final Object value) {
            if (Objects.isNull(value)) {
                return;
            }
            final var hosts = (List<?>) value;
            if (hosts.isEmpty()) {
                throw new ConfigException(name, value, "At least one host must be configured");
            }
            for (final var host : hosts) {
                if (!(host instanceof Map)) {
                    throw new ConfigException(name, value, "Hosts must be objects with a host and a port");
                }
                final var hostName = ((Map<?, ?>) host).get("host");
                if (!(hostName instanceof String) || ((String) hostName).isBlank()) {
                    throw new ConfigException(name, value, "Every host entry needs a non-empty host");
                }
                final var port = ((Map<?, ?>) host).get("port");
                if (Objects.nonNull(port)
                        && (!(port instanceof Integer) || (Integer) port < 1 || (Integer) port > 65535)) {
                    throw new ConfigException(name, value, "Port of " + hostName + " must be between 1 and 65535");
                }
            }
        }

        @Override
        public String toString() {
            return "Non-empty list of {host, port} objects";
        }
    };

    public static final ConfigDef CONFIG = baseConfigDef();

    private void validate() {
        final var elasticsearch = hasBlock(ELASTICSEARCH_PREFIX);
        final var opensearch = hasBlock(OPENSEARCH_PREFIX);
        if (elasticsearch && opensearch) {
            throw new ConfigException("Both elasticsearch and opensearch are configured, only one is allowed");
        }
        if (!elasticsearch && !opensearch) {
            throw new ConfigException("Either elasticsearch or opensearch must be configured");
        }
        if (elasticsearch && Objects.isNull(getList(ELASTICSEARCH_CLUSTER_CONFIG))) {
            throw new ConfigException(
                    String.format("Missing required configuration \"%s\"", ELASTICSEARCH_CLUSTER_CONFIG));
        }
        if (opensearch && Objects.isNull(getList(OPENSEARCH_HOSTS_CONFIG))) {
            throw new ConfigException(String.format("Missing required configuration \"%s\"", OPENSEARCH_HOSTS_CONFIG));
        }
    }

    private boolean hasBlock(final String prefix) {
        return originals().keySet().stream().anyMatch(key -> key.startsWith(prefix));
    }

    public boolean debug() {
        return getBoolean(DEBUG_CONFIG);
    }

    public boolean removeIndex() {
        return getBoolean(REMOVE_INDEX_CONFIG);
    }

    public boolean removeIndexExit() {
        return getBoolean(REMOVE_INDEX_EXIT_CONFIG);
    }

    public String mqttServer() {
        return getString(MQTT_SERVER_CONFIG);
    }

    public int mqttPort() {
        return getInt(MQTT_PORT_CONFIG);
    }

    public boolean mqttTls() {
        return getBoolean(MQTT_TLS_CONFIG);
    }

    public String mqttServerUri() {
        return String.format(Locale.ROOT, "%s://%s:%d", mqttTls() ? "ssl" : "tcp", mqttServer(), mqttPort());
    }

    public Optional<String> mqttClientId() {
        return Optional.ofNullable(getString(MQTT_CLIENT_ID_CONFIG)).filter(id -> !id.isEmpty());
    }

    public boolean mqttAuthenticated() {
        final var user = getString(MQTT_USER_CONFIG);
        final var password = getPassword(MQTT_PASSWORD_CONFIG);
        return Objects.nonNull(user) && !user.isEmpty() && Objects.nonNull(password) && !password.value().isEmpty();
    }

    public String mqttUser() {
        return getString(MQTT_USER_CONFIG);
    }

    public Password mqttPassword() {
        return getPassword(MQTT_PASSWORD_CONFIG);
    }

    public boolean mqttHostnameValidation() {
        return getBoolean(MQTT_HOSTNAME_VALIDATION_CONFIG);
    }

    public MqttProtocolVersion mqttProtocolVersion() {
        return MqttProtocolVersion.of(getInt(MQTT_PROTOCOL_VERSION_CONFIG));
    }

    public int mqttKeepAlive() {
        return getInt(MQTT_KEEPALIVE_CONFIG);
    }

    public int mqttQos() {
        return getInt(MQTT_QOS_CONFIG);
    }

    public StoreBackend storeBackend() {
        return hasBlock(ELASTICSEARCH_PREFIX) ? StoreBackend.ELASTICSEARCH : StoreBackend.OPENSEARCH;
    }

    public List<String> elasticsearchCluster() {
        return getList(ELASTICSEARCH_CLUSTER_CONFIG);
    }

    public Optional<Password> elasticsearchApiKey() {
        return Optional.ofNullable(getPassword(ELASTICSEARCH_API_KEY_CONFIG));
    }

    public HttpHost[] opensearchHosts() {
        final var scheme = opensearchTls() ? "https" : "http";
        return ((List<?>) get(OPENSEARCH_HOSTS_CONFIG)).stream().map(Map.class::cast).map(host -> {
            final var port = host.get("port");
            return new HttpHost(scheme, (String) host.get("host"),
                    Objects.isNull(port) ? OPENSEARCH_DEFAULT_PORT : (Integer) port);
        }).toArray(HttpHost[]::new);
    }

    public String opensearchUsername() {
        return getString(OPENSEARCH_USERNAME_CONFIG);
    }

    public Password opensearchPassword() {
        return getPassword(OPENSEARCH_PASSWORD_CONFIG);
    }

    public boolean opensearchTls() {
        return getBoolean(OPENSEARCH_TLS_CONFIG);
    }

    public boolean opensearchVerifyCerts() {
        return getBoolean(OPENSEARCH_VERIFY_CERTS_CONFIG);
    }

    public Path opensearchCaCertsPath() {
        return Path.of(getString(OPENSEARCH_CA_CERTS_PATH_CONFIG));
    }
}
