package com.amqpclient.config;

import com.amqpclient.reconnect.ReconnectOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Reads connect configuration from a JSON document, a {@link Properties}
 * object or environment variables.
 *
 * <p>All three sources share one set of keys:
 * <pre>
 *   scheme, host, port, user, password, vhost, reconnect,
 *   sasl.enable, sasl.mechanisms, tls.enable,
 *   reconnect.delay, reconnect.multiplier, reconnect.maxDelay, reconnect.maxAttempts,
 *   failover, reconnectUrl
 * </pre>
 * {@code reconnect} is a boolean that turns on the default policy. In JSON the
 * dotted keys are nested objects and {@code failover} is an array. In
 * properties {@code failover} is comma separated. Delays are milliseconds. Unknown keys are ignored.
 *
 * <p>Malformed values raise {@link IllegalArgumentException} naming the key.
 */
public final class ConnectConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConnectConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Environment variable names and the keys they map to.
     */
    static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put("AMQP_SCHEME", "scheme");
        ENVIRONMENT_KEYS.put("AMQP_HOST", "host");
        ENVIRONMENT_KEYS.put("AMQP_PORT", "port");
        ENVIRONMENT_KEYS.put("AMQP_USER", "user");
        ENVIRONMENT_KEYS.put("AMQP_PASSWORD", "password");
        ENVIRONMENT_KEYS.put("AMQP_VHOST", "vhost");
        ENVIRONMENT_KEYS.put("AMQP_SASL_ENABLE", "sasl.enable");
        ENVIRONMENT_KEYS.put("AMQP_SASL_MECHANISMS", "sasl.mechanisms");
        ENVIRONMENT_KEYS.put("AMQP_TLS_ENABLE", "tls.enable");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT", "reconnect");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT_DELAY", "reconnect.delay");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT_MULTIPLIER", "reconnect.multiplier");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT_MAX_DELAY", "reconnect.maxDelay");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT_MAX_ATTEMPTS", "reconnect.maxAttempts");
        ENVIRONMENT_KEYS.put("AMQP_FAILOVER_URLS", "failover");
        ENVIRONMENT_KEYS.put("AMQP_RECONNECT_URL", "reconnectUrl");
    }

    private ConnectConfigLoader() {
    }

    public static ConnectConfig fromJson(Path file) {
        try {
            return fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read connect config " + file, e);
        }
    }

    public static ConnectConfig fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON connect config: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Connect config must be a JSON object");
        }

        Values values = new Values();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode node = field.getValue();
            if ("failover".equals(key)) {
                values.failover(jsonList(key, node));
            } else if ("reconnect".equals(key) && node.isBoolean()) {
                values.reconnectEnabled(node.booleanValue());
            } else if (node.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> nested = node.fields();
                while (nested.hasNext()) {
                    Map.Entry<String, JsonNode> inner = nested.next();
                    values.set(key + "." + inner.getKey(), jsonScalar(key + "." + inner.getKey(), inner.getValue()));
                }
            } else {
                values.set(key, jsonScalar(key, node));
            }
        }
        return values.toConfig();
    }

    public static ConnectConfig fromProperties(Properties properties) {
        Values values = new Values();
        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if ("failover".equals(key)) {
                values.failover(splitList(value));
            } else {
                values.set(key, value);
            }
        }
        return values.toConfig();
    }

    public static ConnectConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Load from the given environment, using the {@code AMQP_*} variables only.
     */
    public static ConnectConfig fromEnvironment(Map<String, String> env) {
        Properties properties = new Properties();
        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = env.get(entry.getKey());
            if (value != null) {
                properties.setProperty(entry.getValue(), value);
            }
        }
        return fromProperties(properties);
    }

    private static String jsonScalar(String key, JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': expected a scalar");
        }
        return node.asText();
    }

    private static List<String> jsonList(String key, JsonNode node) {
        List<String> urls = new ArrayList<>();
        if (node.isNull()) {
            return urls;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': expected an array");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("Invalid value for '" + key + "': expected strings");
            }
            urls.add(element.asText());
        }
        return urls;
    }

    private static List<String> splitList(String value) {
        List<String> urls = new ArrayList<>();
        for (String part : value.split(",")) {
            String url = part.trim();
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }
        return urls;
    }

    /**
     * Collects the flat key/value pairs and builds the config.
     */
    private static final class Values {
        private String scheme = "amqp";
        private String host = "localhost";
        private Integer port;
        private final ConnectionOptions.Builder options = ConnectionOptions.builder();
        private ReconnectOptions.Builder reconnect;
        private Boolean reconnectEnabled;

        void set(String key, String value) {
            if (value == null) {
                return;
            }
            switch (key) {
                case "scheme":
                    if (!"amqp".equals(value) && !"amqps".equals(value)) {
                        throw invalid(key, value, "expected amqp or amqps");
                    }
                    scheme = value;
                    break;
                case "host":
                    host = value;
                    break;
                case "port":
                    port = parsePort(key, value);
                    break;
                case "user":
                    options.user(value);
                    break;
                case "password":
                    options.password(value);
                    break;
                case "vhost":
                    options.virtualHost(value);
                    break;
                case "sasl.enable":
                    options.saslEnabled(parseBoolean(key, value));
                    break;
                case "sasl.mechanisms":
                    options.saslAllowedMechs(value);
                    break;
                case "tls.enable":
                    options.sslEnabled(parseBoolean(key, value));
                    break;
                case "reconnect":
                    reconnectEnabled(parseBoolean(key, value));
                    break;
                case "reconnect.delay":
                    Duration delay = parseMillis(key, value);
                    applyReconnect(key, value, () -> reconnect().delay(delay));
                    break;
                case "reconnect.multiplier":
                    double multiplier = parseDouble(key, value);
                    applyReconnect(key, value, () -> reconnect().delayMultiplier(multiplier));
                    break;
                case "reconnect.maxDelay":
                    Duration maxDelay = parseMillis(key, value);
                    applyReconnect(key, value, () -> reconnect().maxDelay(maxDelay));
                    break;
                case "reconnect.maxAttempts":
                    int maxAttempts = parseInt(key, value);
                    applyReconnect(key, value, () -> reconnect().maxAttempts(maxAttempts));
                    break;
                case "reconnectUrl":
                    try {
                        options.reconnectUrl(value);
                    } catch (IllegalArgumentException e) {
                        throw invalid(key, value, e.getMessage());
                    }
                    break;
                default:
                    log.debug("Ignoring unknown connect config key '{}'", key);
            }
        }

        private void applyReconnect(String key, String value, Runnable setter) {
            try {
                setter.run();
            } catch (IllegalArgumentException e) {
                throw invalid(key, value, e.getMessage());
            }
        }

        void failover(List<String> urls) {
            try {
                options.failoverUrls(urls);
            } catch (IllegalArgumentException e) {
                throw invalid("failover", urls.toString(), e.getMessage());
            }
        }

        void reconnectEnabled(boolean enabled) {
            reconnectEnabled = enabled;
        }

        ConnectConfig toConfig() {
            if (reconnect != null && !Boolean.FALSE.equals(reconnectEnabled)) {
                try {
                    options.reconnect(reconnect.build());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid value for 'reconnect': " + e.getMessage(), e);
                }
            } else if (Boolean.TRUE.equals(reconnectEnabled)) {
                options.reconnect(ReconnectOptions.defaults());
            }

            String hostPart = host.contains(":") && !host.startsWith("[") ? "[" + host + "]" : host;
            String address = scheme + "://" + hostPart + (port != null ? ":" + port : "");
            return new ConnectConfig(address, options.build());
        }

        private ReconnectOptions.Builder reconnect() {
            if (reconnect == null) {
                reconnect = ReconnectOptions.builder();
            }
            return reconnect;
        }

        private static int parsePort(String key, String value) {
            int port = parseInt(key, value);
            if (port < 1 || port > 65535) {
                throw invalid(key, value, "port out of range");
            }
            return port;
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "expected an integer");
            }
        }

        private static double parseDouble(String key, String value) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "expected a number");
            }
        }

        private static Duration parseMillis(String key, String value) {
            try {
                long millis = Long.parseLong(value.trim());
                if (millis < 0) {
                    throw invalid(key, value, "must not be negative");
                }
                return Duration.ofMillis(millis);
            } catch (NumberFormatException e) {
                throw invalid(key, value, "expected milliseconds");
            }
        }

        private static boolean parseBoolean(String key, String value) {
            String v = value.trim();
            if ("true".equalsIgnoreCase(v)) {
                return true;
            }
            if ("false".equalsIgnoreCase(v)) {
                return false;
            }
            throw invalid(key, value, "expected true or false");
        }

        private static IllegalArgumentException invalid(String key, String value, String reason) {
            return new IllegalArgumentException("Invalid value for '" + key + "': " + value + " (" + reason + ")");
        }
    }
}
