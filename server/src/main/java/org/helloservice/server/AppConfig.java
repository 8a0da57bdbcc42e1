package org.helloservice.server;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup configuration for the service. Built once in {@link HelloServiceApp} and handed
 * to {@link HelloServer}; nothing reads configuration from global state afterwards.
 */
public record AppConfig(ServerConfig server, GreetingConfig greeting) {

    static final String DEFAULT_HOST = "0.0.0.0";
    static final int DEFAULT_PORT = 3000;
    static final String PORT_ENV = "PORT";
    static final String DEFAULT_MESSAGE = "Hello World!";
    static final String DEFAULT_VERSION = "1.0.0";

    /**
     * Loads the YAML file at {@code path} when it exists, then applies the {@code PORT}
     * environment override.
     *
     * @param required whether a missing file is an error rather than "use defaults"
     */
    public static AppConfig load(Path path, boolean required, Map<String, String> env) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Config path is required");
        }
        Map<String, Object> root = new LinkedHashMap<>();
        if (Files.exists(path)) {
            Yaml yaml = new Yaml();
            try (InputStream input = Files.newInputStream(path)) {
                Map<String, Object> loaded = yaml.load(input);
                if (loaded != null) {
                    root = loaded;
                }
            }
        } else if (required) {
            throw new IOException("Config file not found: " + path);
        }

        Map<String, Object> serverMap = map(root, "server");
        ServerConfig server = new ServerConfig(
                string(serverMap, "host", DEFAULT_HOST),
                port(serverMap.get("port"), DEFAULT_PORT)
        );
        Map<String, Object> greetingMap = map(root, "greeting");
        GreetingConfig greeting = new GreetingConfig(
                string(greetingMap, "message", DEFAULT_MESSAGE),
                string(greetingMap, "version", DEFAULT_VERSION)
        );
        return new AppConfig(server.withPortFrom(env), greeting);
    }

    public record ServerConfig(String host, int port) {

        ServerConfig withPortFrom(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            // an unusable PORT keeps whatever the file (or the default) chose
            return new ServerConfig(host, resolvePort(env.get(PORT_ENV), port));
        }
    }

    /** Payload of the root route, from the {@code greeting} section of the YAML file. */
    public record GreetingConfig(String message, String version) {

        public static GreetingConfig defaults() {
            return new GreetingConfig(DEFAULT_MESSAGE, DEFAULT_VERSION);
        }
    }

    /**
     * Parses a listening port. Anything that is not an integer in {@code 0..65535}
     * yields {@code fallback}.
     */
    static int resolvePort(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            return port < 0 || port > 65535 ? fallback : port;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int port(Object value, int fallback) {
        if (value instanceof Number number) {
            int port = number.intValue();
            return port < 0 || port > 65535 ? fallback : port;
        }
        return value == null ? fallback : resolvePort(value.toString(), fallback);
    }

    private static Map<String, Object> map(Map<String, Object> root, String key) {
        if (root == null) {
            return new LinkedHashMap<>();
        }
        Object value = root.get(key);
        if (value instanceof Map<?, ?> rawMap) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : rawMap.entrySet()) {
                if (entry.getKey() != null) {
                    result.put(entry.getKey().toString(), entry.getValue());
                }
            }
            return result;
        }
        return new LinkedHashMap<>();
    }

    private static String string(Map<String, Object> map, String key, String fallback) {
        if (map == null) {
            return fallback;
        }
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        String str = value.toString().trim();
        return str.isEmpty() ? fallback : str;
    }
}
