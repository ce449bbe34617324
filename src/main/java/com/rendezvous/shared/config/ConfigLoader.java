package com.rendezvous.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    static final int DEFAULT_PORT = 4000;

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".rendezvous", "config.yaml"
    );

    public static RelayConfig load() {
        return load(DEFAULT_PATH);
    }

    public static RelayConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static RelayConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var welcome = (Map<String, Object>) raw.getOrDefault("welcome", Map.of());

        return new RelayConfig(
            Integer.parseInt(envOrDefault(env, "RENDEZVOUS_PORT",
                String.valueOf(server.getOrDefault("port", DEFAULT_PORT)))),
            Boolean.parseBoolean(envOrDefault(env, "RENDEZVOUS_LOG_REQUESTS",
                String.valueOf(server.getOrDefault("log-requests", false)))),
            new WelcomeConfig(
                envOrDefault(env, "RENDEZVOUS_CURRENT_VERSION", optional(welcome, "current-version")),
                envOrDefault(env, "RENDEZVOUS_MOTD", optional(welcome, "motd")),
                optional(welcome, "error")
            )
        );
    }

    private static String optional(Map<String, Object> section, String key) {
        var value = section.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
