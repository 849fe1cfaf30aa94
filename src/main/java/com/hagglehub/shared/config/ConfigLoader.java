package com.hagglehub.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".hagglehub", "config.yaml"
    );

    public static HaggleHubConfig load() {
        var override = System.getenv("HAGGLEHUB_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static HaggleHubConfig load(Path path) {
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

        var routing = (Map<String, Object>) raw.getOrDefault("routing", Map.of());
        var dispatch = (Map<String, Object>) raw.getOrDefault("dispatch", Map.of());
        var store = (Map<String, Object>) raw.getOrDefault("store", Map.of());
        var pipeline = (Map<String, Object>) raw.getOrDefault("pipeline", Map.of());

        return new HaggleHubConfig(
            parseRoutingConfig(routing),
            parseDispatchConfig(dispatch),
            parseStoreConfig(store),
            Math.max(1, Integer.parseInt(String.valueOf(
                pipeline.getOrDefault("workers", HaggleHubConfig.defaults().pipelineWorkers()))))
        );
    }

    @SuppressWarnings("unchecked")
    private static RoutingConfig parseRoutingConfig(Map<String, Object> routing) {
        var defaults = RoutingConfig.defaults();

        var fallbacks = new HashMap<String, String>();
        var rawFallbacks = (Map<String, Object>) routing.getOrDefault("fallback-deals", Map.of());
        rawFallbacks.forEach((k, v) -> fallbacks.put(String.valueOf(k), String.valueOf(v)));

        var strategies = routing.containsKey("strategies")
                ? ((List<?>) routing.get("strategies")).stream().map(String::valueOf).toList()
                : defaults.strategies();

        var freeMail = routing.containsKey("free-mail-domains")
                ? ((List<?>) routing.get("free-mail-domains")).stream()
                        .map(d -> String.valueOf(d).trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet())
                : defaults.freeMailDomains();

        return new RoutingConfig(
            Integer.parseInt(String.valueOf(routing.getOrDefault("max-body-length", defaults.maxBodyLength()))),
            String.valueOf(routing.getOrDefault("alias-prefix", defaults.aliasPrefix())),
            Boolean.parseBoolean(String.valueOf(routing.getOrDefault("auto-create", defaults.autoCreate()))),
            Map.copyOf(fallbacks),
            strategies,
            freeMail
        );
    }

    private static DispatchConfig parseDispatchConfig(Map<String, Object> dispatch) {
        var defaults = DispatchConfig.defaults();
        return new DispatchConfig(
            String.valueOf(dispatch.getOrDefault("mode", defaults.mode())),
            Integer.parseInt(String.valueOf(dispatch.getOrDefault("retries", defaults.retries()))),
            Long.parseLong(String.valueOf(dispatch.getOrDefault("retry-delay-ms", defaults.retryDelayMs()))),
            String.valueOf(dispatch.getOrDefault("function-name", defaults.functionName()))
        );
    }

    private static StoreConfig parseStoreConfig(Map<String, Object> store) {
        var defaults = StoreConfig.defaults();
        var apiKey = envOrDefault("HAGGLEHUB_API_KEY",
                envOrDefault("BASE44_API_KEY", String.valueOf(store.getOrDefault("api-key", defaults.apiKey()))));
        return new StoreConfig(
            String.valueOf(store.getOrDefault("mode", defaults.mode())),
            envOrDefault("HAGGLEHUB_STORE_URL", String.valueOf(store.getOrDefault("base-url", defaults.baseUrl()))),
            apiKey,
            Integer.parseInt(String.valueOf(store.getOrDefault("timeout-seconds", defaults.timeoutSeconds())))
        );
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
